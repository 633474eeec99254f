package org.abstractica.xmpp;

import java.util.Objects;

/**
 * Connection lifecycle failure.
 */
public class ConnectionException extends XmppException
{
    /**
     * Connection failure categories.
     */
    public enum Kind
    {
        INVALID_CONFIG,
        TIMEOUT,
        TRANSPORT_ERROR,
        ALREADY_CONNECTING,
        ALREADY_ONLINE
    }

    private final Kind kind;

    public ConnectionException(Kind kind, String message)
    {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ConnectionException(Kind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind getKind()
    {
        return kind;
    }
}
