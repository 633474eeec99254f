package org.abstractica.xmpp;

import java.util.Objects;

/**
 * Failure of a read/delivered status operation.
 */
public class MessageStatusException extends XmppException
{
    /**
     * Status failure categories.
     */
    public enum Kind
    {
        NOT_FOUND,
        UNAUTHORIZED,
        INVALID_ID,
        INVALID_JID,
        SERVER_ERROR
    }

    private final Kind kind;

    public MessageStatusException(Kind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind getKind()
    {
        return kind;
    }
}
