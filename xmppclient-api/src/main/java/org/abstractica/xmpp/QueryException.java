package org.abstractica.xmpp;

import java.util.Objects;

/**
 * Failure to deliver a stanza or to obtain a response to a correlated query.
 *
 * <p>Errors reported by the server itself are not query exceptions; they are
 * raised as {@link ProtocolException}.</p>
 */
public class QueryException extends XmppException
{
    /**
     * Query failure categories.
     */
    public enum Kind
    {
        /** The session is not online, or was torn down while waiting. */
        NOT_CONNECTED,
        /** The engine failed to write the stanza. */
        SEND_FAILED,
        /** No response arrived within the configured query timeout. */
        TIMEOUT,
        /** Another query with the same id is still outstanding. */
        DUPLICATE_ID
    }

    private final Kind kind;

    public QueryException(Kind kind, String message)
    {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public QueryException(Kind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind getKind()
    {
        return kind;
    }
}
