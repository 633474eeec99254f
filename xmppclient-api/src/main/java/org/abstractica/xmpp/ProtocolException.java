package org.abstractica.xmpp;

import java.util.Objects;

/**
 * A correlated query was answered with a structured stanza error.
 */
public class ProtocolException extends XmppException
{
    private final StanzaError error;

    public ProtocolException(StanzaError error)
    {
        super(describe(error));
        this.error = error;
    }

    public StanzaError getError()
    {
        return error;
    }

    public String getCondition()
    {
        return error.condition();
    }

    private static String describe(StanzaError error)
    {
        Objects.requireNonNull(error, "error");
        if (error.text() == null || error.text().isEmpty())
        {
            return error.condition();
        }
        return error.condition() + ": " + error.text();
    }
}
