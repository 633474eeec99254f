package org.abstractica.xmpp;

/**
 * Base class of all errors raised by the client.
 *
 * <p>Asynchronous operations complete their futures exceptionally with a
 * subclass of this type. Each subclass exposes a {@code Kind} describing
 * the failure category.</p>
 */
public abstract class XmppException extends RuntimeException
{
    protected XmppException(String message)
    {
        super(message);
    }

    protected XmppException(String message, Throwable cause)
    {
        super(message, cause);
    }
}
