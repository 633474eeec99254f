package org.abstractica.xmpp;

/**
 * Creates a fresh {@link XmppEngine} for each connection attempt.
 */
@FunctionalInterface
public interface EngineFactory
{
    /**
     * Creates an engine configured for the given account.
     *
     * @param config the connection settings
     * @return a new, unstarted engine
     */
    XmppEngine create(ConnectionConfig config);
}
