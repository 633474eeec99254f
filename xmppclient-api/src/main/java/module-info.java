/**
 * XMPP client API module.
 *
 * <p>Provides the client interface, connection settings, the stanza frame
 * model, the engine boundary and the domain types delivered as events.</p>
 */
module xmppclient.api
{
    exports org.abstractica.xmpp;
    exports org.abstractica.xmpp.model;
}
