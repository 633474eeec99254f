/**
 * XMPP client implementation module.
 *
 * <p>Provides the default client: connection management, stanza building
 * and parsing, dispatch, archive aggregation and the feature services.</p>
 */
module xmppclient.impl
{
    requires transitive xmppclient.api;
    requires org.slf4j;
    requires java.net.http;

    // Factory and the building blocks it wires together
    exports org.abstractica.xmpp.impl.client;
    exports org.abstractica.xmpp.impl.connection;
    exports org.abstractica.xmpp.impl.dispatch;
    exports org.abstractica.xmpp.impl.archive;
    exports org.abstractica.xmpp.impl.stanza;
    exports org.abstractica.xmpp.impl.status;
    exports org.abstractica.xmpp.impl.files;

    // Simulated engine for testing against the client
    exports org.abstractica.xmpp.impl.transport;
}
