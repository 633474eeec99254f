package org.abstractica.xmpp;

/**
 * State of the client's session with the server.
 */
public enum ConnectionStatus
{
    /**
     * No session. Initial state, and the state after an explicit disconnect
     * or after the server closed the stream.
     */
    DISCONNECTED,

    /**
     * The engine has been started and the client is waiting for it to come
     * online, bounded by the connect timeout.
     */
    CONNECTING,

    /**
     * The session is established; stanzas may be sent.
     */
    ONLINE,

    /**
     * The last connection attempt failed. An automatic reconnect may be
     * pending.
     */
    ERROR,

    /**
     * An explicit disconnect is stopping the engine.
     */
    DISCONNECTING
}
