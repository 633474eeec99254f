package org.abstractica.xmpp.impl.connection;

import org.abstractica.xmpp.ConnectionException;
import org.abstractica.xmpp.ConnectionStatus;
import org.abstractica.xmpp.Frame;

/**
 * Observes a {@link ConnectionManager}.
 *
 * <p>All callbacks run on the manager's event loop, synchronously at the
 * point of the transition they describe. Implement only the callbacks you
 * need.</p>
 */
public interface ConnectionListener
{
    /**
     * The connection status changed.
     *
     * @param status the new status
     */
    default void onStatus(ConnectionStatus status) {}

    /**
     * A connection attempt or the established stream failed.
     *
     * @param error the failure
     */
    default void onError(ConnectionException error) {}

    default void onOnline() {}

    default void onOffline() {}

    /**
     * A stanza arrived. Responses to correlated queries are delivered here
     * too, after their query has been resolved.
     *
     * @param frame the stanza
     */
    default void onFrame(Frame frame) {}

    /**
     * A stanza was handed to the engine.
     *
     * @param frame the stanza
     */
    default void onFrameSent(Frame frame) {}
}
