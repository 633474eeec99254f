package org.abstractica.xmpp.impl.dispatch;

import org.abstractica.xmpp.model.ArchiveResult;
import org.abstractica.xmpp.model.DomainMessage;
import org.abstractica.xmpp.model.Presence;
import org.abstractica.xmpp.model.Receipt;

/**
 * Receives the typed events produced by the {@link Dispatcher}.
 */
public interface DispatchListener
{
    default void onPresence(Presence presence) {}

    default void onMessage(DomainMessage message) {}

    default void onReceipt(Receipt receipt) {}

    /**
     * A complete archive result. Emitted once per query, when its terminal
     * element arrives.
     *
     * @param result the result
     */
    default void onArchiveResult(ArchiveResult result) {}
}
