package org.abstractica.xmpp.model;

import org.abstractica.xmpp.MessageStatusException;

/**
 * Outcome of a read/delivered status change initiated by this client.
 *
 * <p>Sealed interface enabling exhaustive handling of status outcomes.</p>
 */
public sealed interface MessageStatusEvent
{
    /**
     * A message was marked as read and the displayed receipt sent.
     */
    record Read(String messageId, String from, String to) implements MessageStatusEvent {}

    /**
     * A message was marked as delivered and the received receipt sent.
     */
    record Delivered(String messageId, String from, String to) implements MessageStatusEvent {}

    /**
     * Marking one or more messages as read failed.
     */
    record ReadFailed(MessageStatusException error) implements MessageStatusEvent {}

    /**
     * Marking one or more messages as delivered failed.
     */
    record DeliveredFailed(MessageStatusException error) implements MessageStatusEvent {}
}
