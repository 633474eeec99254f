package org.abstractica.xmpp.impl.status;

import org.abstractica.xmpp.MessageStatusException;
import org.abstractica.xmpp.ProtocolException;
import org.abstractica.xmpp.impl.connection.ConnectionManager;
import org.abstractica.xmpp.impl.stanza.StanzaBuilder;
import org.abstractica.xmpp.impl.stanza.StanzaParser;
import org.abstractica.xmpp.model.DomainMessage;
import org.abstractica.xmpp.model.MessageStatusEvent;
import org.abstractica.xmpp.model.ReadStatus;
import org.abstractica.xmpp.model.ReceiptType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * Records read and delivered status on the server and notifies senders.
 *
 * <p>Marking a message first sends a status iq and waits for the server to
 * accept it; only then is a receipt sent to the message's sender. Failures
 * are reported as {@link MessageStatusException}.</p>
 */
public class MessageStatusManager
{
    private static final Logger LOG = LoggerFactory.getLogger(MessageStatusManager.class);

    private final ConnectionManager connection;
    private final Consumer<MessageStatusEvent> events;

    /**
     * Creates a status manager.
     *
     * @param connection the connection to send through
     * @param events     receives the outcome of every mark operation
     */
    public MessageStatusManager(ConnectionManager connection, Consumer<MessageStatusEvent> events)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.events = Objects.requireNonNull(events, "events");
    }

    // ========== Marking ==========

    public CompletableFuture<Void> markAsRead(DomainMessage message)
    {
        return mark(message, ReceiptType.DISPLAYED);
    }

    public CompletableFuture<Void> markAsDelivered(DomainMessage message)
    {
        return mark(message, ReceiptType.RECEIVED);
    }

    /**
     * Marks all messages as read concurrently. Any failure fails the batch.
     *
     * @param messages the messages
     * @return completes when every message was marked
     */
    public CompletableFuture<Void> markMultipleAsRead(List<? extends DomainMessage> messages)
    {
        return CompletableFuture.allOf(messages.stream()
                .map(this::markAsRead)
                .toArray(CompletableFuture[]::new));
    }

    public CompletableFuture<Void> markMultipleAsDelivered(List<? extends DomainMessage> messages)
    {
        return CompletableFuture.allOf(messages.stream()
                .map(this::markAsDelivered)
                .toArray(CompletableFuture[]::new));
    }

    private CompletableFuture<Void> mark(DomainMessage message, ReceiptType receipt)
    {
        Objects.requireNonNull(message, "message");
        boolean read = receipt == ReceiptType.DISPLAYED;

        CompletableFuture<Void> result = new CompletableFuture<>();
        connection.sendQuery(read ? StanzaBuilder.markRead(message) : StanzaBuilder.markDelivered(message))
                .thenCompose(response -> connection.send(StanzaBuilder.receipt(message, receipt)))
                .whenComplete((ignored, error) ->
                {
                    if (error != null)
                    {
                        MessageStatusException failure = toStatusException(error);
                        LOG.warn("Failed to mark message {} as {}: {}", message.id(), read ? "read" : "delivered", failure.getMessage());
                        emit(read ? new MessageStatusEvent.ReadFailed(failure) : new MessageStatusEvent.DeliveredFailed(failure));
                        result.completeExceptionally(failure);
                        return;
                    }
                    emit(read
                            ? new MessageStatusEvent.Read(message.id(), message.from(), message.to())
                            : new MessageStatusEvent.Delivered(message.id(), message.from(), message.to()));
                    result.complete(null);
                });
        return result;
    }

    // ========== Lookup ==========

    /**
     * Looks up the recorded status of a message.
     *
     * <p>A message the server has no record for yields
     * {@link ReadStatus#UNKNOWN}. A response without a {@code status}
     * element fails with {@code SERVER_ERROR}.</p>
     *
     * @param messageId the message id
     * @param address   address of the message's sender
     * @return the status
     */
    public CompletableFuture<ReadStatus> getStatus(String messageId, String address)
    {
        CompletableFuture<ReadStatus> result = new CompletableFuture<>();
        connection.sendQuery(StanzaBuilder.statusQuery(messageId, address))
                .whenComplete((response, error) ->
                {
                    if (error != null)
                    {
                        Throwable cause = unwrap(error);
                        if (cause instanceof ProtocolException pe && pe.getError().is("item-not-found"))
                        {
                            result.complete(ReadStatus.UNKNOWN);
                        }
                        else
                        {
                            result.completeExceptionally(toStatusException(cause));
                        }
                        return;
                    }
                    StanzaParser.parseReadStatus(response).ifPresentOrElse(
                            result::complete,
                            () -> result.completeExceptionally(new MessageStatusException(
                                    MessageStatusException.Kind.SERVER_ERROR, "Invalid response format", null)));
                });
        return result;
    }

    // ========== Errors ==========

    /**
     * Maps a failure to a status exception by its stanza error condition.
     *
     * @param error the failure
     * @return the status exception
     */
    static MessageStatusException toStatusException(Throwable error)
    {
        Throwable cause = unwrap(error);
        if (cause instanceof MessageStatusException mse)
        {
            return mse;
        }
        if (cause instanceof ProtocolException pe)
        {
            switch (pe.getCondition())
            {
                case "item-not-found":
                    return new MessageStatusException(MessageStatusException.Kind.NOT_FOUND,
                            "Message status not found", pe);
                case "forbidden":
                    return new MessageStatusException(MessageStatusException.Kind.UNAUTHORIZED,
                            "Not authorized to access message status", pe);
                case "bad-request":
                    if (pe.getMessage().toLowerCase(Locale.ROOT).contains("jid"))
                    {
                        return new MessageStatusException(MessageStatusException.Kind.INVALID_JID,
                                "Invalid JID format", pe);
                    }
                    return new MessageStatusException(MessageStatusException.Kind.INVALID_ID,
                            "Invalid message ID", pe);
                default:
                    break;
            }
        }
        String message = cause.getMessage() != null ? cause.getMessage() : "Unknown error";
        return new MessageStatusException(MessageStatusException.Kind.SERVER_ERROR, message, cause);
    }

    private void emit(MessageStatusEvent event)
    {
        try
        {
            events.accept(event);
        }
        catch (Exception e)
        {
            LOG.error("Callback error", e);
        }
    }

    private static Throwable unwrap(Throwable error)
    {
        if (error instanceof CompletionException && error.getCause() != null)
        {
            return error.getCause();
        }
        return error;
    }
}
