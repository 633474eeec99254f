package org.abstractica.xmpp;

import org.abstractica.xmpp.model.ArchiveQuery;
import org.abstractica.xmpp.model.ArchiveResult;
import org.abstractica.xmpp.model.Availability;
import org.abstractica.xmpp.model.DomainMessage;
import org.abstractica.xmpp.model.FileAttachment;
import org.abstractica.xmpp.model.FileMessage;
import org.abstractica.xmpp.model.MessageOptions;
import org.abstractica.xmpp.model.MessageStatusEvent;
import org.abstractica.xmpp.model.Presence;
import org.abstractica.xmpp.model.ReadStatus;
import org.abstractica.xmpp.model.Receipt;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A client session with an XMPP server.
 *
 * <p>The client keeps the session alive (reconnecting with exponential
 * backoff after failures), turns operations into stanzas and turns inbound
 * stanzas into typed events. Operations are asynchronous: each returns a
 * future that completes when the server accepted the stanza or answered
 * the query, or fails with an {@link XmppException}.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * XmppClient client = new DefaultXmppClientFactory().builder()
 *     .config(config)
 *     .engineFactory(engineFactory)
 *     .build();
 *
 * client.onMessage(message -> System.out.println(message.from() + ": " + message.body()));
 * client.onArchiveResult(result -> render(result.messages()));
 *
 * client.connect().join();
 * client.sendMessage("bob@example.com", "hi");
 * }</pre>
 */
public interface XmppClient extends AutoCloseable
{
    // ========== Lifecycle ==========

    /**
     * Connects to the server.
     *
     * @return completes when online; fails with {@link ConnectionException}
     */
    CompletableFuture<Void> connect();

    /**
     * Disconnects from the server and cancels any pending reconnect.
     *
     * @return completes when the stream is closed
     */
    CompletableFuture<Void> disconnect();

    /**
     * Disconnects and releases the client's event loop.
     */
    @Override
    void close();

    ConnectionStatus getStatus();

    /**
     * Returns the bare address of the connected account.
     *
     * @return the account address
     */
    String getUserAddress();

    // ========== Messaging ==========

    CompletableFuture<Void> sendMessage(String to, String body);

    CompletableFuture<Void> sendMessage(String to, String body, MessageOptions options);

    CompletableFuture<Void> sendGroupMessage(String roomAddress, String body, MessageOptions options);

    /**
     * Uploads a file and sends a message announcing it.
     *
     * @param to         recipient address
     * @param body       message text; the file name is used when empty
     * @param attachment the file
     * @return completes when the announcement was sent; fails with
     *         {@link FileTransferException} if the upload failed
     */
    CompletableFuture<Void> sendAttachment(String to, String body, FileAttachment attachment);

    /**
     * Downloads the file announced by a file message.
     *
     * @param message the file message
     * @return the file bytes
     */
    CompletableFuture<byte[]> downloadAttachment(FileMessage message);

    /**
     * Sends an archive query. The result is delivered once, complete, to
     * {@link #onArchiveResult} listeners.
     *
     * @param query the query
     * @return completes when the query was sent
     */
    CompletableFuture<Void> queryArchive(ArchiveQuery query);

    // ========== Presence ==========

    CompletableFuture<Void> broadcastPresence(Availability availability);

    CompletableFuture<Void> sendRoomPresence(String roomAddress, Availability availability);

    CompletableFuture<Void> subscribeToPresence(String address);

    CompletableFuture<Void> probePresence(String address);

    CompletableFuture<Void> acceptSubscription(String address);

    // ========== Message Status ==========

    /**
     * Records a message as read on the server, then sends a displayed
     * receipt to its sender.
     *
     * @param message the message that was read
     * @return completes when both steps succeeded; fails with {@link MessageStatusException}
     */
    CompletableFuture<Void> markMessageAsRead(DomainMessage message);

    /**
     * Records a message as delivered on the server, then sends a received
     * receipt to its sender.
     *
     * @param message the message that was delivered
     * @return completes when both steps succeeded; fails with {@link MessageStatusException}
     */
    CompletableFuture<Void> markMessageAsDelivered(DomainMessage message);

    /**
     * Looks up the recorded status of a message. A message without any
     * recorded status yields {@link ReadStatus#UNKNOWN}.
     *
     * @param messageId the message id
     * @param address   address of the message's sender
     * @return the status
     */
    CompletableFuture<ReadStatus> getMessageStatus(String messageId, String address);

    /**
     * Marks several messages as read concurrently. Any single failure fails
     * the whole batch.
     *
     * @param messages the messages
     * @return completes when all succeeded
     */
    CompletableFuture<Void> markMultipleMessagesAsRead(List<? extends DomainMessage> messages);

    /**
     * Marks several messages as delivered concurrently. Any single failure
     * fails the whole batch.
     *
     * @param messages the messages
     * @return completes when all succeeded
     */
    CompletableFuture<Void> markMultipleMessagesAsDelivered(List<? extends DomainMessage> messages);

    // ========== Events ==========

    void onStatus(Consumer<ConnectionStatus> handler);

    /**
     * Registers a callback for connection errors, including those that lead
     * to an automatic reconnect.
     *
     * @param handler called with the error
     */
    void onError(Consumer<XmppException> handler);

    void onMessage(Consumer<DomainMessage> handler);

    void onPresence(Consumer<Presence> handler);

    void onReceipt(Consumer<Receipt> handler);

    void onArchiveResult(Consumer<ArchiveResult> handler);

    void onMessageStatus(Consumer<MessageStatusEvent> handler);
}
