package org.abstractica.xmpp.impl.client;

import org.abstractica.xmpp.ConnectionConfig;
import org.abstractica.xmpp.ConnectionException;
import org.abstractica.xmpp.ConnectionStatus;
import org.abstractica.xmpp.EngineFactory;
import org.abstractica.xmpp.FileTransferException;
import org.abstractica.xmpp.XmppClient;
import org.abstractica.xmpp.XmppException;
import org.abstractica.xmpp.impl.archive.ArchiveResultAggregator;
import org.abstractica.xmpp.impl.connection.ConnectionListener;
import org.abstractica.xmpp.impl.connection.ConnectionManager;
import org.abstractica.xmpp.impl.connection.EventLoop;
import org.abstractica.xmpp.impl.connection.ReconnectPolicy;
import org.abstractica.xmpp.impl.dispatch.DispatchListener;
import org.abstractica.xmpp.impl.dispatch.Dispatcher;
import org.abstractica.xmpp.impl.files.AttachmentManager;
import org.abstractica.xmpp.impl.files.FileTransfer;
import org.abstractica.xmpp.impl.stanza.StanzaBuilder;
import org.abstractica.xmpp.impl.status.MessageStatusManager;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Default implementation of the XmppClient interface.
 *
 * <p>Wires the connection manager, the dispatcher and the feature services
 * together and fans their events out to registered callbacks. Callbacks run
 * on the client's event loop; an exception thrown by one is logged and does
 * not affect the others.</p>
 */
public class DefaultXmppClient implements XmppClient
{
    private static final Logger LOG = LoggerFactory.getLogger(DefaultXmppClient.class);

    private final ConnectionConfig config;
    private final EventLoop loop;
    private final boolean ownsLoop;
    private final ConnectionManager connection;
    private final MessageStatusManager statusManager;
    private final AttachmentManager attachments;

    private final List<Consumer<ConnectionStatus>> statusCallbacks;
    private final List<Consumer<XmppException>> errorCallbacks;
    private final List<Consumer<DomainMessage>> messageCallbacks;
    private final List<Consumer<Presence>> presenceCallbacks;
    private final List<Consumer<Receipt>> receiptCallbacks;
    private final List<Consumer<ArchiveResult>> archiveCallbacks;
    private final List<Consumer<MessageStatusEvent>> messageStatusCallbacks;

    /**
     * Creates a new client. The client stays disconnected until
     * {@link #connect()} is called.
     */
    DefaultXmppClient(
            ConnectionConfig config,
            EngineFactory engineFactory,
            FileTransfer fileTransfer,
            EventLoop loop,
            boolean ownsLoop,
            ReconnectPolicy reconnectPolicy
    )
    {
        this.config = Objects.requireNonNull(config, "config");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.ownsLoop = ownsLoop;

        this.statusCallbacks = new CopyOnWriteArrayList<>();
        this.errorCallbacks = new CopyOnWriteArrayList<>();
        this.messageCallbacks = new CopyOnWriteArrayList<>();
        this.presenceCallbacks = new CopyOnWriteArrayList<>();
        this.receiptCallbacks = new CopyOnWriteArrayList<>();
        this.archiveCallbacks = new CopyOnWriteArrayList<>();
        this.messageStatusCallbacks = new CopyOnWriteArrayList<>();

        this.connection = new ConnectionManager(config, engineFactory, loop, reconnectPolicy);
        this.statusManager = new MessageStatusManager(connection, event -> emit(messageStatusCallbacks, event));
        this.attachments = new AttachmentManager(connection, fileTransfer);

        connection.addListener(new Dispatcher(new ArchiveResultAggregator(), new InboundEvents()));
        connection.addListener(new ConnectionListener()
        {
            @Override
            public void onStatus(ConnectionStatus status)
            {
                emit(statusCallbacks, status);
            }

            @Override
            public void onError(ConnectionException error)
            {
                emit(errorCallbacks, error);
            }
        });
    }

    // ========== Lifecycle ==========

    @Override
    public CompletableFuture<Void> connect()
    {
        return connection.connect();
    }

    @Override
    public CompletableFuture<Void> disconnect()
    {
        return connection.disconnect();
    }

    @Override
    public void close()
    {
        connection.disconnect().whenComplete((ignored, error) ->
        {
            if (error != null)
            {
                LOG.warn("Disconnect on close failed: {}", error.getMessage());
            }
            if (ownsLoop)
            {
                loop.close();
            }
        });
    }

    @Override
    public ConnectionStatus getStatus()
    {
        return connection.getStatus();
    }

    @Override
    public String getUserAddress()
    {
        return connection.getUserAddress();
    }

    // ========== Messaging ==========

    @Override
    public CompletableFuture<Void> sendMessage(String to, String body)
    {
        return sendMessage(to, body, MessageOptions.none());
    }

    @Override
    public CompletableFuture<Void> sendMessage(String to, String body, MessageOptions options)
    {
        return connection.send(StanzaBuilder.chatMessage(to, body, options));
    }

    @Override
    public CompletableFuture<Void> sendGroupMessage(String roomAddress, String body, MessageOptions options)
    {
        return connection.send(StanzaBuilder.groupChatMessage(roomAddress, body, options));
    }

    @Override
    public CompletableFuture<Void> sendAttachment(String to, String body, FileAttachment attachment)
    {
        return attachments.sendAttachment(to, body, attachment);
    }

    @Override
    public CompletableFuture<byte[]> downloadAttachment(FileMessage message)
    {
        Objects.requireNonNull(message, "message");
        if (message.url() == null)
        {
            return CompletableFuture.failedFuture(new FileTransferException(
                    FileTransferException.Kind.DOWNLOAD_FAILED, "File message has no URL"));
        }
        return attachments.download(message.url());
    }

    @Override
    public CompletableFuture<Void> queryArchive(ArchiveQuery query)
    {
        return connection.send(StanzaBuilder.archiveQuery(query));
    }

    // ========== Presence ==========

    @Override
    public CompletableFuture<Void> broadcastPresence(Availability availability)
    {
        return connection.send(StanzaBuilder.availability(availability));
    }

    @Override
    public CompletableFuture<Void> sendRoomPresence(String roomAddress, Availability availability)
    {
        return connection.send(StanzaBuilder.roomPresence(roomAddress, availability));
    }

    @Override
    public CompletableFuture<Void> subscribeToPresence(String address)
    {
        return connection.send(StanzaBuilder.subscribe(address));
    }

    @Override
    public CompletableFuture<Void> probePresence(String address)
    {
        return connection.send(StanzaBuilder.probe(address));
    }

    @Override
    public CompletableFuture<Void> acceptSubscription(String address)
    {
        return connection.send(StanzaBuilder.subscribed(address));
    }

    // ========== Message Status ==========

    @Override
    public CompletableFuture<Void> markMessageAsRead(DomainMessage message)
    {
        return statusManager.markAsRead(message);
    }

    @Override
    public CompletableFuture<Void> markMessageAsDelivered(DomainMessage message)
    {
        return statusManager.markAsDelivered(message);
    }

    @Override
    public CompletableFuture<ReadStatus> getMessageStatus(String messageId, String address)
    {
        return statusManager.getStatus(messageId, address);
    }

    @Override
    public CompletableFuture<Void> markMultipleMessagesAsRead(List<? extends DomainMessage> messages)
    {
        return statusManager.markMultipleAsRead(messages);
    }

    @Override
    public CompletableFuture<Void> markMultipleMessagesAsDelivered(List<? extends DomainMessage> messages)
    {
        return statusManager.markMultipleAsDelivered(messages);
    }

    // ========== Events ==========

    @Override
    public void onStatus(Consumer<ConnectionStatus> handler)
    {
        statusCallbacks.add(Objects.requireNonNull(handler, "handler"));
    }

    @Override
    public void onError(Consumer<XmppException> handler)
    {
        errorCallbacks.add(Objects.requireNonNull(handler, "handler"));
    }

    @Override
    public void onMessage(Consumer<DomainMessage> handler)
    {
        messageCallbacks.add(Objects.requireNonNull(handler, "handler"));
    }

    @Override
    public void onPresence(Consumer<Presence> handler)
    {
        presenceCallbacks.add(Objects.requireNonNull(handler, "handler"));
    }

    @Override
    public void onReceipt(Consumer<Receipt> handler)
    {
        receiptCallbacks.add(Objects.requireNonNull(handler, "handler"));
    }

    @Override
    public void onArchiveResult(Consumer<ArchiveResult> handler)
    {
        archiveCallbacks.add(Objects.requireNonNull(handler, "handler"));
    }

    @Override
    public void onMessageStatus(Consumer<MessageStatusEvent> handler)
    {
        messageStatusCallbacks.add(Objects.requireNonNull(handler, "handler"));
    }

    // ========== Internal ==========

    /**
     * Looks up the read status of a message when enabled. A failed lookup
     * leaves the message without status.
     */
    private CompletableFuture<DomainMessage> resolveReadStatus(DomainMessage message)
    {
        if (!config.resolveReadStatus() || message.id() == null || message.from() == null)
        {
            return CompletableFuture.completedFuture(message);
        }
        return statusManager.getStatus(message.id(), message.from())
                .handle((status, error) ->
                {
                    if (error != null)
                    {
                        LOG.debug("Read status lookup for {} failed: {}", message.id(), error.getMessage());
                        return message;
                    }
                    return message.withReadStatus(status);
                });
    }

    private <T> void emit(List<Consumer<T>> callbacks, T event)
    {
        for (Consumer<T> callback : callbacks)
        {
            safeCallback(() -> callback.accept(event));
        }
    }

    private void safeCallback(Runnable callback)
    {
        try
        {
            callback.run();
        }
        catch (Exception e)
        {
            LOG.error("Callback error", e);
        }
    }

    /**
     * Emits inbound events in arrival order. An event waiting for its read
     * status holds back every event that arrived after it.
     */
    private final class InboundEvents implements DispatchListener
    {
        // Loop-confined; completes once every earlier event was emitted
        private CompletableFuture<Void> emitted = CompletableFuture.completedFuture(null);

        @Override
        public void onPresence(Presence presence)
        {
            inOrder(CompletableFuture.completedFuture(emission(presenceCallbacks, presence)));
        }

        @Override
        public void onReceipt(Receipt receipt)
        {
            inOrder(CompletableFuture.completedFuture(emission(receiptCallbacks, receipt)));
        }

        @Override
        public void onMessage(DomainMessage message)
        {
            inOrder(resolveReadStatus(message).thenApply(resolved -> emission(messageCallbacks, resolved)));
        }

        @Override
        public void onArchiveResult(ArchiveResult result)
        {
            if (!config.resolveReadStatus() || result.messages().isEmpty())
            {
                inOrder(CompletableFuture.completedFuture(emission(archiveCallbacks, result)));
                return;
            }
            List<CompletableFuture<DomainMessage>> lookups = result.messages().stream()
                    .map(DefaultXmppClient.this::resolveReadStatus)
                    .toList();
            inOrder(CompletableFuture.allOf(lookups.toArray(CompletableFuture[]::new))
                    .thenApply(ignored -> emission(archiveCallbacks, result.withMessages(
                            lookups.stream().map(CompletableFuture::join).toList()))));
        }

        private void inOrder(CompletableFuture<Runnable> ready)
        {
            emitted = emitted.thenCombine(ready, (ignored, emission) ->
            {
                emission.run();
                return (Void) null;
            });
        }
    }

    private <T> Runnable emission(List<Consumer<T>> callbacks, T event)
    {
        return () -> emit(callbacks, event);
    }
}
