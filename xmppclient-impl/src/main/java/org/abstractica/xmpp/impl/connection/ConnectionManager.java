package org.abstractica.xmpp.impl.connection;

import org.abstractica.xmpp.ConnectionConfig;
import org.abstractica.xmpp.ConnectionException;
import org.abstractica.xmpp.ConnectionStatus;
import org.abstractica.xmpp.EngineFactory;
import org.abstractica.xmpp.Frame;
import org.abstractica.xmpp.ProtocolException;
import org.abstractica.xmpp.QueryException;
import org.abstractica.xmpp.StanzaError;
import org.abstractica.xmpp.XmppEngine;
import org.abstractica.xmpp.impl.stanza.StanzaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the session with the XMPP engine.
 *
 * <p>Drives the connection state machine (timeout-bounded connect,
 * online/offline/error transitions, exponential-backoff reconnect), sends
 * stanzas and correlates query responses with their requests.</p>
 *
 * <p>All state is confined to the {@link EventLoop}. Public methods post
 * their work to the loop and return futures; engine callbacks are posted
 * the same way. Listener callbacks run on the loop, synchronously at the
 * transition they report.</p>
 */
public class ConnectionManager
{
    private static final Logger LOG = LoggerFactory.getLogger(ConnectionManager.class);

    private final ConnectionConfig config;
    private final EngineFactory engineFactory;
    private final EventLoop loop;
    private final ReconnectPolicy reconnectPolicy;
    private final List<ConnectionListener> listeners;

    // Loop-confined state
    private volatile ConnectionStatus status;
    private TransportSession session;
    private int attempts;
    private EventLoop.ScheduledTask connectTimeoutTask;
    private EventLoop.ScheduledTask reconnectTask;
    private CompletableFuture<Void> pendingConnect;
    private final Map<String, PendingRequest> pendingRequests;

    /**
     * A correlated query awaiting its response.
     */
    private record PendingRequest(
            String id,
            CompletableFuture<Frame> future,
            EventLoop.ScheduledTask timeoutTask
    )
    {
    }

    /**
     * Creates a connection manager with the default reconnect policy.
     *
     * @param config        connection settings
     * @param engineFactory creates one engine per connection attempt
     * @param loop          event loop confining the session state
     */
    public ConnectionManager(ConnectionConfig config, EngineFactory engineFactory, EventLoop loop)
    {
        this(config, engineFactory, loop, ReconnectPolicy.DEFAULT);
    }

    public ConnectionManager(
            ConnectionConfig config,
            EngineFactory engineFactory,
            EventLoop loop,
            ReconnectPolicy reconnectPolicy
    )
    {
        this.config = Objects.requireNonNull(config, "config");
        this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
        this.listeners = new CopyOnWriteArrayList<>();
        this.pendingRequests = new HashMap<>();
        this.status = ConnectionStatus.DISCONNECTED;
    }

    // ========== Accessors ==========

    public ConnectionStatus getStatus()
    {
        return status;
    }

    public ConnectionConfig getConfig()
    {
        return config;
    }

    /**
     * Returns the bare address of the configured account.
     *
     * @return the account address
     */
    public String getUserAddress()
    {
        return config.principal();
    }

    public boolean isConnected()
    {
        return status == ConnectionStatus.ONLINE;
    }

    public void addListener(ConnectionListener listener)
    {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ConnectionListener listener)
    {
        listeners.remove(listener);
    }

    // ========== Lifecycle ==========

    /**
     * Starts a connection attempt.
     *
     * <p>Fails with {@code ALREADY_CONNECTING} or {@code ALREADY_ONLINE},
     * leaving the state untouched, when an attempt is in progress or the
     * session is online. Otherwise any pending reconnect is cancelled, the
     * reconnect attempt count starts over and a fresh engine is started.</p>
     *
     * @return completes when online; fails with {@link ConnectionException}
     */
    public CompletableFuture<Void> connect()
    {
        CompletableFuture<Void> future = new CompletableFuture<>();
        loop.execute(() ->
        {
            if (status == ConnectionStatus.CONNECTING)
            {
                future.completeExceptionally(new ConnectionException(
                        ConnectionException.Kind.ALREADY_CONNECTING, "Connection already in progress"));
                return;
            }
            if (status == ConnectionStatus.ONLINE)
            {
                future.completeExceptionally(new ConnectionException(
                        ConnectionException.Kind.ALREADY_ONLINE, "Already connected"));
                return;
            }
            cancel(reconnectTask);
            reconnectTask = null;
            attempts = 0;
            startAttempt(future);
        });
        return future;
    }

    /**
     * Closes the session and cancels any pending reconnect.
     *
     * <p>Does nothing when no engine exists. A failing engine stop still
     * tears the session down; the returned future then fails with
     * {@code TRANSPORT_ERROR}.</p>
     *
     * @return completes when the session is torn down
     */
    public CompletableFuture<Void> disconnect()
    {
        CompletableFuture<Void> future = new CompletableFuture<>();
        loop.execute(() ->
        {
            if (session == null)
            {
                // Engine creation failed; only a reconnect wait can be pending
                cancel(reconnectTask);
                reconnectTask = null;
                if (status == ConnectionStatus.ERROR)
                {
                    setStatus(ConnectionStatus.DISCONNECTED);
                }
                future.complete(null);
                return;
            }

            LOG.info("Disconnecting from {}", config.serviceUri());

            cancel(connectTimeoutTask);
            connectTimeoutTask = null;
            cancel(reconnectTask);
            reconnectTask = null;

            TransportSession closing = session;
            closing.deactivate();
            setStatus(ConnectionStatus.DISCONNECTING);
            failPendingConnect(new ConnectionException(
                    ConnectionException.Kind.TRANSPORT_ERROR, "Disconnected before going online"));

            CompletableFuture<Void> stopped;
            try
            {
                stopped = closing.engine.stop();
            }
            catch (RuntimeException e)
            {
                stopped = CompletableFuture.failedFuture(e);
            }
            stopped.whenComplete((ignored, error) -> loop.execute(() ->
            {
                if (session == closing)
                {
                    teardown();
                }
                if (error != null)
                {
                    Throwable cause = unwrap(error);
                    LOG.warn("Engine stop failed: {}", cause.getMessage());
                    future.completeExceptionally(new ConnectionException(
                            ConnectionException.Kind.TRANSPORT_ERROR, "Disconnect failed: " + cause.getMessage(), cause));
                }
                else
                {
                    future.complete(null);
                }
            }));
        });
        return future;
    }

    // ========== Sending ==========

    /**
     * Sends a stanza without waiting for a response.
     *
     * @param frame the stanza
     * @return completes when the engine accepted the stanza; fails with
     *         {@link QueryException} ({@code NOT_CONNECTED}, {@code SEND_FAILED})
     */
    public CompletableFuture<Void> send(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");
        CompletableFuture<Void> future = new CompletableFuture<>();
        loop.execute(() ->
        {
            if (!isConnected() || session == null)
            {
                future.completeExceptionally(notConnected());
                return;
            }
            transmit(frame).whenComplete((ignored, error) -> loop.execute(() ->
            {
                if (error != null)
                {
                    Throwable cause = unwrap(error);
                    LOG.warn("Failed to send {}: {}", frame.getName(), cause.getMessage());
                    future.completeExceptionally(new QueryException(
                            QueryException.Kind.SEND_FAILED, "Failed to send stanza: " + cause.getMessage(), cause));
                }
                else
                {
                    future.complete(null);
                }
            }));
        });
        return future;
    }

    /**
     * Sends a query and waits for the {@code iq} response with the same id.
     *
     * <p>A random id is attached when the frame carries none. A
     * {@code result} response completes the future; an {@code error}
     * response fails it with {@link ProtocolException}. The query fails
     * with {@link QueryException} when the session is not online, when the
     * id is already outstanding, when the stanza cannot be sent, when no
     * response arrives within the query timeout, or when the session is
     * torn down while waiting.</p>
     *
     * @param frame the query stanza
     * @return the response stanza
     */
    public CompletableFuture<Frame> sendQuery(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");
        CompletableFuture<Frame> future = new CompletableFuture<>();
        loop.execute(() ->
        {
            if (!isConnected() || session == null)
            {
                future.completeExceptionally(notConnected());
                return;
            }

            String id = frame.getAttribute("id");
            Frame query = frame;
            if (id == null || id.isEmpty())
            {
                id = UUID.randomUUID().toString();
                query = frame.withAttribute("id", id);
            }
            if (pendingRequests.containsKey(id))
            {
                future.completeExceptionally(new QueryException(
                        QueryException.Kind.DUPLICATE_ID, "Query already outstanding: " + id));
                return;
            }

            String queryId = id;
            EventLoop.ScheduledTask timeout = loop.schedule(() -> handleQueryTimeout(queryId), config.queryTimeout());
            pendingRequests.put(id, new PendingRequest(id, future, timeout));

            transmit(query).whenComplete((ignored, error) ->
            {
                if (error != null)
                {
                    loop.execute(() -> handleQuerySendFailure(queryId, unwrap(error)));
                }
            });
        });
        return future;
    }

    // ========== Transitions ==========

    private void startAttempt(CompletableFuture<Void> future)
    {
        if (session != null)
        {
            retire(session);
            session = null;
        }

        LOG.info("Connecting to {} as {}", config.serviceUri(), config.principal());

        pendingConnect = future;
        TransportSession attempt;
        try
        {
            attempt = new TransportSession(engineFactory.create(config));
        }
        catch (RuntimeException e)
        {
            setStatus(ConnectionStatus.CONNECTING);
            handleConnectionError(e);
            return;
        }
        session = attempt;
        setStatus(ConnectionStatus.CONNECTING);
        connectTimeoutTask = loop.schedule(() ->
        {
            if (session == attempt && status == ConnectionStatus.CONNECTING)
            {
                handleConnectionError(new ConnectionException(
                        ConnectionException.Kind.TIMEOUT, "Connection timeout after " + config.connectTimeoutMs() + " ms"));
            }
        }, config.connectTimeout());

        CompletableFuture<Void> started;
        try
        {
            started = attempt.engine.start();
        }
        catch (RuntimeException e)
        {
            started = CompletableFuture.failedFuture(e);
        }
        started.whenComplete((ignored, error) ->
        {
            if (error != null)
            {
                loop.execute(() ->
                {
                    if (attempt.isCurrent() && status == ConnectionStatus.CONNECTING)
                    {
                        handleConnectionError(unwrap(error));
                    }
                });
            }
        });
    }

    private void handleOnline()
    {
        if (status != ConnectionStatus.CONNECTING)
        {
            LOG.debug("Ignoring online event in state {}", status);
            return;
        }
        cancel(connectTimeoutTask);
        connectTimeoutTask = null;
        attempts = 0;

        LOG.info("Online as {}", config.principal());

        setStatus(ConnectionStatus.ONLINE);
        for (ConnectionListener listener : listeners)
        {
            safeCallback(listener::onOnline);
        }
        CompletableFuture<Void> future = pendingConnect;
        pendingConnect = null;
        if (future != null)
        {
            future.complete(null);
        }
    }

    private void handleOffline()
    {
        LOG.info("Stream closed");

        TransportSession closed = session;
        session = null;
        closed.deactivate();
        cancel(connectTimeoutTask);
        connectTimeoutTask = null;
        rejectPendingRequests();
        failPendingConnect(new ConnectionException(
                ConnectionException.Kind.TRANSPORT_ERROR, "Stream closed before going online"));
        setStatus(ConnectionStatus.DISCONNECTED);
        for (ConnectionListener listener : listeners)
        {
            safeCallback(listener::onOffline);
        }
    }

    private void handleConnectionError(Throwable cause)
    {
        cancel(connectTimeoutTask);
        connectTimeoutTask = null;

        ConnectionException error = cause instanceof ConnectionException ce
                ? ce
                : new ConnectionException(ConnectionException.Kind.TRANSPORT_ERROR,
                        "Connection error: " + cause.getMessage(), cause);

        LOG.warn("Connection error: {}", error.getMessage());

        // Handle stays so a disconnect during backoff can still stop it
        if (session != null)
        {
            session.deactivate();
        }
        rejectPendingRequests();
        setStatus(ConnectionStatus.ERROR);
        for (ConnectionListener listener : listeners)
        {
            safeCallback(() -> listener.onError(error));
        }
        failPendingConnect(error);

        scheduleReconnect();
    }

    private void scheduleReconnect()
    {
        if (!reconnectPolicy.allows(attempts) || status == ConnectionStatus.DISCONNECTED)
        {
            LOG.info("Not reconnecting after {} attempts", attempts);
            if (session != null)
            {
                retire(session);
                session = null;
            }
            return;
        }
        Duration delay = reconnectPolicy.delayFor(attempts);
        attempts++;

        LOG.info("Reconnecting in {} ms (attempt {} of {})", delay.toMillis(), attempts, reconnectPolicy.maxAttempts());

        reconnectTask = loop.schedule(() ->
        {
            reconnectTask = null;
            if (status != ConnectionStatus.ERROR)
            {
                LOG.debug("Skipping reconnect in state {}", status);
                return;
            }
            startAttempt(new CompletableFuture<>());
        }, delay);
    }

    private void teardown()
    {
        session = null;
        attempts = 0;
        rejectPendingRequests();
        setStatus(ConnectionStatus.DISCONNECTED);
    }

    // ========== Frames ==========

    private CompletableFuture<Void> transmit(Frame frame)
    {
        for (ConnectionListener listener : listeners)
        {
            safeCallback(() -> listener.onFrameSent(frame));
        }
        try
        {
            return session.engine.send(frame);
        }
        catch (RuntimeException e)
        {
            return CompletableFuture.failedFuture(e);
        }
    }

    private void handleFrame(Frame frame)
    {
        if (frame.is("iq"))
        {
            correlate(frame);
        }
        for (ConnectionListener listener : listeners)
        {
            safeCallback(() -> listener.onFrame(frame));
        }
    }

    private void correlate(Frame iq)
    {
        String type = iq.getAttribute("type");
        String id = iq.getAttribute("id");
        if (id == null || !("result".equals(type) || "error".equals(type)))
        {
            return;
        }
        PendingRequest request = pendingRequests.remove(id);
        if (request == null)
        {
            return;
        }
        cancel(request.timeoutTask());
        if ("result".equals(type))
        {
            request.future().complete(iq);
        }
        else
        {
            StanzaError error = StanzaParser.parseStanzaError(iq)
                    .orElse(new StanzaError(StanzaError.UNDEFINED_CONDITION, null, null));
            LOG.debug("Query {} rejected: {}", id, error.condition());
            request.future().completeExceptionally(new ProtocolException(error));
        }
    }

    private void handleQueryTimeout(String id)
    {
        PendingRequest request = pendingRequests.remove(id);
        if (request != null)
        {
            LOG.warn("Query {} timed out", id);
            request.future().completeExceptionally(new QueryException(
                    QueryException.Kind.TIMEOUT, "No response to query " + id + " within " + config.queryTimeout().toMillis() + " ms"));
        }
    }

    private void handleQuerySendFailure(String id, Throwable cause)
    {
        PendingRequest request = pendingRequests.remove(id);
        if (request != null)
        {
            cancel(request.timeoutTask());
            LOG.warn("Failed to send query {}: {}", id, cause.getMessage());
            request.future().completeExceptionally(new QueryException(
                    QueryException.Kind.SEND_FAILED, "Failed to send query: " + cause.getMessage(), cause));
        }
    }

    private void rejectPendingRequests()
    {
        if (pendingRequests.isEmpty())
        {
            return;
        }
        List<PendingRequest> rejected = new ArrayList<>(pendingRequests.values());
        pendingRequests.clear();
        for (PendingRequest request : rejected)
        {
            cancel(request.timeoutTask());
            request.future().completeExceptionally(new QueryException(
                    QueryException.Kind.NOT_CONNECTED, "Connection lost while waiting for query " + request.id()));
        }
    }

    // ========== Helpers ==========

    private void setStatus(ConnectionStatus newStatus)
    {
        if (status == newStatus)
        {
            return;
        }
        LOG.debug("Status {} -> {}", status, newStatus);
        status = newStatus;
        for (ConnectionListener listener : listeners)
        {
            safeCallback(() -> listener.onStatus(newStatus));
        }
    }

    private void failPendingConnect(ConnectionException error)
    {
        CompletableFuture<Void> future = pendingConnect;
        pendingConnect = null;
        if (future != null)
        {
            future.completeExceptionally(error);
        }
    }

    private void retire(TransportSession old)
    {
        old.deactivate();
        try
        {
            old.engine.stop().whenComplete((ignored, error) ->
            {
                if (error != null)
                {
                    LOG.debug("Stopping previous engine failed: {}", unwrap(error).getMessage());
                }
            });
        }
        catch (RuntimeException e)
        {
            LOG.debug("Stopping previous engine failed: {}", e.getMessage());
        }
    }

    private static QueryException notConnected()
    {
        return new QueryException(QueryException.Kind.NOT_CONNECTED, "Not connected");
    }

    private static void cancel(EventLoop.ScheduledTask task)
    {
        if (task != null)
        {
            task.cancel();
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
     * One engine and its liveness. Events from an engine whose session has
     * been deactivated or replaced are dropped.
     */
    private final class TransportSession implements XmppEngine.Listener
    {
        private final XmppEngine engine;
        private boolean active;

        private TransportSession(XmppEngine engine)
        {
            this.engine = Objects.requireNonNull(engine, "engine");
            this.active = true;
            engine.setListener(this);
        }

        private boolean isCurrent()
        {
            return active && session == this;
        }

        private void deactivate()
        {
            active = false;
            engine.setListener(null);
        }

        @Override
        public void onOnline()
        {
            loop.execute(() ->
            {
                if (isCurrent())
                {
                    handleOnline();
                }
            });
        }

        @Override
        public void onOffline()
        {
            loop.execute(() ->
            {
                if (isCurrent())
                {
                    handleOffline();
                }
            });
        }

        @Override
        public void onError(Throwable error)
        {
            loop.execute(() ->
            {
                if (isCurrent())
                {
                    handleConnectionError(error);
                }
            });
        }

        @Override
        public void onFrame(Frame frame)
        {
            loop.execute(() ->
            {
                if (isCurrent())
                {
                    handleFrame(frame);
                }
                else
                {
                    LOG.debug("Dropping frame from inactive session: {}", frame.getName());
                }
            });
        }
    }
}
