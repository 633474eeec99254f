package org.abstractica.xmpp.impl.transport;

import org.abstractica.xmpp.Frame;
import org.abstractica.xmpp.XmppEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * In-memory engine for testing the client without a server.
 *
 * <p>By default the engine stays offline after {@link #start()} until the
 * test calls {@link #goOnline()}. Stream events are raised on the calling
 * thread. Every sent stanza is recorded; a responder can answer queries by
 * returning a frame, which is delivered back as an inbound stanza.</p>
 *
 * <p>Failures can be injected for start, stop and send.</p>
 */
public class SimulatedEngine implements XmppEngine
{
    private static final Logger LOG = LoggerFactory.getLogger(SimulatedEngine.class);

    private final List<Frame> sentFrames;
    private volatile Listener listener;
    private volatile boolean started;
    private volatile boolean stopped;

    // Behaviour
    private volatile boolean autoOnline;
    private volatile RuntimeException startFailure;
    private volatile RuntimeException stopFailure;
    private volatile RuntimeException sendFailure;
    private volatile Function<Frame, Frame> responder;

    public SimulatedEngine()
    {
        this.sentFrames = new ArrayList<>();
    }

    // ========== Configuration ==========

    /**
     * Makes the engine report online as soon as it is started.
     *
     * @param autoOnline true to go online on start
     * @return this engine
     */
    public SimulatedEngine autoOnline(boolean autoOnline)
    {
        this.autoOnline = autoOnline;
        return this;
    }

    public SimulatedEngine failStart(RuntimeException failure)
    {
        this.startFailure = failure;
        return this;
    }

    public SimulatedEngine failStop(RuntimeException failure)
    {
        this.stopFailure = failure;
        return this;
    }

    /**
     * Makes every following send fail, or clears the failure when null.
     *
     * @param failure the failure to report
     * @return this engine
     */
    public SimulatedEngine failSend(RuntimeException failure)
    {
        this.sendFailure = failure;
        return this;
    }

    /**
     * Installs a function answering sent stanzas. A non-null return value is
     * delivered as an inbound stanza right after the send completes.
     *
     * @param responder maps a sent stanza to its response, or to null
     * @return this engine
     */
    public SimulatedEngine respondWith(Function<Frame, Frame> responder)
    {
        this.responder = responder;
        return this;
    }

    // ========== XmppEngine ==========

    @Override
    public void setListener(Listener listener)
    {
        this.listener = listener;
    }

    @Override
    public CompletableFuture<Void> start()
    {
        started = true;
        if (startFailure != null)
        {
            return CompletableFuture.failedFuture(startFailure);
        }
        if (autoOnline)
        {
            goOnline();
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> stop()
    {
        stopped = true;
        if (stopFailure != null)
        {
            return CompletableFuture.failedFuture(stopFailure);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> send(Frame frame)
    {
        if (sendFailure != null)
        {
            return CompletableFuture.failedFuture(sendFailure);
        }
        synchronized (sentFrames)
        {
            sentFrames.add(frame);
        }
        LOG.debug("Sent: {}", frame);

        Function<Frame, Frame> currentResponder = responder;
        if (currentResponder != null)
        {
            Frame response = currentResponder.apply(frame);
            if (response != null)
            {
                deliver(response);
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    // ========== Stream Events ==========

    public void goOnline()
    {
        Listener current = listener;
        if (current != null)
        {
            current.onOnline();
        }
    }

    public void goOffline()
    {
        Listener current = listener;
        if (current != null)
        {
            current.onOffline();
        }
    }

    public void fail(Throwable error)
    {
        Listener current = listener;
        if (current != null)
        {
            current.onError(error);
        }
    }

    /**
     * Delivers an inbound stanza to the listener.
     *
     * @param frame the stanza
     */
    public void deliver(Frame frame)
    {
        Listener current = listener;
        if (current != null)
        {
            current.onFrame(frame);
        }
        else
        {
            LOG.debug("No listener, dropping {}", frame.getName());
        }
    }

    // ========== Inspection ==========

    public List<Frame> getSentFrames()
    {
        synchronized (sentFrames)
        {
            return List.copyOf(sentFrames);
        }
    }

    /**
     * Returns the most recently sent stanza.
     *
     * @return the stanza, or null if nothing was sent
     */
    public Frame getLastSent()
    {
        synchronized (sentFrames)
        {
            return sentFrames.isEmpty() ? null : sentFrames.get(sentFrames.size() - 1);
        }
    }

    public boolean hasListener()
    {
        return listener != null;
    }

    public boolean isStarted()
    {
        return started;
    }

    public boolean isStopped()
    {
        return stopped;
    }
}
