package org.abstractica.xmpp;

import java.util.concurrent.CompletableFuture;

/**
 * The underlying XMPP stream engine.
 *
 * <p>An engine owns the socket, TLS, SASL and stream negotiation; this
 * library only drives it. One engine instance serves one connection
 * attempt: the client asks its {@link EngineFactory} for a fresh engine on
 * every connect and reconnect.</p>
 *
 * <p>Engines report what happens on the stream through the registered
 * {@link Listener}. Callbacks may arrive on any thread; the client moves
 * them onto its own event loop.</p>
 */
public interface XmppEngine
{
    /**
     * Registers the listener for stream events, replacing any previous one.
     *
     * @param listener the listener, or null to detach
     */
    void setListener(Listener listener);

    /**
     * Opens the stream and begins negotiation.
     *
     * <p>The returned future completes once the engine has started; going
     * online is reported separately through {@link Listener#onOnline()}.</p>
     *
     * @return completion of the start
     */
    CompletableFuture<Void> start();

    /**
     * Closes the stream.
     *
     * @return completion of the stop
     */
    CompletableFuture<Void> stop();

    /**
     * Writes one stanza to the stream.
     *
     * @param frame the stanza
     * @return completion of the write
     */
    CompletableFuture<Void> send(Frame frame);

    /**
     * Receives stream events from an engine.
     */
    interface Listener
    {
        /**
         * The stream is negotiated and the session is bound.
         */
        void onOnline();

        /**
         * The stream was closed, by either side.
         */
        void onOffline();

        /**
         * The stream failed.
         *
         * @param error the failure
         */
        void onError(Throwable error);

        /**
         * A stanza arrived.
         *
         * @param frame the stanza
         */
        void onFrame(Frame frame);
    }
}
