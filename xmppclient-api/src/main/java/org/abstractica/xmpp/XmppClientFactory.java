package org.abstractica.xmpp;

/**
 * Factory for creating {@link XmppClient} instances.
 *
 * <pre>{@code
 * XmppClientFactory factory = new DefaultXmppClientFactory();
 * XmppClient client = factory.builder()
 *     .config(config)
 *     .engineFactory(engineFactory)
 *     .build();
 * }</pre>
 */
public interface XmppClientFactory
{
    /**
     * Creates a new client builder.
     *
     * @return a new builder instance
     */
    Builder builder();

    /**
     * Builder for configuring and creating a client.
     */
    interface Builder
    {
        /**
         * Sets the connection settings.
         *
         * @param config the settings
         * @return this builder
         */
        Builder config(ConnectionConfig config);

        /**
         * Sets the factory producing the stream engine for each connection
         * attempt.
         *
         * @param engineFactory the engine factory
         * @return this builder
         */
        Builder engineFactory(EngineFactory engineFactory);

        /**
         * Builds the client. The client does not connect until
         * {@link XmppClient#connect()} is called.
         *
         * @return the configured client
         * @throws IllegalStateException if required parameters are missing
         */
        XmppClient build();
    }
}
