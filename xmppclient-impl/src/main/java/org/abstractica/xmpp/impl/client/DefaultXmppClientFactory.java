package org.abstractica.xmpp.impl.client;

import org.abstractica.xmpp.ConnectionConfig;
import org.abstractica.xmpp.EngineFactory;
import org.abstractica.xmpp.XmppClient;
import org.abstractica.xmpp.XmppClientFactory;
import org.abstractica.xmpp.impl.connection.EventLoop;
import org.abstractica.xmpp.impl.connection.ExecutorEventLoop;
import org.abstractica.xmpp.impl.connection.ReconnectPolicy;
import org.abstractica.xmpp.impl.files.FileTransfer;
import org.abstractica.xmpp.impl.files.HttpFileTransfer;

import java.util.Objects;

/**
 * Default implementation of XmppClientFactory.
 */
public class DefaultXmppClientFactory implements XmppClientFactory
{
    private static final String EVENT_LOOP_THREAD = "xmpp-event-loop";

    @Override
    public Builder builder()
    {
        return new DefaultBuilder();
    }

    public static class DefaultBuilder implements Builder
    {
        private ConnectionConfig config;
        private EngineFactory engineFactory;
        private FileTransfer fileTransfer;
        private EventLoop eventLoop;
        private ReconnectPolicy reconnectPolicy;

        @Override
        public DefaultBuilder config(ConnectionConfig config)
        {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        @Override
        public DefaultBuilder engineFactory(EngineFactory engineFactory)
        {
            this.engineFactory = Objects.requireNonNull(engineFactory, "engineFactory");
            return this;
        }

        /**
         * Sets the transfer used for attachment bytes.
         *
         * <p>If not set, {@link HttpFileTransfer} is used.</p>
         *
         * @param fileTransfer the transfer
         * @return this builder
         */
        public DefaultBuilder fileTransfer(FileTransfer fileTransfer)
        {
            this.fileTransfer = Objects.requireNonNull(fileTransfer, "fileTransfer");
            return this;
        }

        /**
         * Sets the event loop the client runs on.
         *
         * <p>If not set, the client creates an {@link ExecutorEventLoop} and
         * closes it on {@link XmppClient#close()}. A loop supplied here is
         * left open.</p>
         *
         * @param eventLoop the loop
         * @return this builder
         */
        public DefaultBuilder eventLoop(EventLoop eventLoop)
        {
            this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
            return this;
        }

        public DefaultBuilder reconnectPolicy(ReconnectPolicy reconnectPolicy)
        {
            this.reconnectPolicy = Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");
            return this;
        }

        @Override
        public XmppClient build()
        {
            if (config == null)
            {
                throw new IllegalStateException("Connection config must be specified");
            }
            if (engineFactory == null)
            {
                throw new IllegalStateException("Engine factory must be specified");
            }

            boolean ownsLoop = eventLoop == null;
            return new DefaultXmppClient(
                    config,
                    engineFactory,
                    fileTransfer != null ? fileTransfer : new HttpFileTransfer(),
                    ownsLoop ? new ExecutorEventLoop(EVENT_LOOP_THREAD) : eventLoop,
                    ownsLoop,
                    reconnectPolicy != null ? reconnectPolicy : ReconnectPolicy.DEFAULT
            );
        }
    }
}
