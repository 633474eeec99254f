package org.abstractica.xmpp.impl.dispatch;

import org.abstractica.xmpp.ConnectionStatus;
import org.abstractica.xmpp.Frame;
import org.abstractica.xmpp.impl.archive.ArchiveResultAggregator;
import org.abstractica.xmpp.impl.connection.ConnectionListener;
import org.abstractica.xmpp.impl.stanza.ArchiveItem;
import org.abstractica.xmpp.impl.stanza.ArchiveTerminal;
import org.abstractica.xmpp.impl.stanza.Namespaces;
import org.abstractica.xmpp.impl.stanza.StanzaParser;
import org.abstractica.xmpp.model.ArchiveResult;
import org.abstractica.xmpp.model.ReceiptType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Routes inbound stanzas to typed events.
 *
 * <p>Each stanza is classified by the first matching rule:</p>
 * <ol>
 *   <li>{@code presence} becomes a presence event</li>
 *   <li>a {@code message} or {@code iq} with an archive {@code result} or
 *       {@code fin} child goes to the aggregator; a result event is emitted
 *       only on {@code fin}</li>
 *   <li>a {@code message} with a {@code received} or {@code displayed}
 *       marker becomes a receipt event</li>
 *   <li>any other {@code message} becomes a message event</li>
 *   <li>everything else is dropped</li>
 * </ol>
 *
 * <p>Partial archive results are discarded whenever the connection leaves
 * {@link ConnectionStatus#ONLINE}.</p>
 */
public class Dispatcher implements ConnectionListener
{
    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final ArchiveResultAggregator aggregator;
    private final DispatchListener listener;

    public Dispatcher(ArchiveResultAggregator aggregator, DispatchListener listener)
    {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Classifies a stanza without side effects.
     *
     * @param frame the stanza
     * @return its routing category
     */
    public static StanzaKind classify(Frame frame)
    {
        if (frame.is("presence"))
        {
            return StanzaKind.PRESENCE;
        }
        boolean message = frame.is("message");
        if (message || frame.is("iq"))
        {
            if (frame.getChild("result", Namespaces.MAM) != null)
            {
                return StanzaKind.ARCHIVE_ITEM;
            }
            if (frame.getChild("fin", Namespaces.MAM) != null)
            {
                return StanzaKind.ARCHIVE_TERMINAL;
            }
        }
        if (message)
        {
            for (ReceiptType type : ReceiptType.values())
            {
                if (StanzaParser.receiptMarker(frame, type) != null)
                {
                    return StanzaKind.RECEIPT;
                }
            }
            return StanzaKind.MESSAGE;
        }
        return StanzaKind.UNCLASSIFIED;
    }

    @Override
    public void onStatus(ConnectionStatus status)
    {
        if (status != ConnectionStatus.ONLINE)
        {
            aggregator.reset();
        }
    }

    @Override
    public void onFrame(Frame frame)
    {
        StanzaKind kind = classify(frame);
        LOG.debug("Dispatching {} as {}", frame.getName(), kind);

        switch (kind)
        {
            case PRESENCE -> StanzaParser.parsePresence(frame)
                    .ifPresentOrElse(listener::onPresence, () -> dropped(frame));
            case ARCHIVE_ITEM -> handleArchiveItem(frame);
            case ARCHIVE_TERMINAL -> handleArchiveTerminal(frame);
            case RECEIPT -> StanzaParser.parseReceipt(frame)
                    .ifPresentOrElse(listener::onReceipt, () -> dropped(frame));
            case MESSAGE -> StanzaParser.parseMessage(frame)
                    .ifPresentOrElse(listener::onMessage, () -> dropped(frame));
            case UNCLASSIFIED -> LOG.debug("Ignoring {} stanza", frame.getName());
        }
    }

    private void handleArchiveItem(Frame frame)
    {
        Optional<ArchiveItem> item = StanzaParser.parseArchiveItem(frame);
        if (item.isEmpty())
        {
            dropped(frame);
            return;
        }
        aggregator.onItem(item.get().queryId(), item.get().message());
    }

    private void handleArchiveTerminal(Frame frame)
    {
        Optional<ArchiveTerminal> terminal = StanzaParser.parseArchiveTerminal(frame);
        if (terminal.isEmpty())
        {
            dropped(frame);
            return;
        }
        ArchiveTerminal fin = terminal.get();
        ArchiveResult result = aggregator.onTerminal(fin.queryId(), fin.complete(), fin.paging());
        listener.onArchiveResult(result);
    }

    private static void dropped(Frame frame)
    {
        LOG.debug("Dropping unparseable {}: {}", frame.getName(), frame);
    }
}
