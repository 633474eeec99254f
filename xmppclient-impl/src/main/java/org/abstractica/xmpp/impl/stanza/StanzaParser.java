package org.abstractica.xmpp.impl.stanza;

import org.abstractica.xmpp.Frame;
import org.abstractica.xmpp.StanzaError;
import org.abstractica.xmpp.model.ChatMessage;
import org.abstractica.xmpp.model.DomainMessage;
import org.abstractica.xmpp.model.FileMessage;
import org.abstractica.xmpp.model.GroupChatMessage;
import org.abstractica.xmpp.model.PagingCursor;
import org.abstractica.xmpp.model.Presence;
import org.abstractica.xmpp.model.PresenceType;
import org.abstractica.xmpp.model.ReadStatus;
import org.abstractica.xmpp.model.Receipt;
import org.abstractica.xmpp.model.ReceiptType;
import org.abstractica.xmpp.model.ThreadInfo;
import org.abstractica.xmpp.model.UploadSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parses inbound stanzas into domain values.
 *
 * <p>Parsers never throw. A frame that is not of the expected shape, or
 * that fails to parse, yields {@link Optional#empty()}.</p>
 */
public final class StanzaParser
{
    private static final Logger LOG = LoggerFactory.getLogger(StanzaParser.class);

    private StanzaParser() {}

    // ========== Presence ==========

    public static Optional<Presence> parsePresence(Frame frame)
    {
        return guarded("presence", frame, f ->
        {
            if (!f.is("presence"))
            {
                return Optional.empty();
            }
            return Optional.of(new Presence(
                    f.getAttribute("from"),
                    PresenceType.fromWire(f.getAttribute("type")),
                    Optional.ofNullable(f.getChildText("show")),
                    Optional.ofNullable(f.getChildText("status"))
            ));
        });
    }

    // ========== Messages ==========

    /**
     * Parses a live message.
     *
     * <p>The timestamp comes from a delay element when present, otherwise it
     * is the current time. A message carrying an upload {@code x/file}
     * element becomes a {@link FileMessage}; a {@code groupchat} message
     * becomes a {@link GroupChatMessage}.</p>
     *
     * @param frame the message stanza
     * @return the message
     */
    public static Optional<DomainMessage> parseMessage(Frame frame)
    {
        return guarded("message", frame, f ->
        {
            if (!f.is("message"))
            {
                return Optional.empty();
            }
            Instant timestamp = delayOf(f).orElseGet(Instant::now);
            return Optional.of(toDomainMessage(f, timestamp));
        });
    }

    private static DomainMessage toDomainMessage(Frame message, Instant timestamp)
    {
        String id = message.getAttribute("id");
        Optional<String> archiveId = archiveIdOf(message);
        String from = message.getAttribute("from");
        String to = message.getAttribute("to");
        String body = Optional.ofNullable(message.getChildText("body")).orElse("");

        Frame upload = message.getChild("x", Namespaces.HTTP_UPLOAD);
        Frame file = upload != null ? upload.getChild("file") : null;
        if (file != null)
        {
            return new FileMessage(id, archiveId, from, to, timestamp, body, Optional.empty(),
                    file.getAttribute("url"),
                    file.getAttribute("name"),
                    file.getAttribute("size"),
                    file.getAttribute("type"));
        }

        if ("groupchat".equals(message.getAttribute("type")))
        {
            String room = from != null ? from : "";
            String nickname = "";
            int slash = room.indexOf('/');
            if (slash >= 0)
            {
                nickname = room.substring(slash + 1);
                room = room.substring(0, slash);
            }
            return new GroupChatMessage(id, archiveId, from, to, timestamp, body, Optional.empty(), room, nickname);
        }

        return new ChatMessage(id, archiveId, from, to, timestamp, body, Optional.empty());
    }

    private static Optional<String> archiveIdOf(Frame message)
    {
        Frame stanzaId = message.getChild("stanza-id", Namespaces.STANZA_ID);
        if (stanzaId == null)
        {
            stanzaId = message.getChild("stanza-id");
        }
        return stanzaId != null ? Optional.ofNullable(stanzaId.getAttribute("id")) : Optional.empty();
    }

    /**
     * Parses a delivery or display receipt. Both the receipts and the chat
     * markers namespace are accepted.
     *
     * @param frame the message stanza
     * @return the receipt
     */
    public static Optional<Receipt> parseReceipt(Frame frame)
    {
        return guarded("receipt", frame, f ->
        {
            if (!f.is("message"))
            {
                return Optional.empty();
            }
            for (ReceiptType type : ReceiptType.values())
            {
                Frame marker = receiptMarker(f, type);
                if (marker != null && marker.getAttribute("id") != null)
                {
                    return Optional.of(new Receipt(f.getAttribute("from"), marker.getAttribute("id"), type));
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Returns the receipt element of the given kind, if the message has one.
     *
     * @param message the message stanza
     * @param type    receipt kind
     * @return the element, or null
     */
    public static Frame receiptMarker(Frame message, ReceiptType type)
    {
        Frame marker = message.getChild(type.getElementName(), Namespaces.RECEIPTS);
        if (marker == null)
        {
            marker = message.getChild(type.getElementName(), Namespaces.CHAT_MARKERS);
        }
        return marker;
    }

    public static Optional<ThreadInfo> threadOf(Frame message)
    {
        Frame thread = message.getChild("thread");
        if (thread == null)
        {
            return Optional.empty();
        }
        return Optional.of(new ThreadInfo(thread.getText(), Optional.ofNullable(thread.getAttribute("parent"))));
    }

    public static Optional<String> replacedIdOf(Frame message)
    {
        Frame replace = message.getChild("replace", Namespaces.CORRECTION);
        return replace != null ? Optional.ofNullable(replace.getAttribute("id")) : Optional.empty();
    }

    /**
     * Returns the timestamp of a delay element child, if present and valid.
     *
     * @param frame a message or forwarded element
     * @return the delay stamp
     */
    public static Optional<Instant> delayOf(Frame frame)
    {
        Frame delay = frame.getChild("delay", Namespaces.DELAY);
        if (delay == null || delay.getAttribute("stamp") == null)
        {
            return Optional.empty();
        }
        try
        {
            return Optional.of(OffsetDateTime.parse(delay.getAttribute("stamp")).toInstant());
        }
        catch (DateTimeParseException e)
        {
            LOG.debug("Invalid delay stamp: {}", delay.getAttribute("stamp"));
            return Optional.empty();
        }
    }

    // ========== Archive ==========

    /**
     * Parses an archive result item ({@code result/forwarded/message}).
     *
     * <p>The timestamp comes from the delay element of {@code forwarded}.</p>
     *
     * @param frame the carrying stanza
     * @return the item, empty if the frame is no archive item or lacks a query id
     */
    public static Optional<ArchiveItem> parseArchiveItem(Frame frame)
    {
        return guarded("archive item", frame, f ->
        {
            Frame result = f.getChild("result", Namespaces.MAM);
            if (result == null || result.getAttribute("queryid") == null)
            {
                return Optional.empty();
            }
            Frame forwarded = result.getChild("forwarded", Namespaces.FORWARD);
            Frame message = forwarded != null ? forwarded.getChild("message") : null;
            if (message == null)
            {
                return Optional.empty();
            }
            Instant timestamp = delayOf(forwarded).orElseGet(Instant::now);
            return Optional.of(new ArchiveItem(result.getAttribute("queryid"), toDomainMessage(message, timestamp)));
        });
    }

    /**
     * Parses the {@code fin} element ending an archive result.
     *
     * <p>The query id is the {@code queryid} of {@code fin}, falling back to
     * the id of the carrying stanza.</p>
     *
     * @param frame the carrying stanza
     * @return the terminal, empty if the frame has no {@code fin} or no query id
     */
    public static Optional<ArchiveTerminal> parseArchiveTerminal(Frame frame)
    {
        return guarded("archive terminal", frame, f ->
        {
            Frame fin = f.getChild("fin", Namespaces.MAM);
            if (fin == null)
            {
                return Optional.empty();
            }
            String queryId = fin.getAttribute("queryid");
            if (queryId == null)
            {
                queryId = f.getAttribute("id");
            }
            if (queryId == null)
            {
                return Optional.empty();
            }
            return Optional.of(new ArchiveTerminal(
                    queryId,
                    "true".equals(fin.getAttribute("complete")),
                    pagingOf(fin)
            ));
        });
    }

    private static Optional<PagingCursor> pagingOf(Frame fin)
    {
        Frame set = fin.getChild("set", Namespaces.RSM);
        if (set == null)
        {
            return Optional.empty();
        }
        Optional<Integer> count = Optional.empty();
        String countText = set.getChildText("count");
        if (countText != null && !countText.isEmpty())
        {
            try
            {
                count = Optional.of(Integer.parseInt(countText.trim()));
            }
            catch (NumberFormatException e)
            {
                LOG.debug("Invalid result set count: {}", countText);
            }
        }
        return Optional.of(new PagingCursor(
                nonEmpty(set.getChildText("first")),
                nonEmpty(set.getChildText("last")),
                count
        ));
    }

    // ========== Query Responses ==========

    /**
     * Parses an upload slot from an iq result.
     *
     * <p>Headers without a name or a value are skipped.</p>
     *
     * @param frame the iq response
     * @return the slot, empty unless both {@code put} and {@code get} are present
     */
    public static Optional<UploadSlot> parseUploadSlot(Frame frame)
    {
        return guarded("upload slot", frame, f ->
        {
            if (!f.is("iq") || !"result".equals(f.getAttribute("type")))
            {
                return Optional.empty();
            }
            Frame slot = f.getChild("slot", Namespaces.HTTP_UPLOAD);
            Frame put = slot != null ? slot.getChild("put") : null;
            Frame get = slot != null ? slot.getChild("get") : null;
            if (put == null || get == null || put.getAttribute("url") == null || get.getAttribute("url") == null)
            {
                return Optional.empty();
            }
            return Optional.of(new UploadSlot(
                    put.getAttribute("url"),
                    get.getAttribute("url"),
                    headersOf(put),
                    headersOf(get)
            ));
        });
    }

    private static Map<String, String> headersOf(Frame element)
    {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Frame header : element.getChildren("header"))
        {
            String name = header.getAttribute("name");
            String value = header.getText();
            if (name != null && !name.isEmpty() && !value.isEmpty())
            {
                headers.put(name, value);
            }
        }
        return headers;
    }

    /**
     * Parses the {@code status} element of a status lookup response. The
     * timestamp attribute is in epoch milliseconds.
     *
     * @param frame the iq response
     * @return the status, empty if the response has no {@code status}
     */
    public static Optional<ReadStatus> parseReadStatus(Frame frame)
    {
        return guarded("read status", frame, f ->
        {
            Frame status = f.getChild("status");
            if (status == null)
            {
                return Optional.empty();
            }
            Optional<Instant> timestamp = Optional.empty();
            String millis = status.getAttribute("timestamp");
            if (millis != null && !millis.isEmpty())
            {
                try
                {
                    timestamp = Optional.of(Instant.ofEpochMilli(Long.parseLong(millis.trim())));
                }
                catch (NumberFormatException e)
                {
                    LOG.debug("Invalid status timestamp: {}", millis);
                }
            }
            return Optional.of(new ReadStatus(
                    "true".equals(status.getAttribute("delivered")),
                    "true".equals(status.getAttribute("read")),
                    timestamp
            ));
        });
    }

    /**
     * Parses the {@code error} element of an error response.
     *
     * <p>The condition is the first child in the stanza errors namespace
     * other than {@code text}; without a namespaced child the first child
     * element is used.</p>
     *
     * @param frame the error stanza
     * @return the error, empty if the frame has no {@code error} child
     */
    public static Optional<StanzaError> parseStanzaError(Frame frame)
    {
        return guarded("stanza error", frame, f ->
        {
            Frame error = f.getChild("error");
            if (error == null)
            {
                return Optional.empty();
            }
            String condition = null;
            String fallback = null;
            String text = null;
            for (Object child : error.getChildren())
            {
                if (!(child instanceof Frame element))
                {
                    continue;
                }
                if (element.is("text"))
                {
                    text = element.getText();
                }
                else if (condition == null && Namespaces.STANZA_ERRORS.equals(element.getNamespace()))
                {
                    condition = element.getName();
                }
                else if (fallback == null)
                {
                    fallback = element.getName();
                }
            }
            if (condition == null)
            {
                condition = fallback != null ? fallback : StanzaError.UNDEFINED_CONDITION;
            }
            return Optional.of(new StanzaError(condition, error.getAttribute("type"), text));
        });
    }

    // ========== Helpers ==========

    private static Optional<String> nonEmpty(String value)
    {
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static <T> Optional<T> guarded(String what, Frame frame, Function<Frame, Optional<T>> parser)
    {
        if (frame == null)
        {
            return Optional.empty();
        }
        try
        {
            return parser.apply(frame);
        }
        catch (RuntimeException e)
        {
            LOG.debug("Failed to parse {}: {}", what, e.getMessage());
            return Optional.empty();
        }
    }
}
