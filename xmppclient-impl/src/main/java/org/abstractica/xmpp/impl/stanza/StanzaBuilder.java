package org.abstractica.xmpp.impl.stanza;

import org.abstractica.xmpp.Frame;
import org.abstractica.xmpp.model.ArchiveQuery;
import org.abstractica.xmpp.model.Availability;
import org.abstractica.xmpp.model.DomainMessage;
import org.abstractica.xmpp.model.FileAttachment;
import org.abstractica.xmpp.model.MessageOptions;
import org.abstractica.xmpp.model.PageRequest;
import org.abstractica.xmpp.model.PresenceType;
import org.abstractica.xmpp.model.ReceiptType;
import org.abstractica.xmpp.model.ThreadInfo;
import org.abstractica.xmpp.model.UploadSlot;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;

/**
 * Builds outbound stanzas.
 *
 * <p>All methods are pure: they only assemble frames and never touch the
 * connection. Query stanzas without an {@code id} get one when they are
 * sent through {@code ConnectionManager.sendQuery}.</p>
 */
public final class StanzaBuilder
{
    private StanzaBuilder() {}

    // ========== Messages ==========

    /**
     * Builds a one-to-one chat message.
     *
     * @param to      recipient address
     * @param body    message text
     * @param options message extensions
     * @return the message stanza
     */
    public static Frame chatMessage(String to, String body, MessageOptions options)
    {
        return message(to, "chat", options)
                .textChild("body", Objects.requireNonNull(body, "body"))
                .build();
    }

    /**
     * Builds a message to a multi-user chat room.
     *
     * @param roomAddress bare address of the room
     * @param body        message text
     * @param options     message extensions
     * @return the message stanza
     */
    public static Frame groupChatMessage(String roomAddress, String body, MessageOptions options)
    {
        return message(roomAddress, "groupchat", options)
                .textChild("body", Objects.requireNonNull(body, "body"))
                .build();
    }

    /**
     * Builds the message announcing an uploaded file.
     *
     * <p>The body defaults to the file name when empty. The file metadata
     * follows the body in an upload {@code x} element.</p>
     *
     * @param to         recipient address
     * @param body       message text, may be null or empty
     * @param attachment the uploaded file
     * @param slot       the slot the file was uploaded to
     * @return the message stanza
     */
    public static Frame attachmentMessage(String to, String body, FileAttachment attachment, UploadSlot slot)
    {
        Objects.requireNonNull(attachment, "attachment");
        Objects.requireNonNull(slot, "slot");
        String text = body == null || body.isEmpty() ? attachment.name() : body;

        Frame file = Frame.builder("file")
                .attribute("name", attachment.name())
                .attribute("size", Long.toString(attachment.size()))
                .attribute("type", attachment.contentType())
                .attribute("url", slot.getUrl())
                .build();

        return message(to, "chat", MessageOptions.none())
                .textChild("body", text)
                .child(Frame.builder("x").namespace(Namespaces.HTTP_UPLOAD).child(file).build())
                .build();
    }

    private static Frame.Builder message(String to, String type, MessageOptions options)
    {
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(options, "options");

        Frame.Builder message = Frame.builder("message")
                .attribute("to", to)
                .attribute("type", type)
                .attribute("id", options.id().orElseGet(() -> UUID.randomUUID().toString()));

        options.priority().ifPresent(priority ->
                message.attribute("priority", priority.name().toLowerCase(Locale.ROOT)));

        options.thread().ifPresent(thread -> message.child(thread(thread)));

        options.delay().ifPresent(delay -> message.child(Frame.builder("delay")
                .namespace(Namespaces.DELAY)
                .attribute("stamp", format(delay))
                .build()));

        options.replacesId().ifPresent(id -> message.child(Frame.builder("replace")
                .namespace(Namespaces.CORRECTION)
                .attribute("id", id)
                .build()));

        if (options.requestReceipt())
        {
            message.child(Frame.builder("request").namespace(Namespaces.RECEIPTS).build());
        }
        if (options.markable())
        {
            message.child(Frame.builder("markable").namespace(Namespaces.CHAT_MARKERS).build());
        }
        return message;
    }

    private static Frame thread(ThreadInfo thread)
    {
        return Frame.builder("thread")
                .attribute("parent", thread.parent().orElse(null))
                .text(thread.id())
                .build();
    }

    // ========== Presence ==========

    /**
     * Builds a broadcast presence. Available presence carries no type.
     *
     * @param availability the availability to announce
     * @return the presence stanza
     */
    public static Frame availability(Availability availability)
    {
        return presence(null, toType(availability));
    }

    public static Frame roomPresence(String roomAddress, Availability availability)
    {
        return presence(Objects.requireNonNull(roomAddress, "roomAddress"), toType(availability));
    }

    public static Frame subscribe(String to)
    {
        return presence(Objects.requireNonNull(to, "to"), PresenceType.SUBSCRIBE);
    }

    public static Frame probe(String to)
    {
        return presence(Objects.requireNonNull(to, "to"), PresenceType.PROBE);
    }

    /**
     * Builds the presence approving a contact's subscription request.
     *
     * @param to the requesting contact
     * @return the presence stanza
     */
    public static Frame subscribed(String to)
    {
        return presence(Objects.requireNonNull(to, "to"), PresenceType.SUBSCRIBED);
    }

    private static Frame presence(String to, PresenceType type)
    {
        return Frame.builder("presence")
                .attribute("to", to)
                .attribute("type", type.getWireValue())
                .build();
    }

    private static PresenceType toType(Availability availability)
    {
        Objects.requireNonNull(availability, "availability");
        return availability == Availability.AVAILABLE ? PresenceType.AVAILABLE : PresenceType.UNAVAILABLE;
    }

    // ========== Archive ==========

    /**
     * Builds an archive query.
     *
     * <p>The iq id equals the query id, so a {@code fin} element without its
     * own {@code queryid} can still be matched. Filters are sent as a
     * submitted data form, paging as a result set element.</p>
     *
     * @param query the query
     * @return the iq stanza
     */
    public static Frame archiveQuery(ArchiveQuery query)
    {
        Objects.requireNonNull(query, "query");

        String namespace = query.namespace().filter(ns -> !ns.isEmpty()).orElse(Namespaces.MAM);
        Frame.Builder element = Frame.builder("query")
                .namespace(namespace)
                .attribute("queryid", query.queryId())
                .attribute("node", query.node().orElse(null));

        if (query.hasFilter())
        {
            element.child(filterForm(query));
        }
        query.page().ifPresent(page -> element.child(resultSet(page)));

        return Frame.builder("iq")
                .attribute("type", "set")
                .attribute("id", query.queryId())
                .child(element.build())
                .build();
    }

    private static Frame filterForm(ArchiveQuery query)
    {
        Frame.Builder form = Frame.builder("x")
                .namespace(Namespaces.DATA_FORM)
                .attribute("type", "submit")
                .child(field("FORM_TYPE", "hidden", Namespaces.MAM));

        query.with().ifPresent(with -> form.child(field("with", null, with)));
        query.start().ifPresent(start -> form.child(field("start", null, format(start))));
        query.end().ifPresent(end -> form.child(field("end", null, format(end))));
        query.fullText().ifPresent(text -> form.child(field("withtext", null, text)));
        return form.build();
    }

    private static Frame field(String var, String type, String value)
    {
        return Frame.builder("field")
                .attribute("var", var)
                .attribute("type", type)
                .textChild("value", value)
                .build();
    }

    private static Frame resultSet(PageRequest page)
    {
        Frame.Builder set = Frame.builder("set").namespace(Namespaces.RSM);
        if (page.max() != null)
        {
            set.textChild("max", page.max().toString());
        }
        if (page.before() != null)
        {
            // Empty before asks for the last page
            set.child(page.before().isEmpty()
                    ? Frame.builder("before").build()
                    : Frame.builder("before").text(page.before()).build());
        }
        if (page.after() != null)
        {
            set.textChild("after", page.after());
        }
        if (page.index() != null)
        {
            set.textChild("index", page.index().toString());
        }
        return set.build();
    }

    // ========== Files ==========

    /**
     * Builds an upload slot request addressed to {@code upload.<domain>}.
     *
     * @param filename    name of the file
     * @param size        size in bytes
     * @param contentType MIME type
     * @param domain      the account's XMPP domain
     * @return the iq stanza
     */
    public static Frame uploadSlotRequest(String filename, long size, String contentType, String domain)
    {
        Objects.requireNonNull(filename, "filename");
        Objects.requireNonNull(contentType, "contentType");
        Objects.requireNonNull(domain, "domain");

        return Frame.builder("iq")
                .attribute("type", "get")
                .attribute("id", UUID.randomUUID().toString())
                .attribute("to", "upload." + domain)
                .child(Frame.builder("request")
                        .namespace(Namespaces.HTTP_UPLOAD)
                        .attribute("filename", filename)
                        .attribute("size", Long.toString(size))
                        .attribute("content-type", contentType)
                        .build())
                .build();
    }

    // ========== Message Status ==========

    public static Frame markRead(DomainMessage message)
    {
        return statusUpdate("mark-read", message);
    }

    public static Frame markDelivered(DomainMessage message)
    {
        return statusUpdate("mark-delivered", message);
    }

    private static Frame statusUpdate(String action, DomainMessage message)
    {
        Objects.requireNonNull(message, "message");
        return Frame.builder("iq")
                .attribute("type", "set")
                .child(Frame.builder(action)
                        .namespace(Namespaces.MESSAGE_STATUS)
                        .attribute("id", message.id())
                        .attribute("from", message.from())
                        .attribute("to", message.to())
                        .build())
                .build();
    }

    /**
     * Builds a status lookup for one message.
     *
     * @param messageId id of the message
     * @param address   address of the message's sender
     * @return the iq stanza
     */
    public static Frame statusQuery(String messageId, String address)
    {
        return Frame.builder("iq")
                .attribute("type", "get")
                .child(Frame.builder("get-status")
                        .namespace(Namespaces.MESSAGE_STATUS)
                        .attribute("id", Objects.requireNonNull(messageId, "messageId"))
                        .attribute("jid", Objects.requireNonNull(address, "address"))
                        .build())
                .build();
    }

    public static Frame displayedReceipt(DomainMessage message)
    {
        return receipt(message, ReceiptType.DISPLAYED);
    }

    public static Frame receivedReceipt(DomainMessage message)
    {
        return receipt(message, ReceiptType.RECEIVED);
    }

    /**
     * Builds a receipt addressed back to the sender of a message. The
     * receipt reuses the message id.
     *
     * @param message the acknowledged message
     * @param type    receipt kind
     * @return the message stanza
     */
    public static Frame receipt(DomainMessage message, ReceiptType type)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(type, "type");
        return Frame.builder("message")
                .attribute("id", message.id())
                .attribute("to", message.from())
                .attribute("from", message.to())
                .attribute("type", "chat")
                .child(Frame.builder(type.getElementName())
                        .namespace(Namespaces.RECEIPTS)
                        .attribute("id", message.id())
                        .build())
                .build();
    }

    private static String format(Instant instant)
    {
        return DateTimeFormatter.ISO_INSTANT.format(instant);
    }
}
