package org.abstractica.xmpp.impl.stanza;

/**
 * XML namespaces of the protocol extensions the client speaks.
 */
public final class Namespaces
{
    private Namespaces() {}

    // ========== Archive ==========

    /** Message Archive Management (XEP-0313). */
    public static final String MAM = "urn:xmpp:mam:2";

    /** Result Set Management (XEP-0059). */
    public static final String RSM = "http://jabber.org/protocol/rsm";

    /** Data Forms (XEP-0004). */
    public static final String DATA_FORM = "jabber:x:data";

    /** Stanza Forwarding (XEP-0297). */
    public static final String FORWARD = "urn:xmpp:forward:0";

    /** Unique and Stable Stanza IDs (XEP-0359). */
    public static final String STANZA_ID = "urn:xmpp:sid:0";

    // ========== Messaging ==========

    /** Delayed Delivery (XEP-0203). */
    public static final String DELAY = "urn:xmpp:delay";

    /** Last Message Correction (XEP-0308). */
    public static final String CORRECTION = "urn:xmpp:message-correct:0";

    /** Message Delivery Receipts (XEP-0184). */
    public static final String RECEIPTS = "urn:xmpp:receipts";

    /** Chat Markers (XEP-0333). */
    public static final String CHAT_MARKERS = "urn:xmpp:chat-markers:0";

    /** Server-side read/delivered status. */
    public static final String MESSAGE_STATUS = "urn:xmpp:message-status:0";

    // ========== Files ==========

    /** HTTP File Upload (XEP-0363). */
    public static final String HTTP_UPLOAD = "urn:xmpp:http:upload:0";

    // ========== Core ==========

    public static final String STANZA_ERRORS = "urn:ietf:params:xml:ns:xmpp-stanzas";
}
