package org.abstractica.xmpp.impl.dispatch;

/**
 * Routing category of an inbound stanza.
 */
public enum StanzaKind
{
    PRESENCE,
    ARCHIVE_ITEM,
    ARCHIVE_TERMINAL,
    RECEIPT,
    MESSAGE,
    UNCLASSIFIED
}
