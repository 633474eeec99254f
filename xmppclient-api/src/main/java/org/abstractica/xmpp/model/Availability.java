package org.abstractica.xmpp.model;

/**
 * Availability announced to contacts or rooms.
 */
public enum Availability
{
    AVAILABLE,
    UNAVAILABLE
}
