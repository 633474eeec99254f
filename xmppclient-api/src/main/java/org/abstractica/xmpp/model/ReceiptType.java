package org.abstractica.xmpp.model;

/**
 * Kinds of message receipt, named after their XML element.
 */
public enum ReceiptType
{
    RECEIVED("received"),
    DISPLAYED("displayed");

    private final String elementName;

    ReceiptType(String elementName)
    {
        this.elementName = elementName;
    }

    public String getElementName()
    {
        return elementName;
    }
}
