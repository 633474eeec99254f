package org.abstractica.xmpp;

import java.util.Objects;

/**
 * Failure to validate, upload or download an attachment.
 */
public class FileTransferException extends XmppException
{
    /**
     * File failure categories.
     */
    public enum Kind
    {
        SIZE_EXCEEDED,
        INVALID_TYPE,
        UPLOAD_FAILED,
        DOWNLOAD_FAILED
    }

    private final Kind kind;

    public FileTransferException(Kind kind, String message)
    {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public FileTransferException(Kind kind, String message, Throwable cause)
    {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public Kind getKind()
    {
        return kind;
    }
}
