package org.abstractica.xmpp.impl.files;

import org.abstractica.xmpp.FileTransferException;
import org.abstractica.xmpp.UploadConfig;
import org.abstractica.xmpp.impl.connection.ConnectionManager;
import org.abstractica.xmpp.impl.stanza.StanzaBuilder;
import org.abstractica.xmpp.impl.stanza.StanzaParser;
import org.abstractica.xmpp.model.FileAttachment;
import org.abstractica.xmpp.model.UploadSlot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Uploads and downloads attachments through the server's HTTP upload
 * service.
 *
 * <p>An upload validates the file against the {@link UploadConfig},
 * requests a slot from {@code upload.<domain>}, then PUTs the bytes to the
 * slot. The announcing message is sent only after the upload succeeded.</p>
 */
public class AttachmentManager
{
    private static final Logger LOG = LoggerFactory.getLogger(AttachmentManager.class);

    private final ConnectionManager connection;
    private final FileTransfer transfer;
    private final UploadConfig uploadConfig;

    public AttachmentManager(ConnectionManager connection, FileTransfer transfer)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.transfer = Objects.requireNonNull(transfer, "transfer");
        this.uploadConfig = connection.getConfig().upload();
    }

    /**
     * Uploads a file and sends the message announcing it.
     *
     * @param to         recipient address
     * @param body       message text, the file name when empty
     * @param attachment the file
     * @return completes when the announcement was sent
     */
    public CompletableFuture<Void> sendAttachment(String to, String body, FileAttachment attachment)
    {
        Objects.requireNonNull(to, "to");
        return upload(attachment)
                .thenCompose(slot -> connection.send(StanzaBuilder.attachmentMessage(to, body, attachment, slot)));
    }

    /**
     * Validates and uploads a file.
     *
     * @param attachment the file
     * @return the slot the file was uploaded to; fails with
     *         {@link FileTransferException}
     */
    public CompletableFuture<UploadSlot> upload(FileAttachment attachment)
    {
        Objects.requireNonNull(attachment, "attachment");
        try
        {
            validate(attachment);
        }
        catch (FileTransferException e)
        {
            return CompletableFuture.failedFuture(e);
        }

        String domain = connection.getConfig().domain();
        CompletableFuture<UploadSlot> result = new CompletableFuture<>();
        connection.sendQuery(StanzaBuilder.uploadSlotRequest(
                        attachment.name(), attachment.size(), attachment.contentType(), domain))
                .thenApply(response -> StanzaParser.parseUploadSlot(response)
                        .orElseThrow(() -> new FileTransferException(
                                FileTransferException.Kind.UPLOAD_FAILED, "Invalid upload slot response")))
                .thenCompose(slot -> transfer.put(slot.putUrl(), putHeaders(attachment, slot), attachment.content())
                        .thenApply(ignored -> slot))
                .whenComplete((slot, error) ->
                {
                    if (error != null)
                    {
                        FileTransferException failure = wrap(error, FileTransferException.Kind.UPLOAD_FAILED, "Failed to upload file");
                        LOG.warn("Upload of {} failed: {}", attachment.name(), failure.getMessage());
                        result.completeExceptionally(failure);
                    }
                    else
                    {
                        LOG.debug("Uploaded {} to {}", attachment.name(), slot.getUrl());
                        result.complete(slot);
                    }
                });
        return result;
    }

    /**
     * Downloads a file.
     *
     * @param url the file URL
     * @return the bytes; fails with {@link FileTransferException}
     */
    public CompletableFuture<byte[]> download(String url)
    {
        Objects.requireNonNull(url, "url");
        CompletableFuture<byte[]> result = new CompletableFuture<>();
        CompletableFuture<byte[]> download;
        try
        {
            download = transfer.get(url);
        }
        catch (RuntimeException e)
        {
            download = CompletableFuture.failedFuture(e);
        }
        download.whenComplete((bytes, error) ->
        {
            if (error != null)
            {
                result.completeExceptionally(wrap(error, FileTransferException.Kind.DOWNLOAD_FAILED, "Failed to download file"));
            }
            else
            {
                result.complete(bytes);
            }
        });
        return result;
    }

    // ========== Helpers ==========

    private void validate(FileAttachment attachment)
    {
        if (attachment.size() > uploadConfig.maxFileSize())
        {
            throw new FileTransferException(FileTransferException.Kind.SIZE_EXCEEDED,
                    "File size exceeds maximum allowed size of " + uploadConfig.maxFileSize() + " bytes");
        }
        if (!uploadConfig.allows(attachment.contentType()))
        {
            throw new FileTransferException(FileTransferException.Kind.INVALID_TYPE,
                    "File type " + attachment.contentType() + " is not allowed");
        }
    }

    private Map<String, String> putHeaders(FileAttachment attachment, UploadSlot slot)
    {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", attachment.contentType());
        headers.putAll(uploadConfig.headers());
        headers.putAll(slot.putHeaders());
        return headers;
    }

    private static FileTransferException wrap(Throwable error, FileTransferException.Kind kind, String prefix)
    {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (cause instanceof FileTransferException fte)
        {
            return fte;
        }
        return new FileTransferException(kind, prefix + ": " + cause.getMessage(), cause);
    }
}
