package org.abstractica.xmpp.impl.files;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Moves attachment bytes to and from an HTTP upload service.
 */
public interface FileTransfer
{
    /**
     * Uploads bytes with an HTTP PUT.
     *
     * @param url     the slot's PUT URL
     * @param headers request headers, including {@code Content-Type}
     * @param content the bytes
     * @return completes when the server accepted the upload
     */
    CompletableFuture<Void> put(String url, Map<String, String> headers, byte[] content);

    /**
     * Downloads bytes with an HTTP GET.
     *
     * @param url the file URL
     * @return the bytes
     */
    CompletableFuture<byte[]> get(String url);
}
