package org.abstractica.xmpp.impl.files;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link FileTransfer} over {@link HttpClient}. Any non-2xx response is a
 * failure.
 */
public class HttpFileTransfer implements FileTransfer
{
    private static final Logger LOG = LoggerFactory.getLogger(HttpFileTransfer.class);
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    // Restricted by HttpClient, set implicitly
    private static final String CONTENT_LENGTH = "content-length";
    private static final String HOST = "host";

    private final HttpClient client;

    public HttpFileTransfer()
    {
        this(HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build());
    }

    public HttpFileTransfer(HttpClient client)
    {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CompletableFuture<Void> put(String url, Map<String, String> headers, byte[] content)
    {
        HttpRequest.Builder request = HttpRequest.newBuilder(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .PUT(HttpRequest.BodyPublishers.ofByteArray(content));
        headers.forEach((name, value) ->
        {
            String lower = name.toLowerCase(Locale.ROOT);
            if (!lower.equals(CONTENT_LENGTH) && !lower.equals(HOST))
            {
                request.header(name, value);
            }
        });

        LOG.debug("PUT {} ({} bytes)", url, content.length);
        return client.sendAsync(request.build(), HttpResponse.BodyHandlers.discarding())
                .thenApply(response ->
                {
                    checkStatus("PUT", url, response.statusCode());
                    return null;
                });
    }

    @Override
    public CompletableFuture<byte[]> get(String url)
    {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .timeout(REQUEST_TIMEOUT)
                .GET()
                .build();

        LOG.debug("GET {}", url);
        return client.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response ->
                {
                    checkStatus("GET", url, response.statusCode());
                    return response.body();
                });
    }

    private static void checkStatus(String method, String url, int status)
    {
        if (status < 200 || status >= 300)
        {
            LOG.debug("{} {} failed with status {}", method, url, status);
            throw new UncheckedIOException(new IOException(method + " " + url + " failed with status " + status));
        }
    }
}
