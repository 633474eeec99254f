package org.abstractica.xmpp.model;

import java.util.Map;
import java.util.Objects;

/**
 * An upload slot granted by the server's HTTP upload service.
 *
 * @param putUrl     where to PUT the file
 * @param getUrl     where recipients download the file
 * @param putHeaders headers the server requires on the PUT
 * @param getHeaders headers the server requires on the GET
 */
public record UploadSlot(
        String putUrl,
        String getUrl,
        Map<String, String> putHeaders,
        Map<String, String> getHeaders
)
{
    public UploadSlot
    {
        Objects.requireNonNull(putUrl, "putUrl");
        Objects.requireNonNull(getUrl, "getUrl");
        putHeaders = Map.copyOf(putHeaders);
        getHeaders = Map.copyOf(getHeaders);
    }
}
