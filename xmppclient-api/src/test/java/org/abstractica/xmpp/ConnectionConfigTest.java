package org.abstractica.xmpp;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ConnectionConfig}.
 */
class ConnectionConfigTest
{
    private static ConnectionConfig.Builder valid()
    {
        return ConnectionConfig.builder()
                .serviceUri("wss://chat.example.com:5443/ws")
                .domain("example.com")
                .principal("alice@example.com")
                .secret("secret");
    }

    @Test
    void build_appliesDefaults()
    {
        ConnectionConfig config = valid().build();

        assertEquals(Duration.ofMillis(10_000), config.connectTimeout());
        assertEquals(10_000, config.connectTimeoutMs());
        assertEquals(Duration.ofMillis(30_000), config.queryTimeout());
        assertEquals(UploadConfig.defaults(), config.upload());
        assertTrue(config.getResource().isEmpty());
        assertFalse(config.resolveReadStatus());
    }

    @Test
    void build_keepsExplicitValues()
    {
        UploadConfig upload = new UploadConfig(1024, Set.of("text/plain"), Map.of("X-Key", "v"));

        ConnectionConfig config = valid()
                .resource("web")
                .connectTimeout(Duration.ofSeconds(3))
                .queryTimeout(Duration.ofSeconds(5))
                .upload(upload)
                .resolveReadStatus(true)
                .build();

        assertEquals("web", config.getResource().orElseThrow());
        assertEquals(3_000, config.connectTimeoutMs());
        assertEquals(Duration.ofSeconds(5), config.queryTimeout());
        assertSame(upload, config.upload());
        assertTrue(config.resolveReadStatus());
    }

    @Test
    void toString_masksSecret()
    {
        String text = valid().secret("hunter2").build().toString();

        assertFalse(text.contains("hunter2"));
        assertTrue(text.contains("secret=****"));
        assertTrue(text.contains("principal=alice@example.com"));
    }

    @Test
    void build_missingServiceUri_isInvalidConfig()
    {
        assertInvalid(valid().serviceUri(null));
    }

    @Test
    void build_missingDomain_isInvalidConfig()
    {
        assertInvalid(valid().domain(""));
    }

    @Test
    void build_missingPrincipal_isInvalidConfig()
    {
        assertInvalid(valid().principal(null));
    }

    @Test
    void build_blankSecret_isInvalidConfig()
    {
        assertInvalid(valid().secret("   "));
    }

    @Test
    void build_nonPositiveTimeout_isInvalidConfig()
    {
        assertInvalid(valid().connectTimeout(Duration.ZERO));
        assertInvalid(valid().queryTimeout(Duration.ofMillis(-1)));
    }

    private static void assertInvalid(ConnectionConfig.Builder builder)
    {
        ConnectionException e = assertThrows(ConnectionException.class, builder::build);
        assertEquals(ConnectionException.Kind.INVALID_CONFIG, e.getKind());
    }

    @Test
    void uploadConfig_allowsOnlyListedTypes()
    {
        UploadConfig upload = UploadConfig.defaults();

        assertTrue(upload.allows("image/png"));
        assertFalse(upload.allows("application/x-msdownload"));
        assertFalse(upload.allows(null));
        assertEquals(10L * 1024 * 1024, upload.maxFileSize());
    }

    @Test
    void uploadConfig_rejectsNonPositiveSize()
    {
        assertThrows(IllegalArgumentException.class, () -> new UploadConfig(0, Set.of(), Map.of()));
    }
}
