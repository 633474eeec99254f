package org.abstractica.xmpp.impl.connection;

import org.abstractica.xmpp.ConnectionConfig;

/**
 * Connection settings shared by the tests.
 */
public final class TestConfigs
{
    private TestConfigs() {}

    public static ConnectionConfig.Builder builder()
    {
        return ConnectionConfig.builder()
                .serviceUri("wss://chat.example.com:5443/ws")
                .domain("example.com")
                .principal("alice@example.com")
                .secret("secret");
    }

    public static ConnectionConfig config()
    {
        return builder().build();
    }
}
