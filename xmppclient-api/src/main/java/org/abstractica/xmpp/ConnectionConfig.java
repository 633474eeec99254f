package org.abstractica.xmpp;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable connection settings.
 *
 * <p>Instances are created through {@link #builder()}, which validates the
 * required fields and fills in defaults. An invalid configuration is
 * rejected when it is built, never later during a connect.</p>
 *
 * <pre>{@code
 * ConnectionConfig config = ConnectionConfig.builder()
 *     .serviceUri("wss://chat.example.com:5443/ws")
 *     .domain("example.com")
 *     .principal("alice@example.com")
 *     .secret("s3cret")
 *     .resource("web")
 *     .build();
 * }</pre>
 *
 * @param serviceUri        websocket or TCP service address of the server
 * @param domain            XMPP domain served by the server
 * @param principal         bare address of the account
 * @param secret            account password
 * @param resource          requested resource, may be null
 * @param connectTimeout    how long a connect attempt may take
 * @param queryTimeout      how long a correlated query waits for its response
 * @param upload            attachment upload settings
 * @param resolveReadStatus whether incoming messages are enriched with their read status
 */
public record ConnectionConfig(
        String serviceUri,
        String domain,
        String principal,
        String secret,
        String resource,
        Duration connectTimeout,
        Duration queryTimeout,
        UploadConfig upload,
        boolean resolveReadStatus
)
{
    /**
     * Default connect timeout (10 seconds).
     */
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofMillis(10_000);

    /**
     * Default correlated query timeout (30 seconds).
     */
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofMillis(30_000);

    public ConnectionConfig
    {
        if (isBlank(serviceUri) || isBlank(domain) || isBlank(principal) || isBlank(secret))
        {
            throw new ConnectionException(ConnectionException.Kind.INVALID_CONFIG,
                    "Invalid configuration: missing required fields");
        }
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(queryTimeout, "queryTimeout");
        Objects.requireNonNull(upload, "upload");
        if (connectTimeout.isNegative() || connectTimeout.isZero())
        {
            throw new ConnectionException(ConnectionException.Kind.INVALID_CONFIG,
                    "connectTimeout must be positive: " + connectTimeout);
        }
        if (queryTimeout.isNegative() || queryTimeout.isZero())
        {
            throw new ConnectionException(ConnectionException.Kind.INVALID_CONFIG,
                    "queryTimeout must be positive: " + queryTimeout);
        }
    }

    public static Builder builder()
    {
        return new Builder();
    }

    public Optional<String> getResource()
    {
        return Optional.ofNullable(resource);
    }

    public long connectTimeoutMs()
    {
        return connectTimeout.toMillis();
    }

    @Override
    public String toString()
    {
        return "ConnectionConfig[serviceUri=" + serviceUri
                + ", domain=" + domain
                + ", principal=" + principal
                + ", secret=****"
                + ", resource=" + resource
                + ", connectTimeout=" + connectTimeout
                + ", queryTimeout=" + queryTimeout
                + ", upload=" + upload
                + ", resolveReadStatus=" + resolveReadStatus + "]";
    }

    private static boolean isBlank(String value)
    {
        return value == null || value.isBlank();
    }

    /**
     * Builder for {@link ConnectionConfig}.
     */
    public static final class Builder
    {
        private String serviceUri;
        private String domain;
        private String principal;
        private String secret;
        private String resource;
        private Duration connectTimeout;
        private Duration queryTimeout;
        private UploadConfig upload;
        private boolean resolveReadStatus;

        private Builder()
        {
        }

        public Builder serviceUri(String serviceUri)
        {
            this.serviceUri = serviceUri;
            return this;
        }

        public Builder domain(String domain)
        {
            this.domain = domain;
            return this;
        }

        /**
         * Sets the bare address of the account, e.g. {@code alice@example.com}.
         *
         * @param principal the account address
         * @return this builder
         */
        public Builder principal(String principal)
        {
            this.principal = principal;
            return this;
        }

        public Builder secret(String secret)
        {
            this.secret = secret;
            return this;
        }

        public Builder resource(String resource)
        {
            this.resource = resource;
            return this;
        }

        /**
         * Sets the connect timeout. Optional; defaults to 10 seconds.
         *
         * @param connectTimeout the timeout
         * @return this builder
         */
        public Builder connectTimeout(Duration connectTimeout)
        {
            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * Sets the correlated query timeout. Optional; defaults to 30 seconds.
         *
         * @param queryTimeout the timeout
         * @return this builder
         */
        public Builder queryTimeout(Duration queryTimeout)
        {
            this.queryTimeout = queryTimeout;
            return this;
        }

        public Builder upload(UploadConfig upload)
        {
            this.upload = upload;
            return this;
        }

        /**
         * Enables read-status lookups for every received message before it is
         * delivered to listeners. Off by default; each lookup is one query.
         * Events keep their arrival order, so a pending lookup also delays
         * the presences, receipts and messages received after it.
         *
         * @param resolveReadStatus true to enable
         * @return this builder
         */
        public Builder resolveReadStatus(boolean resolveReadStatus)
        {
            this.resolveReadStatus = resolveReadStatus;
            return this;
        }

        /**
         * Validates and builds the configuration.
         *
         * @return the configuration
         * @throws ConnectionException with kind {@code INVALID_CONFIG} if a required field is missing
         */
        public ConnectionConfig build()
        {
            return new ConnectionConfig(
                    serviceUri,
                    domain,
                    principal,
                    secret,
                    resource,
                    connectTimeout != null ? connectTimeout : DEFAULT_CONNECT_TIMEOUT,
                    queryTimeout != null ? queryTimeout : DEFAULT_QUERY_TIMEOUT,
                    upload != null ? upload : UploadConfig.defaults(),
                    resolveReadStatus
            );
        }
    }
}
