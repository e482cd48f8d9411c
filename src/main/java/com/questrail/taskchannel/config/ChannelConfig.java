package com.questrail.taskchannel.config;

import com.questrail.taskchannel.internal.reconnect.ReconnectPolicy;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Aggregated configuration for one task channel.
 *
 * @param baseUrl             WebSocket endpoint ({@code ws://} or {@code wss://})
 * @param credential          opaque credential appended to the URL, or {@code null}
 * @param credentialParameter query parameter name carrying the credential
 * @param heartbeatInterval   time between liveness probes
 * @param heartbeatTimeout    time allowed for a probe acknowledgment; shorter than the interval
 * @param reconnectPolicy     backoff and attempt limit
 */
public record ChannelConfig(
    URI baseUrl,
    String credential,
    String credentialParameter,
    Duration heartbeatInterval,
    Duration heartbeatTimeout,
    ReconnectPolicy reconnectPolicy
) {
    public static final String RESOURCE_NAME = "task-channel.properties";

    public static final String KEY_BASE_URL = "task-channel.base-url";
    public static final String KEY_CREDENTIAL = "task-channel.credential";
    public static final String KEY_CREDENTIAL_PARAMETER = "task-channel.credential-parameter";
    public static final String KEY_HEARTBEAT_INTERVAL_MS = "task-channel.heartbeat-interval-ms";
    public static final String KEY_HEARTBEAT_TIMEOUT_MS = "task-channel.heartbeat-timeout-ms";
    public static final String KEY_RECONNECT_BASE_DELAY_MS = "task-channel.reconnect.base-delay-ms";
    public static final String KEY_RECONNECT_BACKOFF_MULTIPLIER = "task-channel.reconnect.backoff-multiplier";
    public static final String KEY_RECONNECT_MAX_DELAY_MS = "task-channel.reconnect.max-delay-ms";
    public static final String KEY_RECONNECT_MAX_ATTEMPTS = "task-channel.reconnect.max-attempts";

    public static final String ENV_BASE_URL = "TASK_CHANNEL_WS_URL";
    public static final String ENV_CREDENTIAL = "TASK_CHANNEL_API_KEY";

    public static final URI DEFAULT_BASE_URL = URI.create("ws://localhost:8080");
    public static final String DEFAULT_CREDENTIAL_PARAMETER = "api_key";
    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final Duration DEFAULT_HEARTBEAT_TIMEOUT = Duration.ofSeconds(5);

    public ChannelConfig {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(credentialParameter, "credentialParameter");
        Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        Objects.requireNonNull(heartbeatTimeout, "heartbeatTimeout");
        Objects.requireNonNull(reconnectPolicy, "reconnectPolicy");

        String scheme = baseUrl.getScheme() == null ? "" : baseUrl.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("ws") && !scheme.equals("wss")) {
            throw new IllegalArgumentException("baseUrl must use ws or wss: " + baseUrl);
        }
        if (credentialParameter.isBlank()) {
            throw new IllegalArgumentException("credentialParameter must not be blank");
        }
        if (heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new IllegalArgumentException("heartbeatInterval must be positive");
        }
        if (heartbeatTimeout.isZero() || heartbeatTimeout.isNegative()) {
            throw new IllegalArgumentException("heartbeatTimeout must be positive");
        }
        if (heartbeatTimeout.compareTo(heartbeatInterval) >= 0) {
            throw new IllegalArgumentException("heartbeatTimeout must be shorter than heartbeatInterval");
        }
        if (credential != null && credential.isBlank()) {
            credential = null;
        }
    }

    public Optional<String> credentialValue() {
        return Optional.ofNullable(credential);
    }

    /**
     * The URI actually dialled: {@link #baseUrl()} with the credential, if any, as a query
     * parameter. Do not log the result.
     */
    public URI connectionUri() {
        if (credential == null) {
            return baseUrl;
        }
        String parameter = URLEncoder.encode(credentialParameter, StandardCharsets.UTF_8)
                + "="
                + URLEncoder.encode(credential, StandardCharsets.UTF_8);

        // Rebuilt from raw components so the query lands before any fragment.
        StringBuilder uri = new StringBuilder(baseUrl.getScheme()).append(':');
        if (baseUrl.getRawAuthority() != null) {
            uri.append("//").append(baseUrl.getRawAuthority());
        }
        if (baseUrl.getRawPath() != null) {
            uri.append(baseUrl.getRawPath());
        }
        uri.append('?');
        if (baseUrl.getRawQuery() != null) {
            uri.append(baseUrl.getRawQuery()).append('&');
        }
        uri.append(parameter);
        if (baseUrl.getRawFragment() != null) {
            uri.append('#').append(baseUrl.getRawFragment());
        }
        return URI.create(uri.toString());
    }

    public static ChannelConfig defaults() {
        return builder().build();
    }

    /**
     * Build a configuration from properties; absent keys fall back to defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static ChannelConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");

        ReconnectPolicy defaults = ReconnectPolicy.defaults();
        Builder builder = builder();

        String baseUrl = trimmed(properties, KEY_BASE_URL);
        if (baseUrl != null) {
            builder.withBaseUrl(parseUri(KEY_BASE_URL, baseUrl));
        }
        builder.withCredential(trimmed(properties, KEY_CREDENTIAL));
        String parameter = trimmed(properties, KEY_CREDENTIAL_PARAMETER);
        if (parameter != null) {
            builder.withCredentialParameter(parameter);
        }

        builder.withHeartbeatInterval(millis(properties, KEY_HEARTBEAT_INTERVAL_MS, DEFAULT_HEARTBEAT_INTERVAL));
        builder.withHeartbeatTimeout(millis(properties, KEY_HEARTBEAT_TIMEOUT_MS, DEFAULT_HEARTBEAT_TIMEOUT));

        Duration maxDelay = properties.containsKey(KEY_RECONNECT_MAX_DELAY_MS)
                && trimmed(properties, KEY_RECONNECT_MAX_DELAY_MS) == null
                ? null // present but blank: uncapped
                : millis(properties, KEY_RECONNECT_MAX_DELAY_MS, defaults.maxDelay());

        builder.withReconnectPolicy(new ReconnectPolicy(
                millis(properties, KEY_RECONNECT_BASE_DELAY_MS, defaults.baseDelay()),
                decimal(properties, KEY_RECONNECT_BACKOFF_MULTIPLIER, defaults.backoffMultiplier()),
                maxDelay,
                integer(properties, KEY_RECONNECT_MAX_ATTEMPTS, defaults.maxAttempts())
        ));

        return builder.build();
    }

    /**
     * Load {@value #RESOURCE_NAME} from the classpath (if present) and apply the
     * {@value #ENV_BASE_URL} / {@value #ENV_CREDENTIAL} environment overrides.
     */
    public static ChannelConfig load() {
        return load(loadResource(RESOURCE_NAME), System.getenv());
    }

    /**
     * Same as {@link #load()} with explicit inputs.
     */
    public static ChannelConfig load(Properties properties, Map<String, String> environment) {
        Objects.requireNonNull(properties, "properties");
        Objects.requireNonNull(environment, "environment");

        Properties merged = new Properties();
        merged.putAll(properties);

        String envUrl = environment.get(ENV_BASE_URL);
        if (envUrl != null && !envUrl.isBlank()) {
            merged.setProperty(KEY_BASE_URL, envUrl);
        }
        String envCredential = environment.get(ENV_CREDENTIAL);
        if (envCredential != null && !envCredential.isBlank()) {
            merged.setProperty(KEY_CREDENTIAL, envCredential);
        }
        return fromProperties(merged);
    }

    static Properties loadResource(String name) {
        Properties properties = new Properties();
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ChannelConfig.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(name)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + name, e);
        }
        return properties;
    }

    private static String trimmed(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null) {
            return null;
        }
        value = value.trim();
        return value.isEmpty() ? null : value;
    }

    private static URI parseUri(String key, String value) {
        try {
            return URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid URI for " + key + ": " + value, e);
        }
    }

    private static Duration millis(Properties properties, String key, Duration fallback) {
        String value = trimmed(properties, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Duration.ofMillis(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid milliseconds for " + key + ": " + value, e);
        }
    }

    private static int integer(Properties properties, String key, int fallback) {
        String value = trimmed(properties, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    private static double decimal(Properties properties, String key, double fallback) {
        String value = trimmed(properties, key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, e);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private URI baseUrl = DEFAULT_BASE_URL;
        private String credential;
        private String credentialParameter = DEFAULT_CREDENTIAL_PARAMETER;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration heartbeatTimeout = DEFAULT_HEARTBEAT_TIMEOUT;
        private ReconnectPolicy reconnectPolicy = ReconnectPolicy.defaults();

        public Builder withBaseUrl(URI baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder withBaseUrl(String baseUrl) {
            return withBaseUrl(parseUri("baseUrl", baseUrl));
        }

        public Builder withCredential(String credential) {
            this.credential = credential;
            return this;
        }

        public Builder withCredentialParameter(String credentialParameter) {
            this.credentialParameter = credentialParameter;
            return this;
        }

        public Builder withHeartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder withHeartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = heartbeatTimeout;
            return this;
        }

        public Builder withReconnectPolicy(ReconnectPolicy reconnectPolicy) {
            this.reconnectPolicy = reconnectPolicy;
            return this;
        }

        public ChannelConfig build() {
            return new ChannelConfig(baseUrl, credential, credentialParameter,
                    heartbeatInterval, heartbeatTimeout, reconnectPolicy);
        }
    }
}
