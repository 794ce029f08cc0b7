package org.msgsearch.search.config;

import org.msgsearch.search.service.TieBreak;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Properties;

/**
 * Typed configuration for the Search Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. A few short environment
 * names are accepted as aliases:
 * <ul>
 *   <li>{@code PORT} for {@code server.port}</li>
 *   <li>{@code MAX_PAGE_SIZE} for {@code search.max.page.size}</li>
 *   <li>{@code UPSTREAM_BASE_URL} for {@code upstream.base.url}</li>
 *   <li>{@code REFRESH_INTERVAL_SECONDS} for {@code refresh.interval.seconds}</li>
 * </ul>
 * Missing or malformed keys fail fast with {@link IllegalStateException}.</p>
 */
public record SearchConfig(
    int serverPort,
    Upstream upstream,
    Refresh refresh,
    Search search
) {
    private static final Map<String, String> ENV_ALIASES = Map.of(
        "PORT", "server.port",
        "MAX_PAGE_SIZE", "search.max.page.size",
        "UPSTREAM_BASE_URL", "upstream.base.url",
        "REFRESH_INTERVAL_SECONDS", "refresh.interval.seconds"
    );

    /** Where and how the messages API is read. */
    public record Upstream(
        String baseUrl,
        String messagesPath,
        int pageSize,
        int maxRetries,
        Duration retryBackoff,
        Duration pageDelay,
        Duration requestTimeout
    ) {
        public String messagesUrl() {
            if (baseUrl.endsWith("/") && messagesPath.startsWith("/")) {
                return baseUrl + messagesPath.substring(1);
            }
            return baseUrl + messagesPath;
        }
    }

    /** Background refresh schedule. */
    public record Refresh(Duration interval, Duration fetchTimeout, boolean onStartup) {}

    /** Query engine limits and ordering. */
    public record Search(int maxPageSize, int defaultPageSize, TieBreak tieBreak) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link SearchConfig}
     */
    public static SearchConfig load() {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties, System.getenv());
        return from(properties);
    }

    /**
     * Builds a config from already-merged properties.
     */
    public static SearchConfig from(Properties p) {
        SearchConfig config = new SearchConfig(
            requireInt(p, "server.port"),
            readUpstream(p),
            readRefresh(p),
            readSearch(p)
        );
        validate(config);
        return config;
    }

    private static Upstream readUpstream(Properties p) {
        return new Upstream(
            requireString(p, "upstream.base.url"),
            requireString(p, "upstream.messages.path"),
            requireInt(p, "upstream.page.size"),
            requireInt(p, "upstream.max.retries"),
            Duration.ofMillis(requireInt(p, "upstream.retry.backoff.ms")),
            Duration.ofMillis(requireInt(p, "upstream.page.delay.ms")),
            Duration.ofMillis(requireInt(p, "upstream.request.timeout.ms"))
        );
    }

    private static Refresh readRefresh(Properties p) {
        return new Refresh(
            Duration.ofSeconds(requireInt(p, "refresh.interval.seconds")),
            Duration.ofSeconds(requireInt(p, "refresh.fetch.timeout.seconds")),
            requireBoolean(p, "refresh.on.startup")
        );
    }

    private static Search readSearch(Properties p) {
        String tieBreak = requireString(p, "search.tiebreak");
        try {
            return new Search(
                requireInt(p, "search.max.page.size"),
                requireInt(p, "search.default.page.size"),
                TieBreak.fromConfig(tieBreak)
            );
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid value for configuration 'search.tiebreak': '" + tieBreak + "'", e);
        }
    }

    private static void validate(SearchConfig config) {
        requirePositive("upstream.page.size", config.upstream().pageSize());
        requirePositive("upstream.max.retries", config.upstream().maxRetries());
        requirePositive("upstream.request.timeout.ms", config.upstream().requestTimeout().toMillis());
        requirePositive("refresh.interval.seconds", config.refresh().interval().getSeconds());
        requirePositive("refresh.fetch.timeout.seconds", config.refresh().fetchTimeout().getSeconds());
        requirePositive("search.max.page.size", config.search().maxPageSize());
        requirePositive("search.default.page.size", config.search().defaultPageSize());
    }

    private static void requirePositive(String key, long value) {
        if (value < 1) {
            throw new IllegalStateException("Configuration '" + key + "' must be >= 1 but was " + value);
        }
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = SearchConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    static void overlayEnvironment(Properties properties, Map<String, String> environment) {
        properties.putAll(environment);
        ENV_ALIASES.forEach((alias, key) -> {
            String value = trimToNull(environment.get(alias));
            if (value != null) {
                properties.setProperty(key, value);
            }
        });
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        String value = requireString(properties, key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static boolean requireBoolean(Properties properties, String key) {
        String value = requireString(properties, key);
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalStateException("Invalid boolean for configuration '" + key + "': '" + value + "'");
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
