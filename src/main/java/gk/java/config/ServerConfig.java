package gk.java.config;

import gk.java.engine.MergeStrategy;
import gk.java.engine.RateLimiterConfig;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/**
 * Settings of the standalone server.
 *
 * <p>Read from {@code gatekeeper.*} system properties, then overridden by command line
 * arguments of the form {@code --key=value} using the same keys without the prefix:
 * <ul>
 *   <li>{@code port} (default 9090)</li>
 *   <li>{@code rules-file} JSON rules loaded at start-up</li>
 *   <li>{@code merge-strategy} {@code most_restrictive} or {@code weighted}</li>
 *   <li>{@code cleanup-interval-seconds} idle state sweep period</li>
 *   <li>{@code event-queue-capacity} bound of the event queue</li>
 * </ul>
 * A single bare argument is taken as the port.
 */
public record ServerConfig(int port, Optional<Path> rulesFile, RateLimiterConfig limiterConfig) {

    public static final int DEFAULT_PORT = 9090;
    static final String PREFIX = "gatekeeper.";

    public ServerConfig {
        if (port < 0 || port > 65_535) throw new IllegalArgumentException("port out of range: " + port);
        if (rulesFile == null) throw new IllegalArgumentException("rulesFile cannot be null");
        if (limiterConfig == null) throw new IllegalArgumentException("limiterConfig cannot be null");
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_PORT, Optional.empty(), RateLimiterConfig.defaults());
    }

    public static ServerConfig load(String[] args) {
        return load(System.getProperties(), args);
    }

    /**
     * @throws IllegalArgumentException on an unknown option or a malformed value
     */
    public static ServerConfig load(Properties systemProperties, String[] args) {
        Properties settings = new Properties();
        for (String name : systemProperties.stringPropertyNames()) {
            if (name.startsWith(PREFIX)) {
                settings.setProperty(name.substring(PREFIX.length()), systemProperties.getProperty(name));
            }
        }
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                settings.setProperty("port", arg);
                continue;
            }
            int eq = arg.indexOf('=');
            if (eq < 0) throw new IllegalArgumentException("expected --key=value, got: " + arg);
            settings.setProperty(arg.substring(2, eq), arg.substring(eq + 1));
        }

        int port = DEFAULT_PORT;
        Optional<Path> rulesFile = Optional.empty();
        RateLimiterConfig limiter = RateLimiterConfig.defaults();
        for (String key : settings.stringPropertyNames()) {
            String value = settings.getProperty(key).trim();
            switch (key) {
                case "port" -> port = parseInt(key, value);
                case "rules-file" -> rulesFile = value.isEmpty() ? Optional.empty() : Optional.of(Path.of(value));
                case "merge-strategy" -> limiter = limiter.withMergeStrategy(mergeStrategy(value));
                case "cleanup-interval-seconds" ->
                    limiter = limiter.withCleanupInterval(Duration.ofSeconds(parseInt(key, value)));
                case "event-queue-capacity" -> limiter = limiter.withEventQueueCapacity(parseInt(key, value));
                default -> throw new IllegalArgumentException("unknown option: " + key);
            }
        }
        return new ServerConfig(port, rulesFile, limiter);
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + key + ": " + value, e);
        }
    }

    private static MergeStrategy mergeStrategy(String value) {
        try {
            return MergeStrategy.valueOf(value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid merge-strategy: " + value, e);
        }
    }
}
