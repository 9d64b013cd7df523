package gk.java.grpc;

import gk.core.clock.SystemClock;
import gk.java.config.RuleFileLoader;
import gk.java.config.ServerConfig;
import gk.java.engine.RateLimiter;
import gk.java.events.LoggingEventSink;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Standalone gRPC server for admission control.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090) via {@code gatekeeper.port} or {@code --port=}</li>
 *   <li>Rules loaded from a JSON file at start-up ({@code --rules-file=})</li>
 *   <li>Periodic cleanup of idle per-caller state</li>
 *   <li>Graceful shutdown with timeout</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * java -cp gatekeeper.jar gk.java.grpc.GatekeeperServer --port=8080 --rules-file=rules.json
 * </pre>
 */
public final class GatekeeperServer {

    private static final Logger log = LoggerFactory.getLogger(GatekeeperServer.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private final RateLimiter limiter;

    /**
     * Creates a server with the given limiter. The server owns the limiter and closes it on stop.
     *
     * @param port Port to listen on, 0 for any free port
     * @param limiter Rate limiter
     */
    public GatekeeperServer(int port, RateLimiter limiter) {
        this.limiter = limiter;
        this.server = ServerBuilder.forPort(port)
            .addService(new GatekeeperServiceImpl(limiter))
            .build();
    }

    /**
     * Builds the limiter from configuration, loads the rules file and binds the port.
     *
     * @throws IOException if the rules file cannot be read
     */
    public static GatekeeperServer create(ServerConfig config) throws IOException {
        RateLimiter limiter = new RateLimiter(SystemClock.instance(), config.limiterConfig(), new LoggingEventSink());
        try {
            Optional<Path> rulesFile = config.rulesFile();
            if (rulesFile.isPresent()) {
                new RuleFileLoader().loadInto(rulesFile.get(), limiter);
            }
        } catch (IOException | RuntimeException e) {
            limiter.close();
            throw e;
        }
        return new GatekeeperServer(config.port(), limiter);
    }

    /**
     * Starts the server and the idle state cleanup.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        limiter.start();
        log.info("GatekeeperServer started on port {}", server.getPort());

        // Graceful shutdown hook
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down gRPC server (JVM shutdown hook)");
            try {
                GatekeeperServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted", e);
            }
        }));
    }

    /**
     * Stops the server gracefully and releases the limiter.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        try {
            server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } finally {
            limiter.close();
        }
        log.info("GatekeeperServer stopped");
    }

    /**
     * Blocks until server is terminated.
     *
     * @throws InterruptedException if waiting is interrupted
     */
    public void blockUntilShutdown() throws InterruptedException {
        server.awaitTermination();
    }

    /**
     * Returns the port the server is listening on.
     *
     * @return port number; only valid once started
     */
    public int getPort() {
        return server.getPort();
    }

    public RateLimiter limiter() {
        return limiter;
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        ServerConfig config;
        try {
            config = ServerConfig.load(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }

        GatekeeperServer server = create(config);
        server.start();
        server.blockUntilShutdown();
    }
}
