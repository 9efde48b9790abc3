package fr.lapetina.watchman;

import fr.lapetina.watchman.api.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for Watchman.
 */
public class WatchmanApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WatchmanApplication.class);

    private final WatchmanFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public WatchmanApplication(String configPath) throws Exception {
        this(WatchmanFactory.create(configPath));
    }

    public WatchmanApplication(WatchmanFactory factory) throws Exception {
        log.info("Starting Watchman...");

        this.factory = factory;

        // Bind the port before any background work starts
        try {
            this.httpServer = new HttpServer(
                    factory.getConfig().getServer(),
                    factory.getConfig().getProject(),
                    factory.getTargetRegistry(),
                    factory.getStatusStore(),
                    factory.getMetricsRegistry(),
                    factory.getConfigLoader()
            );
        } catch (Exception e) {
            factory.close();
            throw e;
        }

        try {
            factory.start();
        } catch (RuntimeException e) {
            httpServer.close();
            factory.close();
            throw e;
        }

        log.info("Watchman initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Watchman started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public WatchmanFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down Watchman...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Watchman shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "watchman.yaml";

        try {
            WatchmanApplication app = new WatchmanApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Watchman", e);
            System.exit(1);
        }
    }
}
