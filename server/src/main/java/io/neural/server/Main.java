// file: server/src/main/java/io/neural/server/Main.java
package io.neural.server;

import io.neural.engine.TableRegistry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a NeuralTable server.
 *
 * Responsibilities:
 *  - Load logging config (bundled logging.properties unless overridden).
 *  - Parse configuration from CLI.
 *  - Build the table registry and create bootstrap tables.
 *  - Start the HTTP server.
 *  - Close every table on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);

        var registry = new TableRegistry(cfg.tableOptions());
        if (cfg.tablesConfigPath() != null && !cfg.tablesConfigPath().isBlank()) {
            TablesConfig.fromJsonFile(Path.of(cfg.tablesConfigPath())).applyTo(registry);
        }

        var web = new WebServer(cfg.httpPort(), new TableService(registry));
        web.start();

        System.out.printf(
                "NeuralTable server listening on http://%s:%d (%d tables)%n",
                "localhost", cfg.httpPort(), registry.names().size()
        );

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "failed to stop HTTP server", e);
            }
            registry.closeAll();
        }, "neural-shutdown"));
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            System.err.println("Failed to load logging.properties: " + e.getMessage());
        }
    }
}
