package in.launchkit.bootstrap;

import in.launchkit.infrastructure.metrics.PrometheusMetricsHandler;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process entry point: wires LaunchKit, starts the due-publish sweep and serves /metrics and /health.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("=== LaunchKit Starting ===");

        LaunchKit kit = LaunchKit.fromEnv();
        Undertow server = Undertow.builder()
            .addHttpListener(kit.config().metricsPort(), "0.0.0.0")
            .setHandler(routes(kit))
            .build();

        server.start();
        kit.sweeper().start();
        log.info("LaunchKit ops endpoints on http://localhost:{}/metrics", kit.config().metricsPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down LaunchKit");
            server.stop();
            kit.close();
        }, "launchkit-shutdown"));
    }

    static RoutingHandler routes(LaunchKit kit) {
        return Handlers.routing()
            .get("/metrics", new PrometheusMetricsHandler(kit.metrics().getRegistry()))
            .get("/health", exchange -> {
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                exchange.getResponseSender().send("{\"status\":\"ok\"}");
            });
    }

    private App() {
    }
}
