package com.broadcaster.dashboard;

import com.broadcaster.api.controller.BroadcasterController;
import com.broadcaster.metrics.MetricsService;
import com.broadcaster.websocket.BroadcastHub;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP server: REST API, the broadcast WebSocket and the Prometheus scrape endpoint.
 */
public final class BroadcasterServer {
    private static final Logger logger = LoggerFactory.getLogger(BroadcasterServer.class);

    private final Javalin app;
    private final int port;

    public BroadcasterServer(BroadcasterController controller, BroadcastHub hub, MetricsService metrics,
                             ObjectMapper objectMapper, int port) {
        this.port = port;
        this.app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));

            // Dashboards are deployed separately
            javalinConfig.bundledPlugins.enableCors(cors -> cors.addRule(it -> {
                it.reflectClientOrigin = true;
                it.allowCredentials = true;
            }));
        });

        app.ws("/ws/broadcast", ws -> {
            ws.onConnect(hub::onConnect);
            ws.onMessage(hub::onMessage);
            ws.onClose(hub::onClose);
            ws.onError(hub::onError);
        });

        controller.registerRoutes(app);

        app.get("/metrics", ctx -> {
            ctx.contentType("text/plain; version=0.0.4");
            ctx.result(metrics.scrape());
        });
    }

    public void start() {
        app.start(port);
        logger.info("🚀 Broadcaster server started at http://localhost:{}", app.port());
        logger.info("   WebSocket: ws://localhost:{}/ws/broadcast", app.port());
        logger.info("   Health: http://localhost:{}/health", app.port());
        logger.info("   Metrics: http://localhost:{}/metrics", app.port());
    }

    public void stop() {
        app.stop();
        logger.info("Broadcaster server stopped");
    }

    /**
     * Bound port; differs from the configured one when started on port 0.
     */
    public int getPort() {
        return app.port();
    }
}
