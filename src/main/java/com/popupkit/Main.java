package com.popupkit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.popupkit.controllers.Controller;
import com.popupkit.controllers.PopupController;
import com.popupkit.json.PopupJacksonModule;
import com.popupkit.parse.PopupParseException;
import com.popupkit.transform.OtherOptionTransform;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;
import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper().registerModule(new PopupJacksonModule());
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            // Environment first so that command-line flags win
            AppConfig config = new AppConfig.Builder()
                    .fromEnvironment()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), true, config.isDevMode());
            logger = AppLogger.get();
            banner("  " + AppConfig.APP_NAME + " v" + VERSION, config.isDevMode() ? "  Mode: Development" : null);

            PopupService popupService = new PopupService(objectMapper, config.isInjectOther());
            if (config.isInjectOther()) {
                logger.info("Choices will include an '" + OtherOptionTransform.OTHER_LABEL + "' option");
            }

            Javalin app = createApp(List.of(new PopupController(popupService, objectMapper)));
            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            banner("  Listening on " + url, "  Log file: " + config.getLogPath(), "  Press Ctrl+C to stop");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start " + AppConfig.APP_NAME + ": " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    static Javalin createApp(List<Controller> controllers) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(objectMapper));
            cfg.http.defaultContentType = "application/json";
        });
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }
        app.get("/api/health", ctx -> ctx.json(Map.of("status", "ok", "version", VERSION)));

        app.exception(PopupParseException.class, (e, ctx) -> {
            logger.warn("Popup rejected [" + e.getKind().getCode() + "]: " + e.getReason());
            ctx.status(400).json(Controller.parseErrorBody(e));
        });
        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
        return app;
    }

    private static void banner(String... lines) {
        logger.console("");
        logger.console("========================================");
        for (String line : lines) {
            if (line != null) {
                logger.console(line);
            }
        }
        logger.console("========================================");
    }
}
