package com.finopti;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.finopti.controllers.AgentController;
import com.finopti.controllers.Controller;
import com.finopti.controllers.HealthController;
import com.finopti.controllers.RemediationController;
import com.finopti.controllers.TaskController;
import io.javalin.Javalin;
import io.javalin.http.BadRequestResponse;
import io.javalin.json.JavalinJackson;

import java.util.List;
import java.util.Map;

public class Main {

    static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            // Environment first, command line overrides
            AppConfig config = new AppConfig.Builder()
                    .fromEnvironment(System.getenv())
                    .parseArgs(args)
                    .build();

            AppConfig.ensureLogDirectory(config.getLogPath());
            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            OrchestratorContext context = new OrchestratorContext(config, objectMapper);
            if (!context.agents().isAvailable()) {
                logger.warn("Starting without an agent registry; every dispatch will fail closed");
            }

            Javalin app = createApp(context, objectMapper);
            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Agents: " + context.agents().size());
            logger.console("  Policy service: " + context.authorization().describePolicyService());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                context.close();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start FinOpti orchestrator: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Build the Javalin app with every controller registered. Not started.
     */
    public static Javalin createApp(OrchestratorContext context, ObjectMapper mapper) {
        Javalin app = Javalin.create(cfg -> {
            cfg.jsonMapper(new JavalinJackson(mapper, false));
            cfg.http.defaultContentType = "application/json";
            cfg.showJavalinBanner = false;
        });

        List<Controller> controllers = List.of(
            new HealthController(VERSION, context.agents(), context.authorization()),
            new AgentController(context.agents()),
            new TaskController(context.router(), mapper),
            new RemediationController(context.remediation(), context.runs(), mapper)
        );
        for (Controller controller : controllers) {
            controller.registerRoutes(app);
        }

        registerExceptionHandlers(app);
        return app;
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  FinOpti Orchestrator v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(BadRequestResponse.class, (e, ctx) -> {
            AppLogger.get().warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            AppLogger.get().warn("Invalid argument: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            AppLogger.get().error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Map.of("error", true, "kind", "INTERNAL",
                "message", "Internal error: " + Controller.errorBody(e).get("error")));
        });
    }
}
