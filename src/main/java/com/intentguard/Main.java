package com.intentguard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentguard.controllers.Controller;
import com.intentguard.controllers.ScenarioController;
import com.intentguard.controllers.ValidationController;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Random;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(),
                    config.isDevMode() || config.getMode() == AppConfig.Mode.GENERATE);
            logger = AppLogger.get();

            printBanner(config);

            ScenarioRegistry scenarioRegistry = new ScenarioRegistry(config.getTemplateDir());
            Random random = config.getSeed() != null ? new Random(config.getSeed()) : new Random();
            AttackPromptGenerator generator = new AttackPromptGenerator(scenarioRegistry, random);
            GeneratedPromptStore promptStore = new GeneratedPromptStore(scenarioRegistry);

            if (config.getMode() == AppConfig.Mode.GENERATE) {
                runGenerate(config, scenarioRegistry, generator, promptStore);
                logger.close();
                return;
            }

            SecurityProxy securityProxy = new SecurityProxy(ResponseSource.quoting());

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            app.get("/api/health", ctx -> ctx.json(Map.of("status", "ok", "version", VERSION)));

            List<Controller> controllers = List.of(
                new ValidationController(securityProxy, objectMapper),
                new ScenarioController(scenarioRegistry, generator, promptStore, config.getOutputDir(), objectMapper)
            );
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }

            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Templates: " + config.getTemplateDir().toAbsolutePath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Intent Guard: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void runGenerate(AppConfig config, ScenarioRegistry registry,
                                    AttackPromptGenerator generator, GeneratedPromptStore store) throws Exception {
        List<String> selected = config.isAllScenarios() ? registry.getScenarioIds() : config.getScenarios();
        logger.console("Generating prompts for scenarios: " + String.join(", ", selected));
        logger.console("Number of prompts per scenario: " + config.getNumPrompts());

        Map<String, List<String>> results = generator.generate(selected, config.getNumPrompts());
        for (Map.Entry<String, List<String>> entry : results.entrySet()) {
            logger.console("");
            logger.console(entry.getKey() + ":");
            List<String> prompts = entry.getValue();
            for (int i = 0; i < prompts.size(); i++) {
                logger.console("  Prompt " + (i + 1) + ": " + preview(prompts.get(i), 100));
            }
        }

        List<Path> written = store.save(config.getOutputDir());
        logger.console("");
        logger.console("Wrote " + written.size() + " prompt file(s) to " + config.getOutputDir().toAbsolutePath());
    }

    private static String preview(String value, int max) {
        String flat = value.replace('\n', ' ');
        return flat.length() <= max ? flat : flat.substring(0, max) + "...";
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Intent Guard v" + VERSION);
        logger.console("========================================");
        if (config.getMode() == AppConfig.Mode.SERVE) {
            logger.console("  Starting server...");
        }
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            logger.warn("Bad request: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
