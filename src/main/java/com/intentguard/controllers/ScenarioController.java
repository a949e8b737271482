package com.intentguard.controllers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentguard.AppConfig;
import com.intentguard.AppLogger;
import com.intentguard.AttackPromptGenerator;
import com.intentguard.GeneratedPromptStore;
import com.intentguard.ScenarioRegistry;
import com.intentguard.models.AttackScenario;
import io.javalin.Javalin;
import io.javalin.http.Context;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Controller for attack scenarios and generated test prompts.
 */
public class ScenarioController implements Controller {

    private final ScenarioRegistry registry;
    private final AttackPromptGenerator generator;
    private final GeneratedPromptStore store;
    private final Path outputDir;
    private final ObjectMapper objectMapper;
    private final AppLogger logger;

    public ScenarioController(ScenarioRegistry registry, AttackPromptGenerator generator,
                              GeneratedPromptStore store, Path outputDir, ObjectMapper objectMapper) {
        this.registry = registry;
        this.generator = generator;
        this.store = store;
        this.outputDir = outputDir;
        this.objectMapper = objectMapper;
        this.logger = AppLogger.get();
    }

    @Override
    public void registerRoutes(Javalin app) {
        app.get("/api/scenarios", this::listScenarios);
        app.get("/api/scenarios/{id}", this::getScenario);
        app.post("/api/scenarios/generate", this::generate);
    }

    private void listScenarios(Context ctx) {
        try {
            ctx.json(registry.listScenarios());
        } catch (Exception e) {
            logger.error("Error listing scenarios: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void getScenario(Context ctx) {
        try {
            String id = ctx.pathParam("id");
            AttackScenario scenario = registry.getScenario(id);
            if (scenario == null) {
                ctx.status(404).json(Map.of("error", "Scenario not found: " + id));
                return;
            }
            ctx.json(scenario);
        } catch (Exception e) {
            logger.error("Error getting scenario: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }

    private void generate(Context ctx) {
        try {
            String raw = ctx.body();
            JsonNode json = raw == null || raw.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(raw);

            List<String> ids = new ArrayList<>();
            JsonNode scenariosNode = json.path("scenarios");
            if (scenariosNode.isArray()) {
                for (JsonNode node : scenariosNode) {
                    if (node.isTextual() && !node.asText().isBlank()) {
                        ids.add(node.asText().trim());
                    }
                }
            }
            if (ids.isEmpty() || ids.contains(AppConfig.ALL_SCENARIOS)) {
                ids = registry.getScenarioIds();
            }

            int count = json.path("numPrompts").asInt(5);
            if (count < 1) {
                ctx.status(400).json(Map.of("error", "numPrompts must be at least 1"));
                return;
            }

            Map<String, List<String>> results = generator.generate(ids, count);
            if (json.path("save").asBoolean(false)) {
                store.save(outputDir);
            }
            ctx.json(results);
        } catch (JsonProcessingException e) {
            ctx.status(400).json(Map.of("error", "Invalid JSON body: " + e.getOriginalMessage()));
        } catch (Exception e) {
            logger.error("Error generating prompts: " + e.getMessage());
            ctx.status(500).json(Controller.errorBody(e));
        }
    }
}
