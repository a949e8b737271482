package com.intentguard;

import com.intentguard.models.AttackScenario;
import com.intentguard.models.GeneratedPromptsFile;
import com.intentguard.storage.JsonStorage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Persists generated prompts as one {@code <scenario>_prompts.json} file per scenario.
 */
public class GeneratedPromptStore {

    private final ScenarioRegistry registry;
    private final AppLogger logger;

    public GeneratedPromptStore(ScenarioRegistry registry) {
        this.registry = registry;
        this.logger = AppLogger.get();
    }

    public List<Path> save(Path outputDir) throws IOException {
        List<Path> written = new ArrayList<>();
        synchronized (registry) {
            for (AttackScenario scenario : registry.listScenarios()) {
                if (scenario.getGeneratedPrompts().isEmpty()) {
                    continue;
                }
                Path file = outputDir.resolve(fileNameFor(scenario.getId()));
                JsonStorage.writeJson(file, new GeneratedPromptsFile(scenario.getId(), scenario.getGeneratedPrompts()));
                logger.info("Saved " + scenario.getGeneratedCount() + " prompts to " + file);
                written.add(file);
            }
        }
        return written;
    }

    public GeneratedPromptsFile load(Path file) throws IOException {
        return JsonStorage.readJson(file, GeneratedPromptsFile.class);
    }

    static String fileNameFor(String scenarioId) {
        String safe = scenarioId.replace(' ', '_').replace('/', '_');
        return safe + "_prompts.json";
    }
}
