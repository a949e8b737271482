package com.intentguard;

import com.intentguard.models.GeneratedPromptsFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class GeneratedPromptStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void savesOnlyScenariosWithPrompts() throws Exception {
        ScenarioRegistry registry = new ScenarioRegistry(tempDir.resolve("templates"));
        new AttackPromptGenerator(registry, new Random(3)).generate(List.of(ScenarioRegistry.PRIVACY_HARVESTING), 2);

        GeneratedPromptStore store = new GeneratedPromptStore(registry);
        Path out = tempDir.resolve("out");
        List<Path> written = store.save(out);

        assertEquals(List.of(out.resolve("Privacy_Harvesting_prompts.json")), written);
        assertTrue(Files.exists(written.get(0)));

        GeneratedPromptsFile file = store.load(written.get(0));
        assertEquals(ScenarioRegistry.PRIVACY_HARVESTING, file.getScenario());
        assertEquals(registry.getScenario(ScenarioRegistry.PRIVACY_HARVESTING).getGeneratedPrompts(), file.getPrompts());
    }

    @Test
    void nothingGeneratedWritesNothing() throws Exception {
        GeneratedPromptStore store = new GeneratedPromptStore(new ScenarioRegistry(tempDir));
        assertTrue(store.save(tempDir.resolve("out")).isEmpty());
        assertFalse(Files.exists(tempDir.resolve("out")));
    }

    @Test
    void fileNamesAreSanitized() {
        assertEquals("a_b_c_prompts.json", GeneratedPromptStore.fileNameFor("a b/c"));
    }
}
