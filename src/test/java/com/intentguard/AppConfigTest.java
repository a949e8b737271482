package com.intentguard;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsServeAllScenarios() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"--log-dir", tempDir.toString(), "--generate"})
            .build();
        assertEquals(AppConfig.Mode.GENERATE, config.getMode());
        assertTrue(config.isAllScenarios());
        assertEquals(5, config.getNumPrompts());
        assertEquals(Paths.get("attack_scenario_prompts"), config.getTemplateDir());
        assertEquals(Paths.get("generated_prompts"), config.getOutputDir());
        assertEquals(tempDir.toAbsolutePath().normalize().resolve("intent-guard.log"), config.getLogPath());
        assertNull(config.getSeed());
    }

    @Test
    void parsesGenerationFlags() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {
                "--generate",
                "--scenarios", "Privacy_Harvesting", "Deceptive_Output",
                "--num-prompts=3",
                "--templates", "tpl",
                "--output-dir=out",
                "--seed", "11",
                "--log-dir=" + tempDir
            })
            .build();
        assertEquals(List.of("Privacy_Harvesting", "Deceptive_Output"), config.getScenarios());
        assertFalse(config.isAllScenarios());
        assertEquals(3, config.getNumPrompts());
        assertEquals(Paths.get("tpl"), config.getTemplateDir());
        assertEquals(Paths.get("out"), config.getOutputDir());
        assertEquals(11L, config.getSeed());
    }

    @Test
    void commaSeparatedScenariosAreSplit() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"--generate", "--scenarios=Privacy_Harvesting, Deceptive_Output",
                "--log-dir", tempDir.toString()})
            .build();
        assertEquals(List.of("Privacy_Harvesting", "Deceptive_Output"), config.getScenarios());
    }

    @Test
    void malformedNumbersKeepDefaults() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"--generate", "--num-prompts", "many", "--port=abc", "--seed=x",
                "--log-dir", tempDir.toString()})
            .build();
        assertEquals(5, config.getNumPrompts());
        assertEquals(8090, config.getPort());
        assertNull(config.getSeed());
    }

    @Test
    void generateModeKeepsRequestedPort() throws Exception {
        AppConfig config = new AppConfig.Builder()
            .parseArgs(new String[] {"--generate", "--port", "9123", "--dev", "--log-dir", tempDir.toString()})
            .build();
        assertEquals(9123, config.getPort());
        assertTrue(config.isDevMode());
    }
}
