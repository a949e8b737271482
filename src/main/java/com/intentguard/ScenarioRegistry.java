package com.intentguard;

import com.intentguard.models.AttackScenario;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attack scenarios used to generate stimulus prompts for exercising the validator.
 * Templates come from the template directory, then the bundled classpath copy, then a placeholder.
 */
public class ScenarioRegistry {

    public static final String PRIVACY_HARVESTING = "Privacy_Harvesting";
    public static final String PHISHING_EMAIL_SENDING = "Phishing_Email_Sending";
    public static final String DECEPTIVE_OUTPUT = "Deceptive_Output";
    public static final String EMAIL_SERVICE_POLLUTION = "Email_Service_Pollution";

    private static final String CLASSPATH_DIR = "/scenarios/";

    private final Path templateDir;
    private final Map<String, AttackScenario> scenarios;
    private final AppLogger logger;

    public ScenarioRegistry(Path templateDir) {
        this.templateDir = templateDir;
        this.logger = AppLogger.get();
        this.scenarios = Collections.unmodifiableMap(loadScenarios());
    }

    public Path getTemplateDir() {
        return templateDir;
    }

    public List<String> getScenarioIds() {
        return new ArrayList<>(scenarios.keySet());
    }

    public List<AttackScenario> listScenarios() {
        return new ArrayList<>(scenarios.values());
    }

    public AttackScenario getScenario(String id) {
        return id != null ? scenarios.get(id) : null;
    }

    public boolean hasScenario(String id) {
        return id != null && scenarios.containsKey(id);
    }

    private Map<String, AttackScenario> loadScenarios() {
        Map<String, AttackScenario> loaded = new LinkedHashMap<>();
        register(loaded, PRIVACY_HARVESTING, "Privacy Harvesting");
        register(loaded, PHISHING_EMAIL_SENDING, "Phishing Email Sending");
        register(loaded, DECEPTIVE_OUTPUT, "Deceptive Output");
        register(loaded, EMAIL_SERVICE_POLLUTION, "Email Service Pollution");
        return loaded;
    }

    private void register(Map<String, AttackScenario> target, String id, String name) {
        Path templatePath = templateDir != null ? templateDir.resolve(id + ".txt") : null;
        AttackScenario scenario = new AttackScenario(id, name, templatePath);
        scenario.setTemplateContent(readTemplate(scenario));
        target.put(id, scenario);
    }

    private String readTemplate(AttackScenario scenario) {
        Path path = scenario.getTemplatePath();
        if (path != null && Files.isRegularFile(path)) {
            try {
                return Files.readString(path, StandardCharsets.UTF_8);
            } catch (IOException e) {
                logger.warn("Could not read template " + path + ": " + e.getMessage());
            }
        }

        try (InputStream in = ScenarioRegistry.class.getResourceAsStream(CLASSPATH_DIR + scenario.getId() + ".txt")) {
            if (in != null) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            logger.warn("Could not read bundled template for " + scenario.getId() + ": " + e.getMessage());
        }

        logger.warn("Template file not found for " + scenario.getId()
            + (path != null ? " (" + path + ")" : "") + ", using default content");
        return "Default " + scenario.getName() + " template content";
    }
}
