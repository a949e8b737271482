package com.intentguard.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A red-team scenario: a template describing one attack against an e-mail agent,
 * plus the prompts generated from it so far.
 */
public class AttackScenario {
    private final String id;
    private final String name;
    private final Path templatePath;
    private String templateContent = "";
    private final List<String> generatedPrompts = new ArrayList<>();

    public AttackScenario(String id, String name, Path templatePath) {
        this.id = id;
        this.name = name;
        this.templatePath = templatePath;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    @JsonIgnore
    public Path getTemplatePath() {
        return templatePath;
    }

    public String getTemplateContent() {
        return templateContent;
    }

    public void setTemplateContent(String templateContent) {
        this.templateContent = templateContent != null ? templateContent : "";
    }

    public List<String> getGeneratedPrompts() {
        return Collections.unmodifiableList(generatedPrompts);
    }

    public int getGeneratedCount() {
        return generatedPrompts.size();
    }

    public void addGeneratedPrompt(String prompt) {
        if (prompt != null) {
            generatedPrompts.add(prompt);
        }
    }
}
