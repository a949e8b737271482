package com.intentguard.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class GeneratedPromptsFile {
    private String scenario;
    private List<String> prompts = new ArrayList<>();

    public GeneratedPromptsFile() {
    }

    public GeneratedPromptsFile(String scenario, List<String> prompts) {
        this.scenario = scenario;
        this.prompts = prompts != null ? new ArrayList<>(prompts) : new ArrayList<>();
    }

    public String getScenario() {
        return scenario;
    }

    public void setScenario(String scenario) {
        this.scenario = scenario;
    }

    public List<String> getPrompts() {
        return prompts;
    }

    public void setPrompts(List<String> prompts) {
        this.prompts = prompts != null ? prompts : new ArrayList<>();
    }
}
