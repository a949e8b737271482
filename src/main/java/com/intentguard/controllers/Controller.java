package com.intentguard.controllers;

import io.javalin.Javalin;

import java.util.Map;

/**
 * A group of HTTP routes over the validator or the scenario tooling.
 * {@code Main} registers every controller on one Javalin instance.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * JSON error payload {@code {"error": ...}}. Exceptions without a message are reported
     * by class name so the client never receives a null error.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }
}
