package com.intentguard.tools;

import com.intentguard.models.ExtractedParams;

import java.util.Map;

/**
 * An action an agent asked to run, as parsed from its tool-call output.
 */
public class ActionCall {
    private final String action;
    private final Map<String, Object> params;
    private final String raw;

    public ActionCall(String action, Map<String, Object> params, String raw) {
        this.action = action;
        this.params = params;
        this.raw = raw;
    }

    public String getAction() {
        return action;
    }

    public Map<String, Object> getParams() {
        return params;
    }

    public String getRaw() {
        return raw;
    }

    public ExtractedParams toExtractedParams() {
        return ExtractedParams.fromRaw(params);
    }
}
