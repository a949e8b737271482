package com.intentguard.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * JSON body accepted by the validation endpoints.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidationRequest {
    private String userPrompt;
    private String proposedAction;
    private Map<String, Object> actionParams;
    private String emailContent;
    private String proposedResponse;
    private String toolCall;

    public ValidationRequest() {
    }

    public String getUserPrompt() {
        return userPrompt;
    }

    public void setUserPrompt(String userPrompt) {
        this.userPrompt = userPrompt;
    }

    public String getProposedAction() {
        return proposedAction;
    }

    public void setProposedAction(String proposedAction) {
        this.proposedAction = proposedAction;
    }

    public Map<String, Object> getActionParams() {
        return actionParams;
    }

    public void setActionParams(Map<String, Object> actionParams) {
        this.actionParams = actionParams;
    }

    public String getEmailContent() {
        return emailContent;
    }

    public void setEmailContent(String emailContent) {
        this.emailContent = emailContent;
    }

    public String getProposedResponse() {
        return proposedResponse;
    }

    public void setProposedResponse(String proposedResponse) {
        this.proposedResponse = proposedResponse;
    }

    public String getToolCall() {
        return toolCall;
    }

    public void setToolCall(String toolCall) {
        this.toolCall = toolCall;
    }

    public ActionRequest toActionRequest() {
        return new ActionRequest(userPrompt, proposedAction, ExtractedParams.fromRaw(actionParams), emailContent);
    }
}
