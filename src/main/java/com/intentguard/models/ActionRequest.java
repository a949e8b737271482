package com.intentguard.models;

import java.util.Optional;

/**
 * One proposed agent action together with the user prompt it claims to serve.
 */
public final class ActionRequest {
    private final String userPrompt;
    private final String proposedAction;
    private final ExtractedParams actionParams;
    private final String emailContent;

    public ActionRequest(String userPrompt, String proposedAction, ExtractedParams actionParams, String emailContent) {
        this.userPrompt = userPrompt != null ? userPrompt : "";
        this.proposedAction = proposedAction != null ? proposedAction : "";
        this.actionParams = actionParams != null ? actionParams : ExtractedParams.empty();
        this.emailContent = emailContent;
    }

    public ActionRequest(String userPrompt, String proposedAction, ExtractedParams actionParams) {
        this(userPrompt, proposedAction, actionParams, null);
    }

    public String getUserPrompt() {
        return userPrompt;
    }

    public String getProposedAction() {
        return proposedAction;
    }

    public ExtractedParams getActionParams() {
        return actionParams;
    }

    public Optional<String> getEmailContent() {
        return Optional.ofNullable(emailContent);
    }

    @Override
    public String toString() {
        return "ActionRequest{" +
            "userPrompt='" + userPrompt + '\'' +
            ", proposedAction='" + proposedAction + '\'' +
            ", actionParams=" + actionParams +
            ", emailContent=" + (emailContent != null ? emailContent.length() + " chars" : "none") +
            '}';
    }
}
