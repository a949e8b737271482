package com.intentguard.models;

import java.util.Objects;

/**
 * Final decision for one {@link ActionRequest}. The dispatcher only proceeds when approved.
 */
public final class ValidationResult {
    private final boolean approved;
    private final String reason;
    private final IntentKind userIntent;

    public ValidationResult(boolean approved, String reason, IntentKind userIntent) {
        this.approved = approved;
        this.reason = reason != null ? reason : "";
        this.userIntent = userIntent != null ? userIntent : IntentKind.UNKNOWN;
    }

    public boolean isApproved() {
        return approved;
    }

    public String getReason() {
        return reason;
    }

    public IntentKind getUserIntent() {
        return userIntent;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ValidationResult)) return false;
        ValidationResult that = (ValidationResult) o;
        return approved == that.approved
            && reason.equals(that.reason)
            && userIntent == that.userIntent;
    }

    @Override
    public int hashCode() {
        return Objects.hash(approved, reason, userIntent);
    }

    @Override
    public String toString() {
        return "ValidationResult{" +
            "approved=" + approved +
            ", reason='" + reason + '\'' +
            ", userIntent=" + userIntent +
            '}';
    }
}
