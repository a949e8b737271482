package com.intentguard.models;

import java.util.Objects;

/**
 * Outcome of a single check: approved flag plus a reason naming what passed or failed.
 */
public final class CheckResult {
    private final boolean approved;
    private final String reason;

    private CheckResult(boolean approved, String reason) {
        this.approved = approved;
        this.reason = reason != null ? reason : "";
    }

    public static CheckResult approve(String reason) {
        return new CheckResult(true, reason);
    }

    public static CheckResult reject(String reason) {
        return new CheckResult(false, reason);
    }

    public boolean isApproved() {
        return approved;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CheckResult)) return false;
        CheckResult that = (CheckResult) o;
        return approved == that.approved && reason.equals(that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(approved, reason);
    }

    @Override
    public String toString() {
        return "CheckResult{approved=" + approved + ", reason='" + reason + "'}";
    }
}
