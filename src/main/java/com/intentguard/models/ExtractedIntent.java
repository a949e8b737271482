package com.intentguard.models;

import java.util.Objects;

public final class ExtractedIntent {

    private static final ExtractedIntent UNKNOWN = new ExtractedIntent(IntentKind.UNKNOWN, ExtractedParams.empty());

    private final IntentKind kind;
    private final ExtractedParams params;

    public ExtractedIntent(IntentKind kind, ExtractedParams params) {
        this.kind = kind != null ? kind : IntentKind.UNKNOWN;
        this.params = params != null ? params : ExtractedParams.empty();
    }

    public static ExtractedIntent unknown() {
        return UNKNOWN;
    }

    public IntentKind getKind() {
        return kind;
    }

    public ExtractedParams getParams() {
        return params;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractedIntent)) return false;
        ExtractedIntent that = (ExtractedIntent) o;
        return kind == that.kind && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, params);
    }

    @Override
    public String toString() {
        return "ExtractedIntent{kind=" + kind + ", params=" + params + '}';
    }
}
