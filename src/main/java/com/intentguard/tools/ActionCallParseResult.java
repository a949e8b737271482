package com.intentguard.tools;

public class ActionCallParseResult {
    private final ActionCall call;
    private final String errorCode;
    private final String errorDetail;

    private ActionCallParseResult(ActionCall call, String errorCode, String errorDetail) {
        this.call = call;
        this.errorCode = errorCode;
        this.errorDetail = errorDetail;
    }

    public static ActionCallParseResult call(ActionCall call) {
        return new ActionCallParseResult(call, null, null);
    }

    public static ActionCallParseResult error(String errorCode) {
        return new ActionCallParseResult(null, errorCode, null);
    }

    public static ActionCallParseResult error(String errorCode, String detail) {
        return new ActionCallParseResult(null, errorCode, detail);
    }

    public static ActionCallParseResult noCall() {
        return new ActionCallParseResult(null, null, null);
    }

    public boolean isActionCall() {
        return call != null;
    }

    public ActionCall getCall() {
        return call;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getErrorDetail() {
        return errorDetail;
    }
}
