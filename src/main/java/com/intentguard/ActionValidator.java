package com.intentguard;

import com.intentguard.models.CheckResult;
import com.intentguard.models.ExtractedIntent;
import com.intentguard.models.ExtractedParams;
import com.intentguard.models.IntentKind;
import com.intentguard.models.ParamKey;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether an agent's proposed action matches the intent the user expressed.
 *
 * <p>The kinds must agree first. Parameters are then compared only when both the user and the
 * action carry them; a field the user never mentioned does not constrain the agent.
 */
public class ActionValidator {

    public static final String REASON_OK = "Parameters validated successfully";
    public static final String REASON_UNKNOWN_INTENT = "Unknown user intent";

    private static final List<String> READ_ACTIONS = List.of("read", "fetch", "get", "retrieve");
    private static final List<String> WRITE_ACTIONS = List.of("send", "write", "compose", "reply", "forward");
    private static final List<String> DELETE_ACTIONS = List.of("delete", "remove", "trash");

    private final IntentExtractor extractor;

    public ActionValidator(IntentExtractor extractor) {
        this.extractor = extractor != null ? extractor : new IntentExtractor();
    }

    public ActionValidator() {
        this(new IntentExtractor());
    }

    public IntentExtractor getExtractor() {
        return extractor;
    }

    public CheckResult validateAction(String userPrompt, String proposedAction, ExtractedParams actionParams) {
        return assess(userPrompt, proposedAction, actionParams).getResult();
    }

    /**
     * Same decision as {@link #validateAction}, keeping the extracted user intent and the
     * action's kind so callers do not classify twice.
     */
    public Assessment assess(String userPrompt, String proposedAction, ExtractedParams actionParams) {
        ExtractedIntent userIntent = extractor.extractIntent(userPrompt);
        IntentKind actionKind = classifyAction(proposedAction);
        ExtractedParams params = actionParams != null ? actionParams : ExtractedParams.empty();

        CheckResult result;
        if (userIntent.getKind() != actionKind) {
            result = CheckResult.reject("Intent mismatch: User intended " + userIntent.getKind()
                + " but action is " + actionKind);
        } else {
            result = reconcile(userIntent.getKind(), userIntent.getParams(), params);
        }
        return new Assessment(userIntent, actionKind, result);
    }

    public IntentKind classifyAction(String proposedAction) {
        if (proposedAction == null) {
            return IntentKind.UNKNOWN;
        }
        String action = proposedAction.toLowerCase(Locale.ROOT);
        if (containsAny(action, READ_ACTIONS)) {
            return IntentKind.READ;
        }
        if (containsAny(action, WRITE_ACTIONS)) {
            return IntentKind.WRITE;
        }
        if (containsAny(action, DELETE_ACTIONS)) {
            return IntentKind.DELETE;
        }
        return IntentKind.UNKNOWN;
    }

    private CheckResult reconcile(IntentKind kind, ExtractedParams userParams, ExtractedParams actionParams) {
        switch (kind) {
            case READ:
            case DELETE:
                return reconcileFields(ParamKey.FROM, "From address", userParams, actionParams);
            case WRITE:
                return reconcileFields(ParamKey.TO, "To address", userParams, actionParams);
            case UNKNOWN:
            default:
                return CheckResult.reject(REASON_UNKNOWN_INTENT);
        }
    }

    private CheckResult reconcileFields(ParamKey addressKey, String addressLabel,
                                        ExtractedParams userParams, ExtractedParams actionParams) {
        Optional<String> userAddress = userParams.get(addressKey);
        Optional<String> actionAddress = actionParams.get(addressKey);
        if (userAddress.isPresent() && actionAddress.isPresent()
            && !userAddress.get().equals(actionAddress.get())) {
            return CheckResult.reject(addressLabel + " mismatch: User specified " + userAddress.get()
                + " but action uses " + actionAddress.get());
        }

        Optional<String> userSubject = userParams.get(ParamKey.SUBJECT);
        Optional<String> actionSubject = actionParams.get(ParamKey.SUBJECT);
        if (userSubject.isPresent() && actionSubject.isPresent()
            && !userSubject.get().toLowerCase(Locale.ROOT).equals(actionSubject.get().toLowerCase(Locale.ROOT))) {
            return CheckResult.reject("Subject mismatch: User specified '" + userSubject.get()
                + "' but action uses '" + actionSubject.get() + "'");
        }

        return CheckResult.approve(REASON_OK);
    }

    private static boolean containsAny(String value, List<String> needles) {
        for (String needle : needles) {
            if (value.contains(needle)) {
                return true;
            }
        }
        return false;
    }

    public static final class Assessment {
        private final ExtractedIntent userIntent;
        private final IntentKind actionKind;
        private final CheckResult result;

        private Assessment(ExtractedIntent userIntent, IntentKind actionKind, CheckResult result) {
            this.userIntent = userIntent;
            this.actionKind = actionKind;
            this.result = result;
        }

        public ExtractedIntent getUserIntent() {
            return userIntent;
        }

        public IntentKind getActionKind() {
            return actionKind;
        }

        public CheckResult getResult() {
            return result;
        }
    }
}
