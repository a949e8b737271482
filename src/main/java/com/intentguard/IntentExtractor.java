package com.intentguard;

import com.intentguard.models.ExtractedIntent;
import com.intentguard.models.ExtractedParams;
import com.intentguard.models.IntentKind;
import com.intentguard.models.ParamKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a free-text user prompt to a coarse intent kind and the parameters the user spelled out.
 *
 * <p>Pattern tables are compiled once per instance and never mutated, so one extractor can be
 * shared across threads. Kinds are tested in the order READ, WRITE, DELETE and the first kind
 * with any matching pattern wins, so "show and send this email" is a read.
 */
public class IntentExtractor {

    private static final List<String> READ_VERBS = List.of(
        "read", "show", "check", "view", "open", "see", "display", "look.*at", "what", "fetch"
    );
    private static final List<String> WRITE_VERBS = List.of(
        "send", "write", "compose", "reply", "forward", "create", "draft"
    );
    private static final List<String> DELETE_VERBS = List.of(
        "delete", "remove", "trash", "discard", "erase"
    );

    private static final String ADDRESS = "([^\\s,]+@[^\\s,]+)";
    // \s must cover non-breaking and other Unicode spaces found in HTML-derived mail.
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS;
    private static final Pattern EDGE_SPACE = Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);

    private final Map<IntentKind, List<Pattern>> kindPatterns;
    private final Pattern fromPattern;
    private final Pattern toPattern;
    private final Pattern subjectPattern;

    public IntentExtractor() {
        // EnumMap iterates in declaration order: READ, WRITE, DELETE.
        EnumMap<IntentKind, List<Pattern>> patterns = new EnumMap<>(IntentKind.class);
        patterns.put(IntentKind.READ, compileVerbPatterns(READ_VERBS));
        patterns.put(IntentKind.WRITE, compileVerbPatterns(WRITE_VERBS));
        patterns.put(IntentKind.DELETE, compileVerbPatterns(DELETE_VERBS));
        this.kindPatterns = Collections.unmodifiableMap(patterns);

        this.fromPattern = Pattern.compile("from[:\\s]*" + ADDRESS, FLAGS);
        this.toPattern = Pattern.compile("to[:\\s]*" + ADDRESS, FLAGS);
        this.subjectPattern = Pattern.compile("subject[:\\s]*['\"]([^'\"]+)['\"]", FLAGS);
    }

    public ExtractedIntent extractIntent(String userPrompt) {
        String prompt = userPrompt != null ? userPrompt : "";
        for (Map.Entry<IntentKind, List<Pattern>> entry : kindPatterns.entrySet()) {
            if (matchesAny(entry.getValue(), prompt)) {
                IntentKind kind = entry.getKey();
                return new ExtractedIntent(kind, extractParams(kind, prompt));
            }
        }
        return ExtractedIntent.unknown();
    }

    private ExtractedParams extractParams(IntentKind kind, String prompt) {
        ExtractedParams.Builder params = ExtractedParams.builder();
        switch (kind) {
            case READ:
            case DELETE:
                params.put(ParamKey.FROM, firstGroup(fromPattern, prompt));
                break;
            case WRITE:
                params.put(ParamKey.TO, firstGroup(toPattern, prompt));
                break;
            case UNKNOWN:
            default:
                return ExtractedParams.empty();
        }
        params.put(ParamKey.SUBJECT, firstGroup(subjectPattern, prompt));
        return params.build();
    }

    private static String firstGroup(Pattern pattern, String prompt) {
        Matcher matcher = pattern.matcher(prompt);
        if (!matcher.find()) {
            return null;
        }
        String value = EDGE_SPACE.matcher(matcher.group(1)).replaceAll("");
        return value.isEmpty() ? null : value;
    }

    private static boolean matchesAny(List<Pattern> patterns, String prompt) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(prompt).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compileVerbPatterns(List<String> verbs) {
        List<Pattern> compiled = new ArrayList<>(verbs.size());
        for (String verb : verbs) {
            compiled.add(Pattern.compile(verb + ".*email", FLAGS));
        }
        return Collections.unmodifiableList(compiled);
    }
}
