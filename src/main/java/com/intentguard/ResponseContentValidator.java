package com.intentguard;

import com.intentguard.models.CheckResult;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Cheap consistency filter between an e-mail and a response that claims to summarize it.
 * Aimed at responses that smuggle extra instructions out of a compromised read path.
 *
 * <p>Checks run in order and the first failure wins: length inflation, attack phrases,
 * then vocabulary the e-mail never used. The thresholds are fixed. Lengths count code points and
 * any Unicode whitespace separates words.
 */
public class ResponseContentValidator {

    public static final double MAX_LENGTH_RATIO = 1.5;
    public static final double MAX_NEW_WORD_RATIO = 0.3;
    public static final String REASON_OK = "Response content validated successfully";

    public static final List<String> ATTACK_INDICATORS = List.of(
        "forward this email",
        "click this link",
        "download this attachment",
        "reply with your password",
        "provide your credentials",
        "execute this code",
        "run this command",
        "ignore security warnings"
    );

    public CheckResult validateResponseContent(String emailContent, String proposedResponse) {
        String email = emailContent != null ? emailContent : "";
        String response = proposedResponse != null ? proposedResponse : "";

        if (codePoints(response) > codePoints(email) * MAX_LENGTH_RATIO) {
            return CheckResult.reject("Response is significantly longer than email content, potential deceptive output");
        }

        String responseLower = response.toLowerCase(Locale.ROOT);
        for (String indicator : ATTACK_INDICATORS) {
            if (responseLower.contains(indicator)) {
                return CheckResult.reject("Response contains potential attack indicator: '" + indicator + "'");
            }
        }

        Set<String> emailWords = words(email);
        Set<String> responseWords = words(response);
        Set<String> newWords = new HashSet<>(responseWords);
        newWords.removeAll(emailWords);
        if (newWords.size() > responseWords.size() * MAX_NEW_WORD_RATIO) {
            return CheckResult.reject("Response introduces many new concepts not present in the email");
        }

        return CheckResult.approve(REASON_OK);
    }

    private static int codePoints(String text) {
        return text.codePointCount(0, text.length());
    }

    static Set<String> words(String text) {
        Set<String> out = new HashSet<>();
        for (String token : text.toLowerCase(Locale.ROOT).split("(?U)\\s+")) {
            // A leading separator yields one empty token.
            if (!token.isEmpty()) {
                out.add(token);
            }
        }
        return out;
    }
}
