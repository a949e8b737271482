package com.intentguard;

import com.intentguard.models.CheckResult;
import com.intentguard.models.ExtractedParams;
import com.intentguard.models.IntentKind;
import com.intentguard.models.ParamKey;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionValidatorTest {

    private final ActionValidator validator = new ActionValidator();

    private static ExtractedParams params(Map<String, ?> raw) {
        return ExtractedParams.fromRaw(raw);
    }

    @Test
    void classifiesActionsBySubstring() {
        assertEquals(IntentKind.READ, validator.classifyAction("read_email"));
        assertEquals(IntentKind.READ, validator.classifyAction("fetch_inbox"));
        assertEquals(IntentKind.READ, validator.classifyAction("GET_MAIL"));
        assertEquals(IntentKind.WRITE, validator.classifyAction("send_email"));
        assertEquals(IntentKind.WRITE, validator.classifyAction("forward_message"));
        assertEquals(IntentKind.DELETE, validator.classifyAction("trash_message"));
        assertEquals(IntentKind.UNKNOWN, validator.classifyAction("archive_message"));
        assertEquals(IntentKind.UNKNOWN, validator.classifyAction(null));
    }

    @Test
    void readVerbsCheckedBeforeWriteVerbs() {
        assertEquals(IntentKind.READ, validator.classifyAction("read_and_reply"));
    }

    @Test
    void validReadIsApproved() {
        CheckResult result = validator.validateAction(
            "Read the latest email from john@example.com",
            "read_email",
            params(Map.of("from", "john@example.com")));
        assertTrue(result.isApproved());
        assertEquals(ActionValidator.REASON_OK, result.getReason());
    }

    @Test
    void readHijackedIntoWriteIsRejected() {
        CheckResult result = validator.validateAction(
            "Read the latest email from john@example.com",
            "write_email",
            params(Map.of("to", "attacker@evil.com")));
        assertFalse(result.isApproved());
        assertEquals("Intent mismatch: User intended read but action is write", result.getReason());
    }

    @Test
    void substitutedSenderIsRejected() {
        CheckResult result = validator.validateAction(
            "Read emails from john@example.com with subject 'Project Update'",
            "read_email",
            params(Map.of("from", "attacker@evil.com", "subject", "Project Update")));
        assertFalse(result.isApproved());
        assertEquals(
            "From address mismatch: User specified john@example.com but action uses attacker@evil.com",
            result.getReason());
    }

    @Test
    void senderComparisonIsExact() {
        CheckResult result = validator.validateAction(
            "Read the latest email from john@example.com",
            "read_email",
            params(Map.of("from", "John@example.com")));
        assertFalse(result.isApproved());
    }

    @Test
    void subjectComparisonIgnoresCase() {
        CheckResult result = validator.validateAction(
            "Read emails with subject 'Project Update'",
            "read_email",
            params(Map.of("subject", "PROJECT update")));
        assertTrue(result.isApproved());
    }

    @Test
    void substitutedSubjectIsRejected() {
        CheckResult result = validator.validateAction(
            "Read emails with subject 'Project Update'",
            "read_email",
            params(Map.of("subject", "Password Reset")));
        assertFalse(result.isApproved());
        assertEquals("Subject mismatch: User specified 'Project Update' but action uses 'Password Reset'",
            result.getReason());
    }

    @Test
    void writeComparesRecipient() {
        CheckResult ok = validator.validateAction(
            "Send an email to alice@example.com",
            "send_email",
            params(Map.of("to", "alice@example.com", "body", "Hi")));
        assertTrue(ok.isApproved());

        CheckResult bad = validator.validateAction(
            "Send an email to alice@example.com",
            "send_email",
            params(Map.of("to", "attacker@evil.com")));
        assertFalse(bad.isApproved());
        assertEquals("To address mismatch: User specified alice@example.com but action uses attacker@evil.com",
            bad.getReason());
    }

    @Test
    void deleteComparesSender() {
        CheckResult result = validator.validateAction(
            "Delete the email from spam@junk.com",
            "delete_email",
            params(Map.of("from", "boss@example.com")));
        assertFalse(result.isApproved());
        assertTrue(result.getReason().startsWith("From address mismatch"));
    }

    @Test
    void unknownUserIntentIsRejectedEvenWhenActionIsUnknownToo() {
        CheckResult result = validator.validateAction("Hello there", "archive_message", ExtractedParams.empty());
        assertFalse(result.isApproved());
        assertEquals(ActionValidator.REASON_UNKNOWN_INTENT, result.getReason());
    }

    @Test
    void unknownUserIntentAgainstKnownActionIsMismatch() {
        CheckResult result = validator.validateAction("Hello there", "read_email", ExtractedParams.empty());
        assertFalse(result.isApproved());
        assertEquals("Intent mismatch: User intended unknown but action is read", result.getReason());
    }

    @Test
    void fieldsTheUserNeverMentionedDoNotConstrain() {
        CheckResult result = validator.validateAction(
            "Read my latest email",
            "read_email",
            params(Map.of("from", "anyone@example.com", "subject", "Anything")));
        assertTrue(result.isApproved());
    }

    @Test
    void addingAbsentKeysKeepsApproval() {
        String prompt = "Read the latest email from john@example.com";
        ExtractedParams base = params(Map.of("from", "john@example.com"));
        assertTrue(validator.validateAction(prompt, "read_email", base).isApproved());

        ExtractedParams extended = params(Map.of(
            "from", "john@example.com", "subject", "Whatever", "to", "x@y.com", "limit", 1));
        assertTrue(validator.validateAction(prompt, "read_email", extended).isApproved());
    }

    @Test
    void assessmentCarriesUserIntentAndActionKind() {
        ActionValidator.Assessment assessment = validator.assess(
            "Read the latest email from john@example.com", "send_email", ExtractedParams.empty());
        assertEquals(IntentKind.READ, assessment.getUserIntent().getKind());
        assertEquals("john@example.com", assessment.getUserIntent().getParams().get(ParamKey.FROM).orElse(null));
        assertEquals(IntentKind.WRITE, assessment.getActionKind());
        assertFalse(assessment.getResult().isApproved());
    }

    @Test
    void senderAfterNonBreakingSpaceMatchesAgentSender() {
        CheckResult result = validator.validateAction(
            "Read the email from:\u00A0john@example.com",
            "read_email",
            params(Map.of("from", "john@example.com")));
        assertTrue(result.isApproved());
    }
}
