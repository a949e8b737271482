package com.intentguard.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intentguard.models.ParamKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActionCallParserTest {

    private ActionCallParser buildParser() {
        return new ActionCallParser(new ObjectMapper());
    }

    @Test
    void parseValidActionCall() {
        ActionCallParser parser = buildParser();
        String json = "{\"action\":\"read_email\",\"params\":{\"from\":\"john@example.com\",\"limit\":1}}";
        ActionCallParseResult result = parser.parseStrict(json);
        assertTrue(result.isActionCall());
        assertEquals("read_email", result.getCall().getAction());
        assertEquals(1, result.getCall().getParams().get("limit"));
        assertEquals("john@example.com", result.getCall().toExtractedParams().get(ParamKey.FROM).orElse(null));
    }

    @Test
    void acceptsToolAndArgsAliases() {
        ActionCallParser parser = buildParser();
        String json = "{\"tool\":\"send_email\",\"args\":{\"to\":\"bob@example.com\"}}";
        ActionCallParseResult result = parser.parseStrict(json);
        assertTrue(result.isActionCall());
        assertEquals("send_email", result.getCall().getAction());
        assertEquals("bob@example.com", result.getCall().getParams().get("to"));
    }

    @Test
    void paramsAreOptional() {
        ActionCallParseResult result = buildParser().parseStrict("{\"action\":\"read_email\"}");
        assertTrue(result.isActionCall());
        assertTrue(result.getCall().getParams().isEmpty());
    }

    @Test
    void rejectsUnknownTopLevelField() {
        String json = "{\"action\":\"read_email\",\"params\":{},\"extra\":1}";
        ActionCallParseResult result = buildParser().parseStrict(json);
        assertFalse(result.isActionCall());
        assertEquals(ActionCallParser.ERR_INVALID_FORMAT, result.getErrorCode());
        assertEquals("unknown-field:extra", result.getErrorDetail());
    }

    @Test
    void rejectsActionAndAliasTogether() {
        String json = "{\"action\":\"read_email\",\"tool\":\"send_email\"}";
        ActionCallParseResult result = buildParser().parseStrict(json);
        assertEquals(ActionCallParser.ERR_INVALID_FORMAT, result.getErrorCode());
    }

    @Test
    void rejectsMissingAction() {
        ActionCallParseResult result = buildParser().parseStrict("{\"params\":{\"from\":\"a@b.com\"}}");
        assertFalse(result.isActionCall());
        assertEquals(ActionCallParser.ERR_INVALID_FORMAT, result.getErrorCode());
        assertEquals("missing-action", result.getErrorDetail());
    }

    @Test
    void rejectsInvalidJson() {
        String json = "{\"action\":\"read_email\",\"params\":{\"from\":}";
        ActionCallParseResult result = buildParser().parseStrict(json);
        assertFalse(result.isActionCall());
        assertEquals(ActionCallParser.ERR_INVALID_FORMAT, result.getErrorCode());
    }

    @Test
    void rejectsNestedParamValues() {
        String json = "{\"action\":\"send_email\",\"params\":{\"to\":[\"a@b.com\",\"c@d.com\"]}}";
        ActionCallParseResult result = buildParser().parseStrict(json);
        assertFalse(result.isActionCall());
        assertEquals(ActionCallParser.ERR_INVALID_PARAMS, result.getErrorCode());
        assertEquals("invalid-type:to", result.getErrorDetail());
    }

    @Test
    void rejectsMultipleObjects() {
        String json = "{\"action\":\"read_email\"}{\"action\":\"delete_email\"}";
        ActionCallParseResult result = buildParser().parseStrict(json);
        assertFalse(result.isActionCall());
        assertEquals(ActionCallParser.ERR_MULTIPLE, result.getErrorCode());
    }

    @Test
    void bracesInsideStringsDoNotSplitObjects() {
        String json = "{\"action\":\"send_email\",\"params\":{\"subject\":\"}{\"}}";
        ActionCallParseResult result = buildParser().parseStrict(json);
        assertTrue(result.isActionCall());
        assertEquals("}{", result.getCall().getParams().get("subject"));
    }

    @Test
    void unwrapsSingleJsonCodeFence() {
        String text = "```json\n{\"action\":\"read_email\",\"params\":{\"from\":\"john@example.com\"}}\n```";
        ActionCallParseResult result = buildParser().parseStrict(text);
        assertTrue(result.isActionCall());
        assertEquals("read_email", result.getCall().getAction());
        assertEquals("{\"action\":\"read_email\",\"params\":{\"from\":\"john@example.com\"}}",
            result.getCall().getRaw());
    }

    @Test
    void stripsZeroWidthEdges() {
        String text = "\uFEFF{\"action\":\"read_email\"}\u200B";
        assertTrue(buildParser().parseStrict(text).isActionCall());
    }

    @Test
    void functionLikeSyntaxIsNotParsed() {
        ActionCallParseResult result = buildParser().parseStrict("read_email(from: \"john@example.com\")");
        assertFalse(result.isActionCall());
        assertNull(result.getErrorCode());
    }

    @Test
    void nullAndBlankAreNotCalls() {
        assertFalse(buildParser().parseStrict(null).isActionCall());
        assertNull(buildParser().parseStrict("   ").getErrorCode());
    }
}
