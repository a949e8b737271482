package com.intentguard;

import com.intentguard.models.ActionRequest;

/**
 * Produces the response text an agent would show for a read action. The validator treats it as
 * an opaque string and only checks its content.
 */
@FunctionalInterface
public interface ResponseSource {

    String respond(ActionRequest request);

    /**
     * Quotes the e-mail back verbatim.
     */
    static ResponseSource quoting() {
        return request -> request.getEmailContent().orElse("");
    }

    static ResponseSource fixed(String text) {
        String response = text != null ? text : "";
        return request -> response;
    }
}
