package com.intentguard;

import com.intentguard.models.ActionRequest;
import com.intentguard.models.CheckResult;
import com.intentguard.models.IntentKind;
import com.intentguard.models.ValidationResult;

/**
 * Entry point for the agent's action dispatcher: validates a proposed action against the user's
 * prompt and, for read actions with e-mail content, checks the response the agent would show.
 *
 * <p>Holds only immutable collaborators; share one instance across request threads.
 */
public class SecurityProxy {

    private final ActionValidator actionValidator;
    private final ResponseContentValidator responseValidator;
    private final ResponseSource responseSource;
    private final AppLogger logger;

    public SecurityProxy(ActionValidator actionValidator, ResponseContentValidator responseValidator,
                         ResponseSource responseSource) {
        this.actionValidator = actionValidator != null ? actionValidator : new ActionValidator();
        this.responseValidator = responseValidator != null ? responseValidator : new ResponseContentValidator();
        this.responseSource = responseSource != null ? responseSource : ResponseSource.quoting();
        this.logger = AppLogger.get();
        logger.info("Security proxy initialized");
    }

    public SecurityProxy(ResponseSource responseSource) {
        this(new ActionValidator(), new ResponseContentValidator(), responseSource);
    }

    public SecurityProxy() {
        this(ResponseSource.quoting());
    }

    public ActionValidator getActionValidator() {
        return actionValidator;
    }

    public ResponseContentValidator getResponseValidator() {
        return responseValidator;
    }

    /**
     * Validates using the configured {@link ResponseSource} for read responses.
     */
    public ValidationResult processRequest(ActionRequest request) {
        return processRequest(request, null);
    }

    /**
     * Validates the request. {@code proposedResponse} is the text the agent would show for a
     * read; when null it is taken from the configured {@link ResponseSource}.
     */
    public ValidationResult processRequest(ActionRequest request, String proposedResponse) {
        logger.info("Processing request: prompt='" + request.getUserPrompt()
            + "', action='" + request.getProposedAction() + "'");

        ActionValidator.Assessment assessment = actionValidator.assess(
            request.getUserPrompt(), request.getProposedAction(), request.getActionParams());
        IntentKind userIntent = assessment.getUserIntent().getKind();
        CheckResult actionResult = assessment.getResult();

        ValidationResult result = new ValidationResult(actionResult.isApproved(), actionResult.getReason(), userIntent);

        String emailContent = request.getEmailContent().orElse("");
        if (actionResult.isApproved() && !emailContent.isEmpty() && assessment.getActionKind() == IntentKind.READ) {
            String response = proposedResponse != null ? proposedResponse : responseSource.respond(request);
            CheckResult responseResult = responseValidator.validateResponseContent(emailContent, response);
            if (!responseResult.isApproved()) {
                result = new ValidationResult(false,
                    "Action approved (" + actionResult.getReason() + ") but response validation failed: "
                        + responseResult.getReason(),
                    userIntent);
            }
        }

        logger.info("Request processed: approved=" + result.isApproved() + ", reason=" + result.getReason());
        return result;
    }
}
