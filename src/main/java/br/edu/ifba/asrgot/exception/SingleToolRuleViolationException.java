package br.edu.ifba.asrgot.exception;

/**
 * A task asked for a capability combination the scheduler does not accept.
 * Raised at enqueue time; the task never reaches the model.
 */
public class SingleToolRuleViolationException extends AsrGotException {

    public SingleToolRuleViolationException(final String message) {
        super(ErrorCode.SINGLE_TOOL_RULE_VIOLATION, message);
    }
}
