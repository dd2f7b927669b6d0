package br.edu.ifba.asrgot.exception;

/**
 * Stage {@code k} was requested while stage {@code k - 1} has not completed.
 */
public class StagePrerequisiteNotMetException extends AsrGotException {

    private final int requestedStage;
    private final int requiredStage;

    public StagePrerequisiteNotMetException(final int requestedStage, final int requiredStage) {
        super(ErrorCode.STAGE_PREREQUISITE_NOT_MET,
            "Stage " + requestedStage + " requires stage " + requiredStage + " to be completed first");
        this.requestedStage = requestedStage;
        this.requiredStage = requiredStage;
    }

    public int getRequestedStage() {
        return requestedStage;
    }

    public int getRequiredStage() {
        return requiredStage;
    }
}
