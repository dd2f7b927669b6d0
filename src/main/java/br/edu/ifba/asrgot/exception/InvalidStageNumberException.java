package br.edu.ifba.asrgot.exception;

public class InvalidStageNumberException extends AsrGotException {

    private final int stageNumber;

    public InvalidStageNumberException(final int stageNumber) {
        super(ErrorCode.INVALID_STAGE_NUMBER, "Invalid stage number: " + stageNumber + ". Must be between 1 and 9");
        this.stageNumber = stageNumber;
    }

    public int getStageNumber() {
        return stageNumber;
    }
}
