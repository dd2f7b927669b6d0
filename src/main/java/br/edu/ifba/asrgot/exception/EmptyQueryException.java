package br.edu.ifba.asrgot.exception;

public class EmptyQueryException extends AsrGotException {

    public EmptyQueryException() {
        super(ErrorCode.EMPTY_QUERY, "Query cannot be empty");
    }
}
