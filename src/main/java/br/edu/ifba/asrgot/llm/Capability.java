package br.edu.ifba.asrgot.llm;

/**
 * Model capabilities a request may ask for.
 *
 * <p>Every request must include {@link #THINKING} and at most one of the others.</p>
 */
public enum Capability {
    THINKING,
    STRUCTURED_OUTPUTS,
    SEARCH_GROUNDING,
    FUNCTION_CALLING,
    CODE_EXECUTION,
    CACHING;

    public boolean isTool() {
        return this != THINKING;
    }
}
