package br.edu.ifba.asrgot.scheduler;

import br.edu.ifba.asrgot.exception.SingleToolRuleViolationException;
import br.edu.ifba.asrgot.llm.Capability;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Every request carries THINKING plus at most one other capability.
 */
public final class CapabilityRule {

    private CapabilityRule() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws SingleToolRuleViolationException if THINKING is missing or more than one tool is requested
     */
    public static void validate(Set<Capability> capabilities) {
        if (capabilities == null || !capabilities.contains(Capability.THINKING)) {
            throw new SingleToolRuleViolationException(
                "Single-tool rule violation: THINKING must always be included");
        }
        List<Capability> tools = capabilities.stream().filter(Capability::isTool).toList();
        if (tools.size() > 1) {
            throw new SingleToolRuleViolationException(String.format(
                "Single-tool rule violation: Found %d non-THINKING tools, maximum is 1. Tools: %s",
                tools.size(), tools.stream().map(Enum::name).collect(Collectors.joining(", "))));
        }
    }
}
