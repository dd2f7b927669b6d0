package br.edu.ifba.asrgot.scheduler;

import br.edu.ifba.asrgot.exception.SingleToolRuleViolationException;
import br.edu.ifba.asrgot.llm.Capability;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CapabilityRuleTest {

    @Test
    void acceptsThinkingAlone() {
        assertDoesNotThrow(() -> CapabilityRule.validate(EnumSet.of(Capability.THINKING)));
    }

    @Test
    void acceptsThinkingWithOneTool() {
        for (Capability tool : Capability.values()) {
            if (tool.isTool()) {
                assertDoesNotThrow(() -> CapabilityRule.validate(EnumSet.of(Capability.THINKING, tool)));
            }
        }
    }

    @Test
    @DisplayName("THINKING is mandatory")
    void rejectsMissingThinking() {
        SingleToolRuleViolationException error = assertThrows(SingleToolRuleViolationException.class,
            () -> CapabilityRule.validate(EnumSet.of(Capability.SEARCH_GROUNDING)));

        assertTrue(error.getMessage().contains("THINKING must always be included"));
        assertThrows(SingleToolRuleViolationException.class, () -> CapabilityRule.validate(Set.of()));
        assertThrows(SingleToolRuleViolationException.class, () -> CapabilityRule.validate(null));
    }

    @Test
    @DisplayName("Two tools name both in the error")
    void rejectsTwoTools() {
        SingleToolRuleViolationException error = assertThrows(SingleToolRuleViolationException.class,
            () -> CapabilityRule.validate(EnumSet.of(
                Capability.THINKING, Capability.STRUCTURED_OUTPUTS, Capability.FUNCTION_CALLING)));

        assertTrue(error.getMessage().contains("Found 2 non-THINKING tools"));
        assertTrue(error.getMessage().contains("STRUCTURED_OUTPUTS"));
        assertTrue(error.getMessage().contains("FUNCTION_CALLING"));
    }
}
