package org.neuralchilli.flotilla.domain;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExitActionRulesTest {

    @Test
    void shouldMatchRangesAndSingleCodes() {
        ExitActionRules rules = new ExitActionRules(Map.of(
                ExitAction.RESCHEDULE, "1-5,10",
                ExitAction.COMPLETE, "42"));

        assertThat(rules.actionFor(3)).contains(ExitAction.RESCHEDULE);
        assertThat(rules.actionFor(10)).contains(ExitAction.RESCHEDULE);
        assertThat(rules.actionFor(42)).contains(ExitAction.COMPLETE);
        assertThat(rules.actionFor(6)).isEmpty();
        assertThat(rules.actionFor(0)).isEmpty();
    }

    @Test
    void shouldPreferActionsInDeclarationOrder() {
        ExitActionRules rules = new ExitActionRules(Map.of(
                ExitAction.FAIL, "1-10",
                ExitAction.COMPLETE, "5"));

        assertThat(rules.actionFor(5)).contains(ExitAction.COMPLETE);
    }

    @Test
    void shouldRejectMalformedRange() {
        assertThatThrownBy(() -> new ExitActionRules(Map.of(ExitAction.FAIL, "one-two")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid exit code range for FAIL");
        assertThatThrownBy(() -> new ExitActionRules(Map.of(ExitAction.FAIL, " ")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldHaveNoActionsByDefault() {
        assertThat(ExitActionRules.NONE.isEmpty()).isTrue();
        assertThat(ExitActionRules.NONE.actionFor(1)).isEmpty();
    }
}
