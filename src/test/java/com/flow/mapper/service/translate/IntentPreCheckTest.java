package com.flow.mapper.service.translate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IntentPreCheckTest {

    private final IntentPreCheck preCheck = new IntentPreCheck();

    @Test
    @DisplayName("Intent without steps is rejected")
    void noSteps() {
        assertThatThrownBy(() -> preCheck.check(ProcessIntent.of(List.of(), List.of())))
                .isInstanceOfSatisfying(TranslationException.class,
                        e -> assertThat(e.getReason()).isEqualTo(TranslationException.Reason.NO_STEPS));
    }

    @Test
    @DisplayName("Several steps without flows are rejected as disconnected")
    void noFlows() {
        var intent = ProcessIntent.of(
                List.of(IntentStep.of("s1", "Receive order"), IntentStep.of("s2", "Ship order")),
                List.of());

        assertThatThrownBy(() -> preCheck.check(intent))
                .isInstanceOfSatisfying(TranslationException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(TranslationException.Reason.NO_FLOWS);
                    assertThat(e.getErrorCode()).isEqualTo("INTENT_REJECTED");
                    assertThat(e.getUserMessage()).contains("describe the process again");
                });
    }

    @Test
    @DisplayName("A single step needs no flows")
    void singleStep() {
        var intent = ProcessIntent.of(List.of(IntentStep.of("s1", "Receive order")), List.of());

        assertThatCode(() -> preCheck.check(intent)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Intent made only of chatter is rejected")
    void onlyChatter() {
        var intent = ProcessIntent.of(
                List.of(IntentStep.of("s1", "Thank you all for joining"),
                        IntentStep.of("s2", "Welcome to the LIVE SESSION"),
                        IntentStep.of("s3", "  ")),
                List.of(IntentFlow.of("s1", "s2"), IntentFlow.of("s2", "s3")));

        assertThatThrownBy(() -> preCheck.check(intent))
                .isInstanceOfSatisfying(TranslationException.class,
                        e -> assertThat(e.getReason()).isEqualTo(TranslationException.Reason.NO_MEANINGFUL_STEPS));
    }

    @Test
    @DisplayName("Chatter next to business steps is tolerated")
    void mixedSteps() {
        var intent = ProcessIntent.of(
                List.of(IntentStep.of("s1", "Thank you for the meeting"), IntentStep.of("s2", "Approve invoice")),
                List.of(IntentFlow.of("s1", "s2")));

        assertThatCode(() -> preCheck.check(intent)).doesNotThrowAnyException();
        assertThat(preCheck.meaningfulSteps(intent)).extracting(IntentStep::id).containsExactly("s2");
    }

    @Test
    @DisplayName("Custom denylist replaces the default one")
    void customDenylist() {
        var strict = new IntentPreCheck(List.of("Lunch"));
        var intent = ProcessIntent.of(List.of(IntentStep.of("s1", "lunch break")), List.of());

        assertThatThrownBy(() -> strict.check(intent)).isInstanceOf(TranslationException.class);
        assertThat(strict.isChatter("Thank you")).isFalse();
    }
}
