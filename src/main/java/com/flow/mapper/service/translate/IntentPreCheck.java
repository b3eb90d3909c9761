package com.flow.mapper.service.translate;

import java.util.List;
import java.util.Locale;

/**
 * Fatal gate in front of the translation pipeline. Rejects intents that are
 * empty, disconnected, or made only of non-business chatter.
 */
public class IntentPreCheck {

    public static final List<String> DEFAULT_DENYLIST = List.of(
            "thank you", "live session", "workshop", "big stage",
            "subscribe", "presentation", "meeting", "session started");

    private final List<String> denylist;

    public IntentPreCheck() {
        this(DEFAULT_DENYLIST);
    }

    public IntentPreCheck(List<String> denylist) {
        this.denylist = denylist.stream()
                .map(phrase -> phrase.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * @throws TranslationException when the intent cannot describe a process
     */
    public void check(ProcessIntent intent) {
        if (intent.steps().isEmpty()) {
            throw new TranslationException(TranslationException.Reason.NO_STEPS,
                    "Intent has no steps");
        }
        if (intent.steps().size() > 1 && intent.flows().isEmpty()) {
            throw new TranslationException(TranslationException.Reason.NO_FLOWS,
                    "Intent has " + intent.steps().size() + " steps but no flows between them");
        }
        if (meaningfulSteps(intent).isEmpty()) {
            throw new TranslationException(TranslationException.Reason.NO_MEANINGFUL_STEPS,
                    "Intent has no business process steps");
        }
    }

    public List<IntentStep> meaningfulSteps(ProcessIntent intent) {
        return intent.steps().stream()
                .filter(step -> !isChatter(step.text()))
                .toList();
    }

    boolean isChatter(String text) {
        if (text == null || text.isBlank()) {
            return true;
        }
        var lower = text.toLowerCase(Locale.ROOT);
        return denylist.stream().anyMatch(lower::contains);
    }
}
