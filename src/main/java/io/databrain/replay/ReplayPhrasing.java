package io.databrain.replay;

import java.util.List;
import java.util.Locale;

/**
 * Sample wording per target profile. Profiles without their own wording use {@link #DEFAULT}.
 * The {@code code} and {@code strategy} profiles add samples of their own on top of the default
 * explanation and relationship pair.
 */
enum ReplayPhrasing {

    DEFAULT("Explain the concept: %s",
            "How is %s related to other concepts?",
            "%s is connected to: %s.",
            false, false),

    QA("What is %s?",
            "Which concepts are most closely related to %s?",
            "The concepts most closely related to %s are %s.",
            false, false),

    INSTRUCT("Write a short explanation of \"%s\" for a knowledge base entry.",
            "List the concepts linked to \"%s\" and how strongly they are linked.",
            "\"%s\" links to %s.",
            false, false),

    CODE("Explain the concept: %s",
            "How is %s related to other concepts?",
            "%s is connected to: %s.",
            true, false),

    STRATEGY("Explain the concept: %s",
            "How is %s related to other concepts?",
            "%s is connected to: %s.",
            false, true);

    private static final List<String> CODE_KEYWORDS = List.of("code", "api", "function", "class", "implementation");

    private final String explainInstruction;
    private final String relateInstruction;
    private final String relateOutput;
    private final boolean codeGuidance;
    private final boolean strategicAnalysis;

    ReplayPhrasing(String explainInstruction, String relateInstruction, String relateOutput,
                   boolean codeGuidance, boolean strategicAnalysis) {
        this.explainInstruction = explainInstruction;
        this.relateInstruction = relateInstruction;
        this.relateOutput = relateOutput;
        this.codeGuidance = codeGuidance;
        this.strategicAnalysis = strategicAnalysis;
    }

    String explainInstruction(String label) {
        return explainInstruction.formatted(label);
    }

    String relateInstruction(String label) {
        return relateInstruction.formatted(label);
    }

    String relateOutput(String label, String related) {
        return relateOutput.formatted(label, related);
    }

    /** True when this profile wants implementation guidance for {@code label}. */
    boolean wantsCodeGuidance(String label) {
        if (!codeGuidance) return false;
        String lower = label.toLowerCase(Locale.ROOT);
        return CODE_KEYWORDS.stream().anyMatch(lower::contains);
    }

    boolean wantsStrategicAnalysis() {
        return strategicAnalysis;
    }

    static ReplayPhrasing forProfile(String profile) {
        return switch (profile.toLowerCase(Locale.ROOT)) {
            case "qa" -> QA;
            case "instruct" -> INSTRUCT;
            case "code" -> CODE;
            case "strategy" -> STRATEGY;
            default -> DEFAULT;
        };
    }
}
