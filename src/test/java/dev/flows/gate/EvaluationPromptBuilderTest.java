package dev.flows.gate;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluationPromptBuilderTest {

    @Test
    void promptContainsContentCriteriaAndResponseFormat() {
        String prompt = EvaluationPromptBuilder.build("def add(a, b): return a + b",
            List.of(CriteriaLibrary.CODE_CORRECTNESS, CriteriaLibrary.FOLLOWS_CONVENTIONS), "Write an add function");

        assertThat(prompt).startsWith("## Evaluation Request\n\n### Context\nWrite an add function");
        assertThat(prompt).contains("### Content to Evaluate\n\n```\ndef add(a, b): return a + b\n```");
        assertThat(prompt).contains("1. **code_correctness** (weight: 2, REQUIRED)");
        assertThat(prompt).contains("2. **follows_conventions** (weight: 0.8)");
        assertThat(prompt).contains("\"overallScore\": 0.85", "Respond with valid JSON only");
    }

    @Test
    void contextSectionIsOmittedWhenAbsent() {
        String prompt = EvaluationPromptBuilder.build("text", List.of(CriteriaLibrary.CLARITY), null);

        assertThat(prompt).doesNotContain("### Context");
    }
}
