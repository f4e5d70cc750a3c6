package dev.flows.engine;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransformsTest {

    @Test
    void mergeAsContextNumbersSections() {
        assertThat(Transforms.mergeAsContext(List.of("first", "second")))
            .isEqualTo("## Step 1\nfirst\n\n## Step 2\nsecond");
        assertThat(Transforms.mergeAsContext(List.of())).isEmpty();
    }

    @Test
    void extractSectionReturnsBodyUpToNextHeading() {
        String doc = """
            # Report

            ## Summary

            All good.
            Nothing to add.

            ## Details
            Long text.
            """;

        assertThat(Transforms.extractSection(doc, "Summary")).isEqualTo("All good.\nNothing to add.");
        assertThat(Transforms.extractSection(doc, "Details")).isEqualTo("Long text.");
    }

    @Test
    void extractSectionFailsWhenMissing() {
        assertThatThrownBy(() -> Transforms.extractSection("## Other\ntext", "Summary"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Section 'Summary' not found");
    }

    @Test
    void appendToRequestKeepsBothParts() {
        assertThat(Transforms.appendToRequest("Build it", "Done"))
            .isEqualTo("Original: Build it\n\nStep Output: Done");
        assertThat(Transforms.appendToRequest("", "")).isEqualTo("Original:\n\nStep Output:");
    }

    @Test
    void jsonExtractFollowsDotPathIntoObjectsAndArrays() {
        String json = """
            {"user": {"profile": {"age": 42, "name": "Ada"}}, "items": [{"name": "first"}, {"name": "second"}]}
            """;

        assertThat(Transforms.jsonExtract(json, "user.profile.name")).isEqualTo("Ada");
        assertThat(Transforms.jsonExtract(json, "user.profile.age")).isEqualTo("42");
        assertThat(Transforms.jsonExtract(json, "items.1.name")).isEqualTo("second");
        assertThat(Transforms.jsonExtract(json, "user.profile")).isEqualTo("{\"age\":42,\"name\":\"Ada\"}");
    }

    @Test
    void jsonExtractRejectsMissingFieldsAndInvalidJson() {
        assertThatThrownBy(() -> Transforms.jsonExtract("{\"a\": 1}", "b"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Field 'b' not found");
        assertThatThrownBy(() -> Transforms.jsonExtract("[1]", "3"))
            .hasMessage("Field '3' not found");
        assertThatThrownBy(() -> Transforms.jsonExtract("not json", "a"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Invalid JSON input");
    }

    @Test
    void templateFillReplacesEveryOccurrence() {
        String filled = Transforms.templateFill("{{name}} meets {{other}}, then {{name}} leaves",
            Map.of("name", "Ada", "other", "Alan"));

        assertThat(filled).isEqualTo("Ada meets Alan, then Ada leaves");
    }

    @Test
    void templateFillFailsOnMissingVariable() {
        assertThatThrownBy(() -> Transforms.templateFill("Hello {{who}}", Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Missing context variable: who");
    }
}
