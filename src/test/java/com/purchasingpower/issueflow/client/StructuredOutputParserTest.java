package com.purchasingpower.issueflow.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.purchasingpower.issueflow.exception.StructuredOutputException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Structured Output Parser Tests")
class StructuredOutputParserTest {

    @Mock
    private LlmClient repairer;

    private final StructuredOutputParser parser = new StructuredOutputParser(new ObjectMapper());

    @Test
    @DisplayName("Should parse a plain JSON object")
    void testParse_ShouldAcceptPlainObject() {
        ObjectNode node = parser.parse("{\"summary\": \"ok\", \"tasks\": []}", repairer);

        assertThat(node.get("summary").asText()).isEqualTo("ok");
        verifyNoInteractions(repairer);
    }

    @Test
    @DisplayName("Should extract an object wrapped in prose and code fences")
    void testParse_ShouldExtractFencedObject() {
        // Given
        String raw = "Here is the plan:\n```json\n{\"summary\": \"do it\", \"steps\": [\"a\"]}\n```\nGood luck!";

        // When
        ObjectNode node = parser.parse(raw, repairer);

        // Then
        assertThat(node.get("steps").get(0).asText()).isEqualTo("a");
        verifyNoInteractions(repairer);
    }

    @Test
    @DisplayName("Should repair garbage exactly once")
    void testParse_ShouldRepairOnce() {
        // Given
        when(repairer.generate(startsWith(StructuredOutputParser.REPAIR_PROMPT), eq(StructuredOutputParser.REPAIR_SYSTEM)))
                .thenReturn("{\"restart\": true}");

        // When
        ObjectNode node = parser.parse("restart: yes please", repairer);

        // Then
        assertThat(node.get("restart").asBoolean()).isTrue();
        verify(repairer, times(1)).generate(anyString(), anyString());
    }

    @Test
    @DisplayName("Should give up when the repair is also invalid")
    void testParse_ShouldFailAfterFailedRepair() {
        // Given
        when(repairer.generate(anyString(), anyString())).thenReturn("still not json");

        // When / Then
        assertThatThrownBy(() -> parser.parse("nope", repairer))
                .isInstanceOf(StructuredOutputException.class)
                .satisfies(e -> assertThat(((StructuredOutputException) e).getRawContent()).isEqualTo("nope"));
        verify(repairer, times(1)).generate(anyString(), anyString());
    }

    @Test
    @DisplayName("Should treat a top-level array as a failure")
    void testTryParse_ShouldRejectArrays() {
        assertThat(parser.tryParse("[1, 2, 3]")).isEmpty();
        assertThat(parser.tryParse("")).isEmpty();
        assertThat(parser.tryParse(null)).isEmpty();
        assertThat(parser.tryParse("} backwards {")).isEmpty();
    }
}
