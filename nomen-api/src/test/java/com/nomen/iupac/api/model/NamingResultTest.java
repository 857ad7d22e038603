package com.nomen.iupac.api.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NamingResultTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("Result serializes with snake_case property names")
    void jsonShape() throws Exception {
        NamingTrace trace = new NamingTrace(TraceLevel.BASIC, 1200L,
                List.of(new NamingTrace.AppliedRule("P-44.1.1", "P-44.1", "PARENT_SELECTION", "kept 1 ring")),
                List.of(), "ring", "benzene", List.of());
        NamingResult result = new NamingResult("benzene", List.of(), trace);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertThat(json.get("name").asText()).isEqualTo("benzene");
        assertThat(json.get("errors").isArray()).isTrue();
        assertThat(json.get("trace").get("applied_rules").get(0).get("rule_id").asText()).isEqualTo("P-44.1.1");
        assertThat(json.get("trace").get("parent_kind").asText()).isEqualTo("ring");
    }

    @Test
    @DisplayName("Null name becomes empty and errors are copied")
    void nullNameBecomesEmpty() {
        NamingResult result = new NamingResult(null, List.of("unclosed ring 1"));

        assertThat(result.name()).isEmpty();
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.hasTrace()).isFalse();
    }

    @Test
    @DisplayName("Applied rule description includes phase and rationale")
    void describe() {
        NamingTrace.AppliedRule rule = new NamingTrace.AppliedRule("P-31.1.4", "P-31.1.4", "NUMBERING", "lowest locants {1,2}");

        assertThat(rule.describe()).isEqualTo("P-31.1.4 [NUMBERING] lowest locants {1,2}");
    }
}
