package com.leadpilot.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadpilot.orchestrator.claude.ClaudeClient;
import com.leadpilot.orchestrator.stage.StageFailure;
import com.leadpilot.orchestrator.support.StageContextFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerificationStageTest {

    @Mock ClaudeClient claude;

    private final ObjectMapper json = new ObjectMapper();
    private VerificationStage stage;

    @BeforeEach
    void setUp() {
        stage = new VerificationStage(claude, new StagePrompts(), json, "test-model");
    }

    private StageContextFixture acceptedLead() {
        ObjectNode roles = json.createObjectNode();
        roles.putArray("people").addObject().put("name", "Cara Chief").put("status", "accepted");
        ObjectNode enrichment = json.createObjectNode();
        enrichment.putArray("contacts").addObject().put("first_name", "Cara").put("email", "cara@acme.com");
        return new StageContextFixture("Acme")
                .prior(DiscoveryStage.NAME, json.createObjectNode().put("name", "Acme Corp").put("status", "accepted"))
                .prior(RoleSearchStage.NAME, roles)
                .prior(EnrichmentStage.NAME, enrichment);
    }

    @Test
    void execute_discoveryRejected_zeroScoreWithoutAskingClaude() {
        StageContextFixture fixture = new StageContextFixture("Acme")
                .prior(DiscoveryStage.NAME, json.createObjectNode().put("status", "rejected").put("reason", "B2C only"));

        JsonNode result = stage.execute(fixture.contextFor(VerificationStage.NAME));

        assertThat(result.path("status").asText()).isEqualTo("rejected");
        assertThat(result.path("confidence_score").asDouble()).isZero();
        assertThat(result.path("reason").asText()).contains("B2C only");
        verify(claude, never()).complete(anyString(), anyString(), anyList());
    }

    @Test
    void execute_noAcceptedPeople_lowScoreRejection() {
        StageContextFixture fixture = new StageContextFixture("Acme")
                .prior(DiscoveryStage.NAME, json.createObjectNode().put("status", "accepted"));

        JsonNode result = stage.execute(fixture.contextFor(VerificationStage.NAME));

        assertThat(result.path("confidence_score").asDouble()).isEqualTo(0.3);
        assertThat(result.path("reason").asText()).isEqualTo("No decision-makers found");
    }

    @Test
    void execute_verifiedBelowThreshold_forcedToRejected() {
        when(claude.complete(anyString(), anyString(), anyList()))
                .thenReturn("<result>{\"status\": \"verified\", \"confidence_score\": 0.65}</result>");
        StageContextFixture fixture = acceptedLead();

        JsonNode result = stage.execute(fixture.contextFor(VerificationStage.NAME));

        assertThat(result.path("status").asText()).isEqualTo("rejected");
        assertThat(fixture.notes.get(0).importance()).isEqualTo(9);
    }

    @Test
    void execute_verifiedAboveThreshold_keptVerified() {
        when(claude.complete(anyString(), anyString(), anyList()))
                .thenReturn("{\"status\": \"Verified\", \"confidence_score\": 0.9, \"recommended_action\": \"Call\"}");

        JsonNode result = stage.execute(acceptedLead().contextFor(VerificationStage.NAME));

        assertThat(result.path("status").asText()).isEqualTo("verified");
        assertThat(result.path("confidence_score").asDouble()).isEqualTo(0.9);
    }

    @Test
    void execute_unparseableAnswer_scoresLocallyCappedAtOne() {
        when(claude.complete(anyString(), anyString(), anyList())).thenReturn("I think it's a good lead.");

        JsonNode result = stage.execute(acceptedLead().contextFor(VerificationStage.NAME));

        assertThat(result.path("status").asText()).isEqualTo("verified");
        assertThat(result.path("confidence_score").asDouble()).isEqualTo(1.0);
        assertThat(result.path("reason").asText()).isEqualTo("Calculated based on available data");
    }

    @Test
    void execute_claudeFailure_propagates() {
        when(claude.complete(anyString(), anyString(), anyList()))
                .thenThrow(new ClaudeClient.ClaudeApiException(500, "overloaded"));

        assertThatThrownBy(() -> stage.execute(acceptedLead().contextFor(VerificationStage.NAME)))
                .isInstanceOf(ClaudeClient.ClaudeApiException.class)
                .isNotInstanceOf(StageFailure.class);
    }
}
