package com.leadpilot.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.leadpilot.orchestrator.claude.ClaudeClient;
import com.leadpilot.orchestrator.provider.ContactEnrichmentClient;
import com.leadpilot.orchestrator.provider.ProfessionalNetworkClient;
import com.leadpilot.orchestrator.provider.ProviderException;
import com.leadpilot.orchestrator.provider.dto.Contact;
import com.leadpilot.orchestrator.provider.dto.NetworkProfile;
import com.leadpilot.orchestrator.support.StageContextFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RoleSearchStageTest {

    @Mock ClaudeClient              claude;
    @Mock ProfessionalNetworkClient network;
    @Mock ContactEnrichmentClient   provider;

    private RoleSearchStage stage;

    @BeforeEach
    void setUp() {
        stage = new RoleSearchStage(claude, new StagePrompts(), new ObjectMapper(), network, provider, "test-model");
    }

    @Test
    void execute_providerPeople_scoredAndSortedByDecisionPower() {
        when(provider.isConfigured()).thenReturn(true);
        when(provider.topPeople("Acme Corp", 10)).thenReturn(List.of(
                new Contact("Olga", "Ops", null, null, null, "Office Manager", "Acme Corp", "apollo"),
                new Contact("Cara", "Chief", null, null, "https://linkedin.com/in/cara", "CEO", "Acme Corp", "apollo"),
                new Contact("Vic", "Vee", null, null, null, "VP Sales", "Acme Corp", "apollo")));
        StageContextFixture fixture = new StageContextFixture("Acme")
                .prior(DiscoveryStage.NAME, JsonNodeFactory.instance.objectNode().put("name", "Acme Corp"));

        JsonNode result = stage.execute(fixture.contextFor(RoleSearchStage.NAME));

        assertThat(result.path("company").asText()).isEqualTo("Acme Corp");
        assertThat(result.path("people_found").asInt()).isEqualTo(3);
        assertThat(result.path("accepted_count").asInt()).isEqualTo(2);
        assertThat(result.path("rejected_count").asInt()).isEqualTo(1);
        JsonNode people = result.path("people");
        assertThat(people.get(0).path("name").asText()).isEqualTo("Cara Chief");
        assertThat(people.get(0).path("decision_power").asInt()).isEqualTo(10);
        assertThat(people.get(0).path("linkedin_url").asText()).contains("linkedin");
        assertThat(people.get(2).path("status").asText()).isEqualTo("rejected");
        verify(claude, never()).complete(anyString(), anyString(), anyList());
    }

    @Test
    void execute_providerNotConfigured_usesRequestedRoles() {
        when(provider.isConfigured()).thenReturn(false);
        StageContextFixture fixture = new StageContextFixture("Acme, Roles: Intern, CTO");

        JsonNode result = stage.execute(fixture.contextFor(RoleSearchStage.NAME));

        assertThat(result.path("people").get(0).path("title").asText()).isEqualTo("CTO");
        assertThat(result.path("people").get(0).path("name").asText()).isEqualTo(RoleSearchStage.TARGET_ROLE);
        assertThat(result.path("accepted_count").asInt()).isEqualTo(1);
    }

    @Test
    void execute_permanentProviderError_fallsBackToRequestedRoles() {
        when(provider.isConfigured()).thenReturn(true);
        when(provider.topPeople(anyString(), anyInt())).thenThrow(new ProviderException(403, "forbidden"));
        StageContextFixture fixture = new StageContextFixture("Acme, Roles: VP Sales");

        JsonNode result = stage.execute(fixture.contextFor(RoleSearchStage.NAME));

        assertThat(result.path("people_found").asInt()).isEqualTo(1);
        assertThat(result.path("people").get(0).path("source").asText()).isEqualTo("user_input");
    }

    @Test
    void execute_transientProviderError_propagatesForRetry() {
        when(provider.isConfigured()).thenReturn(true);
        when(provider.topPeople(anyString(), anyInt())).thenThrow(new ProviderException(429, "slow down"));
        StageContextFixture fixture = new StageContextFixture("Acme, Roles: VP Sales");

        assertThatThrownBy(() -> stage.execute(fixture.contextFor(RoleSearchStage.NAME)))
                .isInstanceOf(ProviderException.class);
    }

    @Test
    void execute_noProviderNoRoles_asksClaudeForSuggestions() {
        when(provider.isConfigured()).thenReturn(false);
        when(claude.complete(anyString(), anyString(), anyList()))
                .thenReturn("<result>{\"roles\": [\"Chief Technology Officer\", \"\", \"Sales Lead\"]}</result>");
        StageContextFixture fixture = new StageContextFixture("Acme");

        JsonNode result = stage.execute(fixture.contextFor(RoleSearchStage.NAME));

        assertThat(result.path("people_found").asInt()).isEqualTo(2);
        assertThat(result.path("people").get(0).path("source").asText()).isEqualTo("suggested");
        assertThat(result.path("accepted_count").asInt()).isEqualTo(1);
        assertThat(fixture.notes.get(0).importance()).isEqualTo(5);
    }

    @Test
    void execute_networkProfilesFound_usedBeforeContactProvider() {
        when(network.isConfigured()).thenReturn(true);
        when(network.decisionMakers("Acme Corp", "large")).thenReturn(List.of(
                new NetworkProfile("Dana Diaz", "VP Engineering", "Acme Corp", "https://linkedin.com/in/dana", "VP"),
                new NetworkProfile("Sam Small", "Recruiter", "Acme Corp", "https://linkedin.com/in/sam", "VP")));
        StageContextFixture fixture = new StageContextFixture("Acme, Roles: CTO")
                .prior(DiscoveryStage.NAME, JsonNodeFactory.instance.objectNode()
                        .put("name", "Acme Corp").put("size", "large"));

        JsonNode result = stage.execute(fixture.contextFor(RoleSearchStage.NAME));

        assertThat(result.path("people_found").asInt()).isEqualTo(2);
        assertThat(result.path("accepted_count").asInt()).isEqualTo(1);
        JsonNode top = result.path("people").get(0);
        assertThat(top.path("name").asText()).isEqualTo("Dana Diaz");
        assertThat(top.path("source").asText()).isEqualTo("linkedin");
        assertThat(top.path("linkedin_url").asText()).isEqualTo("https://linkedin.com/in/dana");
        verify(provider, never()).topPeople(anyString(), anyInt());
    }

    @Test
    void execute_networkPermanentError_fallsBackToContactProvider() {
        when(network.isConfigured()).thenReturn(true);
        when(network.decisionMakers(anyString(), anyString())).thenThrow(new ProviderException(401, "bad key"));
        when(provider.isConfigured()).thenReturn(true);
        when(provider.topPeople("Acme", 10)).thenReturn(List.of(
                new Contact("Cara", "Chief", null, null, null, "CEO", "Acme", "apollo")));
        StageContextFixture fixture = new StageContextFixture("Acme");

        JsonNode result = stage.execute(fixture.contextFor(RoleSearchStage.NAME));

        assertThat(result.path("people").get(0).path("source").asText()).isEqualTo("apollo");
        assertThat(result.path("accepted_count").asInt()).isEqualTo(1);
    }

    @Test
    void execute_networkTransientError_propagatesForRetry() {
        when(network.isConfigured()).thenReturn(true);
        when(network.decisionMakers(anyString(), anyString()))
                .thenThrow(new ProviderException("connection reset", new IOException("reset")));
        StageContextFixture fixture = new StageContextFixture("Acme, Roles: CTO");

        assertThatThrownBy(() -> stage.execute(fixture.contextFor(RoleSearchStage.NAME)))
                .isInstanceOf(ProviderException.class);
        verify(provider, never()).topPeople(anyString(), anyInt());
    }

    @Test
    void decisionPower_titleScale() {
        assertThat(DecisionPower.score("Co-Founder & CEO")).isEqualTo(10);
        assertThat(DecisionPower.score("Vice President of Sales")).isEqualTo(8);
        assertThat(DecisionPower.score("SVP Marketing")).isEqualTo(9);
        assertThat(DecisionPower.score("Director, IT")).isEqualTo(7);
        assertThat(DecisionPower.score("Engineering Manager")).isEqualTo(5);
        assertThat(DecisionPower.score("Analyst")).isEqualTo(3);
        assertThat(DecisionPower.score(null)).isEqualTo(1);
        assertThat(DecisionPower.accepted(6)).isTrue();
        assertThat(DecisionPower.accepted(5)).isFalse();
    }
}
