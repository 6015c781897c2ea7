package com.leadpilot.orchestrator.stage.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leadpilot.orchestrator.claude.ClaudeClient;
import com.leadpilot.orchestrator.claude.ClaudeClient.Message;
import com.leadpilot.orchestrator.memory.ContextBundle;
import com.leadpilot.orchestrator.memory.ContextEntry;
import com.leadpilot.orchestrator.model.ResearchRequest;
import com.leadpilot.orchestrator.provider.WebSearchClient;
import com.leadpilot.orchestrator.provider.dto.CompanyResearch;
import com.leadpilot.orchestrator.provider.dto.SearchResult;
import com.leadpilot.orchestrator.stage.StageContext;
import com.leadpilot.orchestrator.stage.StageInterruptedException;
import com.leadpilot.orchestrator.support.StageContextFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DiscoveryStageTest {

    @Mock ClaudeClient    claude;
    @Mock WebSearchClient search;

    private DiscoveryStage stage;
    private StageContextFixture fixture;

    @BeforeEach
    void setUp() {
        stage   = new DiscoveryStage(claude, new StagePrompts(), new ObjectMapper(), search, "test-model");
        fixture = new StageContextFixture("Acme, Roles: CEO");
    }

    @Test
    void execute_accepted_defaultsNameAndNotesDecision() {
        when(claude.complete(eq("test-model"), anyString(), anyList()))
                .thenReturn("<result>{\"status\": \"Accepted\", \"industry\": \"Robotics\"}</result>");

        JsonNode result = stage.execute(fixture.contextFor(DiscoveryStage.NAME));

        assertThat(result.path("status").asText()).isEqualTo("accepted");
        assertThat(result.path("name").asText()).isEqualTo("Acme");
        assertThat(stage.endsPipeline(result)).isFalse();
        assertThat(fixture.notes).singleElement().satisfies(n -> {
            assertThat(n.eventType()).isEqualTo("decision");
            assertThat(n.importance()).isEqualTo(6);
        });
    }

    @Test
    void execute_unrecognisedStatus_treatedAsRejectedAndEndsPipeline() {
        when(claude.complete(anyString(), anyString(), anyList()))
                .thenReturn("{\"name\": \"Acme Corp\", \"status\": \"maybe\"}");

        JsonNode result = stage.execute(fixture.contextFor(DiscoveryStage.NAME));

        assertThat(result.path("status").asText()).isEqualTo("rejected");
        assertThat(result.path("reason").asText()).contains("maybe");
        assertThat(stage.endsPipeline(result)).isTrue();
        assertThat(fixture.notes.get(0).importance()).isEqualTo(8);
    }

    @Test
    void execute_appendsRenderedContextToRequest() {
        when(claude.complete(anyString(), anyString(), anyList()))
                .thenReturn("<result>{\"status\": \"accepted\"}</result>");
        ContextBundle bundle = new ContextBundle("acme", DiscoveryStage.NAME,
                List.of(new ContextEntry(ContextEntry.Source.LONG_TERM, "industry", "Robotics")), 1000, false);
        StageContext ctx = new StageContext("exec-1", DiscoveryStage.NAME, ResearchRequest.parse("Acme"),
                Map.of(), bundle, () -> false, d -> { }, (t, p, i) -> { });

        stage.execute(ctx);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> messages = ArgumentCaptor.forClass(List.class);
        verify(claude).complete(anyString(), anyString(), messages.capture());
        String user = messages.getValue().get(0).content();
        assertThat(user).startsWith("Company: Acme");
        assertThat(user).contains("[KNOWN FACTS]").contains("industry: Robotics");
    }

    @Test
    void execute_searchResultsAvailable_groundsPromptAndRecordsSources() {
        when(search.isConfigured()).thenReturn(true);
        when(search.researchCompany("Acme")).thenReturn(new CompanyResearch("Acme",
                List.of(new SearchResult("Acme Robotics", "Industrial robots for warehouses", "https://acme.io")),
                List.of(),
                new SearchResult("Acme | LinkedIn", "", "https://linkedin.com/company/acme"),
                List.of("web", "linkedin"),
                List.of("News search failed: HTTP 500")));
        when(claude.complete(anyString(), anyString(), anyList()))
                .thenReturn("<result>{\"status\": \"accepted\"}</result>");

        JsonNode result = stage.execute(fixture.contextFor(DiscoveryStage.NAME));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> messages = ArgumentCaptor.forClass(List.class);
        verify(claude).complete(anyString(), anyString(), messages.capture());
        String user = messages.getValue().get(0).content();
        assertThat(user).startsWith("Analyze this company based on the following REAL search results:");
        assertThat(user).contains("Industrial robots for warehouses").contains("https://linkedin.com/company/acme");
        assertThat(result.path("sources").toString()).isEqualTo("[\"web\",\"linkedin\"]");
    }

    @Test
    void execute_searchFindsNothing_fallsBackToCompanyName() {
        when(search.isConfigured()).thenReturn(true);
        when(search.researchCompany("Acme")).thenReturn(CompanyResearch.none("Acme", "Web search failed: HTTP 401"));
        when(claude.complete(anyString(), anyString(), anyList()))
                .thenReturn("<result>{\"status\": \"accepted\"}</result>");

        JsonNode result = stage.execute(fixture.contextFor(DiscoveryStage.NAME));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> messages = ArgumentCaptor.forClass(List.class);
        verify(claude).complete(anyString(), anyString(), messages.capture());
        assertThat(messages.getValue().get(0).content()).startsWith("Company: Acme");
        assertThat(result.has("sources")).isFalse();
    }

    @Test
    void execute_stopAlreadyRequested_doesNotCallClaude() {
        fixture.stopRequested.set(true);

        assertThatThrownBy(() -> stage.execute(fixture.contextFor(DiscoveryStage.NAME)))
                .isInstanceOf(StageInterruptedException.class);
        verify(claude, never()).complete(anyString(), anyString(), anyList());
        verify(search, never()).researchCompany(anyString());
    }
}
