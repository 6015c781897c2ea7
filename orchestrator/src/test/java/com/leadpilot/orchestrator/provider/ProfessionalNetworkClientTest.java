package com.leadpilot.orchestrator.provider;

import com.leadpilot.orchestrator.provider.dto.NetworkProfile;
import com.leadpilot.orchestrator.provider.dto.SearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProfessionalNetworkClientTest {

    @Mock WebSearchClient search;

    private ProfessionalNetworkClient client;

    @BeforeEach
    void setUp() {
        client = new ProfessionalNetworkClient(search);
    }

    private static SearchResult hit(String title, String snippet, String url) {
        return new SearchResult(title, snippet, url);
    }

    @Test
    void decisionMakers_searchesFirstThreeTitlesForSizeAndDedupesByName() {
        when(search.search(anyString(), eq(3))).thenAnswer(inv -> {
            String q = inv.getArgument(0);
            if (q.endsWith("\"Founder\"") || q.endsWith("\"CEO\"")) {
                return List.of(hit("Jane Doe - CEO & Founder - Acme | LinkedIn", "", "https://linkedin.com/in/jane"));
            }
            return List.of(
                    hit("JANE DOE - CTO", "", "https://linkedin.com/in/jane-2"),
                    hit("Acme | LinkedIn", "", "https://linkedin.com/company/acme"),
                    hit("Tom Tech - CTO - Acme", "", "https://linkedin.com/in/tom"));
        });

        List<NetworkProfile> found = client.decisionMakers("Acme", "small");

        assertThat(found).extracting(NetworkProfile::name).containsExactly("Jane Doe", "Tom Tech");
        assertThat(found.get(0).searchedTitle()).isEqualTo("Founder");
        assertThat(found.get(1).profileUrl()).isEqualTo("https://linkedin.com/in/tom");
        ArgumentCaptor<String> queries = ArgumentCaptor.forClass(String.class);
        verify(search, times(3)).search(queries.capture(), eq(3));
        assertThat(queries.getAllValues()).containsExactly(
                "site:linkedin.com/in \"Acme\" \"Founder\"",
                "site:linkedin.com/in \"Acme\" \"CEO\"",
                "site:linkedin.com/in \"Acme\" \"CTO\"");
    }

    @Test
    void decisionMakers_searchFailure_propagates() {
        when(search.search(anyString(), eq(3))).thenThrow(new ProviderException(429, "rate limited"));

        assertThatThrownBy(() -> client.decisionMakers("Acme", "medium"))
                .isInstanceOf(ProviderException.class);
    }

    @Test
    void titlesFor_unknownSize_usesMedium() {
        assertThat(ProfessionalNetworkClient.titlesFor("Enterprise")).startsWith("SVP", "EVP", "VP");
        assertThat(ProfessionalNetworkClient.titlesFor(null)).isEqualTo(ProfessionalNetworkClient.titlesFor("medium"));
        assertThat(ProfessionalNetworkClient.titlesFor("huge")).startsWith("CEO", "CTO", "VP");
    }

    // ------------------------------------------------------------------
    // result parsing
    // ------------------------------------------------------------------

    @Test
    void parse_dashSeparatedTitle_readsNameAndTitle() {
        Optional<NetworkProfile> p = ProfessionalNetworkClient.parse(
                hit("Dr. Ana-María Díaz ✔ - VP Engineering - Acme | LinkedIn", "", "https://linkedin.com/in/ana"),
                "Acme", "VP");

        assertThat(p).get().satisfies(profile -> {
            assertThat(profile.name()).isEqualTo("Dr. Ana-María Díaz");
            assertThat(profile.title()).isEqualTo("VP Engineering");
            assertThat(profile.company()).isEqualTo("Acme");
        });
    }

    @Test
    void parse_pipeSeparated_takesTitleFromSnippet() {
        Optional<NetworkProfile> p = ProfessionalNetworkClient.parse(
                hit("Sam Lee | LinkedIn", "Sam is Head of Sales at Acme since 2021", "https://linkedin.com/in/sam"),
                "Acme", "Head of");

        assertThat(p).get().satisfies(profile -> {
            assertThat(profile.name()).isEqualTo("Sam Lee");
            assertThat(profile.title()).isEqualTo("Head of");
        });
    }

    @Test
    void parse_notAProfileOrNoUsableName_rejected() {
        assertThat(ProfessionalNetworkClient.parse(
                hit("Acme - Company Page", "", "https://linkedin.com/company/acme"), "Acme", "CEO")).isEmpty();
        assertThat(ProfessionalNetworkClient.parse(
                hit("LinkedIn - CEO", "", "https://linkedin.com/in/x"), "Acme", "CEO")).isEmpty();
        assertThat(ProfessionalNetworkClient.parse(
                hit("🚀 - CEO", "", "https://linkedin.com/in/y"), "Acme", "CEO")).isEmpty();
    }
}
