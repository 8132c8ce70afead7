package com.casetrace.storage.hot;

import org.apache.http.HttpHost;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.opensearch.client.RestHighLevelClient;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OpenSearchConfig Tests")
class OpenSearchConfigTest {

    @Test
    @DisplayName("Should parse bare hosts, ports and per-host schemes")
    void shouldParseHosts() {
        List<HttpHost> nodes = OpenSearchConfig.parseHosts(
            "search-1, search-2:9201 ,http://10.0.0.5:9300/,", "https");

        assertThat(nodes).extracting(HttpHost::getHostName).containsExactly("search-1", "search-2", "10.0.0.5");
        assertThat(nodes).extracting(HttpHost::getPort).containsExactly(9200, 9201, 9300);
        assertThat(nodes).extracting(HttpHost::getSchemeName).containsExactly("https", "https", "http");
    }

    @Test
    @DisplayName("Should fall back to https when no scheme is configured")
    void shouldDefaultScheme() {
        assertThat(OpenSearchConfig.parseHosts("localhost", " ").get(0).toURI()).isEqualTo("https://localhost:9200");
    }

    @Test
    @DisplayName("Should reject an empty host list and non-numeric ports")
    void shouldRejectBadHosts() {
        assertThatThrownBy(() -> OpenSearchConfig.parseHosts(" , ", "https"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("No OpenSearch host");
        assertThatThrownBy(() -> OpenSearchConfig.parseHosts("search-1:ninety", "https"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("search-1:ninety");
    }

    @Test
    @DisplayName("Should reject non-positive timeouts at startup")
    void shouldRejectTimeouts() {
        assertThatThrownBy(() -> new OpenSearchConfig("localhost", "https", "", "", 0, 60_000))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("connect=0");
    }

    @Test
    @DisplayName("Should build a client with and without credentials")
    void shouldBuildClient() throws IOException {
        try (RestHighLevelClient anonymous = new OpenSearchConfig("localhost:9200", "http", "", "", 1_000, 2_000)
                .openSearchClient();
             RestHighLevelClient authenticated = new OpenSearchConfig("localhost:9200", "https", "casetrace", "secret",
                 1_000, 2_000).openSearchClient()) {
            assertThat(anonymous.getLowLevelClient().getNodes())
                .singleElement()
                .satisfies(node -> assertThat(node.getHost().toURI()).isEqualTo("http://localhost:9200"));
            assertThat(authenticated.getLowLevelClient().getNodes()).hasSize(1);
        }
    }

    @Test
    @DisplayName("Should name case indices with a fixed prefix")
    void shouldExposeIndexPrefix() {
        assertThat(IndexNames.forCase(12)).isEqualTo(IndexNames.prefix() + "12");
    }
}
