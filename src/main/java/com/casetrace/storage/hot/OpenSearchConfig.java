package com.casetrace.storage.hot;

import org.apache.http.HttpHost;
import org.apache.http.auth.AuthScope;
import org.apache.http.auth.UsernamePasswordCredentials;
import org.apache.http.impl.client.BasicCredentialsProvider;
import org.opensearch.client.RestClient;
import org.opensearch.client.RestClientBuilder;
import org.opensearch.client.RestHighLevelClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Client for the cluster holding the {@code case_<id>} indices.
 *
 * Hosts are a comma separated list of {@code host}, {@code host:port} or
 * {@code scheme://host:port}. Basic auth is sent only when a username is
 * configured. Connect and socket timeouts bound every engine call; a timeout
 * surfaces as a {@link SearchEngineException} of kind TIMEOUT.
 */
@Configuration
public class OpenSearchConfig {
    private static final Logger logger = LoggerFactory.getLogger(OpenSearchConfig.class);

    static final int DEFAULT_PORT = 9200;

    private final String hosts;
    private final String scheme;
    private final String username;
    private final String password;
    private final int connectTimeoutMs;
    private final int socketTimeoutMs;

    public OpenSearchConfig(@Value("${casetrace.opensearch.hosts:localhost:9200}") String hosts,
                            @Value("${casetrace.opensearch.scheme:https}") String scheme,
                            @Value("${casetrace.opensearch.username:}") String username,
                            @Value("${casetrace.opensearch.password:}") String password,
                            @Value("${casetrace.opensearch.connect-timeout-ms:5000}") int connectTimeoutMs,
                            @Value("${casetrace.opensearch.socket-timeout-ms:60000}") int socketTimeoutMs) {
        if (connectTimeoutMs <= 0 || socketTimeoutMs <= 0) {
            throw new IllegalArgumentException(String.format(
                "OpenSearch timeouts must be positive (connect=%d, socket=%d)", connectTimeoutMs, socketTimeoutMs));
        }
        this.hosts = hosts;
        this.scheme = scheme;
        this.username = username;
        this.password = password;
        this.connectTimeoutMs = connectTimeoutMs;
        this.socketTimeoutMs = socketTimeoutMs;
    }

    @Bean(destroyMethod = "close")
    public RestHighLevelClient openSearchClient() {
        List<HttpHost> nodes = parseHosts(hosts, scheme);

        RestClientBuilder builder = RestClient.builder(nodes.toArray(new HttpHost[0]))
            .setRequestConfigCallback(request -> request
                .setConnectTimeout(connectTimeoutMs)
                .setSocketTimeout(socketTimeoutMs));

        boolean authenticated = username != null && !username.isBlank();
        if (authenticated) {
            BasicCredentialsProvider credentials = new BasicCredentialsProvider();
            credentials.setCredentials(AuthScope.ANY,
                new UsernamePasswordCredentials(username, password == null ? "" : password));
            builder.setHttpClientConfigCallback(http -> http.setDefaultCredentialsProvider(credentials));
        }

        logger.info("Case indices {}* served by {} (auth={}, connect={}ms, socket={}ms)",
            IndexNames.prefix(), nodes, authenticated ? username : "none", connectTimeoutMs, socketTimeoutMs);
        return new RestHighLevelClient(builder);
    }

    /**
     * @throws IllegalArgumentException when the list names no host or a port is not a number
     */
    static List<HttpHost> parseHosts(String hosts, String defaultScheme) {
        List<HttpHost> nodes = new ArrayList<>();
        String fallbackScheme = defaultScheme == null || defaultScheme.isBlank()
            ? "https"
            : defaultScheme.trim().toLowerCase(Locale.ROOT);

        for (String entry : hosts == null ? new String[0] : hosts.split(",")) {
            String host = entry.trim();
            if (host.isEmpty()) {
                continue;
            }
            String nodeScheme = fallbackScheme;
            int schemeEnd = host.indexOf("://");
            if (schemeEnd > 0) {
                nodeScheme = host.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
                host = host.substring(schemeEnd + 3);
            }
            if (host.endsWith("/")) {
                host = host.substring(0, host.length() - 1);
            }

            int port = DEFAULT_PORT;
            int colon = host.lastIndexOf(':');
            if (colon > 0) {
                try {
                    port = Integer.parseInt(host.substring(colon + 1));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid port in OpenSearch host '" + entry.trim() + "'", e);
                }
                host = host.substring(0, colon);
            }
            nodes.add(new HttpHost(host, port, nodeScheme));
        }

        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("No OpenSearch host configured in '" + hosts + "'");
        }
        return nodes;
    }
}
