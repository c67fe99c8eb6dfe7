package dev.webcrawler.search;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient}s for the Serper search API and the Wikipedia API.
 */
@Configuration
public class SearchClientConfig {

    @Bean
    public RestClient serperRestClient(RestClient.Builder builder, SearchProperties props) {
        return builder.clone()
                .baseUrl(props.getSerperBaseUrl())
                .requestFactory(requestFactory(props))
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    /**
     * The Wikipedia host depends on the requested language, so this client has no base URL;
     * callers pass absolute URIs.
     */
    @Bean
    public RestClient wikipediaRestClient(RestClient.Builder builder, SearchProperties props) {
        return builder.clone()
                .requestFactory(requestFactory(props))
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(SearchProperties props) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(props.getTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(props.getTimeoutMs()));
        return requestFactory;
    }
}
