package dev.webcrawler.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

@ExtendWith(MockitoExtension.class)
class Crawl4AiClientTest {

  @Mock private RestClient restClient;

  @Mock private RestClient.RequestBodyUriSpec requestBodyUriSpec;

  @Mock private RestClient.RequestBodySpec requestBodySpec;

  @Mock private RestClient.ResponseSpec responseSpec;

  private Crawl4AiClient crawl4AiClient;

  @BeforeEach
  void setUp() {
    crawl4AiClient = new Crawl4AiClient(restClient);
  }

  private void stubRestClientChain() {
    when(restClient.post()).thenReturn(requestBodyUriSpec);
    when(requestBodyUriSpec.uri("/crawl")).thenReturn(requestBodySpec);
    when(requestBodySpec.body(any(Crawl4AiRequest.class))).thenReturn(requestBodySpec);
    when(requestBodySpec.retrieve()).thenReturn(responseSpec);
  }

  private void respondWith(Crawl4AiPageResult page) {
    when(responseSpec.body(Crawl4AiResponse.class))
        .thenReturn(new Crawl4AiResponse(true, List.of(page)));
  }

  @Test
  void crawlSuccessfulResponseReturnsMarkdownAndInternalLinks() {
    stubRestClientChain();
    var markdown = new Crawl4AiMarkdown("# Raw", "# Fit content");
    respondWith(
        new Crawl4AiPageResult(
            "https://docs.example.com",
            true,
            null,
            markdown,
            Map.of(
                "internal",
                List.of(new Crawl4AiLink("https://docs.example.com/page2", "Page 2", null)),
                "external",
                List.of(new Crawl4AiLink("https://other.example.org", "Elsewhere", null))),
            null));

    CrawlResult result = crawl4AiClient.crawl("https://docs.example.com");

    assertThat(result.success()).isTrue();
    assertThat(result.url()).isEqualTo("https://docs.example.com");
    assertThat(result.markdown()).isEqualTo("# Fit content");
    assertThat(result.internalLinks()).containsExactly("https://docs.example.com/page2");
  }

  @Test
  void crawlSendsUrlWithCacheBypass() {
    stubRestClientChain();
    respondWith(
        new Crawl4AiPageResult(
            "https://docs.example.com", true, null, new Crawl4AiMarkdown("# A", null), null, null));

    crawl4AiClient.crawl("https://docs.example.com#intro");

    verify(requestBodySpec)
        .body(
            argThat(
                (Crawl4AiRequest request) ->
                    request.urls().equals(List.of("https://docs.example.com#intro"))
                        && request.crawler_config().get("params") instanceof Map<?, ?> params
                        && "bypass".equals(params.get("cache_mode"))));
  }

  @Test
  void crawlReportsRedirectTargetAsUrl() {
    stubRestClientChain();
    respondWith(
        new Crawl4AiPageResult(
            "https://docs.example.com/old",
            true,
            "https://docs.example.com/new",
            new Crawl4AiMarkdown("# New", null),
            Map.of(),
            null));

    CrawlResult result = crawl4AiClient.crawl("https://docs.example.com/old");

    assertThat(result.url()).isEqualTo("https://docs.example.com/new");
  }

  @Test
  void crawlFitMarkdownBlankFallsBackToRawMarkdown() {
    stubRestClientChain();
    respondWith(
        new Crawl4AiPageResult(
            "https://docs.example.com",
            true,
            null,
            new Crawl4AiMarkdown("# Raw markdown", "   "),
            Map.of(),
            null));

    CrawlResult result = crawl4AiClient.crawl("https://docs.example.com");

    assertThat(result.markdown()).isEqualTo("# Raw markdown");
  }

  @Test
  void crawlMarkdownObjectNullReturnsNullMarkdown() {
    stubRestClientChain();
    respondWith(
        new Crawl4AiPageResult("https://docs.example.com", true, null, null, Map.of(), null));

    CrawlResult result = crawl4AiClient.crawl("https://docs.example.com");

    assertThat(result.success()).isTrue();
    assertThat(result.markdown()).isNull();
    assertThat(result.hasContent()).isFalse();
  }

  @Test
  void crawlPageNotSuccessReturnsFailedWithSidecarMessage() {
    stubRestClientChain();
    respondWith(
        new Crawl4AiPageResult(
            "https://docs.example.com", false, null, null, Map.of(), "net::ERR_NAME_NOT_RESOLVED"));

    CrawlResult result = crawl4AiClient.crawl("https://docs.example.com");

    assertThat(result.success()).isFalse();
    assertThat(result.errorMessage()).isEqualTo("net::ERR_NAME_NOT_RESOLVED");
  }

  @Test
  void crawlEmptyResultsReturnsFailed() {
    stubRestClientChain();
    when(responseSpec.body(Crawl4AiResponse.class))
        .thenReturn(new Crawl4AiResponse(true, List.of()));

    CrawlResult result = crawl4AiClient.crawl("https://docs.example.com");

    assertThat(result.success()).isFalse();
    assertThat(result.errorMessage()).contains("no results");
  }

  @Test
  void crawlNullResponseReturnsFailed() {
    stubRestClientChain();
    when(responseSpec.body(Crawl4AiResponse.class)).thenReturn(null);

    CrawlResult result = crawl4AiClient.crawl("https://docs.example.com");

    assertThat(result.success()).isFalse();
  }

  @Test
  void crawlRestClientExceptionPropagatesForRetry() {
    when(restClient.post()).thenReturn(requestBodyUriSpec);
    when(requestBodyUriSpec.uri("/crawl")).thenReturn(requestBodySpec);
    when(requestBodySpec.body(any(Crawl4AiRequest.class))).thenReturn(requestBodySpec);
    when(requestBodySpec.retrieve()).thenThrow(new RestClientException("Connection refused"));

    assertThatThrownBy(() -> crawl4AiClient.crawl("https://docs.example.com"))
        .isInstanceOf(RestClientException.class)
        .hasMessage("Connection refused");
  }

  @Test
  void recoverCrawlReturnsFailedResult() {
    CrawlResult result =
        crawl4AiClient.recoverCrawl(
            new RestClientException("Connection refused"), "https://docs.example.com");

    assertThat(result.success()).isFalse();
    assertThat(result.errorMessage()).isEqualTo("Connection refused");
    assertThat(result.url()).isEqualTo("https://docs.example.com");
  }
}
