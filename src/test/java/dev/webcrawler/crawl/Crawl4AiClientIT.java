package dev.webcrawler.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.Objects;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.wait.strategy.Wait;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

/** Runs against a real Crawl4AI sidecar; executed by Failsafe only. */
@Testcontainers
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class Crawl4AiClientIT {

  private static final int PORT = 11235;

  @Container
  static GenericContainer<?> crawl4ai =
      new GenericContainer<>(DockerImageName.parse("unclecode/crawl4ai:0.8.0"))
          .withExposedPorts(PORT)
          .withCreateContainerCmdModifier(
              cmd -> Objects.requireNonNull(cmd.getHostConfig()).withShmSize(1024L * 1024L * 1024L))
          .waitingFor(
              Wait.forHttp("/health")
                  .forPort(PORT)
                  .forStatusCode(200)
                  .withStartupTimeout(Duration.ofSeconds(120)));

  @DynamicPropertySource
  static void overrideProperties(DynamicPropertyRegistry registry) {
    registry.add(
        "webcrawler.crawl4ai.base-url",
        () -> "http://" + crawl4ai.getHost() + ":" + crawl4ai.getMappedPort(PORT));
  }

  @Autowired private Crawl4AiClient crawl4AiClient;

  @Autowired private DeepCrawlService deepCrawlService;

  @Test
  void crawlReturnsMarkdownForValidUrl() {
    CrawlResult result = crawl4AiClient.crawl("https://example.com");

    assertThat(result.success()).isTrue();
    assertThat(result.markdown()).isNotNull().isNotBlank();
    assertThat(result.markdown()).containsIgnoringCase("Example Domain");
  }

  @Test
  void crawlReturnsFailureForUnreachableUrl() {
    CrawlResult result = crawl4AiClient.crawl("http://localhost:1");

    assertThat(result.success()).isFalse();
  }

  @Test
  void deepCrawlOfWebpageReturnsAtLeastTheSeed() {
    CrawlOutcome outcome = deepCrawlService.deepCrawl("https://example.com", 1, 2);

    assertThat(outcome.success()).isTrue();
    assertThat(outcome.crawlType()).isEqualTo(CrawlType.WEBPAGE);
    assertThat(outcome.pagesCrawled()).isEqualTo(1);
  }
}
