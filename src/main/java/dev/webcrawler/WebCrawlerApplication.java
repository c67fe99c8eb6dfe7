package dev.webcrawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the web crawler MCP server.
 *
 * <p>Supports two Spring profiles: {@code web} (MCP SSE on port 8080) and {@code stdio} (MCP stdio
 * transport, no web server).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableRetry
public class WebCrawlerApplication {
    public static void main(String[] args) {
        SpringApplication.run(WebCrawlerApplication.class, args);
    }
}
