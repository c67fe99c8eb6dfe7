package dev.webcrawler.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Subset of the Serper {@code /search} response used by {@link WebSearchService}. */
@JsonIgnoreProperties(ignoreUnknown = true)
record SerperResponse(List<Organic> organic) {

  SerperResponse {
    organic = organic == null ? List.of() : List.copyOf(organic);
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record Organic(@Nullable String title, @Nullable String link, @Nullable String snippet) {}
}
