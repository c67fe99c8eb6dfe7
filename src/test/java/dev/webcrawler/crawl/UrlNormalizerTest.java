package dev.webcrawler.crawl;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class UrlNormalizerTest {

    @Nested
    class Normalize {

        @Test
        void removes_fragment() {
            String result = UrlNormalizer.normalize("https://docs.example.com/guide#section");
            assertThat(result).isEqualTo("https://docs.example.com/guide");
        }

        @Test
        void removes_everything_after_first_hash() {
            String result = UrlNormalizer.normalize("http://a/b#frag#more");
            assertThat(result).isEqualTo("http://a/b");
        }

        @Test
        void removes_empty_fragment() {
            String result = UrlNormalizer.normalize("https://docs.example.com/guide#");
            assertThat(result).isEqualTo("https://docs.example.com/guide");
        }

        @Test
        void keeps_trailing_slash() {
            String result = UrlNormalizer.normalize("https://docs.example.com/guide/");
            assertThat(result).isEqualTo("https://docs.example.com/guide/");
        }

        @Test
        void keeps_query_string() {
            String result = UrlNormalizer.normalize("https://example.com/search?z=1&a=2#top");
            assertThat(result).isEqualTo("https://example.com/search?z=1&a=2");
        }

        @Test
        void keeps_host_case() {
            String result = UrlNormalizer.normalize("https://Docs.Example.COM/Guide");
            assertThat(result).isEqualTo("https://Docs.Example.COM/Guide");
        }

        @Test
        void url_without_fragment_is_unchanged() {
            String url = "https://docs.example.com/api?version=3";
            assertThat(UrlNormalizer.normalize(url)).isEqualTo(url);
        }

        @Test
        void fragment_only_input_becomes_empty() {
            assertThat(UrlNormalizer.normalize("#section")).isEmpty();
        }

        @Test
        void null_and_blank_are_returned_unchanged() {
            assertThat(UrlNormalizer.normalize(null)).isNull();
            assertThat(UrlNormalizer.normalize("  ")).isEqualTo("  ");
        }
    }
}
