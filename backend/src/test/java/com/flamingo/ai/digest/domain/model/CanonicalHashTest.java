package com.flamingo.ai.digest.domain.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CanonicalHash Tests")
class CanonicalHashTest {

  @Test
  @DisplayName("Should ignore case, links and whitespace differences")
  void shouldIgnoreCaseLinksAndWhitespace() {
    String a = "Breaking:   Central bank raises rates https://t.co/abc?utm=1";
    String b = "breaking: central bank\nraises rates";

    assertThat(CanonicalHash.of(a)).isEqualTo(CanonicalHash.of(b));
  }

  @Test
  @DisplayName("Should produce different hashes for different text")
  void shouldDifferForDifferentText() {
    assertThat(CanonicalHash.of("rates go up")).isNotEqualTo(CanonicalHash.of("rates go down"));
  }

  @Test
  @DisplayName("Should return 64 hex characters")
  void shouldReturnSha256Hex() {
    assertThat(CanonicalHash.of("hello")).hasSize(64).matches("[0-9a-f]+");
  }

  @Test
  @DisplayName("Should return empty hash for blank or link-only text")
  void shouldReturnEmptyForBlankText() {
    assertThat(CanonicalHash.of(null)).isEmpty();
    assertThat(CanonicalHash.of("   \n\t")).isEmpty();
    assertThat(CanonicalHash.of("https://example.com/only-a-link")).isEmpty();
  }

  @Test
  @DisplayName("Should normalize to lowercase single-spaced text")
  void shouldNormalize() {
    assertThat(CanonicalHash.normalize("  Hello\t\tWORLD  see http://x.y/z  "))
        .isEqualTo("hello world see");
  }
}
