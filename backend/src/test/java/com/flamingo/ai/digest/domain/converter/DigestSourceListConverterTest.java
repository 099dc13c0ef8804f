package com.flamingo.ai.digest.domain.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.digest.domain.model.DigestSource;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DigestSourceListConverter Tests")
class DigestSourceListConverterTest {

  private final DigestSourceListConverter converter = new DigestSourceListConverter();

  @Test
  @DisplayName("Should write sources with msg_id keys")
  void shouldWriteSnakeCaseKeys() {
    String json =
        converter.convertToDatabaseColumn(
            List.of(new DigestSource("newsroom", 42L), new DigestSource("wire", 7L)));

    assertThat(json)
        .isEqualTo(
            "[{\"channel\":\"newsroom\",\"msg_id\":42},"
                + "{\"channel\":\"wire\",\"msg_id\":7}]");
  }

  @Test
  @DisplayName("Should read sources stored by the database")
  void shouldReadJsonb() {
    List<DigestSource> sources =
        converter.convertToEntityAttribute("[{\"channel\": \"newsroom\", \"msg_id\": 42}]");

    assertThat(sources).containsExactly(new DigestSource("newsroom", 42L));
  }

  @Test
  @DisplayName("Should treat null and blank columns as no sources")
  void shouldHandleEmptyColumns() {
    assertThat(converter.convertToEntityAttribute(null)).isEmpty();
    assertThat(converter.convertToEntityAttribute(" ")).isEmpty();
    assertThat(converter.convertToDatabaseColumn(null)).isEqualTo("[]");
  }

  @Test
  @DisplayName("Should reject malformed JSON")
  void shouldRejectMalformedJson() {
    assertThatThrownBy(() -> converter.convertToEntityAttribute("{not json"))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
