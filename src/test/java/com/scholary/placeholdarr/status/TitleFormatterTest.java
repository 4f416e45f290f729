package com.scholary.placeholdarr.status;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TitleFormatterTest {

  @Test
  void compose_shouldAppendStatusLabel() {
    assertThat(TitleFormatter.compose("Dune", DisplayStatus.downloading(42)))
        .isEqualTo("Dune - Downloading 42%");
  }

  @Test
  void compose_shouldReplacePreviousStatus() {
    assertThat(TitleFormatter.compose("Dune - Searching...", DisplayStatus.AVAILABLE))
        .isEqualTo("Dune - Available");
  }

  @Test
  void strip_shouldRemoveStackedSuffixes() {
    assertThat(TitleFormatter.strip("Dune - [Request] - Downloading 7% - Not Found"))
        .isEqualTo("Dune");
  }

  @Test
  void strip_shouldKeepTitlesContainingDashes() {
    assertThat(TitleFormatter.strip("Spider-Man - Far From Home"))
        .isEqualTo("Spider-Man - Far From Home");
  }

  @Test
  void strip_shouldHandleNull() {
    assertThat(TitleFormatter.strip(null)).isEmpty();
  }
}
