package com.scholary.placeholdarr.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import java.util.List;
import org.junit.jupiter.api.Test;

class BackendClientsTest {

  @Test
  void find_shouldResolveByKindAndTier() {
    BackendClient radarr = client(MediaKind.MOVIE, QualityTier.STANDARD);
    BackendClient radarr4k = client(MediaKind.MOVIE, QualityTier.HIGH_QUALITY);

    BackendClients clients = new BackendClients(List.of(radarr, radarr4k));

    assertThat(clients.find(MediaKind.MOVIE, QualityTier.HIGH_QUALITY)).containsSame(radarr4k);
    assertThat(clients.find(MediaKind.EPISODE, QualityTier.STANDARD)).isEmpty();
    assertThat(clients.find(MediaKind.MOVIE, QualityTier.STANDARD)).containsSame(radarr);
  }

  @Test
  void constructor_shouldRejectDuplicateClients() {
    List<BackendClient> duplicates =
        List.of(
            client(MediaKind.EPISODE, QualityTier.STANDARD),
            client(MediaKind.EPISODE, QualityTier.STANDARD));

    assertThatThrownBy(() -> new BackendClients(duplicates))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static BackendClient client(MediaKind kind, QualityTier tier) {
    BackendClient client = mock(BackendClient.class);
    when(client.kind()).thenReturn(kind);
    when(client.tier()).thenReturn(tier);
    return client;
  }
}
