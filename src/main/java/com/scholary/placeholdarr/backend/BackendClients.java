package com.scholary.placeholdarr.backend;

import com.scholary.placeholdarr.media.MediaKind;
import com.scholary.placeholdarr.media.QualityTier;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Lookup of configured backend clients by kind and tier. */
public class BackendClients {

  private final Map<BackendKey, BackendClient> clients = new HashMap<>();

  public BackendClients(List<? extends BackendClient> clients) {
    for (BackendClient client : clients) {
      BackendKey key = new BackendKey(client.kind(), client.tier());
      if (this.clients.putIfAbsent(key, client) != null) {
        throw new IllegalArgumentException("Duplicate backend client for " + key);
      }
    }
  }

  public Optional<BackendClient> find(MediaKind kind, QualityTier tier) {
    return Optional.ofNullable(clients.get(new BackendKey(kind, tier)));
  }

  /** Grouping key of the poller: one queue call per key and cycle. */
  public record BackendKey(MediaKind kind, QualityTier tier) {}
}
