package com.gentoro.warmpath.store.providers;

import com.gentoro.warmpath.store.EvidenceStore;
import com.gentoro.warmpath.store.InMemoryEvidenceStore;
import com.gentoro.warmpath.store.SnapshotReader;
import com.gentoro.warmpath.store.spi.EvidenceStoreProvider;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the process-local store, optionally populated from {@code store.seed}. */
public class InMemoryEvidenceStoreProvider implements EvidenceStoreProvider {
  @Override
  public String id() {
    return "in-memory";
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    return true;
  }

  @Override
  public EvidenceStore create(Configuration configuration) {
    String seed = configuration.getString("seed", null);
    if (seed == null || seed.isBlank()) {
      return new InMemoryEvidenceStore();
    }
    return new InMemoryEvidenceStore(SnapshotReader.read(seed.trim()));
  }
}
