package com.gentoro.warmpath.store.providers;

import com.gentoro.warmpath.store.EvidenceStore;
import com.gentoro.warmpath.store.FileEvidenceStore;
import com.gentoro.warmpath.store.spi.EvidenceStoreProvider;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;

/** Service provider for the JSON file backed store. Requires {@code store.file.path}. */
public class FileEvidenceStoreProvider implements EvidenceStoreProvider {
  @Override
  public String id() {
    return "file";
  }

  @Override
  public boolean isAvailable(Configuration configuration) {
    String path = configuration.getString("file.path", null);
    return path != null && !path.isBlank();
  }

  @Override
  public EvidenceStore create(Configuration configuration) {
    return new FileEvidenceStore(
        Path.of(configuration.getString("file.path").trim()),
        configuration.getString("seed", null));
  }
}
