package com.gentoro.warmpath.store;

import com.gentoro.warmpath.exception.ConfigException;
import com.gentoro.warmpath.store.spi.EvidenceStoreProvider;
import java.util.Map;
import java.util.ServiceLoader;
import org.apache.commons.configuration2.Configuration;

/** Creates the configured {@link EvidenceStore} through the {@link EvidenceStoreProvider} SPI. */
public final class EvidenceStoreFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(EvidenceStoreFactory.class);

  private EvidenceStoreFactory() {}

  /**
   * Resolve the driver named by {@code store.driver} (default "in-memory").
   *
   * @throws ConfigException when no provider matches or the matching one lacks configuration
   */
  public static EvidenceStore create(Configuration configuration) {
    String desired = configuration.getString("store.driver", "in-memory").trim();
    Configuration storeConfig = configuration.subset("store");
    for (EvidenceStoreProvider p : ServiceLoader.load(EvidenceStoreProvider.class)) {
      if (!p.id().equalsIgnoreCase(desired)) continue;
      if (!p.isAvailable(storeConfig)) {
        throw new ConfigException(
            "Evidence store driver '%s' is missing required configuration".formatted(desired),
            Map.of("driver", desired));
      }
      EvidenceStore store = p.create(storeConfig);
      log.info("Using evidence store driver '{}'", store.driver());
      return store;
    }
    throw new ConfigException(
        "Unknown evidence store driver: " + desired, Map.of("driver", desired));
  }
}
