package com.gentoro.warmpath.store.spi;

import com.gentoro.warmpath.store.EvidenceStore;
import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface for pluggable evidence store drivers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}; register them in {@code
 * META-INF/services/com.gentoro.warmpath.store.spi.EvidenceStoreProvider}. The driver is selected
 * by matching {@code store.driver} against {@link #id()}.
 */
public interface EvidenceStoreProvider {

  /** Stable, lowercase driver identifier, e.g. "file". */
  String id();

  /** Whether the configuration carries everything this driver needs. */
  boolean isAvailable(Configuration configuration);

  /**
   * @param configuration the {@code store.*} subset of the application configuration
   */
  EvidenceStore create(Configuration configuration);
}
