package com.gentoro.warmpath.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.warmpath.exception.EvidenceStoreException;
import com.gentoro.warmpath.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Reads {@link StoreSnapshot} documents from the classpath or the filesystem. Files ending in
 * {@code .yaml} or {@code .yml} are parsed as YAML, everything else as JSON.
 */
public final class SnapshotReader {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(SnapshotReader.class);

  private SnapshotReader() {}

  public static StoreSnapshot read(String location) {
    ObjectMapper mapper = mapperFor(location);
    if (location.startsWith("classpath:")) {
      String resource = location.substring("classpath:".length());
      try (InputStream in =
          Thread.currentThread().getContextClassLoader().getResourceAsStream(resource)) {
        if (in == null) {
          throw new EvidenceStoreException(
              "Snapshot resource not found on classpath", Map.of("location", location));
        }
        return mapper.readValue(in, StoreSnapshot.class);
      } catch (IOException e) {
        throw new EvidenceStoreException("Failed to read snapshot from " + location, e);
      }
    }
    return read(Path.of(location));
  }

  public static StoreSnapshot read(Path path) {
    log.debug("Reading evidence snapshot from {}", path.toAbsolutePath());
    try (InputStream in = Files.newInputStream(path)) {
      return mapperFor(path.toString()).readValue(in, StoreSnapshot.class);
    } catch (IOException e) {
      throw new EvidenceStoreException("Failed to read snapshot from " + path, e);
    }
  }

  private static ObjectMapper mapperFor(String location) {
    String lower = location.toLowerCase(Locale.ROOT);
    return lower.endsWith(".yaml") || lower.endsWith(".yml")
        ? JacksonUtility.getYamlMapper()
        : JacksonUtility.getJsonMapper();
  }
}
