package com.gentoro.warmpath.graph;

import com.gentoro.warmpath.exception.ConfigException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.apache.commons.configuration2.Configuration;

/**
 * Background upkeep: rebuilds the graph once the last rebuild is older than {@code
 * ingestion.schedule.rebuildInterval} and runs the invitation expiry sweep every {@code
 * activation.sweepInterval}.
 *
 * <p>A failing run is logged and the next one still happens.
 */
public class GraphMaintenanceScheduler implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(GraphMaintenanceScheduler.class);

  private static final Duration STALENESS_CHECK = Duration.ofMinutes(1);

  private final GraphService graphService;
  private final Runnable invitationSweep;
  private final Duration sweepInterval;
  private final Duration checkInterval;
  private ScheduledExecutorService executor;

  public GraphMaintenanceScheduler(
      Configuration configuration, GraphService graphService, Runnable invitationSweep) {
    this(configuration, graphService, invitationSweep, STALENESS_CHECK);
  }

  GraphMaintenanceScheduler(
      Configuration configuration,
      GraphService graphService,
      Runnable invitationSweep,
      Duration checkInterval) {
    this.graphService = graphService;
    this.invitationSweep = invitationSweep;
    this.checkInterval = checkInterval;
    String sweep = configuration.getString("activation.sweepInterval", "PT15M");
    try {
      this.sweepInterval = Duration.parse(sweep);
    } catch (DateTimeParseException e) {
      throw new ConfigException(
          "Invalid activation.sweepInterval: " + sweep, Map.of("value", sweep));
    }
  }

  public synchronized void start() {
    if (executor != null) return;
    executor =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "warmpath-maintenance");
              t.setDaemon(true);
              return t;
            });
    executor.scheduleWithFixedDelay(
        () -> run("graph rebuild", graphService::rebuildIfStale),
        checkInterval.toMillis(),
        checkInterval.toMillis(),
        TimeUnit.MILLISECONDS);
    executor.scheduleWithFixedDelay(
        () -> run("invitation sweep", invitationSweep),
        sweepInterval.toMillis(),
        sweepInterval.toMillis(),
        TimeUnit.MILLISECONDS);
    log.info(
        "Maintenance scheduled: staleness check every {}, invitation sweep every {}",
        checkInterval,
        sweepInterval);
  }

  public synchronized boolean isRunning() {
    return executor != null && !executor.isShutdown();
  }

  @Override
  public synchronized void close() {
    if (executor == null) return;
    executor.shutdownNow();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Maintenance tasks did not stop within 5 seconds");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      executor = null;
    }
  }

  private static void run(String name, Runnable task) {
    try {
      task.run();
    } catch (RuntimeException e) {
      // an escaping exception would cancel the periodic task
      log.error("Scheduled {} failed", name, e);
    }
  }
}
