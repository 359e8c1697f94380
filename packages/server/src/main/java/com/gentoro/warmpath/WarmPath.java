package com.gentoro.warmpath;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.Appender;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.rolling.RollingFileAppender;
import ch.qos.logback.core.rolling.TimeBasedRollingPolicy;
import com.gentoro.warmpath.activation.InvitationService;
import com.gentoro.warmpath.actuator.ActuatorService;
import com.gentoro.warmpath.api.WarmPathApi;
import com.gentoro.warmpath.exception.EvidenceStoreException;
import com.gentoro.warmpath.exception.StateException;
import com.gentoro.warmpath.exception.WarmPathErrorCode;
import com.gentoro.warmpath.exception.WarmPathException;
import com.gentoro.warmpath.graph.GraphMaintenanceScheduler;
import com.gentoro.warmpath.graph.GraphService;
import com.gentoro.warmpath.graph.GraphStats;
import com.gentoro.warmpath.http.EmbeddedJettyServer;
import com.gentoro.warmpath.ingestion.RelationshipIngestionService;
import com.gentoro.warmpath.matching.FuzzyIdentityMatcher;
import com.gentoro.warmpath.notification.NotificationDispatcher;
import com.gentoro.warmpath.notification.NotificationDispatcherFactory;
import com.gentoro.warmpath.pathfinding.PathDiscoveryService;
import com.gentoro.warmpath.store.EvidenceStore;
import com.gentoro.warmpath.store.EvidenceStoreFactory;
import com.gentoro.warmpath.utility.JacksonUtility;
import java.io.File;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Application object: loads configuration, wires every service and owns their lifecycle.
 *
 * <p>In {@code server} mode the graph is rebuilt (or loaded from the store), the HTTP API and
 * maintenance scheduler are started and the caller usually blocks on {@link
 * #waitShutdownSignal()}. In {@code rebuild} mode a single rebuild runs and its statistics are
 * printed as JSON.
 */
public class WarmPath {

  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(WarmPath.class);

  private final StartupParameters startupParameters;
  private final Clock clock;
  private ConfigurationProvider configurationProvider;
  private EvidenceStore evidenceStore;
  private GraphService graphService;
  private FuzzyIdentityMatcher matcher;
  private PathDiscoveryService pathDiscovery;
  private NotificationDispatcher dispatcher;
  private InvitationService invitations;
  private EmbeddedJettyServer httpServer;
  private GraphMaintenanceScheduler scheduler;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public WarmPath(String[] applicationArgs) {
    this(applicationArgs, Clock.systemUTC());
  }

  public WarmPath(String[] applicationArgs, Clock clock) {
    this.startupParameters = new StartupParameters(applicationArgs);
    this.clock = clock;
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    // Apply logging levels from application.yaml as early as possible
    com.gentoro.warmpath.logging.LoggingService.applyConfiguration(configuration());

    this.evidenceStore = EvidenceStoreFactory.create(configuration());
    RelationshipIngestionService ingestion =
        new RelationshipIngestionService(configuration(), clock);
    this.graphService = new GraphService(configuration(), evidenceStore, ingestion, clock);
    this.matcher = new FuzzyIdentityMatcher(configuration(), graphService);
    this.pathDiscovery = new PathDiscoveryService(configuration(), graphService, matcher);
    this.dispatcher = NotificationDispatcherFactory.create(configuration());
    this.invitations =
        new InvitationService(configuration(), evidenceStore, graphService, dispatcher, clock);
    log.info(
        "WarmPath initialized with store '{}' and notification driver '{}'",
        evidenceStore.driver(),
        dispatcher.id());

    switch (startupParameters.mode()) {
      case "server":
        startServer();
        break;
      case "rebuild":
        configureFileOnlyLogging();
        GraphStats stats = graphService.rebuildGraph();
        System.out.println(JacksonUtility.toJson(stats));
        shutdown();
        break;
      default:
        shutdown();
        throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  private void startServer() {
    if (configuration().getBoolean("ingestion.rebuildOnStartup", true)) {
      try {
        graphService.rebuildGraph();
      } catch (EvidenceStoreException e) {
        // the scheduler retries while the graph has never been rebuilt
        log.error("Initial graph rebuild failed, serving an empty graph for now", e);
      }
    } else {
      graphService.loadPersisted();
    }

    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new WarmPathApi(this).register();
      new ActuatorService(this).register();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw new WarmPathException(
          WarmPathErrorCode.NETWORK_ERROR, "Could not start http server", e);
    }

    this.scheduler =
        new GraphMaintenanceScheduler(configuration(), graphService, invitations::expireOverdue);
    scheduler.start();
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "warmpath-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }

    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Release resources. Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        closeQuietly(scheduler);
        closeQuietly(httpServer);
        closeQuietly(evidenceStore);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public boolean isShutdown() {
    return shuttingDown.get();
  }

  private void closeQuietly(AutoCloseable closeable) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (Exception e) {
        log.warn("Failed to close {}", closeable.getClass().getSimpleName(), e);
      }
    }
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("WarmPath not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public EvidenceStore evidenceStore() {
    return evidenceStore;
  }

  public GraphService graphService() {
    return graphService;
  }

  public FuzzyIdentityMatcher matcher() {
    return matcher;
  }

  public PathDiscoveryService pathDiscovery() {
    return pathDiscovery;
  }

  public InvitationService invitations() {
    return invitations;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }

  /**
   * Reconfigure Logback to disable console output and enable only file-based logging, so that the
   * statistics printed by {@code rebuild} mode are the only thing on standard output.
   */
  private void configureFileOnlyLogging() {
    LoggerContext context = (LoggerContext) org.slf4j.LoggerFactory.getILoggerFactory();
    ch.qos.logback.classic.Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

    for (java.util.Iterator<Appender<ILoggingEvent>> it = root.iteratorForAppenders();
        it.hasNext(); ) {
      Appender<ILoggingEvent> app = it.next();
      if (app instanceof ConsoleAppender) {
        root.detachAppender(app);
      }
    }

    File logsDir = new File(configuration().getString("logging.dir", "logs"));
    if (!logsDir.exists()) {
      // noinspection ResultOfMethodCallIgnored
      logsDir.mkdirs();
    }

    RollingFileAppender<ILoggingEvent> fileAppender = new RollingFileAppender<>();
    fileAppender.setContext(context);
    fileAppender.setName("FILE");
    fileAppender.setFile(new File(logsDir, "warmpath.log").getPath());

    TimeBasedRollingPolicy<ILoggingEvent> rollingPolicy = new TimeBasedRollingPolicy<>();
    rollingPolicy.setContext(context);
    rollingPolicy.setParent(fileAppender);
    rollingPolicy.setFileNamePattern(
        new File(logsDir, "warmpath.%d{yyyy-MM-dd}.log.gz").getPath());
    rollingPolicy.setMaxHistory(7);
    rollingPolicy.start();

    PatternLayoutEncoder encoder = new PatternLayoutEncoder();
    encoder.setContext(context);
    encoder.setPattern("%d{yyyy-MM-dd HH:mm:ss.SSS} [%thread] %-5level %logger{36} - %msg%n");
    encoder.start();

    fileAppender.setEncoder(encoder);
    fileAppender.setRollingPolicy(rollingPolicy);
    fileAppender.start();

    root.addAppender(fileAppender);
    log.info("Rebuild mode: logging to {}", new File(logsDir, "warmpath.log").getPath());
  }
}
