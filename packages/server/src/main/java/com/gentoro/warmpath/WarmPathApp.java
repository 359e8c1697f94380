package com.gentoro.warmpath;

public class WarmPathApp {

  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(WarmPathApp.class);

  static final String USAGE =
      """
      Usage: warmpath [--mode server|rebuild|help] [--config-file <location>]

        --mode server     rebuild the graph, serve the HTTP API and run maintenance (default)
        --mode rebuild    rebuild the graph once and print its statistics as JSON
        --mode help       print this message
        --config-file     classpath:<resource>, file:<uri> or a path
                          (default classpath:application.yaml)
      """;

  public static void main(String[] args) {
    WarmPath app;
    try {
      app = new WarmPath(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.print(USAGE);
      System.exit(2);
      return;
    }
    if ("help".equals(app.startupParameters().mode())) {
      System.out.print(USAGE);
      return;
    }

    try {
      app.initialize();
      if ("server".equals(app.startupParameters().mode())) {
        app.waitShutdownSignal();
      }
    } catch (Exception e) {
      log.error("Application failed to start", e);
      app.shutdown();
      System.exit(1);
    }
  }
}
