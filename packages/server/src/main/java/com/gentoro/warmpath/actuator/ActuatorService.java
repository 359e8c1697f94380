package com.gentoro.warmpath.actuator;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.warmpath.WarmPath;
import com.gentoro.warmpath.graph.GraphIndex;
import com.gentoro.warmpath.graph.GraphService;
import com.gentoro.warmpath.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * Health check endpoint in the style of Spring Boot's actuator, at {@code /actuator/health}.
 *
 * <p>Response body:
 *
 * <pre>{"status":"UP","graph":{"nodes":..,"edges":..,"builtAt":..,"rebuilding":false},
 * "store":"in-memory"}</pre>
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(ActuatorService.class);

  private final WarmPath warmPath;

  public ActuatorService(WarmPath warmPath) {
    this.warmPath = warmPath;
  }

  /** Register the actuator servlet with the shared Jetty context handler. */
  public void register() {
    warmPath
        .httpServer()
        .getContextHandler()
        .addServlet(new ServletHolder(new ActuatorServlet()), "/actuator/health");
    log.info("Actuator health endpoint registered at /actuator/health");
  }

  private class ActuatorServlet extends HttpServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      GraphService graphService = warmPath.graphService();
      GraphIndex index = graphService.snapshot();

      ObjectNode payload = JacksonUtility.getJsonMapper().createObjectNode();
      payload.put("status", "UP");
      ObjectNode graph = payload.putObject("graph");
      graph.put("nodes", index.nodeCount());
      graph.put("edges", index.edgeCount());
      graph.put("builtAt", index.builtAt() == null ? null : index.builtAt().toString());
      graph.put("rebuilding", graphService.isRebuilding());
      graph.put("stale", graphService.shouldRebuild());
      payload.put("store", warmPath.evidenceStore().driver());

      resp.setStatus(200);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println(JacksonUtility.toJson(payload));
      }
    }
  }
}
