package com.gentoro.warmpath.api;

import com.gentoro.warmpath.WarmPath;
import com.gentoro.warmpath.activation.ActivationData;
import com.gentoro.warmpath.activation.ActivationResult;
import com.gentoro.warmpath.exception.ErrorDetails;
import com.gentoro.warmpath.exception.ExceptionUtil;
import com.gentoro.warmpath.exception.SerializationException;
import com.gentoro.warmpath.exception.ValidationException;
import com.gentoro.warmpath.exception.WarmPathException;
import com.gentoro.warmpath.graph.GraphService;
import com.gentoro.warmpath.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/**
 * JSON endpoints over the WarmPath services, registered on the shared Jetty context under {@code
 * http.api.context-path} (default {@code /api}).
 *
 * <p>Errors are answered with an {@link ErrorDetails} body and the status given by {@link
 * ExceptionUtil#httpStatus}.
 */
public class WarmPathApi {
  private static final org.slf4j.Logger log =
      com.gentoro.warmpath.logging.LoggingService.getLogger(WarmPathApi.class);

  private final WarmPath warmPath;

  public WarmPathApi(WarmPath warmPath) {
    this.warmPath = warmPath;
  }

  record InvitationRequest(String ghostId, String requesterId, String targetId) {}

  record ActivationRequest(
      String token, String name, String email, String company, String title, String location) {}

  private String contextPath() {
    String contextPath = warmPath.configuration().getString("http.api.context-path", "/api");
    if (contextPath == null || !contextPath.startsWith("/")) {
      throw new ValidationException("Invalid http.api.context-path: " + contextPath);
    }
    return contextPath.endsWith("/")
        ? contextPath.substring(0, contextPath.length() - 1)
        : contextPath;
  }

  /** Register the API servlets on the shared Jetty context handler. */
  public void register() {
    String base = contextPath();
    add(new RebuildServlet(), base + "/graph/rebuild");
    add(new GraphStatsServlet(), base + "/graph/stats");
    add(new ConnectionsServlet(), base + "/connections");
    add(new ConnectionSearchServlet(), base + "/connections/search");
    add(new ResolveTargetServlet(), base + "/targets/resolve");
    add(new InvitationsServlet(), base + "/invitations");
    add(new ActivationServlet(), base + "/invitations/activate");
    add(new InvitationStatsServlet(), base + "/invitations/stats");
    log.info("WarmPath API registered under {}/*", base);
  }

  private void add(HttpServlet servlet, String path) {
    warmPath.httpServer().getContextHandler().addServlet(new ServletHolder(servlet), path);
  }

  /** Base servlet turning thrown exceptions into error responses. */
  private abstract static class ApiServlet extends HttpServlet {
    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      try {
        super.service(req, resp);
      } catch (WarmPathException e) {
        int status = ExceptionUtil.httpStatus(e.getCode());
        if (status >= 500) {
          log.error("{} {} failed", req.getMethod(), req.getRequestURI(), e);
        } else {
          log.debug("{} {} rejected: {}", req.getMethod(), req.getRequestURI(), e.getMessage());
        }
        sendJson(resp, status, ExceptionUtil.toErrorDetails(e));
      } catch (RuntimeException e) {
        log.error("{} {} failed", req.getMethod(), req.getRequestURI(), e);
        sendJson(resp, 500, ExceptionUtil.toErrorDetails(e));
      } catch (jakarta.servlet.ServletException e) {
        log.error("{} {} failed", req.getMethod(), req.getRequestURI(), e);
        sendJson(resp, 500, ExceptionUtil.toErrorDetails(e));
      }
    }
  }

  private class RebuildServlet extends ApiServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      GraphService graph = warmPath.graphService();
      boolean force = Boolean.parseBoolean(req.getParameter("force"));
      sendJson(resp, 200, force ? graph.forceRebuild() : graph.rebuildGraph());
    }
  }

  private class GraphStatsServlet extends ApiServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      sendJson(resp, 200, warmPath.graphService().stats());
    }
  }

  private class ConnectionsServlet extends ApiServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      sendJson(
          resp,
          200,
          warmPath
              .pathDiscovery()
              .findConnections(
                  required(req, "source"), required(req, "target"), intParam(req, "maxHops")));
    }
  }

  private class ConnectionSearchServlet extends ApiServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      sendJson(
          resp,
          200,
          warmPath
              .pathDiscovery()
              .findConnectionsByDescription(
                  required(req, "source"),
                  required(req, "name"),
                  req.getParameter("company"),
                  req.getParameter("title"),
                  intParam(req, "maxHops")));
    }
  }

  private class ResolveTargetServlet extends ApiServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      sendJson(
          resp,
          200,
          warmPath
              .matcher()
              .resolveTarget(
                  req.getParameter("requester"),
                  req.getParameter("name"),
                  req.getParameter("company"),
                  req.getParameter("title")));
    }
  }

  private class InvitationsServlet extends ApiServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      InvitationRequest body = readBody(req, InvitationRequest.class);
      sendJson(
          resp,
          201,
          warmPath
              .invitations()
              .createInvitation(body.ghostId(), body.requesterId(), body.targetId()));
    }
  }

  private class ActivationServlet extends ApiServlet {
    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      ActivationRequest body = readBody(req, ActivationRequest.class);
      ActivationResult result =
          warmPath
              .invitations()
              .activateProfile(
                  body.token(),
                  new ActivationData(
                      body.name(), body.email(), body.company(), body.title(), body.location()));
      sendJson(resp, result.success() ? 200 : 400, result);
    }
  }

  private class InvitationStatsServlet extends ApiServlet {
    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      sendJson(resp, 200, warmPath.invitations().stats());
    }
  }

  private static <T> T readBody(HttpServletRequest req, Class<T> type) throws IOException {
    T body;
    try {
      body = JacksonUtility.fromJson(req.getInputStream(), type);
    } catch (SerializationException e) {
      throw new ValidationException("Malformed JSON request body", e);
    }
    if (body == null) {
      throw new ValidationException("Missing JSON request body");
    }
    return body;
  }

  private static String required(HttpServletRequest req, String name) {
    String value = req.getParameter(name);
    if (value == null || value.isBlank()) {
      throw new ValidationException(
          "Missing query parameter: " + name, Map.of("parameter", name));
    }
    return value.trim();
  }

  private static Integer intParam(HttpServletRequest req, String name) {
    String value = req.getParameter(name);
    if (value == null || value.isBlank()) return null;
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ValidationException(
          "Query parameter " + name + " must be an integer", Map.of(name, value));
    }
  }

  static void sendJson(HttpServletResponse resp, int code, Object response) throws IOException {
    String json = JacksonUtility.toJson(response);
    log.trace("Sending response ({}):\n{}\n---\n", code, json);
    resp.setStatus(code);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    try (PrintWriter out = resp.getWriter()) {
      out.println(json);
    }
  }
}
