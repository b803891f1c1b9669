package com.gentoro.contextmcp.actuator;

import com.gentoro.contextmcp.http.EmbeddedJettyServer;
import com.gentoro.contextmcp.store.StoreGateway;
import com.gentoro.contextmcp.store.StoreHealth;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;

/**
 * Health endpoint in the style of Spring Boot's actuator, registered at {@code /actuator/health}.
 *
 * <p>Responds {@code 200 {"status":"UP"}} while the store answers, {@code 503 {"status":"DOWN"}}
 * otherwise.
 */
public class ActuatorService {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(ActuatorService.class);

  public static final String HEALTH_PATH = "/actuator/health";

  private final EmbeddedJettyServer httpServer;
  private final StoreGateway store;

  public ActuatorService(EmbeddedJettyServer httpServer, StoreGateway store) {
    this.httpServer = httpServer;
    this.store = store;
  }

  public void register() {
    httpServer.mount(HEALTH_PATH, new ActuatorServlet(store));
    log.info("Actuator health endpoint registered at {}", HEALTH_PATH);
  }

  static class ActuatorServlet extends HttpServlet {
    private final transient StoreGateway store;

    ActuatorServlet(StoreGateway store) {
      this.store = store;
    }

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
      StoreHealth health = store.healthCheck();
      resp.setStatus(health.isHealthy() ? 200 : 503);
      resp.setContentType("application/json");
      try (PrintWriter out = resp.getWriter()) {
        out.println("{\"status\": \"" + (health.isHealthy() ? "UP" : "DOWN") + "\"}");
      }
    }
  }
}
