package com.gentoro.contextmcp.http;

import com.gentoro.contextmcp.exception.ConfigException;
import com.gentoro.contextmcp.exception.ExceptionUtil;
import com.gentoro.contextmcp.exception.NetworkException;
import com.gentoro.contextmcp.exception.StateException;
import jakarta.servlet.http.HttpServlet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.commons.configuration2.Configuration;
import org.eclipse.jetty.ee10.servlet.ServletContextHandler;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;

/**
 * Embedded Jetty 12 server hosting the MCP transport and the actuator under one root context.
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.hostname</b>: listen address; default "0.0.0.0" (all interfaces)
 *   <li><b>http.port</b>: listen port; 0 picks a free port; default 8080
 *   <li><b>http.idle-timeout-ms</b>: connector idle timeout; default 30000
 *   <li><b>http.stop-timeout-ms</b>: grace period for in-flight requests on stop; default 5000
 * </ul>
 */
public class EmbeddedJettyServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(EmbeddedJettyServer.class);

  private static final String ALL_INTERFACES = "0.0.0.0";
  private static final String BIND_FAILURE =
      "Could not bind the HTTP listener. Check that the configured port and hostname are"
          + " available and that this process may listen on them";

  /** Listener settings resolved once from configuration. */
  public record Settings(String hostname, int port, long idleTimeoutMs, long stopTimeoutMs) {

    public static Settings from(Configuration cfg) {
      try {
        String hostname = cfg.getString("http.hostname", ALL_INTERFACES);
        if (hostname == null || hostname.isBlank()) {
          throw new ConfigException("Missing http.hostname configuration");
        }
        int port = cfg.getInt("http.port", 8080);
        if (port < 0 || port > 65535) {
          throw new ConfigException("http.port out of range: " + port);
        }
        return new Settings(
            hostname.trim(),
            port,
            cfg.getLong("http.idle-timeout-ms", 30_000L),
            cfg.getLong("http.stop-timeout-ms", 5_000L));
      } catch (RuntimeException e) {
        throw ExceptionUtil.toDomainException(
            e, ex -> new ConfigException("Invalid http configuration", ex));
      }
    }
  }

  private final Settings settings;
  private final Object lifecycleLock = new Object();
  private final List<String> mounted = new ArrayList<>();
  private Server server;
  private ServletContextHandler contextHandler;

  public EmbeddedJettyServer(Configuration configuration) {
    this(Settings.from(configuration));
  }

  public EmbeddedJettyServer(Settings settings) {
    this.settings = settings;
  }

  /** Build the server and its root context without binding the port. */
  public void prepare() {
    synchronized (lifecycleLock) {
      if (server != null) {
        log.trace("Server already prepared");
        return;
      }
      log.trace("Preparing http listener {}:{}", settings.hostname(), settings.port());
      server = new Server();
      server.setStopTimeout(settings.stopTimeoutMs());
      ServerConnector connector = new ServerConnector(server);
      if (!ALL_INTERFACES.equals(settings.hostname())) {
        connector.setHost(settings.hostname());
      }
      connector.setPort(settings.port());
      connector.setIdleTimeout(settings.idleTimeoutMs());
      server.addConnector(connector);

      contextHandler = new ServletContextHandler();
      contextHandler.setContextPath("/");
      server.setHandler(contextHandler);
    }
  }

  /**
   * Register {@code servlet} at {@code pathSpec}. Mounting is only allowed between {@link
   * #prepare()} and {@link #start()}.
   */
  public void mount(String pathSpec, HttpServlet servlet) {
    synchronized (lifecycleLock) {
      if (contextHandler == null) {
        throw new StateException("Cannot mount " + pathSpec + " before prepare()");
      }
      if (server.isStarted()) {
        throw new StateException("Cannot mount " + pathSpec + " on a running server");
      }
      if (mounted.contains(pathSpec)) {
        throw new StateException("Path already mounted: " + pathSpec);
      }
      contextHandler.addServlet(new ServletHolder(servlet), pathSpec);
      mounted.add(pathSpec);
      log.debug("Mounted {} at {}", servlet.getClass().getSimpleName(), pathSpec);
    }
  }

  public List<String> mountedPaths() {
    synchronized (lifecycleLock) {
      return Collections.unmodifiableList(new ArrayList<>(mounted));
    }
  }

  public void start() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        log.trace("Server already started");
        return;
      }
      if (server == null) {
        log.warn("Called start() before prepare()");
        prepare();
      }
      try {
        server.start();
        log.info("Jetty listening on http://{}:{} {}", displayHost(), getPort(), mounted);
      } catch (Exception e) {
        throw ExceptionUtil.toDomainException(e, ex -> new NetworkException(BIND_FAILURE, ex));
      }
    }
  }

  public void stop() {
    synchronized (lifecycleLock) {
      if (server == null) return;
      try {
        if (server.isRunning() || server.isStarting()) {
          server.stop();
          log.info("Jetty stopped");
        }
      } catch (Exception e) {
        // keep stopping the remaining services
        log.error("Error stopping jetty server", e);
      } finally {
        server = null;
        contextHandler = null;
        mounted.clear();
      }
    }
  }

  public void join() throws InterruptedException {
    Server s;
    synchronized (lifecycleLock) {
      s = this.server;
    }
    if (s != null) s.join();
  }

  public boolean isRunning() {
    synchronized (lifecycleLock) {
      return server != null && server.isRunning();
    }
  }

  /** The bound port once started, the configured one before. */
  public int getPort() {
    synchronized (lifecycleLock) {
      if (server != null && server.isStarted()) {
        return ((ServerConnector) server.getConnectors()[0]).getLocalPort();
      }
      return settings.port();
    }
  }

  private String displayHost() {
    return ALL_INTERFACES.equals(settings.hostname()) ? "localhost" : settings.hostname();
  }

  @Override
  public void close() {
    stop();
  }
}
