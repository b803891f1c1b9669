package com.gentoro.contextmcp;

import com.gentoro.contextmcp.actuator.ActuatorService;
import com.gentoro.contextmcp.analytics.AnalyticsService;
import com.gentoro.contextmcp.audit.AuditChannel;
import com.gentoro.contextmcp.audit.AuditService;
import com.gentoro.contextmcp.cache.CaffeineContextCache;
import com.gentoro.contextmcp.cache.ContextCache;
import com.gentoro.contextmcp.context.ContextRepository;
import com.gentoro.contextmcp.context.ContextService;
import com.gentoro.contextmcp.exception.NetworkException;
import com.gentoro.contextmcp.exception.StateException;
import com.gentoro.contextmcp.http.EmbeddedJettyServer;
import com.gentoro.contextmcp.identity.IdentityService;
import com.gentoro.contextmcp.identity.PermissionResolver;
import com.gentoro.contextmcp.identity.Role;
import com.gentoro.contextmcp.identity.SecuritySettings;
import com.gentoro.contextmcp.identity.User;
import com.gentoro.contextmcp.logging.LoggingService;
import com.gentoro.contextmcp.mcp.McpServer;
import com.gentoro.contextmcp.search.SearchEngine;
import com.gentoro.contextmcp.store.StoreGateway;
import com.gentoro.contextmcp.tool.ArgumentValidator;
import com.gentoro.contextmcp.tool.ContextTools;
import com.gentoro.contextmcp.tool.ToolDispatcher;
import com.gentoro.contextmcp.utility.JacksonUtility;
import com.gentoro.contextmcp.utility.StdoutUtility;
import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import org.apache.commons.configuration2.Configuration;

/**
 * Application root: loads configuration, wires every component explicitly, runs the selected
 * mode and releases resources on shutdown.
 */
public class ContextMcp {

  private static final org.slf4j.Logger log = LoggingService.getLogger(ContextMcp.class);

  private final StartupParameters startupParameters;
  private final Clock clock;
  private ConfigurationProvider configurationProvider;
  private StoreGateway store;
  private AuditChannel auditChannel;
  private AuditService audit;
  private IdentityService identity;
  private PermissionResolver permissions;
  private ContextCache cache;
  private ContextService contexts;
  private AnalyticsService analytics;
  private SearchEngine search;
  private ToolDispatcher dispatcher;
  private EmbeddedJettyServer httpServer;
  private McpServer mcpServer;
  private Instant startedAt;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public ContextMcp(String[] applicationArgs) {
    this(new StartupParameters(applicationArgs), Clock.systemUTC());
  }

  public ContextMcp(StartupParameters startupParameters, Clock clock) {
    this.startupParameters = startupParameters;
    this.clock = clock;
  }

  /**
   * Run the selected mode. {@code server} returns once the HTTP listener is up; the one-shot modes
   * release every resource before returning.
   */
  public void initialize() {
    // Disable java logging entirely.
    LogManager.getLogManager().reset();
    Logger.getLogger("").setLevel(Level.OFF);

    if (StartupParameters.MODE_HELP.equals(startupParameters.mode())) {
      StdoutUtility.printNewLine(StartupParameters.usage());
      shutdown();
      return;
    }

    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());
    log.debug("Effective configuration: {}", configurationProvider.describe());
    this.startedAt = clock.instant();
    initializeServices();

    switch (startupParameters.mode()) {
      case StartupParameters.MODE_SERVER -> startServer();
      case StartupParameters.MODE_PROVISION_USER -> runOnce(this::provisionUser);
      case StartupParameters.MODE_CLEANUP_AUDIT -> runOnce(this::cleanupAudit);
      default -> {
        shutdown();
        throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
      }
    }
  }

  /** Build the service graph from configuration, leaves first. */
  void initializeServices() {
    Configuration cfg = configuration();
    this.store = StoreGateway.fromConfiguration(cfg);
    this.auditChannel =
        AuditChannel.singleThreaded(
            cfg.getInt("audit.queue-capacity", AuditChannel.DEFAULT_QUEUE_CAPACITY));
    boolean auditEnabled = cfg.getBoolean("features.enable-audit-log", true);
    this.audit = new AuditService(store, auditChannel, clock, auditEnabled);
    this.identity =
        new IdentityService(store, audit, clock, SecuritySettings.fromConfiguration(cfg));
    this.permissions = new PermissionResolver(store, audit, clock);
    this.cache = CaffeineContextCache.fromConfiguration(cfg);
    this.contexts =
        new ContextService(store, new ContextRepository(), permissions, audit, cache, clock);
    this.analytics = new AnalyticsService(store, auditChannel, clock);
    this.search = new SearchEngine(store, analytics);

    boolean authEnabled = cfg.getBoolean("features.enable-auth", true);
    if (!authEnabled) {
      log.warn("Authentication is disabled; every tool call runs as the service user");
    }
    if (!auditEnabled) {
      log.warn("Audit logging is disabled");
    }
    this.dispatcher =
        new ToolDispatcher(
            new ArgumentValidator(),
            identity,
            audit,
            analytics,
            authEnabled,
            serviceUsername());
    new ContextTools(contexts, search, analytics, audit, permissions).registerAll(dispatcher);
  }

  private void startServer() {
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    try {
      new ActuatorService(httpServer, store).register();
      this.mcpServer = new McpServer(this);
      mcpServer.register();
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw new NetworkException("Could not start http server", e);
    }
    log.info("{} {} ready", serverName(), serverVersion());
  }

  private void runOnce(Runnable task) {
    try {
      task.run();
    } finally {
      shutdown();
    }
  }

  private void provisionUser() {
    String password = startupParameters.getOptionalParameter("password").orElse(null);
    Role role = Role.fromString(startupParameters.getOptionalParameter("role").orElse("user"));
    User user =
        identity.createUser(
            startupParameters.getParameter("username"),
            startupParameters.getParameter("email"),
            password,
            role,
            null);
    String apiKey = identity.generateApiKey(user.id());
    StdoutUtility.printSuccessLine(
        "Created %s user %s (%s)".formatted(role.wireName(), user.username(), user.id()));
    StdoutUtility.printNewLine(JacksonUtility.toYaml(user));
    StdoutUtility.printNewLine("API key (shown once): " + apiKey);
  }

  private void cleanupAudit() {
    int days =
        startupParameters.isParameterPresent("retention-days")
            ? startupParameters.retentionDays()
            : configuration().getInt("audit.retention-days", 365);
    int deleted = audit.cleanupOldLogs(days);
    StdoutUtility.printSuccessLine(
        "Deleted %d audit entries older than %d days".formatted(deleted, days));
  }

  /**
   * Block the current thread until a shutdown signal is received (e.g., Ctrl+C or JVM termination).
   * When signaled, this method invokes {@link #shutdown()} to release resources before returning.
   */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "context-mcp-shutdown-hook");
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
        // transport first, so no new work reaches the channel or the pool
        closeQuietly(mcpServer);
        closeQuietly(httpServer);
        closeQuietly(auditChannel);
        closeQuietly(store);
      } finally {
        shutdownLatch.countDown();
      }
    }
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

  public boolean isShutdown() {
    return shuttingDown.get();
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("ContextMcp not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public String serverName() {
    return configuration().getString("http.mcp.server.name", "context-mcp");
  }

  public String serverVersion() {
    return configuration().getString("http.mcp.server.version", "1.0.0");
  }

  private String serviceUsername() {
    return configuration().getString("features.service-user", "context-mcp-service");
  }

  /**
   * Principal used for resource reads, which carry no credentials: the service user when
   * authentication is disabled, otherwise an anonymous reader limited to public data.
   */
  public User resourceReader() {
    if (configuration().getBoolean("features.enable-auth", true)) {
      return User.anonymous();
    }
    return identity.ensureServiceUser(serviceUsername());
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public Instant startedAt() {
    return startedAt;
  }

  public StoreGateway store() {
    return store;
  }

  public AuditChannel auditChannel() {
    return auditChannel;
  }

  public AuditService audit() {
    return audit;
  }

  public IdentityService identity() {
    return identity;
  }

  public PermissionResolver permissions() {
    return permissions;
  }

  public ContextCache cache() {
    return cache;
  }

  public ContextService contexts() {
    return contexts;
  }

  public AnalyticsService analytics() {
    return analytics;
  }

  public SearchEngine search() {
    return search;
  }

  public ToolDispatcher dispatcher() {
    return dispatcher;
  }

  public EmbeddedJettyServer httpServer() {
    return httpServer;
  }
}
