package com.gentoro.contextmcp.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.contextmcp.ContextMcp;
import com.gentoro.contextmcp.audit.RequestOrigin;
import com.gentoro.contextmcp.context.CollectionQuery;
import com.gentoro.contextmcp.exception.ExceptionUtil;
import com.gentoro.contextmcp.store.Row;
import com.gentoro.contextmcp.tool.JsonSchemas;
import com.gentoro.contextmcp.tool.ToolDefinition;
import com.gentoro.contextmcp.tool.ToolOutcome;
import com.gentoro.contextmcp.utility.JacksonUtility;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.server.transport.HttpServletStreamableServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.apache.commons.configuration2.Configuration;

/**
 * Streamable-HTTP MCP endpoint backed by the official MCP Java SDK and mounted on the shared Jetty
 * context.
 *
 * <p>Every registered tool is published with its JSON schema and routed through the tool
 * dispatcher. Three read-only resources are also published:
 *
 * <ul>
 *   <li><b>context://collections</b>: collections visible to the resource reader
 *   <li><b>context://schema</b>: column listing of the store tables
 *   <li><b>context://stats</b>: server, store, cache and audit channel statistics
 * </ul>
 *
 * <p>Configuration keys:
 *
 * <ul>
 *   <li><b>http.mcp.endpoint</b> (string): servlet path; default: "/mcp"
 *   <li><b>http.mcp.disallow-delete</b> (boolean): reject HTTP DELETE; default: false
 *   <li><b>http.mcp.server.name</b> / <b>http.mcp.server.version</b>: reported to clients
 * </ul>
 */
public class McpServer implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(McpServer.class);

  public static final String COLLECTIONS_URI = "context://collections";
  public static final String SCHEMA_URI = "context://schema";
  public static final String STATS_URI = "context://stats";
  private static final String JSON = "application/json";

  private final ContextMcp app;
  private HttpServletStreamableServerTransportProvider servletTransport;
  private McpSyncServer mcpServer;

  public McpServer(ContextMcp app) {
    this.app = app;
  }

  /** Build the MCP server and mount its servlet on the shared Jetty context. */
  public void register() {
    Configuration cfg = app.configuration();
    String endpoint = normalizeEndpoint(cfg.getString("http.mcp.endpoint", "/mcp"));
    boolean disallowDelete = cfg.getBoolean("http.mcp.disallow-delete", false);

    var json = new JacksonMcpJsonMapper(new ObjectMapper());
    servletTransport =
        HttpServletStreamableServerTransportProvider.builder()
            .jsonMapper(json)
            .mcpEndpoint(endpoint)
            .disallowDelete(disallowDelete)
            .build();

    mcpServer =
        io.modelcontextprotocol.server.McpServer.sync(servletTransport)
            .serverInfo(app.serverName(), app.serverVersion())
            .capabilities(
                McpSchema.ServerCapabilities.builder()
                    .tools(true)
                    .resources(false, false)
                    .logging()
                    .build())
            .tools(toolSpecifications())
            .resources(resourceSpecifications())
            .build();

    app.httpServer().mount(endpoint, servletTransport);
    log.info(
        "MCP servlet registered at http://localhost:{}{} with {} tool(s)",
        app.httpServer().getPort(),
        endpoint,
        app.dispatcher().definitions().size());
  }

  List<McpServerFeatures.SyncToolSpecification> toolSpecifications() {
    List<McpServerFeatures.SyncToolSpecification> specs = new ArrayList<>();
    for (ToolDefinition definition : app.dispatcher().definitions()) {
      specs.add(
          McpServerFeatures.SyncToolSpecification.builder()
              .tool(
                  McpSchema.Tool.builder()
                      .name(definition.name())
                      .description(definition.description())
                      .inputSchema(
                          new McpSchema.JsonSchema(
                              "object",
                              JsonSchemas.properties(definition),
                              JsonSchemas.required(definition),
                              false,
                              Collections.emptyMap(),
                              Collections.emptyMap()))
                      .build())
              .callHandler(
                  (srv, request) -> {
                    ToolOutcome outcome =
                        app.dispatcher()
                            .dispatch(
                                definition.name(),
                                request.arguments(),
                                request.meta(),
                                originOf(srv));
                    return new McpSchema.CallToolResult(outcome.content(), outcome.error());
                  })
              .build());
    }
    return specs;
  }

  List<McpServerFeatures.SyncResourceSpecification> resourceSpecifications() {
    return List.of(
        resource(
            COLLECTIONS_URI,
            "Context Collections",
            "Collections visible to the reader",
            () ->
                app.contexts()
                    .listCollections(
                        new CollectionQuery(true, null, 200, 0), app.resourceReader())),
        resource(SCHEMA_URI, "Database Schema", "Columns of the store tables", this::schema),
        resource(STATS_URI, "Server Statistics", "Server statistics and health", this::stats));
  }

  private McpServerFeatures.SyncResourceSpecification resource(
      String uri, String name, String description, Supplier<Object> reader) {
    McpSchema.Resource resource =
        McpSchema.Resource.builder()
            .uri(uri)
            .name(name)
            .description(description)
            .mimeType(JSON)
            .build();
    return new McpServerFeatures.SyncResourceSpecification(
        resource,
        (exchange, request) -> {
          String text;
          try {
            text = JacksonUtility.toWireJson(reader.get());
          } catch (RuntimeException e) {
            log.error("Failed to read resource {}", uri, e);
            text = JacksonUtility.toWireJson(ExceptionUtil.toErrorDetails(e));
          }
          return new McpSchema.ReadResourceResult(
              List.of(new McpSchema.TextResourceContents(uri, JSON, text)));
        });
  }

  /** Columns grouped by table, in ordinal order. */
  Map<String, List<Map<String, Object>>> schema() {
    Map<String, List<Map<String, Object>>> tables = new LinkedHashMap<>();
    for (Row row : app.store().describeSchema()) {
      Map<String, Object> column = new LinkedHashMap<>();
      column.put("column", row.getString("column_name"));
      column.put("type", row.getString("data_type"));
      column.put("nullable", "YES".equalsIgnoreCase(row.getString("is_nullable")));
      tables.computeIfAbsent(row.getString("table_name"), k -> new ArrayList<>()).add(column);
    }
    return tables;
  }

  Map<String, Object> stats() {
    Runtime runtime = Runtime.getRuntime();
    Map<String, Object> server = new LinkedHashMap<>();
    server.put("name", app.serverName());
    server.put("version", app.serverVersion());
    server.put("started_at", app.startedAt());
    server.put("uptime_seconds", Duration.between(app.startedAt(), Instant.now()).getSeconds());
    server.put("memory_used_bytes", runtime.totalMemory() - runtime.freeMemory());
    server.put("memory_max_bytes", runtime.maxMemory());
    server.put("threads", ManagementFactory.getThreadMXBean().getThreadCount());

    Map<String, Object> stats = new LinkedHashMap<>();
    stats.put("server", server);
    stats.put("store", app.store().healthCheck());
    stats.put("cache", app.cache().stats());
    stats.put("audit_channel", app.auditChannel().stats());
    return stats;
  }

  private static RequestOrigin originOf(McpSyncServerExchange exchange) {
    McpSchema.Implementation client = exchange == null ? null : exchange.getClientInfo();
    if (client == null) return RequestOrigin.UNKNOWN;
    return new RequestOrigin(
        null, client.name() + "/" + Objects.requireNonNullElse(client.version(), "unknown"));
  }

  @Override
  public void close() {
    if (mcpServer != null) {
      try {
        mcpServer.closeGracefully();
      } finally {
        mcpServer = null;
      }
    }
    if (servletTransport != null) {
      try {
        servletTransport.destroy();
      } finally {
        servletTransport = null;
      }
    }
  }

  private static String normalizeEndpoint(String endpoint) {
    if (endpoint == null || endpoint.isBlank()) return "/mcp";
    return endpoint.startsWith("/") ? endpoint : "/" + endpoint;
  }
}
