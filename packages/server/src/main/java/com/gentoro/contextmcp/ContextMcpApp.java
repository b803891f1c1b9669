package com.gentoro.contextmcp;

import com.gentoro.contextmcp.utility.StdoutUtility;
import java.util.Objects;

public class ContextMcpApp {

  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(ContextMcpApp.class);

  public static void main(String[] args) {
    ContextMcp app;
    try {
      app = new ContextMcp(args);
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      StdoutUtility.printError(
          Objects.requireNonNullElse(e.getMessage(), "Application failed to start"), e);
      System.exit(1);
      return;
    }
    if (!app.isShutdown()) {
      app.waitShutdownSignal();
    }
  }
}
