package com.gentoro.contextmcp;

import com.gentoro.contextmcp.exception.ValidationException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Command line options given as {@code --name value} pairs. */
public class StartupParameters {

  public static final String MODE_SERVER = "server";
  public static final String MODE_PROVISION_USER = "provision-user";
  public static final String MODE_CLEANUP_AUDIT = "cleanup-audit";
  public static final String MODE_HELP = "help";

  private static final Set<String> MODES =
      Set.of(MODE_SERVER, MODE_PROVISION_USER, MODE_CLEANUP_AUDIT, MODE_HELP);

  final Map<String, String> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", MODE_SERVER);
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, String> parseArguments(String[] arguments) {
    Map<String, String> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    String mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode)) {
      throw new ValidationException("Invalid mode: " + mode);
    }
    String configFile = parameters.get("config-file");
    if (configFile == null || configFile.isBlank()) {
      throw new ValidationException("Missing config file location");
    }
    if (MODE_PROVISION_USER.equals(mode)) {
      for (String required : new String[] {"username", "email"}) {
        if (getOptionalParameter(required).isEmpty()) {
          throw new ValidationException("--" + required + " is required for " + mode);
        }
      }
    }
    if (MODE_CLEANUP_AUDIT.equals(mode) && parameters.containsKey("retention-days")) {
      retentionDays();
    }
  }

  public String mode() {
    return parameters.get("mode");
  }

  /**
   * Returns the configuration location string. Examples: "classpath:application.yaml",
   * "/etc/context-mcp.yaml", "config/local.yaml".
   */
  public String configFile() {
    return getOptionalParameter("config-file").orElse("classpath:application.yaml");
  }

  /** Days of audit history kept by {@code cleanup-audit}; 365 unless given. */
  public int retentionDays() {
    String value = getOptionalParameter("retention-days").orElse("365");
    try {
      int days = Integer.parseInt(value.trim());
      if (days < 1) throw new NumberFormatException("must be positive");
      return days;
    } catch (NumberFormatException e) {
      throw new ValidationException("--retention-days must be a positive integer: " + value, e);
    }
  }

  public String getParameter(String name) {
    return parameters.get(name);
  }

  public Optional<String> getOptionalParameter(String name) {
    return Optional.ofNullable(parameters.get(name)).filter(v -> !v.isBlank());
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }

  public static String usage() {
    return String.join(
        "\n",
        "Usage: context-mcp [--config-file <location>] [--mode <mode>] [options]",
        "",
        "Modes:",
        "  server          Serve MCP over HTTP (default)",
        "  provision-user  Create a user and print its API key",
        "                  --username <name> --email <email> [--password <pw>]",
        "                  [--role admin|user|readonly]",
        "  cleanup-audit   Delete audit entries older than --retention-days (365)",
        "  help            Print this message");
  }
}
