package com.gentoro.contextmcp.tool;

import com.gentoro.contextmcp.exception.ValidationException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Checks raw tool arguments against a {@link ToolDefinition} schema: unknown arguments, required
 * arguments, JSON types, string formats, lengths, ranges and enumerations. The first violation is
 * reported as a {@link ValidationException} naming the offending argument.
 */
public class ArgumentValidator {

  public ToolArguments validate(ToolDefinition definition, Map<String, Object> arguments) {
    Map<String, Object> raw = arguments == null ? Map.of() : arguments;
    return new ToolArguments(validateObject(definition.schema(), raw, ""));
  }

  private Map<String, Object> validateObject(
      ToolProperty schema, Map<?, ?> raw, String pathPrefix) {
    List<ToolProperty> children =
        schema.getProperties() == null ? List.of() : schema.getProperties();
    for (Object key : raw.keySet()) {
      if (children.stream().noneMatch(c -> c.getName().equals(key))) {
        throw invalid(pathPrefix + key, "Unknown argument: " + pathPrefix + key);
      }
    }

    Map<String, Object> normalized = new LinkedHashMap<>();
    for (ToolProperty child : children) {
      String path = pathPrefix + child.getName();
      Object value = raw.get(child.getName());
      if (value == null) {
        if (child.isRequired()) {
          throw invalid(path, "Missing required argument: " + path);
        }
        value = child.getDefaultValue();
        if (value == null) continue;
      }
      normalized.put(child.getName(), validateValue(child, value, path));
    }
    return normalized;
  }

  private Object validateValue(ToolProperty property, Object value, String path) {
    return switch (property.getType()) {
      case STRING -> validateString(property, value, path);
      case BOOLEAN -> {
        if (!(value instanceof Boolean)) throw typeMismatch(path, "boolean");
        yield value;
      }
      case INTEGER -> validateInteger(property, value, path);
      case NUMBER -> {
        if (!(value instanceof Number)) throw typeMismatch(path, "number");
        yield value;
      }
      case ARRAY -> validateArray(property, value, path);
      case OBJECT -> {
        if (!(value instanceof Map<?, ?> map)) throw typeMismatch(path, "object");
        if (property.getProperties() == null) {
          Map<String, Object> copy = new LinkedHashMap<>();
          map.forEach((k, v) -> copy.put(String.valueOf(k), v));
          yield copy;
        }
        yield validateObject(property, map, path + ".");
      }
    };
  }

  private Object validateString(ToolProperty property, Object value, String path) {
    if (!(value instanceof String s)) throw typeMismatch(path, "string");
    if (property.getMinLength() != null && s.trim().length() < property.getMinLength()) {
      throw invalid(
          path, path + " must be at least " + property.getMinLength() + " character(s)");
    }
    if (property.getMaxLength() != null && s.length() > property.getMaxLength()) {
      throw invalid(path, path + " must be at most " + property.getMaxLength() + " characters");
    }
    if (property.getEnumValues() != null && !property.getEnumValues().contains(s)) {
      throw invalid(path, path + " must be one of " + property.getEnumValues());
    }
    if (property.getFormat() == null) return s;
    return switch (property.getFormat()) {
      case UUID -> {
        try {
          yield UUID.fromString(s.trim());
        } catch (IllegalArgumentException e) {
          throw invalid(path, path + " must be a UUID");
        }
      }
      case DATE -> {
        try {
          yield LocalDate.parse(s.trim());
        } catch (DateTimeParseException e) {
          throw invalid(path, path + " must be a date in YYYY-MM-DD format");
        }
      }
      case URL -> {
        if (!isHttpUrl(s.trim())) throw invalid(path, path + " must be an http(s) URL");
        yield s.trim();
      }
    };
  }

  private Object validateInteger(ToolProperty property, Object value, String path) {
    if (!(value instanceof Number n)) throw typeMismatch(path, "integer");
    double d = n.doubleValue();
    if (d != Math.rint(d) || d > Integer.MAX_VALUE || d < Integer.MIN_VALUE) {
      throw typeMismatch(path, "integer");
    }
    int i = n.intValue();
    if (property.getMinimum() != null && i < property.getMinimum()) {
      throw invalid(path, path + " must be >= " + property.getMinimum());
    }
    if (property.getMaximum() != null && i > property.getMaximum()) {
      throw invalid(path, path + " must be <= " + property.getMaximum());
    }
    return i;
  }

  private Object validateArray(ToolProperty property, Object value, String path) {
    if (!(value instanceof List<?> list)) throw typeMismatch(path, "array");
    if (property.getItems() == null) return new ArrayList<>(list);
    List<Object> normalized = new ArrayList<>(list.size());
    for (int i = 0; i < list.size(); i++) {
      String itemPath = path + "[" + i + "]";
      Object item = list.get(i);
      if (item == null) throw invalid(itemPath, itemPath + " must not be null");
      normalized.add(validateValue(property.getItems(), item, itemPath));
    }
    return normalized;
  }

  private static boolean isHttpUrl(String value) {
    try {
      URI uri = new URI(value);
      String scheme = uri.getScheme();
      return ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))
          && uri.getHost() != null;
    } catch (URISyntaxException e) {
      return false;
    }
  }

  private static ValidationException typeMismatch(String path, String expected) {
    return invalid(path, path + " must be of type " + expected);
  }

  private static ValidationException invalid(String path, String message) {
    return new ValidationException(message, Map.of("argument", path));
  }
}
