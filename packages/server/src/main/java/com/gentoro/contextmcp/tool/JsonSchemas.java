package com.gentoro.contextmcp.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Renders {@link ToolProperty} trees as JSON-schema maps. */
public final class JsonSchemas {
  private JsonSchemas() {}

  /** The {@code properties} object of a tool's input schema. */
  public static Map<String, Object> properties(ToolDefinition definition) {
    Map<String, Object> props = new LinkedHashMap<>();
    List<ToolProperty> children = definition.schema().getProperties();
    if (children != null) {
      for (ToolProperty child : children) {
        props.put(child.getName(), toJsonSchema(child));
      }
    }
    return props;
  }

  /** Names of the required top-level arguments. */
  public static List<String> required(ToolDefinition definition) {
    List<String> required = new ArrayList<>();
    List<ToolProperty> children = definition.schema().getProperties();
    if (children != null) {
      for (ToolProperty child : children) {
        if (child.isRequired()) required.add(child.getName());
      }
    }
    return required;
  }

  public static Map<String, Object> toJsonSchema(ToolProperty property) {
    Map<String, Object> node = new LinkedHashMap<>();
    node.put("type", property.getType().name().toLowerCase(Locale.ROOT));
    if (property.getDescription() != null) {
      node.put("description", property.getDescription());
    }
    if (property.getFormat() != null) node.put("format", property.getFormat().schemaName());
    if (property.getMinLength() != null) node.put("minLength", property.getMinLength());
    if (property.getMaxLength() != null) node.put("maxLength", property.getMaxLength());
    if (property.getMinimum() != null) node.put("minimum", property.getMinimum());
    if (property.getMaximum() != null) node.put("maximum", property.getMaximum());
    if (property.getEnumValues() != null) node.put("enum", property.getEnumValues());
    if (property.getDefaultValue() != null) node.put("default", property.getDefaultValue());

    if (property.getType() == ToolProperty.Type.ARRAY && property.getItems() != null) {
      node.put("items", toJsonSchema(property.getItems()));
    }
    if (property.getType() == ToolProperty.Type.OBJECT && property.getProperties() != null) {
      Map<String, Object> props = new LinkedHashMap<>();
      List<String> required = new ArrayList<>();
      for (ToolProperty child : property.getProperties()) {
        props.put(child.getName(), toJsonSchema(child));
        if (child.isRequired()) required.add(child.getName());
      }
      node.put("properties", props);
      if (!required.isEmpty()) node.put("required", required);
      node.put("additionalProperties", false);
    }
    return node;
  }
}
