package com.gentoro.contextmcp.tool;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One node of a tool's argument schema. Objects carry child properties, arrays an item schema;
 * scalar nodes may carry constraints that {@link ArgumentValidator} enforces and that are
 * published in the JSON schema advertised to clients.
 */
public class ToolProperty {
  public enum Type {
    STRING,
    BOOLEAN,
    INTEGER,
    NUMBER,
    OBJECT,
    ARRAY
  }

  /** Well-known string formats. */
  public enum Format {
    UUID("uuid"),
    URL("uri"),
    DATE("date");

    private final String schemaName;

    Format(String schemaName) {
      this.schemaName = schemaName;
    }

    public String schemaName() {
      return schemaName;
    }
  }

  private String name;
  private String description;
  private boolean required;
  private Type type;
  private ToolProperty items;
  private List<ToolProperty> properties;
  private Format format;
  private Integer minLength;
  private Integer maxLength;
  private Integer minimum;
  private Integer maximum;
  private List<String> enumValues;
  private Object defaultValue;

  public ToolProperty(String name, String description, Type type) {
    this(name, description, false, type, null, null);
  }

  public ToolProperty(String name, String description, boolean required, Type type) {
    this(name, description, required, type, null, null);
  }

  public ToolProperty(
      String name,
      String description,
      boolean required,
      Type type,
      ToolProperty items,
      List<ToolProperty> properties) {
    this.name = name;
    this.description = description;
    this.required = required;
    this.type = type;
    this.items = items;
    this.properties = properties;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public boolean isRequired() {
    return required;
  }

  public Type getType() {
    return type;
  }

  public ToolProperty getItems() {
    return items;
  }

  public List<ToolProperty> getProperties() {
    return properties;
  }

  public Format getFormat() {
    return format;
  }

  public Integer getMinLength() {
    return minLength;
  }

  public Integer getMaxLength() {
    return maxLength;
  }

  public Integer getMinimum() {
    return minimum;
  }

  public Integer getMaximum() {
    return maximum;
  }

  public List<String> getEnumValues() {
    return enumValues;
  }

  public Object getDefaultValue() {
    return defaultValue;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof ToolProperty that)) return false;
    return isRequired() == that.isRequired()
        && Objects.equals(getName(), that.getName())
        && Objects.equals(getDescription(), that.getDescription())
        && getType() == that.getType();
  }

  @Override
  public int hashCode() {
    return Objects.hash(getName(), getDescription(), isRequired(), getType());
  }

  public static Builder builder() {
    return new Builder();
  }

  public static Builder string(String name, String description) {
    return builder().name(name).description(description).type(Type.STRING);
  }

  public static Builder integer(String name, String description) {
    return builder().name(name).description(description).type(Type.INTEGER);
  }

  public static Builder bool(String name, String description) {
    return builder().name(name).description(description).type(Type.BOOLEAN);
  }

  /** Array of plain strings. */
  public static Builder stringArray(String name, String description) {
    return builder()
        .name(name)
        .description(description)
        .type(Type.ARRAY)
        .items(builder().type(Type.STRING).build());
  }

  /** Array of UUID strings. */
  public static Builder uuidArray(String name, String description) {
    return builder()
        .name(name)
        .description(description)
        .type(Type.ARRAY)
        .items(builder().type(Type.STRING).format(Format.UUID).build());
  }

  /** Free-form JSON object. */
  public static Builder object(String name, String description) {
    return builder().name(name).description(description).type(Type.OBJECT);
  }

  public static class Builder {
    private String name;
    private String description;
    private boolean required;
    private Type type;
    private ToolProperty items;
    private List<ToolProperty> properties;
    private Format format;
    private Integer minLength;
    private Integer maxLength;
    private Integer minimum;
    private Integer maximum;
    private List<String> enumValues;
    private Object defaultValue;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder required(boolean required) {
      this.required = required;
      return this;
    }

    public Builder required() {
      return required(true);
    }

    public Builder type(Type type) {
      this.type = type;
      return this;
    }

    public Builder items(ToolProperty items) {
      this.items = items;
      return this;
    }

    public Builder properties(List<ToolProperty> properties) {
      this.properties = properties;
      return this;
    }

    public Builder property(ToolProperty property) {
      if (this.properties == null) {
        this.properties = new ArrayList<>();
      }
      this.properties.add(property);
      return this;
    }

    public Builder format(Format format) {
      this.format = format;
      return this;
    }

    public Builder minLength(int minLength) {
      this.minLength = minLength;
      return this;
    }

    public Builder maxLength(int maxLength) {
      this.maxLength = maxLength;
      return this;
    }

    public Builder range(int minimum, int maximum) {
      this.minimum = minimum;
      this.maximum = maximum;
      return this;
    }

    public Builder minimum(int minimum) {
      this.minimum = minimum;
      return this;
    }

    public Builder enumValues(String... values) {
      this.enumValues = List.of(values);
      return this;
    }

    public Builder defaultValue(Object defaultValue) {
      this.defaultValue = defaultValue;
      return this;
    }

    public ToolProperty build() {
      ToolProperty p = new ToolProperty(name, description, required, type, items, properties);
      p.format = format;
      p.minLength = minLength;
      p.maxLength = maxLength;
      p.minimum = minimum;
      p.maximum = maximum;
      p.enumValues = enumValues;
      p.defaultValue = defaultValue;
      return p;
    }
  }
}
