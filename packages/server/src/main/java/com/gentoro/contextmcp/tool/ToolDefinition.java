package com.gentoro.contextmcp.tool;

import java.util.Objects;

/**
 * A tool exposed over MCP: its name, description, argument schema and whether only admins may
 * call it.
 */
public final class ToolDefinition {
  private final String name;
  private final String description;

  /** Root of the argument schema; always of type {@link ToolProperty.Type#OBJECT}. */
  private final ToolProperty schema;

  private final boolean adminOnly;

  public ToolDefinition(String name, String description, ToolProperty schema, boolean adminOnly) {
    this.name = Objects.requireNonNull(name, "name");
    this.description = Objects.requireNonNull(description, "description");
    this.schema = Objects.requireNonNull(schema, "schema");
    if (schema.getType() != ToolProperty.Type.OBJECT) {
      throw new IllegalArgumentException("Tool schema for " + name + " must be an object");
    }
    this.adminOnly = adminOnly;
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public ToolProperty schema() {
    return schema;
  }

  public boolean adminOnly() {
    return adminOnly;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String name;
    private String description;
    private final ToolProperty.Builder schema =
        ToolProperty.builder().type(ToolProperty.Type.OBJECT);
    private boolean adminOnly;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder argument(ToolProperty.Builder property) {
      schema.property(property.build());
      return this;
    }

    public Builder adminOnly() {
      this.adminOnly = true;
      return this;
    }

    public ToolDefinition build() {
      return new ToolDefinition(name, description, schema.name(name).build(), adminOnly);
    }
  }
}
