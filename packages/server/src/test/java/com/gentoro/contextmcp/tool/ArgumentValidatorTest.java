package com.gentoro.contextmcp.tool;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.contextmcp.exception.ValidationException;
import com.gentoro.contextmcp.tool.ToolProperty.Format;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class ArgumentValidatorTest {

  private final ArgumentValidator validator = new ArgumentValidator();

  private final ToolDefinition definition =
      ToolDefinition.builder()
          .name("demo")
          .description("Demo tool")
          .argument(ToolProperty.string("title", "Title").minLength(1).maxLength(5).required())
          .argument(ToolProperty.string("id", "Id").format(Format.UUID))
          .argument(ToolProperty.string("day", "Day").format(Format.DATE))
          .argument(ToolProperty.string("link", "Link").format(Format.URL))
          .argument(ToolProperty.string("mode", "Mode").enumValues("a", "b").defaultValue("a"))
          .argument(ToolProperty.integer("limit", "Limit").range(1, 10).defaultValue(3))
          .argument(ToolProperty.bool("flag", "Flag"))
          .argument(ToolProperty.uuidArray("ids", "Ids"))
          .argument(ToolProperty.stringArray("tags", "Tags"))
          .argument(ToolProperty.object("meta", "Meta"))
          .build();

  private ToolArguments validate(Map<String, Object> raw) {
    return validator.validate(definition, raw);
  }

  private String failingArgument(Map<String, Object> raw) {
    ValidationException e = assertThrows(ValidationException.class, () -> validate(raw));
    return (String) e.getContext().get("argument");
  }

  @Test
  void testDefaultsAndConversions() {
    UUID id = UUID.randomUUID();
    Map<String, Object> raw = new HashMap<>();
    raw.put("title", "Hi");
    raw.put("id", id.toString());
    raw.put("day", "2026-02-28");
    raw.put("ids", List.of(id.toString()));
    raw.put("limit", 7.0);

    ToolArguments args = validate(raw);
    assertEquals("Hi", args.getString("title"));
    assertEquals(id, args.getUuid("id"));
    assertEquals(LocalDate.of(2026, 2, 28), args.getDate("day"));
    assertEquals(List.of(id), args.getUuidList("ids"));
    assertEquals(7, args.getInt("limit"));
    assertEquals("a", args.getString("mode"));
    assertFalse(args.has("flag"));
    assertFalse(args.getBoolean("flag"));
    assertNull(args.getStringList("tags"));
  }

  @Test
  void testDefaultIntegerApplied() {
    assertEquals(3, validate(Map.of("title", "x")).getInt("limit"));
  }

  @Test
  void testMissingArgumentsAreAllowedWhenNull() {
    ToolDefinition empty =
        ToolDefinition.builder().name("empty").description("No arguments").build();
    assertEquals(Map.of(), validator.validate(empty, null).asMap());
  }

  @Test
  void testRequiredArgument() {
    assertEquals("title", failingArgument(Map.of()));
  }

  @Test
  void testUnknownArgument() {
    ValidationException e =
        assertThrows(
            ValidationException.class, () -> validate(Map.of("title", "x", "bogus", 1)));
    assertEquals("Unknown argument: bogus", e.getMessage());
  }

  @Test
  void testStringConstraints() {
    assertEquals("title", failingArgument(Map.of("title", "   ")));
    assertEquals("title", failingArgument(Map.of("title", "toolong")));
    assertEquals("title", failingArgument(Map.of("title", 5)));
    assertEquals("mode", failingArgument(Map.of("title", "x", "mode", "c")));
  }

  @Test
  void testFormats() {
    assertEquals("id", failingArgument(Map.of("title", "x", "id", "nope")));
    assertEquals("day", failingArgument(Map.of("title", "x", "day", "28/02/2026")));
    assertEquals("link", failingArgument(Map.of("title", "x", "link", "ftp://host/file")));
    assertEquals(
        "https://example.com/a",
        validate(Map.of("title", "x", "link", " https://example.com/a ")).getString("link"));
  }

  @Test
  void testIntegerConstraints() {
    assertEquals("limit", failingArgument(Map.of("title", "x", "limit", 0)));
    assertEquals("limit", failingArgument(Map.of("title", "x", "limit", 11)));
    assertEquals("limit", failingArgument(Map.of("title", "x", "limit", 2.5)));
    assertEquals("limit", failingArgument(Map.of("title", "x", "limit", "3")));
  }

  @Test
  void testArrayItemsCarryTheirIndex() {
    List<String> ids = List.of(UUID.randomUUID().toString(), "bad");
    assertEquals("ids[1]", failingArgument(Map.of("title", "x", "ids", ids)));
    assertEquals("tags", failingArgument(Map.of("title", "x", "tags", "single")));
    List<Object> withNull = new ArrayList<>();
    withNull.add(null);
    assertEquals("tags[0]", failingArgument(Map.of("title", "x", "tags", withNull)));
  }

  @Test
  void testTypeChecks() {
    assertEquals("flag", failingArgument(Map.of("title", "x", "flag", "true")));
    assertEquals("meta", failingArgument(Map.of("title", "x", "meta", List.of())));
    ToolArguments args = validate(Map.of("title", "x", "meta", Map.of("k", 1)));
    assertEquals(Map.of("k", 1), args.getMap("meta"));
  }

  @Test
  void testNestedObjectPaths() {
    ToolDefinition nested =
        ToolDefinition.builder()
            .name("nested")
            .description("Nested")
            .argument(
                ToolProperty.object("filter", "Filter")
                    .property(ToolProperty.integer("depth", "Depth").minimum(0).required().build()))
            .build();
    ValidationException e =
        assertThrows(
            ValidationException.class,
            () -> validator.validate(nested, Map.of("filter", Map.of("depth", -1))));
    assertEquals("filter.depth", e.getContext().get("argument"));
  }
}
