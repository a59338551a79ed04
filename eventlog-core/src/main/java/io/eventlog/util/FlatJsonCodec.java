package io.eventlog.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat string-to-string objects.
 *
 * <p>Accessible via {@link JsonCodec#getDefault()}. Null values are skipped when parsing
 * because event metadata never holds them.
 */
public final class FlatJsonCodec implements JsonCodec {
  static final FlatJsonCodec INSTANCE = new FlatJsonCodec();

  private FlatJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> metadata) {
    if (metadata == null || metadata.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder("{");
    String separator = "";
    for (Map.Entry<String, String> entry : metadata.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("metadata cannot contain null keys");
      }
      sb.append(separator);
      appendString(sb, entry.getKey());
      sb.append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        appendString(sb, entry.getValue());
      }
      separator = ",";
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null || json.isBlank() || "null".equals(json.trim())) {
      return Collections.emptyMap();
    }
    return new Parser(json).readObject();
  }

  /**
   * Renders a string as a quoted JSON string literal.
   *
   * @param value the raw string
   * @return the escaped literal, including quotes
   */
  public static String quote(String value) {
    StringBuilder sb = new StringBuilder(value.length() + 2);
    appendString(sb, value);
    return sb.toString();
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  private static final class Parser {
    private final String input;
    private int pos;

    Parser(String input) {
      this.input = input;
    }

    Map<String, String> readObject() {
      expect('{');
      Map<String, String> result = new LinkedHashMap<>();
      if (peek() == '}') {
        pos++;
        return finish(result);
      }
      while (true) {
        String key = readString();
        expect(':');
        if (input.startsWith("null", skipWhitespace())) {
          pos += 4;
        } else {
          result.put(key, readString());
        }
        char next = peek();
        pos++;
        if (next == '}') {
          return finish(result);
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at offset " + (pos - 1));
        }
      }
    }

    private Map<String, String> finish(Map<String, String> result) {
      if (skipWhitespace() != input.length()) {
        throw new IllegalArgumentException("Trailing characters after JSON object");
      }
      return result;
    }

    private String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char escaped = input.charAt(pos++);
        switch (escaped) {
          case '"', '\\', '/' -> sb.append(escaped);
          case 'n' -> sb.append('\n');
          case 'r' -> sb.append('\r');
          case 't' -> sb.append('\t');
          case 'b' -> sb.append('\b');
          case 'f' -> sb.append('\f');
          case 'u' -> {
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw new IllegalArgumentException("Invalid unicode escape", e);
            }
            pos += 4;
          }
          default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private void expect(char expected) {
      if (peek() != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at offset " + pos);
      }
      pos++;
    }

    private char peek() {
      skipWhitespace();
      if (pos >= input.length()) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      return input.charAt(pos);
    }

    private int skipWhitespace() {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
      return pos;
    }
  }
}
