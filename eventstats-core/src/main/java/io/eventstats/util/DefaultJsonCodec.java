package io.eventstats.util;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lightweight JSON encoder/decoder for message bodies. Has no external dependencies.
 *
 * <p>Numbers are decoded as {@link BigDecimal} so the caller decides how to narrow them;
 * exponents outside the double range survive parsing and are rejected later by whoever
 * needs a finite value. Duplicate keys keep the last value.
 *
 * <p>This is the default {@link JsonCodec} implementation, accessible via
 * {@link JsonCodec#getDefault()} or the singleton {@link #INSTANCE}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  private static final int MAX_DEPTH = 64;

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, ?> object) {
    if (object == null) {
      return "null";
    }
    StringBuilder sb = new StringBuilder();
    writeValue(sb, object);
    return sb.toString();
  }

  @Override
  public Map<String, Object> parseObject(String json) {
    if (json == null) {
      throw new IllegalArgumentException("JSON input is null");
    }
    Parser parser = new Parser(json);
    parser.skipWhitespace();
    if (parser.atEnd() || parser.peek() != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    Map<String, Object> result = parser.parseObject(0);
    parser.skipWhitespace();
    if (!parser.atEnd()) {
      throw new IllegalArgumentException("Unexpected trailing content at index " + parser.pos);
    }
    return result;
  }

  private static void writeValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof String s) {
      sb.append('"').append(escape(s)).append('"');
    } else if (value instanceof Boolean b) {
      sb.append(b.booleanValue());
    } else if (value instanceof BigDecimal d) {
      sb.append(d.toString());
    } else if (value instanceof Double || value instanceof Float) {
      double d = ((Number) value).doubleValue();
      if (!Double.isFinite(d)) {
        throw new IllegalArgumentException("Non-finite number cannot be encoded: " + d);
      }
      sb.append(d);
    } else if (value instanceof Number n) {
      sb.append(n.longValue());
    } else if (value instanceof Map<?, ?> map) {
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("object cannot contain null keys");
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        sb.append('"').append(escape(entry.getKey().toString())).append('"').append(':');
        writeValue(sb, entry.getValue());
      }
      sb.append('}');
    } else if (value instanceof List<?> list) {
      sb.append('[');
      for (int i = 0; i < list.size(); i++) {
        if (i > 0) {
          sb.append(',');
        }
        writeValue(sb, list.get(i));
      }
      sb.append(']');
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
  }

  private static String escape(String value) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\b':
          sb.append("\\b");
          break;
        case '\f':
          sb.append("\\f");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    return sb.toString();
  }

  private static final class Parser {
    private final String input;
    private int pos;

    private Parser(String input) {
      this.input = input;
    }

    boolean atEnd() {
      return pos >= input.length();
    }

    char peek() {
      return input.charAt(pos);
    }

    void skipWhitespace() {
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
          break;
        }
        pos++;
      }
    }

    private void expect(char expected) {
      if (atEnd() || input.charAt(pos) != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at index " + pos);
      }
      pos++;
    }

    Object parseValue(int depth) {
      skipWhitespace();
      if (atEnd()) {
        throw new IllegalArgumentException("Unexpected end of JSON input");
      }
      char c = peek();
      if (c == '{') {
        return parseObject(depth + 1);
      }
      if (c == '[') {
        return parseArray(depth + 1);
      }
      if (c == '"') {
        pos++;
        return parseString();
      }
      if (c == '-' || (c >= '0' && c <= '9')) {
        return parseNumber();
      }
      if (input.startsWith("true", pos)) {
        pos += 4;
        return Boolean.TRUE;
      }
      if (input.startsWith("false", pos)) {
        pos += 5;
        return Boolean.FALSE;
      }
      if (input.startsWith("null", pos)) {
        pos += 4;
        return null;
      }
      throw new IllegalArgumentException("Unexpected character '" + c + "' at index " + pos);
    }

    Map<String, Object> parseObject(int depth) {
      checkDepth(depth);
      expect('{');
      Map<String, Object> result = new LinkedHashMap<>();
      skipWhitespace();
      if (!atEnd() && peek() == '}') {
        pos++;
        return result;
      }
      while (true) {
        skipWhitespace();
        expect('"');
        String key = parseString();
        skipWhitespace();
        expect(':');
        result.put(key, parseValue(depth));
        skipWhitespace();
        if (atEnd()) {
          throw new IllegalArgumentException("Unexpected end of JSON object");
        }
        char next = input.charAt(pos++);
        if (next == '}') {
          return result;
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or '}' at index " + (pos - 1));
        }
      }
    }

    private List<Object> parseArray(int depth) {
      checkDepth(depth);
      expect('[');
      List<Object> result = new ArrayList<>();
      skipWhitespace();
      if (!atEnd() && peek() == ']') {
        pos++;
        return Collections.unmodifiableList(result);
      }
      while (true) {
        result.add(parseValue(depth));
        skipWhitespace();
        if (atEnd()) {
          throw new IllegalArgumentException("Unexpected end of JSON array");
        }
        char next = input.charAt(pos++);
        if (next == ']') {
          return Collections.unmodifiableList(result);
        }
        if (next != ',') {
          throw new IllegalArgumentException("Expected ',' or ']' at index " + (pos - 1));
        }
      }
    }

    private BigDecimal parseNumber() {
      int start = pos;
      if (peek() == '-') {
        pos++;
      }
      int intStart = pos;
      while (!atEnd() && isAsciiDigit(peek())) {
        pos++;
      }
      if (pos == intStart) {
        throw new IllegalArgumentException("Invalid number at index " + start);
      }
      if (pos - intStart > 1 && input.charAt(intStart) == '0') {
        throw new IllegalArgumentException("Leading zeros are not allowed at index " + start);
      }
      if (!atEnd() && peek() == '.') {
        pos++;
        int fracStart = pos;
        while (!atEnd() && isAsciiDigit(peek())) {
          pos++;
        }
        if (pos == fracStart) {
          throw new IllegalArgumentException("Invalid fraction at index " + start);
        }
      }
      if (!atEnd() && (peek() == 'e' || peek() == 'E')) {
        pos++;
        if (!atEnd() && (peek() == '+' || peek() == '-')) {
          pos++;
        }
        int expStart = pos;
        while (!atEnd() && isAsciiDigit(peek())) {
          pos++;
        }
        if (pos == expStart) {
          throw new IllegalArgumentException("Invalid exponent at index " + start);
        }
      }
      try {
        return new BigDecimal(input.substring(start, pos));
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid number at index " + start, ex);
      }
    }

    private String parseString() {
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos);
        if (c == '"') {
          pos++;
          return sb.toString();
        }
        if (c < 0x20) {
          throw new IllegalArgumentException("Unescaped control character at index " + pos);
        }
        if (c == '\\') {
          if (pos + 1 >= input.length()) {
            throw new IllegalArgumentException("Invalid escape sequence");
          }
          char next = input.charAt(pos + 1);
          switch (next) {
            case '"':
            case '\\':
            case '/':
              sb.append(next);
              pos += 2;
              break;
            case 'b':
              sb.append('\b');
              pos += 2;
              break;
            case 'f':
              sb.append('\f');
              pos += 2;
              break;
            case 'n':
              sb.append('\n');
              pos += 2;
              break;
            case 'r':
              sb.append('\r');
              pos += 2;
              break;
            case 't':
              sb.append('\t');
              pos += 2;
              break;
            case 'u':
              if (pos + 5 >= input.length()) {
                throw new IllegalArgumentException("Invalid unicode escape");
              }
              sb.append((char) parseHex(pos + 2));
              pos += 6;
              break;
            default:
              throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
          }
        } else {
          sb.append(c);
          pos++;
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }

    private static boolean isAsciiDigit(char c) {
      return c >= '0' && c <= '9';
    }

    private int parseHex(int start) {
      int value = 0;
      for (int i = start; i < start + 4; i++) {
        char c = input.charAt(i);
        int digit;
        if (isAsciiDigit(c)) {
          digit = c - '0';
        } else if (c >= 'a' && c <= 'f') {
          digit = c - 'a' + 10;
        } else if (c >= 'A' && c <= 'F') {
          digit = c - 'A' + 10;
        } else {
          throw new IllegalArgumentException("Invalid unicode escape at index " + (start - 2));
        }
        value = (value << 4) | digit;
      }
      return value;
    }

    private void checkDepth(int depth) {
      if (depth > MAX_DEPTH) {
        throw new IllegalArgumentException("JSON nesting deeper than " + MAX_DEPTH);
      }
    }
  }
}
