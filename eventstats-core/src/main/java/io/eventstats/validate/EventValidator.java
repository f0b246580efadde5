package io.eventstats.validate;

import io.eventstats.model.Event;
import io.eventstats.util.JsonCodec;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Map;
import java.util.Objects;

/**
 * Parses raw message bodies into {@link Event}s.
 *
 * <p>Expected wire format:
 * <pre>{@code
 * {"type": "purchase", "value": 42.5, "occurred_at": "2024-01-15 10:30:00"}
 * }</pre>
 *
 * <p>Fields are checked in the order {@code type}, {@code value}, {@code occurred_at}; the
 * first problem found is reported. Unknown fields are ignored. {@code occurred_at} also
 * accepts ISO-8601 local date-times ({@code 2024-01-15T10:30:00}).
 *
 * <p>This class is stateless and thread-safe.
 */
public final class EventValidator {
  public static final String FIELD_TYPE = "type";
  public static final String FIELD_VALUE = "value";
  public static final String FIELD_OCCURRED_AT = "occurred_at";

  static final DateTimeFormatter OCCURRED_AT_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd HH:mm:ss")
      .withResolverStyle(ResolverStyle.STRICT);

  private final JsonCodec jsonCodec;

  public EventValidator() {
    this(JsonCodec.getDefault());
  }

  public EventValidator(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Validates a UTF-8 encoded body.
   *
   * @param rawBody raw message bytes
   * @return the decoded event
   * @throws EventValidationException if the body is not a valid event
   */
  public Event validate(byte[] rawBody) {
    if (rawBody == null) {
      throw new EventValidationException(ValidationError.malformedEncoding("body is null"));
    }
    String text;
    try {
      text = StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(rawBody))
          .toString();
    } catch (CharacterCodingException e) {
      throw new EventValidationException(ValidationError.malformedEncoding("body is not valid UTF-8"), e);
    }
    return validate(text);
  }

  /**
   * Validates an already-decoded body.
   *
   * @param body message body
   * @return the decoded event
   * @throws EventValidationException if the body is not a valid event
   */
  public Event validate(String body) {
    if (body == null) {
      throw new EventValidationException(ValidationError.malformedEncoding("body is null"));
    }
    Map<String, Object> fields;
    try {
      fields = jsonCodec.parseObject(body);
    } catch (IllegalArgumentException e) {
      throw new EventValidationException(ValidationError.malformedEncoding(e.getMessage()), e);
    }
    String type = readType(fields);
    double value = readValue(fields);
    LocalDateTime occurredAt = readOccurredAt(fields);
    return new Event(type, value, occurredAt);
  }

  private static String readType(Map<String, Object> fields) {
    Object raw = require(fields, FIELD_TYPE);
    if (!(raw instanceof String type)) {
      throw invalid(FIELD_TYPE, "expected a string");
    }
    if (type.isBlank()) {
      throw invalid(FIELD_TYPE, "must not be blank");
    }
    return type;
  }

  private static double readValue(Map<String, Object> fields) {
    Object raw = require(fields, FIELD_VALUE);
    if (!(raw instanceof Number number)) {
      throw invalid(FIELD_VALUE, "expected a number");
    }
    double value = number.doubleValue();
    if (!Double.isFinite(value)) {
      throw invalid(FIELD_VALUE, "number out of range");
    }
    return value;
  }

  private static LocalDateTime readOccurredAt(Map<String, Object> fields) {
    Object raw = require(fields, FIELD_OCCURRED_AT);
    if (!(raw instanceof String text)) {
      throw invalid(FIELD_OCCURRED_AT, "expected a string");
    }
    try {
      return LocalDateTime.parse(text, OCCURRED_AT_FORMAT);
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(text, DateTimeFormatter.ISO_LOCAL_DATE_TIME);
      } catch (DateTimeParseException iso) {
        throw new EventValidationException(
            ValidationError.invalidValue(FIELD_OCCURRED_AT, "expected 'yyyy-MM-dd HH:mm:ss', got '" + text + "'"),
            iso);
      }
    }
  }

  private static Object require(Map<String, Object> fields, String name) {
    Object value = fields.get(name);
    if (value == null) {
      throw new EventValidationException(ValidationError.missingField(name));
    }
    return value;
  }

  private static EventValidationException invalid(String field, String detail) {
    return new EventValidationException(ValidationError.invalidValue(field, detail));
  }
}
