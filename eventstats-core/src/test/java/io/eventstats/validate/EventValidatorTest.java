package io.eventstats.validate;

import io.eventstats.model.Event;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class EventValidatorTest {

  private final EventValidator validator = new EventValidator();

  @Test
  void acceptsWellFormedEvent() {
    Event event = validator.validate(
        "{\"type\": \"purchase\", \"value\": 42.5, \"occurred_at\": \"2024-01-15 10:30:00\"}");

    assertEquals("purchase", event.type());
    assertEquals(42.5, event.value());
    assertEquals(LocalDateTime.of(2024, 1, 15, 10, 30, 0), event.occurredAt());
  }

  @Test
  void acceptsIntegerValue() {
    Event event = validator.validate(
        "{\"type\": \"view\", \"value\": 7, \"occurred_at\": \"2024-01-15 10:30:00\"}");

    assertEquals(7.0, event.value());
  }

  @Test
  void acceptsIsoTimestamp() {
    Event event = validator.validate(
        "{\"type\": \"view\", \"value\": 1, \"occurred_at\": \"2024-01-15T10:30:00\"}");

    assertEquals(LocalDateTime.of(2024, 1, 15, 10, 30, 0), event.occurredAt());
  }

  @Test
  void ignoresUnknownFields() {
    Event event = validator.validate(
        "{\"type\": \"view\", \"value\": 1, \"occurred_at\": \"2024-01-15 10:30:00\"," +
            " \"user\": {\"id\": 9}, \"tags\": [\"a\"]}");

    assertEquals("view", event.type());
  }

  @Test
  void acceptsUtf8Bytes() {
    byte[] body = "{\"type\": \"café\", \"value\": 3, \"occurred_at\": \"2024-01-15 10:30:00\"}"
        .getBytes(StandardCharsets.UTF_8);

    assertEquals("café", validator.validate(body).type());
  }

  @Test
  void rejectsInvalidUtf8() {
    byte[] body = {'{', '"', 't', '"', ':', (byte) 0xC3, (byte) 0x28, '}'};

    EventValidationException ex = assertThrows(EventValidationException.class, () -> validator.validate(body));
    assertInstanceOf(ValidationError.MalformedEncoding.class, ex.error());
  }

  @Test
  void rejectsInvalidJson() {
    EventValidationException ex = assertThrows(EventValidationException.class, () ->
        validator.validate("not json"));

    assertInstanceOf(ValidationError.MalformedEncoding.class, ex.error());
  }

  @Test
  void rejectsJsonThatIsNotAnObject() {
    EventValidationException ex = assertThrows(EventValidationException.class, () ->
        validator.validate("[{\"type\": \"view\"}]"));

    assertInstanceOf(ValidationError.MalformedEncoding.class, ex.error());
  }

  @Test
  void rejectsNonAsciiDigitsInValue() {
    EventValidationException ex = assertThrows(EventValidationException.class, () ->
        validator.validate("{\"type\": \"purchase\", \"value\": 1٣, \"occurred_at\": \"2024-01-15 10:30:00\"}"));

    assertInstanceOf(ValidationError.MalformedEncoding.class, ex.error());
  }

  @Test
  void rejectsSignedUnicodeEscape() {
    EventValidationException ex = assertThrows(EventValidationException.class, () ->
        validator.validate("{\"type\": \"a\\u+041\", \"value\": 1, \"occurred_at\": \"2024-01-15 10:30:00\"}"));

    assertInstanceOf(ValidationError.MalformedEncoding.class, ex.error());
  }

  @Test
  void rejectsNullBody() {
    assertThrows(EventValidationException.class, () -> validator.validate((String) null));
    assertThrows(EventValidationException.class, () -> validator.validate((byte[]) null));
  }

  @Test
  void reportsFirstMissingFieldInOrder() {
    assertEquals(new ValidationError.MissingField("type"), errorOf("{}"));
    assertEquals(new ValidationError.MissingField("value"), errorOf("{\"type\": \"view\"}"));
    assertEquals(new ValidationError.MissingField("occurred_at"),
        errorOf("{\"type\": \"view\", \"value\": 1}"));
  }

  @Test
  void treatsNullAsMissing() {
    assertEquals(new ValidationError.MissingField("value"),
        errorOf("{\"type\": \"view\", \"value\": null, \"occurred_at\": \"2024-01-15 10:30:00\"}"));
  }

  @Test
  void typeErrorWinsOverLaterFields() {
    ValidationError error = errorOf("{\"type\": 5, \"value\": \"x\"}");

    assertInstanceOf(ValidationError.InvalidValue.class, error);
    assertEquals("type", ((ValidationError.InvalidValue) error).field());
  }

  @Test
  void rejectsBlankType() {
    assertInvalid("type", "{\"type\": \"  \", \"value\": 1, \"occurred_at\": \"2024-01-15 10:30:00\"}");
  }

  @Test
  void rejectsStringValue() {
    assertInvalid("value", "{\"type\": \"view\", \"value\": \"10\", \"occurred_at\": \"2024-01-15 10:30:00\"}");
  }

  @Test
  void rejectsBooleanValue() {
    assertInvalid("value", "{\"type\": \"view\", \"value\": true, \"occurred_at\": \"2024-01-15 10:30:00\"}");
  }

  @Test
  void rejectsNonFiniteValue() {
    assertInvalid("value", "{\"type\": \"view\", \"value\": 1e400, \"occurred_at\": \"2024-01-15 10:30:00\"}");
  }

  @Test
  void rejectsUnparseableTimestamp() {
    assertInvalid("occurred_at", "{\"type\": \"view\", \"value\": 1, \"occurred_at\": \"15/01/2024\"}");
    assertInvalid("occurred_at", "{\"type\": \"view\", \"value\": 1, \"occurred_at\": \"2024-02-30 10:00:00\"}");
    assertInvalid("occurred_at", "{\"type\": \"view\", \"value\": 1, \"occurred_at\": 1705314600}");
  }

  @Test
  void errorDescriptionNamesTheField() {
    EventValidationException ex = assertThrows(EventValidationException.class, () ->
        validator.validate("{\"type\": \"view\"}"));

    assertTrue(ex.getMessage().contains("value"), ex.getMessage());
  }

  private ValidationError errorOf(String body) {
    return assertThrows(EventValidationException.class, () -> validator.validate(body)).error();
  }

  private void assertInvalid(String field, String body) {
    ValidationError error = errorOf(body);
    assertInstanceOf(ValidationError.InvalidValue.class, error, () -> "got " + error);
    assertEquals(field, ((ValidationError.InvalidValue) error).field());
  }
}
