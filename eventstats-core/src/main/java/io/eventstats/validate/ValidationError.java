package io.eventstats.validate;

import java.util.Objects;

/**
 * Why a message body could not be turned into an {@link io.eventstats.model.Event}.
 *
 * <ul>
 *   <li>{@link MalformedEncoding}: the body is not UTF-8, not JSON, or not a JSON object.</li>
 *   <li>{@link MissingField}: a required field is absent or JSON {@code null}.</li>
 *   <li>{@link InvalidValue}: a required field is present but has the wrong type or shape.</li>
 * </ul>
 *
 * @see EventValidator
 */
public sealed interface ValidationError
    permits ValidationError.MalformedEncoding, ValidationError.MissingField, ValidationError.InvalidValue {

  /**
   * Human-readable description, suitable for logs.
   */
  String describe();

  static MalformedEncoding malformedEncoding(String detail) {
    return new MalformedEncoding(detail);
  }

  static MissingField missingField(String field) {
    return new MissingField(field);
  }

  static InvalidValue invalidValue(String field, String detail) {
    return new InvalidValue(field, detail);
  }

  record MalformedEncoding(String detail) implements ValidationError {
    public MalformedEncoding {
      Objects.requireNonNull(detail, "detail");
    }

    @Override
    public String describe() {
      return "malformed body: " + detail;
    }
  }

  record MissingField(String field) implements ValidationError {
    public MissingField {
      Objects.requireNonNull(field, "field");
    }

    @Override
    public String describe() {
      return "missing field '" + field + "'";
    }
  }

  record InvalidValue(String field, String detail) implements ValidationError {
    public InvalidValue {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(detail, "detail");
    }

    @Override
    public String describe() {
      return "invalid value for '" + field + "': " + detail;
    }
  }
}
