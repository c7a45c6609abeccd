package ca.gc.cra.sweep.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String validation for operator-supplied identifiers and free-form values.
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Trims and validates that the value is non-blank and free of control characters.
   *
   * @param name label used in error messages
   * @param value raw value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a dataset id or model name: letters, digits, dot, underscore and hyphen only.
   *
   * @param name label used in error messages
   * @param value raw value
   * @return trimmed identifier
   * @throws IllegalArgumentException if the value is blank or uses other characters
   */
  public static String requireIdentifier(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen"));
    }
    return trimmed;
  }

  /**
   * Validates printable ASCII content within a length bound.
   *
   * @param name label used in error messages
   * @param value raw value
   * @param maxLength maximum trimmed length
   * @return trimmed value
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
