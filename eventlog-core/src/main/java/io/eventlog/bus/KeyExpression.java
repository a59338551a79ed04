package io.eventlog.bus;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Hierarchical subscription pattern over {@code '/'}-separated keys.
 *
 * <p>Each segment is either a literal, {@code *} (exactly one segment) or {@code **} (zero or
 * more segments). Examples against the key {@code events/Todo/42}:
 * <ul>
 *   <li>{@code events/**} matches</li>
 *   <li>{@code events/Todo/*} matches</li>
 *   <li>{@code events/*}{@code /42} matches</li>
 *   <li>{@code events/Todo} does not match</li>
 * </ul>
 *
 * @see EventKeys
 */
public final class KeyExpression {
  public static final String SEPARATOR = "/";
  public static final String SINGLE_WILDCARD = "*";
  public static final String MULTI_WILDCARD = "**";

  private final String expression;
  private final String[] segments;

  private KeyExpression(String expression, String[] segments) {
    this.expression = expression;
    this.segments = segments;
  }

  /**
   * Parses a pattern.
   *
   * @param expression the pattern text, e.g. {@code events/Todo/**}
   * @return the parsed expression
   * @throws IllegalArgumentException if the pattern is empty, has empty segments, or uses
   *                                  {@code *} inside a literal segment
   */
  public static KeyExpression parse(String expression) {
    Objects.requireNonNull(expression, "expression");
    if (expression.isEmpty()) {
      throw new IllegalArgumentException("Key expression cannot be empty");
    }
    String[] segments = expression.split(SEPARATOR, -1);
    for (String segment : segments) {
      if (segment.isEmpty()) {
        throw new IllegalArgumentException("Empty segment in key expression: " + expression);
      }
      if (segment.contains(SINGLE_WILDCARD)
          && !segment.equals(SINGLE_WILDCARD) && !segment.equals(MULTI_WILDCARD)) {
        throw new IllegalArgumentException("Wildcards must span a whole segment: " + expression);
      }
    }
    return new KeyExpression(expression, segments);
  }

  /**
   * Tests a concrete key against this pattern.
   *
   * @param key a concrete key without wildcards
   * @return {@code true} if the key matches
   */
  public boolean matches(String key) {
    Objects.requireNonNull(key, "key");
    return matches(segments, 0, key.split(SEPARATOR, -1), 0);
  }

  /**
   * Returns {@code true} when the pattern contains no wildcard.
   *
   * @return whether this expression names exactly one key
   */
  public boolean isLiteral() {
    for (String segment : segments) {
      if (segment.equals(SINGLE_WILDCARD) || segment.equals(MULTI_WILDCARD)) {
        return false;
      }
    }
    return true;
  }

  public List<String> segments() {
    return List.of(segments);
  }

  public String expression() {
    return expression;
  }

  private static boolean matches(String[] pattern, int p, String[] key, int k) {
    while (p < pattern.length) {
      String segment = pattern[p];
      if (segment.equals(MULTI_WILDCARD)) {
        if (p == pattern.length - 1) {
          return true;
        }
        for (int skip = k; skip <= key.length; skip++) {
          if (matches(pattern, p + 1, key, skip)) {
            return true;
          }
        }
        return false;
      }
      if (k >= key.length) {
        return false;
      }
      if (!segment.equals(SINGLE_WILDCARD) && !segment.equals(key[k])) {
        return false;
      }
      p++;
      k++;
    }
    return k == key.length;
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof KeyExpression that && Arrays.equals(segments, that.segments));
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(segments);
  }

  @Override
  public String toString() {
    return expression;
  }
}
