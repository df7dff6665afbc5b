package org.parley.relserver.domain;

import java.util.Objects;

/**
 * Value object for the type of a relation between two events.
 * Well-known types are annotations, references and replacements; any other
 * non-blank namespaced identifier is accepted as a custom relation type.
 */
public record RelationType(String value) {

  /** Lightweight keyed reaction such as an emoji. */
  public static final RelationType ANNOTATION = new RelationType("m.annotation");

  /** Reference such as a reply or a thread link. */
  public static final RelationType REFERENCE = new RelationType("m.reference");

  /** Edit that replaces the content of the target. */
  public static final RelationType REPLACE = new RelationType("m.replace");

  private static final int MAX_LENGTH = 255;

  /**
   * Creates a relation type.
   *
   * @param value the wire value (must be non-null, non-blank and without '/')
   * @throws IllegalArgumentException if value is blank, too long or contains '/'
   */
  public RelationType {
    Objects.requireNonNull(value, "Relation type cannot be null");
    if (value.isBlank()) {
      throw new IllegalArgumentException("Relation type cannot be blank");
    }
    if (value.length() > MAX_LENGTH) {
      throw new IllegalArgumentException(
          "Relation type cannot exceed " + MAX_LENGTH + " characters");
    }
    if (value.indexOf('/') >= 0) {
      throw new IllegalArgumentException("Relation type cannot contain '/': " + value);
    }
  }

  /**
   * Creates a relation type from its wire value.
   *
   * @param value the wire value
   * @return the relation type
   */
  public static RelationType of(String value) {
    return new RelationType(value);
  }

  public boolean isAnnotation() {
    return ANNOTATION.equals(this);
  }

  @Override
  public String toString() {
    return value;
  }
}
