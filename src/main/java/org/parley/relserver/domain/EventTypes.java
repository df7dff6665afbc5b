package org.parley.relserver.domain;

/**
 * Well-known room event types and content keys.
 */
public final class EventTypes {

  public static final String MEMBER = "m.room.member";

  public static final String MESSAGE = "m.room.message";

  public static final String REACTION = "m.reaction";

  public static final String REDACTION = "m.room.redaction";

  /** Content key holding the relation descriptor of an event. */
  public static final String RELATES_TO = "m.relates_to";

  /** Content key of a membership event holding the membership state. */
  public static final String MEMBERSHIP = "membership";

  public static final String MEMBERSHIP_JOIN = "join";

  private EventTypes() {
    throw new UnsupportedOperationException("Utility class");
  }
}
