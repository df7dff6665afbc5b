package org.parley.relserver.command;

/**
 * Marker interface for commands that change room state.
 * Commands are validated and applied by a handler, which produces a log event.
 */
public interface Command {
  /**
   * Gets the room this command applies to.
   *
   * @return the room id
   */
  String roomId();
}
