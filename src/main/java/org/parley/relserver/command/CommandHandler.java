package org.parley.relserver.command;

import org.parley.relserver.event.RelationEvent;

/**
 * Interface for command handlers.
 * A handler validates a command, applies it locally as one unit of work and
 * returns the event describing the change, which it also publishes.
 *
 * @param <C> the command type
 */
public interface CommandHandler<C extends Command> {
  /**
   * Handles a command and produces an event.
   *
   * @param command the command to handle
   * @return the event produced by handling the command
   */
  RelationEvent handle(C command);
}
