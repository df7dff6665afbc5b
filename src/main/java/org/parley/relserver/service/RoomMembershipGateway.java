package org.parley.relserver.service;

/**
 * Collaborator that decides whether a user belongs to a room.
 * The relation engine trusts its verdict and does not reimplement membership rules.
 */
public interface RoomMembershipGateway {

  /**
   * Checks whether a user is currently joined to a room.
   *
   * @param roomId the room id
   * @param userId the user id
   * @return true if the user is joined
   */
  boolean isJoined(String roomId, String userId);
}
