package org.parley.relserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.parley.relserver.config.RelationsProperties;
import org.parley.relserver.domain.EventTypes;
import org.parley.relserver.exception.PermissionDeniedException;
import org.springframework.stereotype.Component;

/**
 * Checks the acting user against the membership collaborator.
 * Disabled when {@code relations.enforce-membership} is false.
 */
@Component
public class RoomAccessGuard {

  private final RoomMembershipGateway membershipGateway;
  private final RelationsProperties properties;

  /**
   * Constructs a RoomAccessGuard.
   *
   * @param membershipGateway the membership collaborator
   * @param properties relation configuration
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Collaborators are Spring-managed beans and are intentionally shared"
  )
  public RoomAccessGuard(RoomMembershipGateway membershipGateway,
      RelationsProperties properties) {
    this.membershipGateway = membershipGateway;
    this.properties = properties;
  }

  /**
   * Requires the user to be joined to the room.
   *
   * @param roomId the room id
   * @param userId the acting user
   * @throws PermissionDeniedException if the user is not joined
   */
  public void requireMember(String roomId, String userId) {
    if (properties.isEnforceMembership() && !membershipGateway.isJoined(roomId, userId)) {
      throw new PermissionDeniedException(userId, roomId);
    }
  }

  /**
   * Requires the user to be allowed to send a state event.
   * A user may always set their own membership, which is how they join.
   *
   * @param roomId the room id
   * @param userId the acting user
   * @param eventType the state event type
   * @param stateKey the state key
   * @throws PermissionDeniedException if the user is not joined
   */
  public void requireCanSetState(String roomId, String userId, String eventType,
      String stateKey) {
    if (EventTypes.MEMBER.equals(eventType) && userId.equals(stateKey)) {
      return;
    }
    requireMember(roomId, userId);
  }
}
