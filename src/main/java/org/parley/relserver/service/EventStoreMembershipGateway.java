package org.parley.relserver.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.parley.relserver.domain.EventTypes;
import org.parley.relserver.repository.RoomEventRepository;
import org.springframework.stereotype.Component;

/**
 * Membership gateway backed by the room's current {@code m.room.member} state.
 */
@Component
public class EventStoreMembershipGateway implements RoomMembershipGateway {

  private final RoomEventRepository roomEventRepository;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Repositories are Spring-managed beans and are intentionally shared"
  )
  public EventStoreMembershipGateway(RoomEventRepository roomEventRepository) {
    this.roomEventRepository = roomEventRepository;
  }

  @Override
  public boolean isJoined(String roomId, String userId) {
    return roomEventRepository.findCurrentState(roomId, EventTypes.MEMBER, userId)
        .filter(member -> !member.redacted())
        .map(member -> member.content().get(EventTypes.MEMBERSHIP))
        .map(EventTypes.MEMBERSHIP_JOIN::equals)
        .orElse(false);
  }
}
