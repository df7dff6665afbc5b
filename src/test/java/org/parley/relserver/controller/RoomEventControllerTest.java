package org.parley.relserver.controller;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.parley.relserver.config.RelationsProperties;
import org.parley.relserver.dto.BundledRelations;
import org.parley.relserver.dto.MessagesResponse;
import org.parley.relserver.dto.RoomEventView;
import org.parley.relserver.exception.EventNotFoundException;
import org.parley.relserver.exception.PermissionDeniedException;
import org.parley.relserver.service.RoomAccessGuard;
import org.parley.relserver.service.RoomEventService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Unit tests for RoomEventController.
 */
@WebMvcTest(RoomEventController.class)
@Import({RelationsProperties.class, SimpleMeterRegistry.class})
class RoomEventControllerTest {

  private static final String ROOM = "!room:test";
  private static final String ALICE = "@alice:test";
  private static final String BASE = "/_matrix/client/r0/rooms/" + ROOM;

  @Autowired
  private MockMvc mockMvc;

  @MockitoBean
  private RoomEventService roomEventService;

  @MockitoBean
  private RoomAccessGuard accessGuard;

  @Test
  void getEvent_shouldIncludeBundledRelations() throws Exception {
    // Given
    BundledRelations bundle = new BundledRelations(null,
        new BundledRelations.ReferenceChunk(
            List.of(new BundledRelations.EventReference("$ref"))),
        null);
    RoomEventView view = new RoomEventView("$parent", ROOM, "m.room.message", null, ALICE,
        Map.of("body", "hello"), 1000L, new RoomEventView.Unsigned(bundle, null));
    when(roomEventService.getEvent(ROOM, "$parent")).thenReturn(view);

    // When & Then
    mockMvc.perform(get(BASE + "/event/$parent").header(RelationController.USER_HEADER, ALICE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.event_id").value("$parent"))
        .andExpect(jsonPath("$.origin_server_ts").value(1000))
        .andExpect(jsonPath("$.unsigned['m.relations']['m.reference'].chunk[0].event_id")
            .value("$ref"));
  }

  @Test
  void getEvent_shouldReturn404_whenUnknown() throws Exception {
    when(roomEventService.getEvent(ROOM, "$nope")).thenThrow(new EventNotFoundException("$nope"));

    mockMvc.perform(get(BASE + "/event/$nope").header(RelationController.USER_HEADER, ALICE))
        .andExpect(status().isNotFound());
  }

  @Test
  void messages_shouldPassBundleFlag() throws Exception {
    // Given
    when(roomEventService.messages(ROOM, 2, null, true))
        .thenReturn(new MessagesResponse(List.of(), "end-token"));

    // When & Then
    mockMvc.perform(get(BASE + "/messages")
            .param("limit", "2")
            .param("bundle_relations", "true")
            .header(RelationController.USER_HEADER, ALICE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.end").value("end-token"));
  }

  @Test
  void messages_shouldReturn403_whenNotMember() throws Exception {
    // Given
    doThrow(new PermissionDeniedException(ALICE, ROOM))
        .when(accessGuard).requireMember(ROOM, ALICE);

    // When & Then
    mockMvc.perform(get(BASE + "/messages").header(RelationController.USER_HEADER, ALICE))
        .andExpect(status().isForbidden());

    verifyNoInteractions(roomEventService);
  }

  @Test
  void send_shouldReturnEventId() throws Exception {
    // Given
    when(roomEventService.send(eq(ROOM), eq("m.room.message"), eq(ALICE), anyMap()))
        .thenReturn("$new");

    // When & Then
    mockMvc.perform(post(BASE + "/send/m.room.message")
            .header(RelationController.USER_HEADER, ALICE)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"msgtype\":\"m.text\",\"body\":\"hi\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.event_id").value("$new"));
  }

  @Test
  void send_shouldRejectNonObjectBody() throws Exception {
    mockMvc.perform(post(BASE + "/send/m.room.message")
            .header(RelationController.USER_HEADER, ALICE)
            .contentType(MediaType.APPLICATION_JSON)
            .content("[1,2]"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_argument"));
  }

  @Test
  void setState_shouldCheckStatePermission() throws Exception {
    // Given
    when(roomEventService.sendState(eq(ROOM), eq("m.room.member"), eq(ALICE), eq(ALICE),
        anyMap())).thenReturn("$join");

    // When & Then
    mockMvc.perform(put(BASE + "/state/m.room.member/" + ALICE)
            .header(RelationController.USER_HEADER, ALICE)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"membership\":\"join\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.event_id").value("$join"));

    verify(accessGuard).requireCanSetState(ROOM, ALICE, "m.room.member", ALICE);
  }

  @Test
  void redact_shouldAcceptMissingBody() throws Exception {
    // Given
    when(roomEventService.redact(eq(ROOM), eq("$rel"), eq(ALICE), isNull()))
        .thenReturn("$redaction");

    // When & Then
    mockMvc.perform(post(BASE + "/redact/$rel").header(RelationController.USER_HEADER, ALICE))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.event_id").value("$redaction"));
  }

  @Test
  void redact_shouldPassReason() throws Exception {
    // Given
    when(roomEventService.redact(ROOM, "$rel", ALICE, "spam")).thenReturn("$redaction");

    // When & Then
    mockMvc.perform(post(BASE + "/redact/$rel")
            .header(RelationController.USER_HEADER, ALICE)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"reason\":\"spam\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.event_id").value("$redaction"));
  }

  @Test
  void redact_shouldRejectOverlongReason() throws Exception {
    mockMvc.perform(post(BASE + "/redact/$rel")
            .header(RelationController.USER_HEADER, ALICE)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"reason\":\"" + "x".repeat(1025) + "\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("invalid_argument"))
        .andExpect(jsonPath("$.title").value("reason must be at most 1024 characters"));

    verifyNoInteractions(roomEventService);
  }
}
