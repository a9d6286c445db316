package ch.wordchain.wordchainbackend.application.service;

import ch.wordchain.wordchainbackend.domain.enums.Difficulty;
import ch.wordchain.wordchainbackend.domain.enums.GameStatus;
import ch.wordchain.wordchainbackend.domain.enums.LoadLevel;
import ch.wordchain.wordchainbackend.domain.enums.SubmissionResult;
import ch.wordchain.wordchainbackend.exception.AdmissionDeniedException;
import ch.wordchain.wordchainbackend.exception.RoomNotFoundException;
import ch.wordchain.wordchainbackend.service.GameService;
import ch.wordchain.wordchainbackend.service.SubmissionOutcome;
import ch.wordchain.wordchainbackend.web.api.controller.RoomController;
import ch.wordchain.wordchainbackend.web.api.dto.JoinRoomResponseDto;
import ch.wordchain.wordchainbackend.web.api.dto.PlayerDto;
import ch.wordchain.wordchainbackend.web.api.dto.RoomStateDto;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Controller tests for {@link RoomController}.
 *
 * <p>Focus:
 * <ul>
 *   <li>HTTP 200 with JSON bodies for successful requests</li>
 *   <li>HTTP status mapping for service exceptions (503 / 404 / 400)</li>
 *   <li>Submissions always answer 200 with the classification in the body</li>
 * </ul>
 */
@WebMvcTest(RoomController.class)
class RoomControllerTest {

    private static final String ROOM = "room-1";

    @Autowired
    MockMvc mockMvc;

    @MockitoBean
    GameService gameService;

    // ------------------------------------------------------------------------------------
    // POST /api/rooms/{roomId}/join
    // ------------------------------------------------------------------------------------

    @Test
    void joinRoom_shouldReturn200_andJoinResult() throws Exception {
        when(gameService.joinRoom(ROOM, 1L, "Alice"))
                .thenReturn(new JoinRoomResponseDto(ROOM, 1L, "Alice", GameStatus.WAITING, 1, true));

        mockMvc.perform(post("/api/rooms/{roomId}/join", ROOM)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":1,\"displayName\":\"Alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roomId").value(ROOM))
                .andExpect(jsonPath("$.status").value("WAITING"))
                .andExpect(jsonPath("$.roomCreated").value(true));
    }

    @Test
    void joinRoom_shouldReturn503_whenAdmissionIsDenied() throws Exception {
        when(gameService.joinRoom(ROOM, 1L, "Alice"))
                .thenThrow(new AdmissionDeniedException("System resources are critically low", LoadLevel.CRITICAL));

        mockMvc.perform(post("/api/rooms/{roomId}/join", ROOM)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":1,\"displayName\":\"Alice\"}"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void joinRoom_shouldReturn400_whenGameIsAlreadyRunning() throws Exception {
        when(gameService.joinRoom(ROOM, 3L, "Carol"))
                .thenThrow(new IllegalStateException("Game in room room-1 is already running"));

        mockMvc.perform(post("/api/rooms/{roomId}/join", ROOM)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":3,\"displayName\":\"Carol\"}"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------------------------
    // POST /api/rooms/{roomId}/start
    // ------------------------------------------------------------------------------------

    @Test
    void startGame_shouldReturn404_whenRoomIsUnknown() throws Exception {
        when(gameService.startGame(ROOM)).thenThrow(new RoomNotFoundException(ROOM));

        mockMvc.perform(post("/api/rooms/{roomId}/start", ROOM))
                .andExpect(status().isNotFound());
    }

    @Test
    void startGame_shouldReturn400_whenTooFewPlayers() throws Exception {
        when(gameService.startGame(ROOM)).thenThrow(new IllegalStateException("needs at least 2 players"));

        mockMvc.perform(post("/api/rooms/{roomId}/start", ROOM))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------------------------
    // POST /api/rooms/{roomId}/words
    // ------------------------------------------------------------------------------------

    @Test
    void submitWord_shouldReturn200_withAcceptedResult() throws Exception {
        when(gameService.submitWord(ROOM, 1L, "Cat"))
                .thenReturn(new SubmissionOutcome(SubmissionResult.VALID_WORD, "Accepted 'cat'", "cat"));

        mockMvc.perform(post("/api/rooms/{roomId}/words", ROOM)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":1,\"word\":\"Cat\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("VALID_WORD"))
                .andExpect(jsonPath("$.accepted").value(true))
                .andExpect(jsonPath("$.word").value("cat"));
    }

    @Test
    void submitWord_shouldReturn200_withRejection() throws Exception {
        when(gameService.submitWord(ROOM, 2L, "cat"))
                .thenReturn(new SubmissionOutcome(SubmissionResult.WRONG_PLAYER, "It's Alice's turn", null));

        mockMvc.perform(post("/api/rooms/{roomId}/words", ROOM)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":2,\"word\":\"cat\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("WRONG_PLAYER"))
                .andExpect(jsonPath("$.accepted").value(false));
    }

    // ------------------------------------------------------------------------------------
    // POST /api/rooms/{roomId}/leave, /players/{playerId}/active
    // ------------------------------------------------------------------------------------

    @Test
    void leaveRoom_shouldReturn204() throws Exception {
        mockMvc.perform(post("/api/rooms/{roomId}/leave", ROOM)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":1}"))
                .andExpect(status().isNoContent());

        verify(gameService).leaveRoom(ROOM, 1L);
    }

    @Test
    void leaveRoom_shouldReturn400_whenPlayerIsNotInRoom() throws Exception {
        doThrow(new IllegalArgumentException("Player 9 is not in room room-1"))
                .when(gameService).leaveRoom(ROOM, 9L);

        mockMvc.perform(post("/api/rooms/{roomId}/leave", ROOM)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"playerId\":9}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void setPlayerActive_shouldReturn200_withRoomState() throws Exception {
        when(gameService.setPlayerActive(ROOM, 1L, false)).thenReturn(activeState());

        mockMvc.perform(post("/api/rooms/{roomId}/players/{playerId}/active", ROOM, 1L)
                        .param("active", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentPlayerId").value(2));
    }

    // ------------------------------------------------------------------------------------
    // GET / DELETE /api/rooms/{roomId}
    // ------------------------------------------------------------------------------------

    @Test
    void getRoom_shouldReturn200_withPublicState() throws Exception {
        when(gameService.getRoomState(ROOM)).thenReturn(activeState());

        mockMvc.perform(get("/api/rooms/{roomId}", ROOM))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.currentLetter").value("T"))
                .andExpect(jsonPath("$.players.length()").value(2))
                .andExpect(jsonPath("$.usedWords[0]").value("cat"))
                .andExpect(jsonPath("$.turnToken").doesNotExist());
    }

    @Test
    void getRoom_shouldReturn404_whenRoomIsUnknown() throws Exception {
        when(gameService.getRoomState(ROOM)).thenThrow(new RoomNotFoundException(ROOM));

        mockMvc.perform(get("/api/rooms/{roomId}", ROOM))
                .andExpect(status().isNotFound());
    }

    @Test
    void stopGame_shouldReturn204_thenReturn404() throws Exception {
        when(gameService.stopGame(ROOM)).thenReturn(true, false);

        mockMvc.perform(delete("/api/rooms/{roomId}", ROOM))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/rooms/{roomId}", ROOM))
                .andExpect(status().isNotFound());
    }

    private static RoomStateDto activeState() {
        return new RoomStateDto(
                ROOM,
                GameStatus.ACTIVE,
                List.of(new PlayerDto(2L, "Bob", true), new PlayerDto(1L, "Alice", true)),
                2L,
                "Bob",
                "T",
                1,
                List.of("cat"),
                28L,
                0,
                "Need a 1-letter word starting with 'T' (like 't')",
                Difficulty.EASY
        );
    }
}
