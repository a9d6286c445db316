package ch.wordchain.wordchainbackend.web.api.controller;

import ch.wordchain.wordchainbackend.exception.AdmissionDeniedException;
import ch.wordchain.wordchainbackend.exception.RoomNotFoundException;
import ch.wordchain.wordchainbackend.service.GameService;
import ch.wordchain.wordchainbackend.service.SubmissionOutcome;
import ch.wordchain.wordchainbackend.web.api.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/rooms")
public class RoomController {

    private final GameService gameService;

    public RoomController(GameService gameService) {
        this.gameService = gameService;
    }

    @Operation(summary = "Join a room, creating it if it does not exist")
    @PostMapping("/{roomId}/join")
    public ResponseEntity<JoinRoomResponseDto> joinRoom(@PathVariable String roomId,
                                                        @RequestBody JoinRoomRequest request) {
        try {
            JoinRoomResponseDto dto = gameService.joinRoom(roomId, request.playerId(), request.displayName());
            return ResponseEntity.ok(dto);
        } catch (AdmissionDeniedException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        } catch (IllegalArgumentException | IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Start the game in a waiting room without waiting for the countdown")
    @PostMapping("/{roomId}/start")
    public ResponseEntity<RoomStateDto> startGame(@PathVariable String roomId) {
        try {
            return ResponseEntity.ok(gameService.startGame(roomId));
        } catch (RoomNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalStateException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Submit a word for the current turn")
    @PostMapping("/{roomId}/words")
    public ResponseEntity<SubmissionResultDto> submitWord(@PathVariable String roomId,
                                                          @RequestBody SubmitWordRequest request) {
        SubmissionOutcome outcome = gameService.submitWord(roomId, request.playerId(), request.word());
        return ResponseEntity.ok(SubmissionResultDto.from(outcome));
    }

    @Operation(summary = "Leave a room")
    @PostMapping("/{roomId}/leave")
    public ResponseEntity<Void> leaveRoom(@PathVariable String roomId,
                                          @RequestBody PlayerActionRequest request) {
        try {
            gameService.leaveRoom(roomId, request.playerId());
            return ResponseEntity.noContent().build();
        } catch (RoomNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Pause or resume a player's participation in the turn order")
    @PostMapping("/{roomId}/players/{playerId}/active")
    public ResponseEntity<RoomStateDto> setPlayerActive(@PathVariable String roomId,
                                                        @PathVariable long playerId,
                                                        @RequestParam boolean active) {
        try {
            return ResponseEntity.ok(gameService.setPlayerActive(roomId, playerId, active));
        } catch (RoomNotFoundException e) {
            return ResponseEntity.notFound().build();
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "Get the public state of a room")
    @GetMapping("/{roomId}")
    public ResponseEntity<RoomStateDto> getRoom(@PathVariable String roomId) {
        try {
            return ResponseEntity.ok(gameService.getRoomState(roomId));
        } catch (RoomNotFoundException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Stop the game in a room and remove the room")
    @DeleteMapping("/{roomId}")
    public ResponseEntity<Void> stopGame(@PathVariable String roomId) {
        if (gameService.stopGame(roomId)) {
            return ResponseEntity.noContent().build();
        }
        return ResponseEntity.notFound().build();
    }
}
