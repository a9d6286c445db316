package ch.wordchain.wordchainbackend.web.api.controller;

import ch.wordchain.wordchainbackend.service.GameService;
import ch.wordchain.wordchainbackend.service.SubmissionOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

/**
 * Receives word submissions over STOMP on {@code /app/rooms/{roomId}/words}.
 *
 * <p>The outcome is not sent back on this channel: the room's event topic carries
 * WORD_ACCEPTED and WORD_REJECTED events for all subscribers.
 */
@Controller
@Slf4j
public class WordWebSocketController {

    private final GameService gameService;

    public WordWebSocketController(GameService gameService) {
        this.gameService = gameService;
    }

    @MessageMapping("/rooms/{roomId}/words")
    public void handleWord(@Payload IncomingWord incoming,
                           @DestinationVariable String roomId) {
        SubmissionOutcome outcome = gameService.submitWord(roomId, incoming.playerId(), incoming.word());
        log.debug("STOMP submission in room {} by {}: {}", roomId, incoming.playerId(), outcome.result());
    }

    public record IncomingWord(
            long playerId,
            String word
    ) {}
}
