package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.web.api.dto.GameEventDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Publishes room events to STOMP subscribers on {@code /topic/rooms/{roomId}/events}.
 *
 * <p>Delivery failures are logged only. A broken subscriber must not abort the game operation
 * that produced the event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StompGameEventPublisher implements GameEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;

    public static String destination(String roomId) {
        return "/topic/rooms/" + roomId + "/events";
    }

    @Override
    public void publish(GameEventDto event) {
        try {
            messagingTemplate.convertAndSend(destination(event.roomId()), event);
            log.debug("Sent {} event for room {}", event.type(), event.roomId());
        } catch (MessagingException e) {
            log.warn("Could not deliver {} event for room {}: {}", event.type(), event.roomId(), e.getMessage());
        }
    }
}
