package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.web.api.dto.GameEventDto;

/**
 * Outbound channel for room events. Delivery and formatting are up to the implementation;
 * the game core only hands over structured events.
 */
public interface GameEventPublisher {

    void publish(GameEventDto event);
}
