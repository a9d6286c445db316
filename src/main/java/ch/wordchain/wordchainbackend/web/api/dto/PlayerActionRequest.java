package ch.wordchain.wordchainbackend.web.api.dto;

/**
 * Generic request DTO for player-initiated room actions.
 *
 * <p>Used for endpoints where only the acting player's identity is required (e.g. leave).
 *
 * @param playerId identifier of the player performing the action
 */
public record PlayerActionRequest(
        long playerId
) {}
