package ch.wordchain.wordchainbackend.web.api.dto;

import ch.wordchain.wordchainbackend.domain.enums.GameStatus;

/**
 * Response of a join request.
 *
 * @param roomId room the player joined
 * @param playerId id of the joining player
 * @param displayName display name of the joining player
 * @param status room status after the join
 * @param playerCount players in the room after the join
 * @param roomCreated whether this join opened the room
 */
public record JoinRoomResponseDto(
        String roomId,
        long playerId,
        String displayName,
        GameStatus status,
        int playerCount,
        boolean roomCreated
) {}
