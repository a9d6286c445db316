package ch.wordchain.wordchainbackend.web.api.dto;

import ch.wordchain.wordchainbackend.domain.Player;

/**
 * DTO representing a player in a room.
 *
 * @param id transport user id
 * @param displayName display name of the player
 * @param active whether the player currently takes part in the turn order
 */
public record PlayerDto(
        long id,
        String displayName,
        boolean active
) {

    public static PlayerDto from(Player player) {
        return new PlayerDto(
                player.getId(),
                player.getDisplayName(),
                player.isActive()
        );
    }
}
