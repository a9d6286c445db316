package ch.wordchain.wordchainbackend.domain;

import lombok.Getter;
import lombok.Setter;

/**
 * Represents a player participating in a room.
 *
 * <p>The id is assigned by the chat transport and never changes. The {@code active} flag is
 * used to mark temporary disengagement: an inactive player keeps their seat but is skipped
 * in the turn order.
 */
@Getter
public class Player {

    /**
     * Opaque numeric identity, unique per transport user.
     */
    private final long id;

    /**
     * Display name used in announcements.
     */
    private final String displayName;

    /**
     * Whether the player currently takes part in the turn order.
     */
    @Setter
    private volatile boolean active = true;

    /**
     * Creates a new active player.
     *
     * @param id transport user id
     * @param displayName display name of the player
     */
    public Player(long id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    /**
     * Identity-based equality: two players are equal when their ids match.
     *
     * @param o other object
     * @return {@code true} if both players share the same id
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Player other)) return false;
        return id == other.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return displayName + "#" + id;
    }
}
