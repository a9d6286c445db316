package ch.wordchain.wordchainbackend.domain.enums;

/**
 * What happens to a player whose turn timer expires.
 */
public enum TimeoutPolicy {
    /**
     * The player is removed from the room. The last remaining player wins.
     */
    ELIMINATE,
    /**
     * The player stays in the room and the turn simply moves on.
     */
    SKIP
}
