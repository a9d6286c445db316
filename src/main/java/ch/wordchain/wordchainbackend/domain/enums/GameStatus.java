package ch.wordchain.wordchainbackend.domain.enums;

public enum GameStatus {
    /**
     * Room exists and collects players; no turn timer is running yet.
     */
    WAITING,
    ACTIVE,
    /**
     * Game is over or the room was stopped. A terminated state is never reused.
     */
    TERMINATED
}
