package ch.wordchain.wordchainbackend.domain.enums;

public enum GameEndReason {
    LAST_PLAYER_STANDING,
    NOT_ENOUGH_PLAYERS,
    IDLE_TIMEOUT,
    STOPPED
}
