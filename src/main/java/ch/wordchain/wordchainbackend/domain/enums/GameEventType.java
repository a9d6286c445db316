package ch.wordchain.wordchainbackend.domain.enums;

public enum GameEventType
{
    PLAYER_JOINED,
    WAITING_COUNTDOWN,
    GAME_STARTED,
    TURN_STARTED,
    TURN_WARNING,
    WORD_ACCEPTED,
    WORD_REJECTED,
    PLAYER_ELIMINATED,
    PLAYER_SKIPPED,
    PLAYER_LEFT,
    GAME_ENDED
}
