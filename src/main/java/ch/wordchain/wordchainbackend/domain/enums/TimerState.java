package ch.wordchain.wordchainbackend.domain.enums;

public enum TimerState {
    RUNNING,
    CANCELLED,
    EXPIRED
}
