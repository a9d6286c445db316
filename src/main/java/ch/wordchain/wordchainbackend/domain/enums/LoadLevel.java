package ch.wordchain.wordchainbackend.domain.enums;

public enum LoadLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
