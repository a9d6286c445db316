package ch.wordchain.wordchainbackend.domain.enums;

public enum Difficulty {
    EASY,
    TRICKY_LETTER,
    MODERATE,
    HARD,
    VERY_HARD
}
