package ch.wordchain.wordchainbackend.service;

import ch.wordchain.wordchainbackend.domain.enums.LoadLevel;

/**
 * Result of an admission check.
 *
 * @param allowed whether a new room may be created
 * @param reason human-readable rejection reason, {@code null} when allowed
 * @param loadLevel load level the decision was based on
 */
public record AdmissionDecision(
        boolean allowed,
        String reason,
        LoadLevel loadLevel
) {
    public static AdmissionDecision allow(LoadLevel loadLevel) {
        return new AdmissionDecision(true, null, loadLevel);
    }

    public static AdmissionDecision deny(String reason, LoadLevel loadLevel) {
        return new AdmissionDecision(false, reason, loadLevel);
    }
}
