package ch.wordchain.wordchainbackend.web.api.dto;

public record SubmitWordRequest(
        long playerId,
        String word
) {}
