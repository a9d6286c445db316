package ch.wordchain.wordchainbackend.web.api.dto;

public record JoinRoomRequest(
        long playerId,
        String displayName
) {}
