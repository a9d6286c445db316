package ch.wordchain.wordchainbackend.web.api.dto;

import ch.wordchain.wordchainbackend.domain.enums.LoadLevel;

import java.time.Instant;
import java.util.List;

/**
 * Read-only snapshot of the system for health and operations reporting.
 *
 * @param timestamp when the snapshot was taken
 * @param roomCount registered rooms (waiting and active)
 * @param activeRoomCount rooms with a running game
 * @param maxRooms configured room ceiling
 * @param loadLevel current load classification
 * @param totalPlayers players across all rooms
 * @param activeTimers running countdowns
 * @param roomGates room gates currently held in memory
 * @param dictionaryAvailable whether the dictionary answers
 * @param uptimeSeconds seconds since startup
 * @param roomsCreated rooms created since startup
 * @param roomsCompleted rooms ended since startup
 * @param totalWords accepted words since startup
 * @param totalTimeouts turn timeouts since startup
 * @param totalErrors validation errors since startup
 * @param roomsPerHour rooms created per hour of uptime
 * @param averageRoomDurationSeconds average lifetime of ended rooms
 * @param recentWarnings load warnings in the last hour
 * @param rooms per-room metrics
 */
public record SystemStatusDto(
        Instant timestamp,
        int roomCount,
        int activeRoomCount,
        int maxRooms,
        LoadLevel loadLevel,
        int totalPlayers,
        int activeTimers,
        int roomGates,
        boolean dictionaryAvailable,
        long uptimeSeconds,
        long roomsCreated,
        long roomsCompleted,
        long totalWords,
        long totalTimeouts,
        long totalErrors,
        double roomsPerHour,
        long averageRoomDurationSeconds,
        int recentWarnings,
        List<RoomMetricsDto> rooms
) {}
