package ch.wordchain.wordchainbackend.exception;

/**
 * Thrown when an operation addresses a room that is not registered (never created or
 * already stopped).
 */
public class RoomNotFoundException extends RuntimeException {

    public RoomNotFoundException(String roomId) {
        super("Room not found: " + roomId);
    }
}
