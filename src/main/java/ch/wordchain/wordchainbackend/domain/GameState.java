package ch.wordchain.wordchainbackend.domain;

import ch.wordchain.wordchainbackend.domain.enums.GameStatus;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Represents the game running in one room: players in turn order, the current requirement
 * (starting letter and minimum length), the words already used and the turn timing.
 *
 * <p>The state only offers mutations that keep its invariants intact. Rule enforcement
 * (who may submit what) lives in the service layer. All mutations are expected to happen
 * while holding the room's isolation gate; reads of {@link #getStatus()} and the player
 * list are safe from other threads.
 */
@Getter
public class GameState {

    private final String roomId;

    private final GameConfiguration config;

    /**
     * Players in turn order (insertion order).
     */
    private final List<Player> players = new CopyOnWriteArrayList<>();

    private final Instant createdAt = Instant.now();

    /**
     * Words accepted in this room, lower-case. Only ever grows.
     */
    private final Set<String> usedWords = new LinkedHashSet<>();

    private volatile GameStatus status = GameStatus.WAITING;

    private int currentPlayerIndex;

    /**
     * Letter the next word has to start with, upper-case.
     */
    private char currentLetter;

    /**
     * Minimum length of the next word. Never decreases.
     */
    private int requiredLength;

    /**
     * Start of the current turn's countdown, {@code null} while waiting.
     */
    private Instant turnStartedAt;

    private int currentRoundTurns;

    private int roundsCompleted;

    /**
     * Identifies the outstanding turn timer. Bumped whenever a new turn countdown starts so
     * that callbacks of superseded timers can recognise themselves as stale.
     */
    private long turnToken;

    /**
     * Creates a waiting room state.
     *
     * @param roomId room identifier
     * @param config configuration the room runs with
     * @param startingLetter letter the first word has to start with
     */
    public GameState(String roomId, GameConfiguration config, char startingLetter) {
        this.roomId = roomId;
        this.config = config;
        this.currentLetter = Character.toUpperCase(startingLetter);
        this.requiredLength = config.getMinWordLength();
    }

    /**
     * Returns the player whose turn it is.
     *
     * <p>Never throws: a corrupted index simply yields an empty result, which callers treat as
     * "no legal move possible".
     *
     * @return the current player, or empty if there is none
     */
    public Optional<Player> currentPlayer() {
        if (players.isEmpty() || currentPlayerIndex < 0 || currentPlayerIndex >= players.size()) {
            return Optional.empty();
        }
        return Optional.of(players.get(currentPlayerIndex));
    }

    /**
     * Returns the player after the current one without advancing.
     *
     * @return the next player in turn order, or empty if the room has no players
     */
    public Optional<Player> nextPlayer() {
        if (players.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(players.get((currentPlayerIndex + 1) % players.size()));
    }

    /**
     * Moves the turn to the next seat and restarts the turn clock.
     */
    public void advanceTurn() {
        if (players.isEmpty()) {
            return;
        }
        currentPlayerIndex = (currentPlayerIndex + 1) % players.size();
        anchorTurn();
    }

    /**
     * Adds a player at the end of the turn order.
     *
     * @param player player to add
     * @return {@code true} if added, {@code false} if already present or the room is full
     */
    public boolean addPlayer(Player player) {
        if (findPlayer(player.getId()).isPresent()) {
            return false;
        }
        if (players.size() >= config.getMaxPlayersPerRoom()) {
            return false;
        }
        players.add(player);
        return true;
    }

    /**
     * Removes a player from the turn order.
     *
     * <p>The index is adjusted so the player who now occupies the current relative position
     * keeps (or gets) the turn: removing a seat before the current one shifts the index back,
     * removing the current seat hands the turn to its successor, removing the last seat while
     * it is current wraps to the first seat.
     *
     * @param playerId id of the player to remove
     * @return {@code true} if the player was part of the room
     */
    public boolean removePlayer(long playerId) {
        for (int i = 0; i < players.size(); i++) {
            if (players.get(i).getId() != playerId) {
                continue;
            }
            if (i < currentPlayerIndex) {
                currentPlayerIndex--;
            } else if (i == currentPlayerIndex && currentPlayerIndex >= players.size() - 1) {
                currentPlayerIndex = 0;
            }
            players.remove(i);
            return true;
        }
        return false;
    }

    /**
     * Moves forward until an active player holds the turn, checking each seat at most once.
     * Restarts the turn clock.
     */
    public void skipInactive() {
        if (players.isEmpty()) {
            return;
        }
        for (int attempts = 0; attempts < players.size(); attempts++) {
            Optional<Player> current = currentPlayer();
            if (current.isPresent() && current.get().isActive()) {
                break;
            }
            currentPlayerIndex = (currentPlayerIndex + 1) % players.size();
        }
        anchorTurn();
    }

    /**
     * Changes a player's active flag. Deactivating the current player passes the turn on.
     *
     * @param playerId player to update
     * @param active new flag value
     * @return {@code true} if the player was found
     */
    public boolean setPlayerActive(long playerId, boolean active) {
        Optional<Player> player = findPlayer(playerId);
        if (player.isEmpty()) {
            return false;
        }
        player.get().setActive(active);
        if (!active && currentPlayer().map(p -> p.getId() == playerId).orElse(false)) {
            skipInactive();
        }
        return true;
    }

    /**
     * @return {@code true} when at most one active player is left
     */
    public boolean shouldTerminate() {
        return activePlayers().size() <= 1;
    }

    public Optional<Duration> remainingTurnTime() {
        return remainingTurnTime(Instant.now());
    }

    /**
     * Time left in the current turn, clamped at zero.
     *
     * @param now reference instant
     * @return remaining time, or empty if no turn is running
     */
    public Optional<Duration> remainingTurnTime(Instant now) {
        if (turnStartedAt == null) {
            return Optional.empty();
        }
        Duration remaining = config.getTurnTimeout().minus(Duration.between(turnStartedAt, now));
        return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
    }

    /**
     * Players in turn order, starting with the current one.
     *
     * @return rotated copy of the player list
     */
    public List<Player> turnOrder() {
        List<Player> snapshot = new ArrayList<>(players);
        if (snapshot.isEmpty()) {
            return snapshot;
        }
        int start = Math.min(Math.max(currentPlayerIndex, 0), snapshot.size() - 1);
        Collections.rotate(snapshot, -start);
        return snapshot;
    }

    public List<Player> activePlayers() {
        return players.stream().filter(Player::isActive).toList();
    }

    public Optional<Player> findPlayer(long playerId) {
        return players.stream().filter(p -> p.getId() == playerId).findFirst();
    }

    public boolean isMember(long playerId) {
        return findPlayer(playerId).isPresent();
    }

    public boolean isActive() {
        return status == GameStatus.ACTIVE;
    }

    public boolean isWaiting() {
        return status == GameStatus.WAITING;
    }

    public boolean isTerminated() {
        return status == GameStatus.TERMINATED;
    }

    public List<Player> getPlayers() {
        return Collections.unmodifiableList(players);
    }

    public Set<String> getUsedWords() {
        return Collections.unmodifiableSet(usedWords);
    }

    public boolean isWordUsed(String normalizedWord) {
        return usedWords.contains(normalizedWord);
    }

    /**
     * Records an accepted word. Words are never removed again.
     *
     * @param normalizedWord lower-case word
     */
    public void recordUsedWord(String normalizedWord) {
        usedWords.add(normalizedWord);
    }

    /**
     * Switches a waiting room to active and starts the first turn's clock. The first active
     * player in join order opens; players paused while waiting are passed over.
     */
    public void activate() {
        if (status != GameStatus.WAITING) {
            throw new IllegalStateException("Only a WAITING room can be activated, room " + roomId + " is " + status);
        }
        status = GameStatus.ACTIVE;
        currentPlayerIndex = 0;
        skipInactive();
        anchorTurn();
    }

    public void terminate() {
        status = GameStatus.TERMINATED;
    }

    public void anchorTurn() {
        anchorTurn(Instant.now());
    }

    public void anchorTurn(Instant at) {
        this.turnStartedAt = at;
    }

    public void setCurrentLetter(char letter) {
        this.currentLetter = Character.toUpperCase(letter);
    }

    /**
     * Raises the minimum word length by one.
     */
    public void increaseRequiredLength() {
        requiredLength++;
    }

    public void incrementRoundTurns() {
        currentRoundTurns++;
    }

    /**
     * Closes the current round and resets the per-round turn counter.
     */
    public void completeRound() {
        roundsCompleted++;
        currentRoundTurns = 0;
    }

    /**
     * Invalidates the outstanding turn timer and returns the token of the new one.
     *
     * @return token identifying the next turn countdown
     */
    public long nextTurnToken() {
        return ++turnToken;
    }
}
