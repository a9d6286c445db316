package ch.wordchain.wordchainbackend.application.service;

import ch.wordchain.wordchainbackend.domain.GameConfiguration;
import ch.wordchain.wordchainbackend.domain.GameState;
import ch.wordchain.wordchainbackend.domain.Player;
import ch.wordchain.wordchainbackend.domain.enums.GameStatus;
import ch.wordchain.wordchainbackend.domain.enums.TimeoutPolicy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static ch.wordchain.wordchainbackend.testutil.TestRooms.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link GameState} and {@link GameConfiguration}.
 *
 * <p>Focus areas:
 * <ul>
 *   <li>Turn order: advancing, removing players, skipping inactive players</li>
 *   <li>Membership rules (duplicates, room capacity)</li>
 *   <li>Remaining turn time calculation</li>
 *   <li>Lifecycle transitions (WAITING -> ACTIVE -> TERMINATED)</li>
 * </ul>
 */
class GameStateTest {

    private Player alice;
    private Player bob;
    private Player carol;

    @BeforeEach
    void setUp() {
        alice = player(1L, "Alice");
        bob = player(2L, "Bob");
        carol = player(3L, "Carol");
    }

    // ------------------------------------------------------------------------------------
    // Players and turn order
    // ------------------------------------------------------------------------------------

    @Test
    void addPlayer_shouldRejectDuplicateId() {
        GameState state = waitingRoom("room-1", GameConfiguration.defaultConfig(), 'C', alice);

        boolean added = state.addPlayer(new Player(1L, "Alice again"));

        assertThat(added).isFalse();
        assertThat(state.getPlayers()).containsExactly(alice);
    }

    @Test
    void addPlayer_shouldRejectPlayer_whenRoomIsFull() {
        GameConfiguration config = new GameConfiguration(30, 2, 20, 2, List.of(), 2, 60, List.of(), TimeoutPolicy.ELIMINATE);
        GameState state = waitingRoom("room-1", config, 'C', alice, bob);

        assertThat(state.addPlayer(carol)).isFalse();
        assertThat(state.getPlayers()).hasSize(2);
    }

    @Test
    void advanceTurn_shouldWrapAroundToFirstPlayer() {
        GameState state = activeRoom("room-1", 'C', alice, bob, carol);

        state.advanceTurn();
        state.advanceTurn();
        assertThat(state.currentPlayer()).contains(carol);

        state.advanceTurn();
        assertThat(state.currentPlayer()).contains(alice);
    }

    @Test
    void removePlayer_shouldHandTurnToSuccessor_whenCurrentPlayerIsRemoved() {
        GameState state = activeRoom("room-1", 'C', alice, bob, carol);
        state.advanceTurn(); // Bob

        boolean removed = state.removePlayer(bob.getId());

        assertThat(removed).isTrue();
        assertThat(state.currentPlayer()).contains(carol);
    }

    @Test
    void removePlayer_shouldWrapToFirst_whenCurrentLastPlayerIsRemoved() {
        GameState state = activeRoom("room-1", 'C', alice, bob, carol);
        state.advanceTurn();
        state.advanceTurn(); // Carol

        state.removePlayer(carol.getId());

        assertThat(state.currentPlayer()).contains(alice);
    }

    @Test
    void removePlayer_shouldKeepCurrentPlayer_whenEarlierSeatIsRemoved() {
        GameState state = activeRoom("room-1", 'C', alice, bob, carol);
        state.advanceTurn(); // Bob

        state.removePlayer(alice.getId());

        assertThat(state.currentPlayer()).contains(bob);
        assertThat(state.nextPlayer()).contains(carol);
    }

    @Test
    void removePlayer_shouldKeepCurrentPlayer_whenLaterSeatIsRemoved() {
        GameState state = activeRoom("room-1", 'C', alice, bob, carol);

        state.removePlayer(carol.getId());

        assertThat(state.currentPlayer()).contains(alice);
        assertThat(state.nextPlayer()).contains(bob);
    }

    @Test
    void removePlayer_shouldReturnFalse_whenPlayerIsUnknown() {
        GameState state = activeRoom("room-1", 'C', alice, bob);

        assertThat(state.removePlayer(99L)).isFalse();
        assertThat(state.getPlayers()).hasSize(2);
    }

    @Test
    void removePlayer_shouldNeverGiveTwoConsecutiveTurnsToSamePlayer() {
        GameState state = activeRoom("room-1", 'C', alice, bob, carol, player(4L, "Dave"));
        state.advanceTurn(); // Bob
        Player before = state.currentPlayer().orElseThrow();

        state.removePlayer(before.getId());
        Player after = state.currentPlayer().orElseThrow();

        assertThat(after).isNotEqualTo(before);
        assertThat(after).isEqualTo(carol);
    }

    @Test
    void skipInactive_shouldMoveToNextActivePlayer() {
        GameState state = activeRoom("room-1", 'C', alice, bob, carol);
        bob.setActive(false);
        state.advanceTurn(); // Bob, inactive

        state.skipInactive();

        assertThat(state.currentPlayer()).contains(carol);
    }

    @Test
    void skipInactive_shouldStopAfterOneCycle_whenNobodyIsActive() {
        GameState state = activeRoom("room-1", 'C', alice, bob);
        alice.setActive(false);
        bob.setActive(false);

        state.skipInactive();

        assertThat(state.currentPlayer()).isPresent();
        assertThat(state.shouldTerminate()).isTrue();
    }

    @Test
    void setPlayerActive_shouldPassTurnOn_whenCurrentPlayerIsDeactivated() {
        GameState state = activeRoom("room-1", 'C', alice, bob, carol);

        boolean found = state.setPlayerActive(alice.getId(), false);

        assertThat(found).isTrue();
        assertThat(state.currentPlayer()).contains(bob);
        assertThat(state.activePlayers()).containsExactly(bob, carol);
    }

    @Test
    void setPlayerActive_shouldReturnFalse_whenPlayerIsUnknown() {
        GameState state = activeRoom("room-1", 'C', alice, bob);

        assertThat(state.setPlayerActive(42L, false)).isFalse();
    }

    @Test
    void currentPlayer_shouldBeEmpty_whenIndexIsCorrupted() {
        GameState state = activeRoom("room-1", 'C', alice, bob);
        ReflectionTestUtils.setField(state, "currentPlayerIndex", 7);

        assertThat(state.currentPlayer()).isEmpty();
    }

    @Test
    void turnOrder_shouldStartWithCurrentPlayer() {
        GameState state = activeRoom("room-1", 'C', alice, bob, carol);
        state.advanceTurn();

        assertThat(state.turnOrder()).containsExactly(bob, carol, alice);
    }

    @Test
    void shouldTerminate_shouldBeTrue_whenOneActivePlayerIsLeft() {
        GameState state = activeRoom("room-1", 'C', alice, bob);
        assertThat(state.shouldTerminate()).isFalse();

        state.removePlayer(bob.getId());

        assertThat(state.shouldTerminate()).isTrue();
    }

    // ------------------------------------------------------------------------------------
    // Timing and lifecycle
    // ------------------------------------------------------------------------------------

    @Test
    void remainingTurnTime_shouldBeEmpty_whileWaiting() {
        GameState state = waitingRoom("room-1", GameConfiguration.defaultConfig(), 'C', alice, bob);

        assertThat(state.remainingTurnTime()).isEmpty();
    }

    @Test
    void remainingTurnTime_shouldSubtractElapsedTime_andNeverGoNegative() {
        GameState state = activeRoom("room-1", 'C', alice, bob);
        Instant anchor = Instant.parse("2026-01-01T10:00:00Z");
        state.anchorTurn(anchor);

        assertThat(state.remainingTurnTime(anchor.plusSeconds(10))).contains(Duration.ofSeconds(20));
        assertThat(state.remainingTurnTime(anchor.plusSeconds(45))).contains(Duration.ZERO);
    }

    @Test
    void activate_shouldPassOverPlayersPausedWhileWaiting() {
        GameState state = waitingRoom("room-1", GameConfiguration.defaultConfig(), 'C', alice, bob, carol);
        alice.setActive(false);

        state.activate();

        assertThat(state.currentPlayer()).contains(bob);
        assertThat(state.remainingTurnTime()).isPresent();
    }

    @Test
    void activate_shouldThrow_whenRoomIsNotWaiting() {
        GameState state = activeRoom("room-1", 'C', alice, bob);

        assertThatThrownBy(state::activate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void activate_shouldStartWithFirstPlayerAndAnchorTurn() {
        GameState state = waitingRoom("room-1", GameConfiguration.defaultConfig(), 'c', alice, bob);

        state.activate();

        assertThat(state.getStatus()).isEqualTo(GameStatus.ACTIVE);
        assertThat(state.currentPlayer()).contains(alice);
        assertThat(state.getTurnStartedAt()).isNotNull();
        assertThat(state.getCurrentLetter()).isEqualTo('C');
    }

    @Test
    void nextTurnToken_shouldIncreaseMonotonically() {
        GameState state = activeRoom("room-1", 'C', alice, bob);

        long first = state.nextTurnToken();
        long second = state.nextTurnToken();

        assertThat(second).isGreaterThan(first);
        assertThat(state.getTurnToken()).isEqualTo(second);
    }

    @Test
    void usedWords_shouldBeReadOnlyView() {
        GameState state = activeRoom("room-1", 'C', alice, bob);
        state.recordUsedWord("cat");

        assertThat(state.isWordUsed("cat")).isTrue();
        assertThatThrownBy(() -> state.getUsedWords().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    // ------------------------------------------------------------------------------------
    // GameConfiguration
    // ------------------------------------------------------------------------------------

    @Test
    void configuration_shouldSortAndDeduplicateWarningOffsets() {
        GameConfiguration config = new GameConfiguration(
                30, 2, 20, 10, List.of(5, 15, 10, 5), 2, 60, List.of(10, 30), TimeoutPolicy.SKIP);

        assertThat(config.getWarningOffsetsSeconds()).containsExactly(15, 10, 5);
        assertThat(config.getWaitingWarningOffsets()).containsExactly(Duration.ofSeconds(30), Duration.ofSeconds(10));
    }

    @Test
    void configuration_shouldRejectInvalidBounds() {
        assertThatThrownBy(() -> new GameConfiguration(0, 2, 20, 10, List.of(), 2, 60, List.of(), TimeoutPolicy.ELIMINATE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GameConfiguration(30, 5, 3, 10, List.of(), 2, 60, List.of(), TimeoutPolicy.ELIMINATE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GameConfiguration(30, 2, 20, 1, List.of(), 2, 60, List.of(), TimeoutPolicy.ELIMINATE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GameConfiguration(30, 2, 20, 10, List.of(-1), 2, 60, List.of(), TimeoutPolicy.ELIMINATE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
