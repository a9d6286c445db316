package ch.wordchain.wordchainbackend.application.service;

import ch.wordchain.wordchainbackend.domain.enums.LoadLevel;
import ch.wordchain.wordchainbackend.service.AdmissionController;
import ch.wordchain.wordchainbackend.service.AdmissionDecision;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AdmissionController}.
 *
 * <p>Focus areas:
 * <ul>
 *   <li>Load classification thresholds</li>
 *   <li>Admission decisions and their reasons</li>
 *   <li>Bounded warning log</li>
 * </ul>
 */
class AdmissionControllerTest {

    // ------------------------------------------------------------------------------------
    // classify
    // ------------------------------------------------------------------------------------

    @Test
    void classify_shouldUseRatioThresholds() {
        AdmissionController controller = new AdmissionController(10, 10, 50);

        assertThat(controller.classify(0)).isEqualTo(LoadLevel.LOW);
        assertThat(controller.classify(3)).isEqualTo(LoadLevel.LOW);
        assertThat(controller.classify(4)).isEqualTo(LoadLevel.MEDIUM);
        assertThat(controller.classify(6)).isEqualTo(LoadLevel.MEDIUM);
        assertThat(controller.classify(7)).isEqualTo(LoadLevel.HIGH);
        assertThat(controller.classify(8)).isEqualTo(LoadLevel.HIGH);
        assertThat(controller.classify(9)).isEqualTo(LoadLevel.CRITICAL);
        assertThat(controller.classify(12)).isEqualTo(LoadLevel.CRITICAL);
    }

    // ------------------------------------------------------------------------------------
    // canAdmit
    // ------------------------------------------------------------------------------------

    @Test
    void canAdmit_shouldAllow_atLowLoad_withoutWarning() {
        AdmissionController controller = new AdmissionController(10, 10, 50);

        AdmissionDecision decision = controller.canAdmit(2, 1);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.reason()).isNull();
        assertThat(decision.loadLevel()).isEqualTo(LoadLevel.LOW);
        assertThat(controller.warningCount()).isZero();
    }

    @Test
    void canAdmit_shouldAllow_atHighLoad_butRecordWarning() {
        AdmissionController controller = new AdmissionController(10, 10, 50);

        AdmissionDecision decision = controller.canAdmit(8, 1);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.loadLevel()).isEqualTo(LoadLevel.HIGH);
        assertThat(controller.recentWarnings(Duration.ofMinutes(1)))
                .singleElement()
                .satisfies(w -> {
                    assertThat(w.level()).isEqualTo(LoadLevel.HIGH);
                    assertThat(w.roomCount()).isEqualTo(8);
                    assertThat(w.maxRooms()).isEqualTo(10);
                });
    }

    @Test
    void canAdmit_shouldDeny_atCriticalLoad() {
        AdmissionController controller = new AdmissionController(10, 10, 50);

        AdmissionDecision decision = controller.canAdmit(9, 1);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.loadLevel()).isEqualTo(LoadLevel.CRITICAL);
        assertThat(decision.reason()).isEqualTo("System resources are critically low");
        assertThat(controller.warningCount()).isEqualTo(1);
    }

    @Test
    void canAdmit_shouldDeny_whenRoomLimitIsReached() {
        AdmissionController controller = new AdmissionController(10, 10, 50);

        AdmissionDecision decision = controller.canAdmit(10, 1);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).contains("limit reached (10)");
    }

    @Test
    void canAdmit_shouldDeny_whenTooManyPlayersAreRequested() {
        AdmissionController controller = new AdmissionController(10, 4, 50);

        AdmissionDecision decision = controller.canAdmit(0, 5);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo("Too many players for one room (max: 4)");
    }

    // ------------------------------------------------------------------------------------
    // Warnings
    // ------------------------------------------------------------------------------------

    @Test
    void recordWarning_shouldKeepOnlyMostRecentWarnings() {
        AdmissionController controller = new AdmissionController(10, 10, 3);

        for (int i = 0; i < 5; i++) {
            controller.recordWarning(LoadLevel.HIGH, i);
        }

        assertThat(controller.warningCount()).isEqualTo(3);
        assertThat(controller.recentWarnings(Duration.ofHours(1)))
                .extracting(AdmissionController.LoadWarning::roomCount)
                .containsExactly(2, 3, 4);
    }

    @Test
    void constructor_shouldRejectNonPositiveLimits() {
        assertThatThrownBy(() -> new AdmissionController(0, 10, 50))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
