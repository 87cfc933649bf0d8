package com.techStack.authCore.service.security;

import com.techStack.authCore.models.CounterState;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SlidingWindowTest {

    private static final long WINDOW = 60_000;

    @Test
    void windowStart_shouldAlignToWindowLength() {
        assertThat(SlidingWindow.windowStart(125_000, WINDOW)).isEqualTo(120_000);
        assertThat(SlidingWindow.windowStart(120_000, WINDOW)).isEqualTo(120_000);
    }

    @Test
    void roll_shouldShiftCountIntoPreviousWindow_whenAdjacent() {
        CounterState state = CounterState.empty(0).toBuilder().count(4).lastHitAt(50_000).build();

        CounterState rolled = SlidingWindow.roll(state, 70_000, WINDOW);

        assertThat(rolled.windowStart()).isEqualTo(60_000);
        assertThat(rolled.previousCount()).isEqualTo(4);
        assertThat(rolled.previousLastHitAt()).isEqualTo(50_000);
        assertThat(rolled.count()).isZero();
    }

    @Test
    void roll_shouldDropBothWindows_whenMoreThanOneWindowPassed() {
        CounterState state = CounterState.empty(0).toBuilder().count(4).previousCount(2).lastHitAt(50_000).build();

        CounterState rolled = SlidingWindow.roll(state, 130_000, WINDOW);

        assertThat(rolled.count()).isZero();
        assertThat(rolled.previousCount()).isZero();
    }

    @Test
    void roll_shouldKeepLockFields() {
        CounterState state = CounterState.empty(0).toBuilder().lockedUntil(500_000L).lockouts(2).build();

        CounterState rolled = SlidingWindow.roll(state, 200_000, WINDOW);

        assertThat(rolled.lockedUntil()).isEqualTo(500_000L);
        assertThat(rolled.lockouts()).isEqualTo(2);
    }

    @Test
    void effectiveCount_shouldWeightPreviousWindowByOverlap() {
        CounterState rolled = CounterState.empty(60_000).toBuilder()
                .previousCount(4).previousLastHitAt(59_000).count(1).build();

        assertThat(SlidingWindow.effectiveCount(rolled, 75_000, WINDOW)).isCloseTo(4.0, within(1e-9));
    }

    @Test
    void effectiveCount_shouldIgnorePreviousWindow_onceItsLastHitIsAWindowOld() {
        CounterState rolled = CounterState.empty(60_000).toBuilder()
                .previousCount(4).previousLastHitAt(10_000).build();

        assertThat(SlidingWindow.effectiveCount(rolled, 70_000, WINDOW)).isZero();
    }
}
