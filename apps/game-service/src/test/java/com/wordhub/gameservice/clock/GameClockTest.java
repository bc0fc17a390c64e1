package com.wordhub.gameservice.clock;

import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GameClockTest {

    @Test
    void onlyRunningSideIsCharged() {
        GameClock clock = new GameClock(10_000);
        clock.start(0, 1_000);

        clock.tick(4_000);

        assertThat(clock.remaining(0)).isEqualTo(7_000);
        assertThat(clock.remaining(1)).isEqualTo(10_000);
        assertThat(clock.runningSide()).isZero();
    }

    @Test
    void switchSideSettlesOutgoingSideFirst() {
        GameClock clock = new GameClock(10_000);
        clock.start(1, 0);

        clock.switchSide(2_500);
        clock.tick(3_000);

        assertThat(clock.remaining(1)).isEqualTo(7_500);
        assertThat(clock.remaining(0)).isEqualTo(9_500);
        assertThat(clock.runningSide()).isZero();
    }

    @Test
    void expiryIsReportedExactlyOnce() {
        GameClock clock = new GameClock(1_000);
        clock.start(0, 0);

        OptionalInt first = clock.tick(1_500);
        OptionalInt second = clock.tick(2_000);

        assertThat(first).hasValue(0);
        assertThat(second).isEmpty();
        assertThat(clock.remaining(0)).isZero();
    }

    @Test
    void pauseFreezesBothCounters() {
        GameClock clock = new GameClock(10_000);
        clock.start(0, 0);
        clock.pause(1_000);

        clock.tick(50_000);
        assertThat(clock.remaining(0)).isEqualTo(9_000);
        assertThat(clock.snapshot().paused()).isTrue();
        assertThat(clock.msUntilExpiry(50_000)).isEqualTo(-1);

        clock.resume(50_000);
        clock.tick(51_000);
        assertThat(clock.remaining(0)).isEqualTo(8_000);
    }

    @Test
    void backwardsTimeIsIgnored() {
        GameClock clock = new GameClock(10_000);
        clock.start(0, 5_000);

        clock.tick(4_000);
        assertThat(clock.remaining(0)).isEqualTo(10_000);

        clock.tick(6_000);
        assertThat(clock.remaining(0)).isEqualTo(9_000);
    }

    @Test
    void msUntilExpiryTracksRunningSide() {
        GameClock clock = new GameClock(10_000);
        assertThat(clock.msUntilExpiry(0)).isEqualTo(-1);

        clock.start(0, 0);
        assertThat(clock.msUntilExpiry(3_000)).isEqualTo(7_000);
        assertThat(clock.msUntilExpiry(30_000)).isZero();
    }

    @Test
    void rejectsInvalidArguments() {
        assertThatThrownBy(() -> new GameClock(0)).isInstanceOf(IllegalArgumentException.class);
        GameClock clock = new GameClock(1_000);
        assertThatThrownBy(() -> clock.start(2, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> clock.switchSide(0)).isInstanceOf(IllegalStateException.class);
    }
}
