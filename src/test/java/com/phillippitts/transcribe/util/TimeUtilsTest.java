package com.phillippitts.transcribe.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeUtilsTest {

    @Test
    void roundToMillisKeepsThreeDecimals() {
        assertThat(TimeUtils.roundToMillis(1.23456)).isEqualTo(1.235);
        assertThat(TimeUtils.roundToMillis(0.0004)).isEqualTo(0.0);
    }

    @Test
    void elapsedIsNeverNegative() throws InterruptedException {
        long start = System.nanoTime();
        Thread.sleep(5);

        assertThat(TimeUtils.elapsedMillis(start)).isGreaterThanOrEqualTo(5L);
        assertThat(TimeUtils.elapsedSeconds(start)).isGreaterThanOrEqualTo(0.005);
    }
}
