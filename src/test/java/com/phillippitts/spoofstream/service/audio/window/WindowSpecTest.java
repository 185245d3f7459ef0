package com.phillippitts.spoofstream.service.audio.window;

import com.phillippitts.spoofstream.exception.InvalidWindowConfigException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WindowSpecTest {

    @Test
    void derivesSampleCountsFromDurations() {
        WindowSpec spec = WindowSpec.fromDurations(1.0, 0.5, 1.0, 16_000);

        assertThat(spec.chunkLength()).isEqualTo(16_000);
        assertThat(spec.overlapLength()).isEqualTo(8_000);
        assertThat(spec.minLength()).isEqualTo(16_000);
        assertThat(spec.hopLength()).isEqualTo(8_000);
    }

    @Test
    void roundsFractionalSampleCounts() {
        WindowSpec spec = WindowSpec.fromDurations(0.1, 0.0333, 0.0, 22_050);
        assertThat(spec.chunkLength()).isEqualTo(2_205);
        assertThat(spec.overlapLength()).isEqualTo(734);
    }

    @Test
    void firstWindowThresholdIsTheLargerOfChunkAndMin() {
        assertThat(new WindowSpec(100, 10, 50).firstWindowThreshold()).isEqualTo(100);
        assertThat(new WindowSpec(100, 10, 250).firstWindowThreshold()).isEqualTo(250);
    }

    @Test
    void rejectsOverlapNotShorterThanChunk() {
        assertThatThrownBy(() -> new WindowSpec(100, 100, 0))
                .isInstanceOf(InvalidWindowConfigException.class)
                .hasMessageContaining("overlap");
        assertThatThrownBy(() -> WindowSpec.fromDurations(0.5, 1.0, 0.5, 16_000))
                .isInstanceOf(InvalidWindowConfigException.class);
    }

    @Test
    void rejectsNonPositiveChunkAndNegativeLengths() {
        assertThatThrownBy(() -> new WindowSpec(0, 0, 0)).isInstanceOf(InvalidWindowConfigException.class);
        assertThatThrownBy(() -> new WindowSpec(10, -1, 0)).isInstanceOf(InvalidWindowConfigException.class);
        assertThatThrownBy(() -> new WindowSpec(10, 1, -5)).isInstanceOf(InvalidWindowConfigException.class);
    }

    @Test
    void rejectsNonFiniteDurationsAndBadRate() {
        assertThatThrownBy(() -> WindowSpec.fromDurations(Double.NaN, 0.5, 1.0, 16_000))
                .isInstanceOf(InvalidWindowConfigException.class);
        assertThatThrownBy(() -> WindowSpec.fromDurations(1.0, 0.5, Double.POSITIVE_INFINITY, 16_000))
                .isInstanceOf(InvalidWindowConfigException.class);
        assertThatThrownBy(() -> WindowSpec.fromDurations(1.0, 0.5, 1.0, 0))
                .isInstanceOf(InvalidWindowConfigException.class)
                .hasMessageContaining("sample rate");
    }
}
