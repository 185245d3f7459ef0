package com.phillippitts.spoofstream.service.audio.window;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class WindowingBufferTest {

    @Test
    void emitsOneWindowThenWaitsForHopBeforeTheNext() {
        WindowingBuffer buf = new WindowingBuffer(new WindowSpec(16_000, 4_000, 16_000));

        List<float[]> first = buf.feed(new float[16_000]);
        assertThat(first).hasSize(1);
        assertThat(first.get(0)).hasSize(16_000);
        assertThat(buf.size()).isEqualTo(4_000);

        List<float[]> second = buf.feed(new float[12_000]);
        assertThat(second).hasSize(1);
        assertThat(buf.size()).isEqualTo(4_000);
        assertThat(buf.windowsEmitted()).isEqualTo(2);
    }

    @Test
    void windowCountFollowsHopArithmeticForAnySplit() {
        int chunk = 10;
        int overlap = 3;
        Random random = new Random(42);

        for (int total = 0; total <= 80; total++) {
            WindowingBuffer buf = new WindowingBuffer(new WindowSpec(chunk, overlap, 0));
            int fed = 0;
            int emitted = 0;
            while (fed < total) {
                int n = Math.min(total - fed, 1 + random.nextInt(7));
                emitted += buf.feed(ramp(fed, n)).size();
                fed += n;
            }
            int expected = total < chunk ? 0 : (total - chunk) / (chunk - overlap) + 1;
            assertThat(emitted).as("total=%d", total).isEqualTo(expected);
        }
    }

    @Test
    void consecutiveWindowsShareExactlyTheOverlap() {
        WindowSpec spec = new WindowSpec(8, 3, 8);
        WindowingBuffer buf = new WindowingBuffer(spec);

        List<float[]> windows = buf.feed(ramp(0, 40));

        assertThat(windows).hasSizeGreaterThan(2);
        for (int i = 0; i + 1 < windows.size(); i++) {
            float[] a = windows.get(i);
            float[] b = windows.get(i + 1);
            for (int k = 0; k < spec.overlapLength(); k++) {
                assertThat(Float.floatToIntBits(b[k]))
                        .isEqualTo(Float.floatToIntBits(a[a.length - spec.overlapLength() + k]));
            }
        }
        assertThat(buf.pendingSnapshot()).hasSizeLessThan(spec.chunkLength());
    }

    @Test
    void outputDoesNotDependOnFeedBoundaries() {
        WindowSpec spec = WindowSpec.fromDurations(1.0, 0.25, 1.0, 16_000);
        float[] stream = noise(32_000, 7);

        List<float[]> whole = new WindowingBuffer(spec).feed(stream);

        WindowingBuffer split = new WindowingBuffer(spec);
        List<float[]> pieces = new ArrayList<>();
        for (int off = 0; off < stream.length; off += 1_000) {
            float[] part = new float[1_000];
            System.arraycopy(stream, off, part, 0, part.length);
            pieces.addAll(split.feed(part));
        }

        assertThat(pieces).hasSameSizeAs(whole);
        for (int i = 0; i < whole.size(); i++) {
            assertThat(pieces.get(i)).containsExactly(whole.get(i));
        }
    }

    @Test
    void minLengthDelaysOnlyTheFirstWindow() {
        WindowingBuffer buf = new WindowingBuffer(new WindowSpec(10, 2, 25));

        assertThat(buf.feed(ramp(0, 20))).isEmpty();

        List<float[]> windows = buf.feed(ramp(20, 5));
        assertThat(windows).hasSize(2);
        assertThat(windows.get(0)[0]).isEqualTo(0f);
        assertThat(windows.get(1)[0]).isEqualTo(8f);
        assertThat(buf.size()).isEqualTo(9);

        // Later windows need only a full chunk
        assertThat(buf.feed(ramp(25, 1))).hasSize(1);
    }

    @Test
    void reconfigureReinterpretsPendingSamples() {
        WindowingBuffer buf = new WindowingBuffer(new WindowSpec(10, 2, 10));
        assertThat(buf.feed(ramp(0, 8))).isEmpty();

        buf.reconfigure(new WindowSpec(5, 1, 5));
        List<float[]> windows = buf.feed(new float[0]);

        assertThat(windows).hasSize(1);
        assertThat(windows.get(0)).containsExactly(0f, 1f, 2f, 3f, 4f);
        assertThat(buf.pendingSnapshot()).containsExactly(4f, 5f, 6f, 7f);
        assertThat(buf.spec().chunkLength()).isEqualTo(5);
    }

    @Test
    void discardDropsPartialWindow() {
        WindowingBuffer buf = new WindowingBuffer(new WindowSpec(10, 2, 10));
        buf.feed(ramp(0, 7));

        buf.discard();

        assertThat(buf.size()).isZero();
        assertThat(buf.durationSeconds(16_000)).isZero();
        assertThat(buf.feed(ramp(100, 3))).isEmpty();
        assertThat(buf.pendingSnapshot()).containsExactly(100f, 101f, 102f);
    }

    @Test
    void keepsSampleOrderAcrossCompactionAndGrowth() {
        WindowingBuffer buf = new WindowingBuffer(new WindowSpec(3_000, 1_000, 3_000));
        List<float[]> windows = new ArrayList<>();
        int fed = 0;
        for (int i = 0; i < 12; i++) {
            windows.addAll(buf.feed(ramp(fed, 2_500)));
            fed += 2_500;
        }
        windows.addAll(buf.feed(ramp(fed, 9_000)));

        for (int i = 0; i < windows.size(); i++) {
            float[] w = windows.get(i);
            assertThat(w[0]).isEqualTo(i * 2_000f);
            assertThat(w[w.length - 1]).isEqualTo(i * 2_000f + 2_999f);
        }
    }

    @Test
    void reportsPendingDuration() {
        WindowingBuffer buf = new WindowingBuffer(new WindowSpec(16_000, 8_000, 16_000));
        buf.feed(new float[8_000]);
        assertThat(buf.durationSeconds(16_000)).isEqualTo(0.5);
        assertThat(buf.durationSeconds(0)).isZero();
    }

    private static float[] ramp(int start, int n) {
        float[] out = new float[n];
        for (int i = 0; i < n; i++) {
            out[i] = start + i;
        }
        return out;
    }

    private static float[] noise(int n, long seed) {
        Random r = new Random(seed);
        float[] out = new float[n];
        for (int i = 0; i < n; i++) {
            out[i] = r.nextFloat() * 2f - 1f;
        }
        return out;
    }
}
