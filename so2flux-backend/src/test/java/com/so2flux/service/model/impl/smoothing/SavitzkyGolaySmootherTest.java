package com.so2flux.service.model.impl.smoothing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SavitzkyGolaySmootherTest {

    @Test
    void quadraticFiveSampleCoefficients() {
        double[] coeffs = SavitzkyGolaySmoother.coefficients(5, 2);

        double[] expected = {-3 / 35.0, 12 / 35.0, 17 / 35.0, 12 / 35.0, -3 / 35.0};
        for (int i = 0; i < expected.length; i++) {
            assertThat(coeffs[i]).isCloseTo(expected[i], within(1e-12));
        }
    }

    @Test
    void reproducesPolynomialsUpToItsOrderAwayFromTheEdges() {
        double[] y = new double[9];
        for (int i = 0; i < y.length; i++) {
            y[i] = 2 * i * i - 3 * i + 1;
        }

        double[] smoothed = new SavitzkyGolaySmoother(5, 2).smooth(y);

        for (int i = 2; i < 7; i++) {
            assertThat(smoothed[i]).isCloseTo(y[i], within(1e-9));
        }
    }

    @Test
    void keepsConstantSignalIncludingEdges() {
        double[] y = {4, 4, 4, 4, 4, 4, 4};

        double[] smoothed = new SavitzkyGolaySmoother(5, 3).smooth(y);

        for (double v : smoothed) {
            assertThat(v).isCloseTo(4, within(1e-12));
        }
    }

    @Test
    void windowOfOneLeavesSignalUntouched() {
        double[] y = {2e17, 8e17, 3e17};

        assertThat(new SavitzkyGolaySmoother(1, 0).smooth(y)).containsExactly(2e17, 8e17, 3e17);
    }

    @Test
    void clipsWindowToLargestOddLengthThatFits() {
        SavitzkyGolaySmoother smoother = new SavitzkyGolaySmoother(11, 3);

        assertThat(smoother.effectiveWindow(20)).isEqualTo(11);
        assertThat(smoother.effectiveWindow(7)).isEqualTo(7);
        assertThat(smoother.effectiveWindow(6)).isEqualTo(5);
        assertThat(smoother.effectiveWindow(1)).isEqualTo(1);
    }

    @Test
    void lowersOrderWhenClippedWindowIsTooShort() {
        // Window clipped to 1, order lowered to 0
        double[] smoothed = new SavitzkyGolaySmoother(11, 3).smooth(new double[]{1, 5});

        assertThat(smoothed).containsExactly(1, 5);
    }

    @Test
    void rejectsEvenWindow() {
        assertThatThrownBy(() -> new SavitzkyGolaySmoother(10, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsOrderNotBelowWindow() {
        assertThatThrownBy(() -> new SavitzkyGolaySmoother(5, 5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsEmptySignal() {
        assertThatThrownBy(() -> new SavitzkyGolaySmoother(5, 2).smooth(new double[0]))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
