package at.sv.salat.time;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class AngleMathTest {

    private static final double EPS = 1e-12;

    @Test
    void trigonometricFunctions_useDegrees() {
        assertThat(AngleMath.sin(30)).isCloseTo(0.5, within(EPS));
        assertThat(AngleMath.cos(60)).isCloseTo(0.5, within(EPS));
        assertThat(AngleMath.tan(45)).isCloseTo(1.0, within(EPS));
        assertThat(AngleMath.asin(0.5)).isCloseTo(30.0, within(EPS));
        assertThat(AngleMath.acos(0.5)).isCloseTo(60.0, within(EPS));
        assertThat(AngleMath.atan(1.0)).isCloseTo(45.0, within(EPS));
    }

    @Test
    void acos_outOfDomain_clampsToBoundary() {
        assertThat(AngleMath.acos(1.5)).isEqualTo(0.0);
        assertThat(AngleMath.acos(-2.0)).isCloseTo(180.0, within(EPS));
        assertThat(AngleMath.acos(Double.POSITIVE_INFINITY)).isEqualTo(0.0);
        assertThat(AngleMath.acos(Double.NEGATIVE_INFINITY)).isCloseTo(180.0, within(EPS));
    }

    @Test
    void asin_outOfDomain_clampsToBoundary() {
        assertThat(AngleMath.asin(1.0000001)).isCloseTo(90.0, within(EPS));
        assertThat(AngleMath.asin(-3)).isCloseTo(-90.0, within(EPS));
    }
}
