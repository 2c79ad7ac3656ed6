package at.sv.salat;

import org.junit.jupiter.api.Test;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FormatUtilTest {

    private static final Pattern CLOCK = Pattern.compile("(\\d{1,2}):(\\d{2}) (AM|PM)");

    private static int decode(String formatted) {
        Matcher matcher = CLOCK.matcher(formatted);
        assertThat(matcher.matches()).as(formatted).isTrue();
        int hour = Integer.parseInt(matcher.group(1)) % 12;
        if (matcher.group(3).equals("PM")) {
            hour += 12;
        }
        return hour * 60 + Integer.parseInt(matcher.group(2));
    }

    @Test
    void normalizeHours_wrapsIntoSingleDay() {
        assertThat(FormatUtil.normalizeHours(-0.5)).isCloseTo(23.5, within(1e-12));
        assertThat(FormatUtil.normalizeHours(24.25)).isCloseTo(0.25, within(1e-12));
        assertThat(FormatUtil.normalizeHours(48)).isEqualTo(0.0);
        assertThat(FormatUtil.normalizeHours(-24)).isEqualTo(0.0);
        assertThat(FormatUtil.normalizeHours(13.5)).isEqualTo(13.5);
    }

    @Test
    void normalizeHours_normalizedValue_returnedUnchanged() {
        double normalized = FormatUtil.normalizeHours(-31.92);

        assertThat(normalized).isCloseTo(16.08, within(1e-9));
        assertThat(FormatUtil.normalizeHours(normalized)).isEqualTo(normalized);
        assertThat(FormatUtil.normalizeHours(16.080000000000226)).isEqualTo(16.080000000000226);
        assertThat(FormatUtil.normalizeHours(-1e-17)).isEqualTo(0.0);
        assertThat(FormatUtil.normalizeHours(-0.0)).isEqualTo(0.0);
    }

    @Test
    void normalizeHours_totalAndIdempotent() {
        for (double hours = -100; hours <= 100; hours += 0.37) {
            double normalized = FormatUtil.normalizeHours(hours);

            assertThat(normalized).isGreaterThanOrEqualTo(0.0).isLessThan(24.0);
            assertThat(FormatUtil.normalizeHours(normalized)).isEqualTo(normalized);
        }
    }

    @Test
    void formatHours_twelveHourClock() {
        assertThat(FormatUtil.formatHours(0)).isEqualTo("12:00 AM");
        assertThat(FormatUtil.formatHours(12)).isEqualTo("12:00 PM");
        assertThat(FormatUtil.formatHours(5.25)).isEqualTo("5:15 AM");
        assertThat(FormatUtil.formatHours(17.75)).isEqualTo("5:45 PM");
        assertThat(FormatUtil.formatHours(-0.5)).isEqualTo("11:30 PM");
        assertThat(FormatUtil.formatHours(24.25)).isEqualTo("12:15 AM");
    }

    @Test
    void formatHours_roundingUpToFullHour_neverShowsSixtyMinutes() {
        assertThat(FormatUtil.formatHours(13.9999)).isEqualTo("2:00 PM");
        assertThat(FormatUtil.toMinuteOfDay(13.9999)).isEqualTo(840);
        assertThat(FormatUtil.formatHours(11.9999)).isEqualTo("12:00 PM");
        assertThat(FormatUtil.formatHours(23.9999)).isEqualTo("12:00 AM");
        assertThat(FormatUtil.toMinuteOfDay(23.9999)).isEqualTo(0);
    }

    @Test
    void formattedString_decodesToMinuteOfDay() {
        for (double hours = -30; hours <= 50; hours += 0.0131) {
            int minuteOfDay = FormatUtil.toMinuteOfDay(hours);

            assertThat(minuteOfDay).isBetween(0, 1439);
            assertThat(minuteOfDay).isEqualTo((int) (Math.round(FormatUtil.normalizeHours(hours) * 60) % 1440));
            assertThat(decode(FormatUtil.formatHours(hours))).isEqualTo(minuteOfDay);
        }
    }

    @Test
    void formatUtcOffset() {
        assertThat(FormatUtil.formatUtcOffset(6.5)).isEqualTo("+06:30");
        assertThat(FormatUtil.formatUtcOffset(-3.5)).isEqualTo("-03:30");
        assertThat(FormatUtil.formatUtcOffset(0)).isEqualTo("+00:00");
        assertThat(FormatUtil.formatUtcOffset(5.75)).isEqualTo("+05:45");
    }
}
