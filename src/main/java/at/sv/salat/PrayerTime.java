package at.sv.salat;

import java.time.LocalTime;
import java.util.Objects;

/**
 * A prayer instant as minute of the local day and its 12-hour clock representation. Both are derived from the same
 * rounded minute, so they always denote the same instant.
 * <p>
 * Fajr and Isha are unreachable when the sun never reaches the twilight angle and no high latitude fallback is
 * configured.
 */
public final class PrayerTime {

    static final String UNREACHABLE_TEXT = "--:--";

    private static final PrayerTime UNREACHABLE = new PrayerTime(-1);

    private final int minuteOfDay;

    private PrayerTime(int minuteOfDay) {
        this.minuteOfDay = minuteOfDay;
    }

    /**
     * @param hours local time in hours, wrapped into a single day
     */
    public static PrayerTime ofHours(double hours) {
        return new PrayerTime(FormatUtil.toMinuteOfDay(hours));
    }

    public static PrayerTime unreachable() {
        return UNREACHABLE;
    }

    public boolean isReachable() {
        return minuteOfDay >= 0;
    }

    /**
     * @return the minute of the day within [0, 1439]
     * @throws IllegalStateException if the time is unreachable
     */
    public int getMinuteOfDay() {
        assertReachable();
        return minuteOfDay;
    }

    /**
     * @return the time as 12-hour clock string, e.g. {@code 5:07 PM}, or {@code --:--} if unreachable
     */
    public String getFormatted() {
        if (!isReachable()) {
            return UNREACHABLE_TEXT;
        }
        return FormatUtil.formatMinuteOfDay(minuteOfDay);
    }

    /**
     * @throws IllegalStateException if the time is unreachable
     */
    public LocalTime toLocalTime() {
        assertReachable();
        return LocalTime.of(minuteOfDay / 60, minuteOfDay % 60);
    }

    private void assertReachable() {
        if (!isReachable()) {
            throw new IllegalStateException("Prayer time is unreachable at this location and date");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return minuteOfDay == ((PrayerTime) o).minuteOfDay;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minuteOfDay);
    }

    @Override
    public String toString() {
        return getFormatted();
    }
}
