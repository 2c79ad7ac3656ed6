package at.sv.salat;

import java.util.Locale;

public final class FormatUtil {

    public static final int MINUTES_PER_DAY = 24 * 60;

    private FormatUtil() {
    }

    /**
     * Wraps any hour value into a single day.
     *
     * @param hours the hours, may be negative or exceed 24
     * @return the equivalent hour value within [0, 24), values already within that range are returned unchanged
     */
    public static double normalizeHours(double hours) {
        double remainder = hours % 24;
        if (remainder < 0) {
            remainder += 24;
        } else if (remainder == 0) {
            return 0.0; // also for -0.0
        }
        return remainder >= 24 ? 0.0 : remainder;
    }

    /**
     * @param hours the hours, may be negative or exceed 24
     * @return the rounded minute of the day within [0, 1439]
     */
    public static int toMinuteOfDay(double hours) {
        return (int) (Math.round(normalizeHours(hours) * 60) % MINUTES_PER_DAY);
    }

    /**
     * @param hours the hours, may be negative or exceed 24
     * @return a 12-hour clock string, e.g. {@code 5:07 PM}
     */
    public static String formatHours(double hours) {
        return formatMinuteOfDay(toMinuteOfDay(hours));
    }

    public static String formatMinuteOfDay(int minuteOfDay) {
        int hour = minuteOfDay / 60;
        int minute = minuteOfDay % 60;
        int hour12 = hour % 12 == 0 ? 12 : hour % 12;
        return String.format(Locale.ROOT, "%d:%02d %s", hour12, minute, hour >= 12 ? "PM" : "AM");
    }

    /**
     * @param utcOffsetHours the offset in fractional hours
     * @return the offset in {@code +HH:MM} form
     */
    public static String formatUtcOffset(double utcOffsetHours) {
        int totalMinutes = (int) Math.round(utcOffsetHours * 60);
        int absolute = Math.abs(totalMinutes);
        return String.format(Locale.ROOT, "%s%02d:%02d", totalMinutes < 0 ? "-" : "+", absolute / 60, absolute % 60);
    }
}
