package at.sv.salat.time;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Converts Gregorian calendar timestamps, interpreted as UTC, into continuous Julian day numbers.
 */
public final class JulianDate {

    /**
     * Julian day of the J2000.0 epoch (2000-01-01 12:00 UTC).
     */
    public static final double J2000 = 2451545.0;

    private JulianDate() {
    }

    /**
     * @param dateTime the UTC timestamp
     * @return the Julian day, the fractional part encoding the time of day
     */
    public static double of(LocalDateTime dateTime) {
        double dayFraction = (dateTime.getHour()
                              + dateTime.getMinute() / 60.0
                              + (dateTime.getSecond() + dateTime.getNano() / 1e9) / 3600.0) / 24.0;
        return of(dateTime.getYear(), dateTime.getMonthValue(), dateTime.getDayOfMonth() + dayFraction);
    }

    /**
     * @param date the UTC date
     * @return the Julian day at 0h UTC, always ending in .5
     */
    public static double of(LocalDate date) {
        return of(date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    /**
     * @param date the date
     * @return the integer Julian day number of the day starting at noon UTC of the given date
     */
    public static long dayNumber(LocalDate date) {
        return (long) Math.floor(of(date) + 0.5);
    }

    static double of(int year, int month, double day) {
        if (month <= 2) {
            year--;
            month += 12;
        }
        int century = Math.floorDiv(year, 100);
        int b = 2 - century + Math.floorDiv(century, 4);
        return Math.floor(365.25 * (year + 4716))
               + Math.floor(30.6001 * (month + 1))
               + day + b - 1524.5;
    }

    /**
     * @param julianDay the Julian day
     * @return the Julian centuries elapsed since J2000.0
     */
    public static double centuriesSinceJ2000(double julianDay) {
        return (julianDay - J2000) / 36525.0;
    }
}
