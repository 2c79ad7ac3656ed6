package at.sv.salat.hijri;

import at.sv.salat.time.JulianDate;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Gregorian to Hijri conversion following the arithmetic (Kuwaiti) civil calendar: a 30-year cycle with 11 leap
 * years, no moon sighting. Observed dates may differ by a day or two, which the day offset compensates per region.
 */
public final class HijriCalendar {

    /**
     * Julian day number of 1 Muharram 1 AH (16 July 622, Julian calendar).
     */
    static final long EPOCH = 1948440;

    private static final int DAYS_PER_CYCLE = 10631;

    private HijriCalendar() {
    }

    public static HijriDate toHijri(LocalDate date) {
        return toHijri(date, 0);
    }

    /**
     * @param date      the Gregorian date
     * @param dayOffset days added to the Gregorian date before conversion, may be negative
     * @return the civil Hijri date
     */
    public static HijriDate toHijri(LocalDate date, int dayOffset) {
        Objects.requireNonNull(date, "date");
        return fromJulianDayNumber(JulianDate.dayNumber(date.plusDays(dayOffset)));
    }

    static HijriDate fromJulianDayNumber(long julianDayNumber) {
        long l = julianDayNumber - EPOCH + 10632;
        long cycles = Math.floorDiv(l - 1, DAYS_PER_CYCLE);
        l = l - DAYS_PER_CYCLE * cycles + 354;
        long j = Math.floorDiv(10985 - l, 5316) * Math.floorDiv(50 * l, 17719)
                 + Math.floorDiv(l, 5670) * Math.floorDiv(43 * l, 15238);
        l = l - Math.floorDiv(30 - j, 15) * Math.floorDiv(17719 * j, 50)
            - Math.floorDiv(j, 16) * Math.floorDiv(15238 * j, 43)
            + 29;
        long month = Math.floorDiv(24 * l, 709);
        long day = l - Math.floorDiv(709 * month, 24);
        long year = 30 * cycles + j - 30;
        return new HijriDate((int) day, (int) month, (int) year);
    }
}
