package at.sv.salat.hijri;

/**
 * A named occasion of the Hijri calendar, spanning {@code rangeInDays} consecutive days from its start day.
 *
 * @param month       the Hijri month [1..12]
 * @param day         the first day of the occasion
 * @param key         the stable identifier, e.g. {@code "qadr"}
 * @param rangeInDays the number of days, 1 for single-day occasions
 */
public record IslamicEvent(int month, int day, String key, int rangeInDays) {

    public static IslamicEvent singleDay(int month, int day, String key) {
        return new IslamicEvent(month, day, key, 1);
    }

    public static IslamicEvent spanning(int month, int day, String key, int rangeInDays) {
        return new IslamicEvent(month, day, key, rangeInDays);
    }

    public boolean matches(int hijriDay, int hijriMonth) {
        return hijriMonth == month && hijriDay >= day && hijriDay < day + rangeInDays;
    }

    public boolean isMultiDay() {
        return rangeInDays > 1;
    }
}
