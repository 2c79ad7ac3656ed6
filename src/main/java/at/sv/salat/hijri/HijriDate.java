package at.sv.salat.hijri;

import at.sv.salat.InvalidPropertyValue;

/**
 * A date of the civil (tabular) Islamic calendar.
 *
 * @param day   the day of month [1..30]
 * @param month the month [1..12]
 * @param year  the year after the Hijra
 */
public record HijriDate(int day, int month, int year) {

    public HijriDate {
        HijriMonth.of(month);
        if (day < 1 || day > 30) {
            throw new InvalidPropertyValue("Invalid Hijri day '" + day + "'. Supported values: [1..30]");
        }
    }

    public HijriMonth getMonth() {
        return HijriMonth.of(month);
    }

    public boolean isRamadan() {
        return month == HijriMonth.RAMADAN.getValue();
    }

    @Override
    public String toString() {
        return day + " " + getMonth().getDisplayName() + " " + year + " AH";
    }
}
