package at.sv.salat;

import java.util.Locale;

/**
 * The six instants of a prayer day, in chronological order.
 */
public enum Prayer {
    FAJR,
    SUNRISE,
    /**
     * Solar noon, the midpoint between sunrise and sunset. Dhuhr begins shortly after.
     */
    ZAWAL,
    ASR,
    MAGHRIB,
    ISHA;

    public String getKey() {
        return name().toLowerCase(Locale.ENGLISH);
    }

    public String getDisplayName() {
        return name().charAt(0) + getKey().substring(1);
    }
}
