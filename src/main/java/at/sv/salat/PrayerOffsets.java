package at.sv.salat;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Signed minute adjustments added to each computed time, for local safety margins.
 */
@Builder(toBuilder = true)
@Getter
@EqualsAndHashCode
public final class PrayerOffsets {

    private static final PrayerOffsets NONE = PrayerOffsets.builder().build();
    private static final PrayerOffsets DEFAULTS = PrayerOffsets.builder().fajr(2).maghrib(4).isha(2).build();

    private final int fajr;
    private final int sunrise;
    private final int zawal;
    private final int asr;
    private final int maghrib;
    private final int isha;

    /**
     * @return all offsets zero
     */
    public static PrayerOffsets none() {
        return NONE;
    }

    /**
     * @return +2 minutes for Fajr and Isha, +4 minutes for Maghrib, zero otherwise
     */
    public static PrayerOffsets defaults() {
        return DEFAULTS;
    }

    public int getMinutes(Prayer prayer) {
        return switch (prayer) {
            case FAJR -> fajr;
            case SUNRISE -> sunrise;
            case ZAWAL -> zawal;
            case ASR -> asr;
            case MAGHRIB -> maghrib;
            case ISHA -> isha;
        };
    }

    double getHours(Prayer prayer) {
        return getMinutes(prayer) / 60.0;
    }

    @Override
    public String toString() {
        return "{fajr=" + fajr + ", sunrise=" + sunrise + ", zawal=" + zawal + ", asr=" + asr +
               ", maghrib=" + maghrib + ", isha=" + isha + "}";
    }
}
