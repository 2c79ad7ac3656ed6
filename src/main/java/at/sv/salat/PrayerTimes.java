package at.sv.salat;

import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The six prayer instants of one local date.
 */
public final class PrayerTimes {

    private final LocalDate date;
    private final Map<Prayer, PrayerTime> times;

    PrayerTimes(LocalDate date, Map<Prayer, PrayerTime> times) {
        this.date = date;
        EnumMap<Prayer, PrayerTime> copy = new EnumMap<>(Prayer.class);
        for (Prayer prayer : Prayer.values()) {
            copy.put(prayer, Objects.requireNonNull(times.get(prayer), "Missing time for " + prayer));
        }
        this.times = Collections.unmodifiableMap(copy);
    }

    public LocalDate getDate() {
        return date;
    }

    public PrayerTime get(Prayer prayer) {
        return times.get(prayer);
    }

    public PrayerTime getFajr() {
        return get(Prayer.FAJR);
    }

    public PrayerTime getSunrise() {
        return get(Prayer.SUNRISE);
    }

    public PrayerTime getZawal() {
        return get(Prayer.ZAWAL);
    }

    public PrayerTime getAsr() {
        return get(Prayer.ASR);
    }

    public PrayerTime getMaghrib() {
        return get(Prayer.MAGHRIB);
    }

    public PrayerTime getIsha() {
        return get(Prayer.ISHA);
    }

    /**
     * @return all times in chronological order
     */
    public Map<Prayer, PrayerTime> asMap() {
        return times;
    }

    public String toDebugString() {
        StringBuilder builder = new StringBuilder();
        times.forEach((prayer, time) -> builder.append(prayer.getKey()).append(": ").append(time).append('\n'));
        return builder.toString().trim();
    }

    @Override
    public String toString() {
        return date + " " + times;
    }
}
