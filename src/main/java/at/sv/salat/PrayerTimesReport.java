package at.sv.salat;

import at.sv.salat.hijri.HijriDate;
import at.sv.salat.hijri.IslamicEvent;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Serializable view of one day: Gregorian and Hijri date, the event of the day and the six times. Unreachable times
 * are {@code null}.
 */
@JsonPropertyOrder({"date", "hijri", "event", "times", "minutes"})
public record PrayerTimesReport(String date, Hijri hijri, String event, Map<String, String> times,
                                Map<String, Integer> minutes) {

    @JsonPropertyOrder({"day", "month", "year", "monthName"})
    public record Hijri(int day, int month, int year, String monthName) {
    }

    public static PrayerTimesReport of(PrayerTimes prayerTimes, HijriDate hijriDate, Optional<IslamicEvent> event) {
        Map<String, String> times = new LinkedHashMap<>();
        Map<String, Integer> minutes = new LinkedHashMap<>();
        prayerTimes.asMap().forEach((prayer, time) -> {
            times.put(prayer.getKey(), time.isReachable() ? time.getFormatted() : null);
            minutes.put(prayer.getKey(), time.isReachable() ? time.getMinuteOfDay() : null);
        });
        Hijri hijri = new Hijri(hijriDate.day(), hijriDate.month(), hijriDate.year(),
                hijriDate.getMonth().getDisplayName());
        return new PrayerTimesReport(prayerTimes.getDate().toString(), hijri, event.map(IslamicEvent::key).orElse(null),
                times, minutes);
    }
}
