package at.sv.salat;

import at.sv.salat.hijri.HijriCalendar;
import at.sv.salat.time.HighLatitudeRule;
import at.sv.salat.time.HourAngleSolver;
import at.sv.salat.time.JulianDate;
import at.sv.salat.time.SolarEvent;
import at.sv.salat.time.SolarPosition;
import at.sv.salat.time.SolarTimeSolver;
import at.sv.salat.time.TimeSolution;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.NotNull;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

@Slf4j
public final class PrayerTimesCalculatorImpl implements PrayerTimesCalculator {

    private final Location location;
    private final SolarTimeSolver solver;

    public PrayerTimesCalculatorImpl(@NotNull Location location) {
        this.location = Objects.requireNonNull(location, "location");
        solver = new SolarTimeSolver(location.latitude(), location.longitude(), location.utcOffsetHours());
    }

    @Override
    public PrayerTimes calculate(@NotNull LocalDate date, @NotNull PrayerCalculationSettings settings) {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(settings, "settings");
        double julianDay = JulianDate.of(date);
        CalculationMethod method = settings.getMethod();
        HighLatitudeRule rule = settings.getHighLatitudeRule();

        double sunrise = solver.solve(julianDay, HourAngleSolver.SUNRISE_ALTITUDE, SolarEvent.BEFORE_NOON).hours();
        double sunset = solver.solve(julianDay, HourAngleSolver.SUNRISE_ALTITUDE, SolarEvent.AFTER_NOON).hours();
        double night = sunrise + 24 - sunset;
        double portion = rule.nightPortion(method.getFajrAngle());

        OptionalDouble fajr = resolveTwilight(Prayer.FAJR, date, rule,
                solver.solve(julianDay, method.getFajrAngle(), SolarEvent.BEFORE_NOON),
                sunrise - night * portion);
        OptionalDouble isha;
        if (method.usesFixedIshaInterval()) {
            boolean ramadan = HijriCalendar.toHijri(date, settings.getHijriDayOffset()).isRamadan();
            isha = OptionalDouble.of(sunset + method.getIshaInterval(ramadan));
        } else {
            isha = resolveTwilight(Prayer.ISHA, date, rule,
                    solver.solve(julianDay, method.getIshaAngle(), SolarEvent.AFTER_NOON),
                    sunset + night * portion);
        }

        double declination = SolarPosition.at(julianDay).declination();
        double asrAltitude = HourAngleSolver.asrAltitude(location.latitude(), declination,
                settings.getAsrSchool().getShadowFactor());
        double asr = solver.solve(julianDay, asrAltitude, SolarEvent.AFTER_NOON).hours();
        double zawal = (sunrise + sunset) / 2;

        PrayerOffsets offsets = settings.getOffsets();
        Map<Prayer, PrayerTime> times = new EnumMap<>(Prayer.class);
        times.put(Prayer.FAJR, toPrayerTime(fajr, offsets.getHours(Prayer.FAJR)));
        times.put(Prayer.SUNRISE, PrayerTime.ofHours(sunrise + offsets.getHours(Prayer.SUNRISE)));
        times.put(Prayer.ZAWAL, PrayerTime.ofHours(zawal + offsets.getHours(Prayer.ZAWAL)));
        times.put(Prayer.ASR, PrayerTime.ofHours(asr + offsets.getHours(Prayer.ASR)));
        times.put(Prayer.MAGHRIB, PrayerTime.ofHours(sunset + offsets.getHours(Prayer.MAGHRIB)));
        times.put(Prayer.ISHA, toPrayerTime(isha, offsets.getHours(Prayer.ISHA)));
        return new PrayerTimes(date, times);
    }

    private OptionalDouble resolveTwilight(Prayer prayer, LocalDate date, HighLatitudeRule rule, TimeSolution solution,
                                           double fallback) {
        if (solution.reachable()) {
            return OptionalDouble.of(solution.hours());
        }
        if (!rule.appliesFallback()) {
            log.warn("{} unreachable at {} on {} and no high latitude rule configured", prayer.getDisplayName(),
                    location, date);
            return OptionalDouble.empty();
        }
        log.debug("{} unreachable at {} on {}: Apply {} fallback {}", prayer.getDisplayName(), location, date, rule,
                FormatUtil.formatHours(fallback));
        return OptionalDouble.of(fallback);
    }

    private static PrayerTime toPrayerTime(OptionalDouble hours, double offsetHours) {
        if (hours.isEmpty()) {
            return PrayerTime.unreachable();
        }
        return PrayerTime.ofHours(hours.getAsDouble() + offsetHours);
    }

    public Location getLocation() {
        return location;
    }
}
