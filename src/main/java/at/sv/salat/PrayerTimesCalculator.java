package at.sv.salat;

import at.sv.salat.time.HighLatitudeRule;

import java.time.LocalDate;

public interface PrayerTimesCalculator {

    /**
     * @param date     the local date
     * @param settings the calculation settings
     * @return the prayer times of the date; never fails for valid inputs, unreachable angles are resolved by the
     * settings' {@link HighLatitudeRule} or reported as unreachable times
     */
    PrayerTimes calculate(LocalDate date, PrayerCalculationSettings settings);

    default PrayerTimes calculate(LocalDate date) {
        return calculate(date, PrayerCalculationSettings.defaults());
    }

    default String toDebugString(LocalDate date, PrayerCalculationSettings settings) {
        return calculate(date, settings).toDebugString();
    }

    /**
     * Computes the prayer times for a single location and date.
     *
     * @param latitude       degrees north [-90..90]
     * @param longitude      degrees east [-180..180]
     * @param utcOffsetHours fixed UTC offset in fractional hours
     * @param date           the local date
     * @param method         Fajr and Isha angle convention
     * @param asrSchool      Asr shadow factor
     * @param rule           fallback for unreachable Fajr and Isha angles
     * @param offsets        minute adjustments per prayer
     * @param hijriDayOffset days added before the Hijri conversion used for the Umm al-Qura Ramadan rule
     * @return the prayer times
     * @throws InvalidPropertyValue if the coordinates or offset are out of range
     */
    static PrayerTimes computePrayerTimes(double latitude, double longitude, double utcOffsetHours, LocalDate date,
                                          CalculationMethod method, AsrSchool asrSchool, HighLatitudeRule rule,
                                          PrayerOffsets offsets, int hijriDayOffset) {
        PrayerCalculationSettings settings = PrayerCalculationSettings.builder()
                                                                      .method(method)
                                                                      .asrSchool(asrSchool)
                                                                      .highLatitudeRule(rule)
                                                                      .offsets(offsets)
                                                                      .hijriDayOffset(hijriDayOffset)
                                                                      .build();
        return new PrayerTimesCalculatorImpl(Location.of(latitude, longitude, utcOffsetHours)).calculate(date, settings);
    }
}
