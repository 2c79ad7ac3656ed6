package at.sv.salat;

import at.sv.salat.time.HighLatitudeRule;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

/**
 * Immutable configuration of a prayer time calculation. Fields not set on the builder take the defaults of
 * {@link #defaults()}.
 */
@Builder(toBuilder = true)
@Getter
public final class PrayerCalculationSettings {

    private static final PrayerCalculationSettings DEFAULTS = PrayerCalculationSettings.builder().build();

    @NonNull
    @Builder.Default
    private final CalculationMethod method = CalculationMethod.KARACHI;
    @NonNull
    @Builder.Default
    private final AsrSchool asrSchool = AsrSchool.HANAFI;
    @NonNull
    @Builder.Default
    private final HighLatitudeRule highLatitudeRule = HighLatitudeRule.MIDDLE_OF_NIGHT;
    @NonNull
    @Builder.Default
    private final PrayerOffsets offsets = PrayerOffsets.defaults();
    /**
     * Days added to the Gregorian date before the Hijri conversion.
     */
    private final int hijriDayOffset;

    /**
     * @return Karachi angles, Hanafi Asr, middle of the night fallback, default offsets and no Hijri offset
     */
    public static PrayerCalculationSettings defaults() {
        return DEFAULTS;
    }

    @Override
    public String toString() {
        return "{method=" + method + ", asrSchool=" + asrSchool + ", highLatitudeRule=" + highLatitudeRule +
               ", offsets=" + offsets + ", hijriDayOffset=" + hijriDayOffset + "}";
    }
}
