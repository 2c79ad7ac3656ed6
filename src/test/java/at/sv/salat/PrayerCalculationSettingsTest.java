package at.sv.salat;

import at.sv.salat.time.HighLatitudeRule;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrayerCalculationSettingsTest {

    @Test
    void defaults() {
        PrayerCalculationSettings settings = PrayerCalculationSettings.defaults();

        assertThat(settings.getMethod()).isEqualTo(CalculationMethod.KARACHI);
        assertThat(settings.getAsrSchool()).isEqualTo(AsrSchool.HANAFI);
        assertThat(settings.getHighLatitudeRule()).isEqualTo(HighLatitudeRule.MIDDLE_OF_NIGHT);
        assertThat(settings.getOffsets()).isEqualTo(PrayerOffsets.defaults());
        assertThat(settings.getHijriDayOffset()).isZero();
    }

    @Test
    void builder_keepsDefaultsForUnsetFields() {
        PrayerCalculationSettings settings = PrayerCalculationSettings.builder()
                                                                      .method(CalculationMethod.MWL)
                                                                      .build();

        assertThat(settings.getMethod()).isEqualTo(CalculationMethod.MWL);
        assertThat(settings.getAsrSchool()).isEqualTo(AsrSchool.HANAFI);
        assertThat(settings.getOffsets()).isEqualTo(PrayerOffsets.defaults());
    }

    @Test
    void builder_null_exception() {
        assertThatThrownBy(() -> PrayerCalculationSettings.builder().method(null).build())
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void offsets_defaultsAndNone() {
        PrayerOffsets defaults = PrayerOffsets.defaults();

        assertThat(defaults.getMinutes(Prayer.FAJR)).isEqualTo(2);
        assertThat(defaults.getMinutes(Prayer.SUNRISE)).isZero();
        assertThat(defaults.getMinutes(Prayer.ZAWAL)).isZero();
        assertThat(defaults.getMinutes(Prayer.ASR)).isZero();
        assertThat(defaults.getMinutes(Prayer.MAGHRIB)).isEqualTo(4);
        assertThat(defaults.getMinutes(Prayer.ISHA)).isEqualTo(2);
        for (Prayer prayer : Prayer.values()) {
            assertThat(PrayerOffsets.none().getMinutes(prayer)).isZero();
        }
        assertThat(defaults.toBuilder().asr(-3).build().getAsr()).isEqualTo(-3);
    }

    @Test
    void methodAngles() {
        assertThat(CalculationMethod.MWL.getFajrAngle()).isEqualTo(-18.0);
        assertThat(CalculationMethod.MWL.getIshaAngle()).isEqualTo(-17.0);
        assertThat(CalculationMethod.EGYPT.getFajrAngle()).isEqualTo(-19.5);
        assertThat(CalculationMethod.EGYPT.getIshaAngle()).isEqualTo(-17.5);
        assertThat(CalculationMethod.UMM_AL_QURA.getFajrAngle()).isEqualTo(-18.5);
        assertThat(CalculationMethod.UMM_AL_QURA.usesFixedIshaInterval()).isTrue();
        assertThat(CalculationMethod.UMM_AL_QURA.getIshaInterval(false)).isEqualTo(1.5);
        assertThat(CalculationMethod.UMM_AL_QURA.getIshaInterval(true)).isEqualTo(2.0);
        assertThatThrownBy(() -> CalculationMethod.KARACHI.getIshaInterval(false))
                .isInstanceOf(IllegalStateException.class);
    }
}
