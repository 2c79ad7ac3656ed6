package at.sv.salat.time;

/**
 * On which side of solar noon an altitude crossing is searched.
 */
public enum SolarEvent {
    BEFORE_NOON,
    AFTER_NOON;

    double apply(double noon, double hourAngleHours) {
        return this == BEFORE_NOON ? noon - hourAngleHours : noon + hourAngleHours;
    }
}
