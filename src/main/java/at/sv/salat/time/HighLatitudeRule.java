package at.sv.salat.time;

/**
 * Fallback for Fajr and Isha when the sun never reaches the twilight angle, expressed as the portion of the night
 * (sunset to next sunrise) between the prayer and sunrise or sunset.
 */
public enum HighLatitudeRule {
    /**
     * No fallback: the prayer stays unreachable.
     */
    NONE,
    MIDDLE_OF_NIGHT,
    ONE_SEVENTH,
    /**
     * A sixtieth of the night per degree of the twilight angle.
     */
    ANGLE_BASED;

    /**
     * @param twilightAngle the twilight angle in degrees, sign ignored
     * @return the portion of the night within [0, 1]
     */
    public double nightPortion(double twilightAngle) {
        return switch (this) {
            case NONE -> 0.0;
            case MIDDLE_OF_NIGHT -> 1.0 / 2.0;
            case ONE_SEVENTH -> 1.0 / 7.0;
            case ANGLE_BASED -> Math.abs(twilightAngle) / 60.0;
        };
    }

    public boolean appliesFallback() {
        return this != NONE;
    }
}
