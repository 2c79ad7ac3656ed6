package at.sv.salat.time;

/**
 * Angular distance from local solar noon at which the sun reaches a given altitude.
 *
 * @param degrees   the hour angle within [0, 180], clamped to the boundary if the altitude is never reached
 * @param reachable whether the sun actually reaches the altitude on that day
 */
public record HourAngle(double degrees, boolean reachable) {

    public static HourAngle reachable(double degrees) {
        return new HourAngle(degrees, true);
    }

    public static HourAngle unreachable(double clampedDegrees) {
        return new HourAngle(clampedDegrees, false);
    }

    public double hours() {
        return degrees / 15.0;
    }
}
