package at.sv.salat.time;

/**
 * Local civil time of an altitude crossing in decimal hours, not normalized to a single day.
 *
 * @param hours     the time; for an unreachable altitude the time derived from the clamped hour angle
 * @param reachable whether the sun actually crosses the altitude
 */
public record TimeSolution(double hours, boolean reachable) {

    public static TimeSolution solved(double hours) {
        return new TimeSolution(hours, true);
    }

    public static TimeSolution unreachable(double clampedHours) {
        return new TimeSolution(clampedHours, false);
    }
}
