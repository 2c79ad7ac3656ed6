package at.sv.salat.time;

/**
 * Finds the local civil time at which the sun crosses a given altitude for a fixed location.
 * <p>
 * The solar position is re-evaluated at the current estimate in a fixed number of passes, seeded at 12:00. Declination
 * and equation of time change slowly within a day, so the result is used after the last pass without a convergence
 * check.
 */
public final class SolarTimeSolver {

    static final int PASSES = 3;

    private final double latitude;
    private final double longitude;
    private final double utcOffsetHours;

    public SolarTimeSolver(double latitude, double longitude, double utcOffsetHours) {
        this.latitude = latitude;
        this.longitude = longitude;
        this.utcOffsetHours = utcOffsetHours;
    }

    /**
     * @param julianDay the Julian day at 0h UTC of the date
     * @param altitude  the target solar altitude in degrees
     * @param event     whether the crossing before or after solar noon is wanted
     * @return the local time in hours, reachable only if the last pass found a real hour angle
     */
    public TimeSolution solve(double julianDay, double altitude, SolarEvent event) {
        double time = 12.0;
        boolean reachable = true;
        for (int i = 0; i < PASSES; i++) {
            SolarPosition position = SolarPosition.at(julianDay + time / 24.0);
            HourAngle hourAngle = HourAngleSolver.hourAngle(latitude, position.declination(), altitude);
            time = event.apply(solarNoon(position), hourAngle.hours());
            reachable = hourAngle.reachable();
        }
        return reachable ? TimeSolution.solved(time) : TimeSolution.unreachable(time);
    }

    /**
     * @param position the solar position
     * @return the local time of solar transit in hours
     */
    public double solarNoon(SolarPosition position) {
        return 12.0 + utcOffsetHours - longitude / 15.0 - position.equationOfTime() / 60.0;
    }
}
