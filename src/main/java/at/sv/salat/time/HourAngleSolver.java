package at.sv.salat.time;

import static at.sv.salat.time.AngleMath.acos;
import static at.sv.salat.time.AngleMath.atan;
import static at.sv.salat.time.AngleMath.cos;
import static at.sv.salat.time.AngleMath.sin;
import static at.sv.salat.time.AngleMath.tan;

public final class HourAngleSolver {

    /**
     * Apparent altitude of the sun's upper limb at sunrise and sunset, including refraction.
     */
    public static final double SUNRISE_ALTITUDE = -0.833;

    private HourAngleSolver() {
    }

    /**
     * Solves {@code cos(H) = (sin(altitude) - sin(lat) * sin(decl)) / (cos(lat) * cos(decl))}.
     * <p>
     * Reachability is decided on the raw ratio. A ratio outside [-1, 1] (polar day or night, or a twilight angle the
     * sun never reaches) and the undefined 0/0 ratio at the poles are reported as unreachable, with the hour angle
     * clamped to a finite boundary value.
     *
     * @param latitude    the observer latitude in degrees
     * @param declination the solar declination in degrees
     * @param altitude    the target solar altitude in degrees, negative below the horizon
     * @return the hour angle in degrees
     */
    public static HourAngle hourAngle(double latitude, double declination, double altitude) {
        double numerator = sin(altitude) - sin(latitude) * sin(declination);
        double denominator = cos(latitude) * cos(declination);
        double ratio = numerator / denominator;
        if (Double.isNaN(ratio)) {
            return HourAngle.unreachable(90.0);
        }
        if (ratio < -1.0 || ratio > 1.0) {
            return HourAngle.unreachable(acos(ratio));
        }
        return HourAngle.reachable(acos(ratio));
    }

    /**
     * Altitude of the sun at which the shadow of an object equals its noon shadow plus {@code shadowFactor} times
     * its height.
     *
     * @param latitude     the observer latitude in degrees
     * @param declination  the solar declination in degrees
     * @param shadowFactor 1 for the standard school, 2 for the Hanafi school
     * @return the target altitude in degrees
     */
    public static double asrAltitude(double latitude, double declination, double shadowFactor) {
        return atan(1.0 / (shadowFactor + tan(Math.abs(latitude - declination))));
    }
}
