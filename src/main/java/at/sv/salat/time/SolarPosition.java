package at.sv.salat.time;

import static at.sv.salat.time.AngleMath.asin;
import static at.sv.salat.time.AngleMath.cos;
import static at.sv.salat.time.AngleMath.sin;
import static at.sv.salat.time.AngleMath.tan;

/**
 * Apparent position of the sun, from a low-order ephemeris valid for roughly 1901 to 2099.
 *
 * @param declination    the solar declination in degrees
 * @param equationOfTime apparent minus mean solar time, in minutes
 */
public record SolarPosition(double declination, double equationOfTime) {

    /**
     * @param julianDay the Julian day
     * @return the solar position at the given instant
     */
    public static SolarPosition at(double julianDay) {
        double t = JulianDate.centuriesSinceJ2000(julianDay);

        double meanLongitude = 280.46646 + 36000.76983 * t + 0.0003032 * t * t;
        double meanAnomaly = 357.52911 + 35999.05029 * t - 0.0001537 * t * t;
        double eccentricity = 0.016708634 - 0.000042037 * t - 0.0000001267 * t * t;

        double equationOfCenter = (1.914602 - 0.004817 * t) * sin(meanAnomaly)
                                  + (0.019993 - 0.000101 * t) * sin(2 * meanAnomaly)
                                  + 0.000289 * sin(3 * meanAnomaly);
        double eclipticLongitude = meanLongitude + equationOfCenter;
        double obliquity = 23.439291 - 0.0130042 * t;

        double declination = asin(sin(obliquity) * sin(eclipticLongitude));

        double y = Math.pow(tan(obliquity / 2), 2);
        double equationOfTime = 4 * Math.toDegrees(
                y * sin(2 * meanLongitude)
                - 2 * eccentricity * sin(meanAnomaly)
                + 4 * eccentricity * y * sin(meanAnomaly) * cos(2 * meanLongitude)
                - 0.5 * y * y * sin(4 * meanLongitude)
                - 1.25 * eccentricity * eccentricity * sin(2 * meanAnomaly));

        return new SolarPosition(declination, equationOfTime);
    }
}
