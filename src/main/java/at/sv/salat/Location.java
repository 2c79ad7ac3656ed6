package at.sv.salat;

/**
 * @param latitude       degrees north [-90..90]
 * @param longitude      degrees east [-180..180]
 * @param utcOffsetHours fixed offset of local civil time from UTC in fractional hours, e.g. 6.5 for UTC+06:30
 */
public record Location(double latitude, double longitude, double utcOffsetHours) {

    public Location {
        assertRange("latitude", latitude, 90);
        assertRange("longitude", longitude, 180);
        assertRange("UTC offset", utcOffsetHours, 14);
    }

    public static Location of(double latitude, double longitude, double utcOffsetHours) {
        return new Location(latitude, longitude, utcOffsetHours);
    }

    private static void assertRange(String name, double value, double limit) {
        if (!Double.isFinite(value) || value < -limit || value > limit) {
            throw new InvalidPropertyValue("Invalid " + name + " '" + value + "'. Supported range: [-" + limit + ".." + limit + "]");
        }
    }

    @Override
    public String toString() {
        return "(" + latitude + ", " + longitude + ", UTC" + FormatUtil.formatUtcOffset(utcOffsetHours) + ")";
    }
}
