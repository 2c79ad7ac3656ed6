package at.sv.salat.city;

import at.sv.salat.Location;

/**
 * @param name the display name
 * @param slug the lower case identifier used for lookups
 */
public record City(String name, String slug, double latitude, double longitude, double utcOffsetHours) {

    public Location toLocation() {
        return Location.of(latitude, longitude, utcOffsetHours);
    }

    @Override
    public String toString() {
        return name + " " + toLocation();
    }
}
