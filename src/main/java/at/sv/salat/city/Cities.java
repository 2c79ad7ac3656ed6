package at.sv.salat.city;

import at.sv.salat.InvalidPropertyValue;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Built-in catalog of Myanmar cities, all on Myanmar Standard Time (UTC+06:30).
 */
public final class Cities {

    private static final double MMT = 6.5;

    private static final List<City> CITIES = List.of(
            new City("Yangon", "yangon", 16.8661, 96.1951, MMT),
            new City("Mandalay", "mandalay", 21.9588, 96.0891, MMT),
            new City("Naypyidaw", "naypyidaw", 19.7633, 96.0785, MMT),
            new City("Taunggyi", "taunggyi", 20.7888, 97.0333, MMT),
            new City("Mawlamyine", "mawlamyine", 16.4833, 97.6333, MMT),
            new City("Bago", "bago", 17.3333, 96.4833, MMT),
            new City("Pathein", "pathein", 16.7833, 94.7333, MMT),
            new City("Pyay", "pyay", 18.8167, 95.2167, MMT),
            new City("Monywa", "monywa", 22.1167, 95.1333, MMT),
            new City("Sittwe", "sittwe", 20.15, 92.9, MMT),
            new City("Lashio", "lashio", 22.95, 97.75, MMT),
            new City("Meiktila", "meiktila", 20.8833, 95.85, MMT),
            new City("Magway", "magway", 20.15, 94.9167, MMT),
            new City("Myitkyina", "myitkyina", 25.3833, 97.4, MMT),
            new City("Dawei", "dawei", 14.0833, 98.2, MMT),
            new City("Hpa-An", "hpa-an", 16.8833, 97.6333, MMT),
            new City("Loikaw", "loikaw", 19.6667, 97.2, MMT),
            new City("Hakha", "hakha", 22.65, 93.6, MMT),
            new City("Kalay", "kalay", 23.2, 94.0167, MMT),
            new City("Pakokku", "pakokku", 21.3333, 95.0833, MMT),
            new City("Thaton", "thaton", 16.9167, 97.3667, MMT),
            new City("Pyin Oo Lwin", "pyin-oo-lwin", 22.0315, 96.471, MMT)
    );

    private Cities() {
    }

    /**
     * @return all cities in catalog order, starting with the default city Yangon
     */
    public static List<City> getAll() {
        return CITIES;
    }

    public static City getDefault() {
        return CITIES.get(0);
    }

    public static Optional<City> find(String slug) {
        String normalized = slug.trim().toLowerCase(Locale.ENGLISH);
        return CITIES.stream()
                     .filter(city -> city.slug().equals(normalized))
                     .findFirst();
    }

    /**
     * @throws InvalidPropertyValue if no city with the given slug exists
     */
    public static City require(String slug) {
        return find(slug).orElseThrow(() -> new InvalidPropertyValue(
                "Unknown city '" + slug + "'. Supported values: " + getSlugs()));
    }

    private static String getSlugs() {
        return CITIES.stream().map(City::slug).collect(Collectors.joining(", ", "[", "]"));
    }
}
