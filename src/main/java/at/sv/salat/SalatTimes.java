package at.sv.salat;

import at.sv.salat.city.Cities;
import at.sv.salat.city.City;
import at.sv.salat.hijri.HijriCalendar;
import at.sv.salat.hijri.HijriDate;
import at.sv.salat.hijri.IslamicEvent;
import at.sv.salat.hijri.IslamicEvents;
import at.sv.salat.time.HighLatitudeRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@Command(name = "SalatTimes", version = "0.3.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Calculates Islamic prayer times, the civil Hijri date and Islamic events offline.")
public final class SalatTimes implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(SalatTimes.class);

    static final int MAX_DAYS = 366;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--city",
            defaultValue = "${env:CITY}",
            description = "A built-in city providing latitude, longitude and UTC offset, e.g. yangon or mandalay. " +
                          "Cannot be combined with --lat, --long or --utc-offset.")
    String city;
    @Option(names = "--lat",
            defaultValue = "${env:LAT}",
            description = "The latitude of your location in degrees [-90..90].")
    Double latitude;
    @Option(names = "--long",
            defaultValue = "${env:LONG}",
            description = "The longitude of your location in degrees [-180..180].")
    Double longitude;
    @Option(names = "--utc-offset", paramLabel = "<offset>",
            defaultValue = "${env:UTC_OFFSET}",
            converter = UtcOffsetConverter.class,
            description = "The fixed UTC offset of your location, either in hours (6.5) or as +HH:MM (+06:30).")
    Double utcOffset;
    @Option(names = "--date", paramLabel = "<yyyy-MM-dd>",
            defaultValue = "${env:DATE}",
            description = "The first date to calculate. Default: today at the given UTC offset.")
    LocalDate date;
    @Option(names = "--days",
            defaultValue = "${env:DAYS:-1}",
            description = "The number of consecutive days to calculate [1.." + MAX_DAYS + "]. Default: ${DEFAULT-VALUE}")
    int days;
    @Option(names = "--method",
            defaultValue = "${env:METHOD:-KARACHI}",
            description = "The calculation method for the Fajr and Isha angles: ${COMPLETION-CANDIDATES}. " +
                          "Default: ${DEFAULT-VALUE}")
    CalculationMethod method;
    @Option(names = "--asr-school", paramLabel = "<school>",
            defaultValue = "${env:ASR_SCHOOL:-HANAFI}",
            converter = AsrSchoolConverter.class,
            description = "The school for the Asr shadow length: standard (1) or hanafi (2). Default: ${DEFAULT-VALUE}")
    AsrSchool asrSchool;
    @Option(names = "--high-latitude-rule", paramLabel = "<rule>",
            defaultValue = "${env:HIGH_LATITUDE_RULE:-MIDDLE_OF_NIGHT}",
            description = "The fallback if the sun never reaches the Fajr or Isha angle: ${COMPLETION-CANDIDATES}. " +
                          "Default: ${DEFAULT-VALUE}")
    HighLatitudeRule highLatitudeRule;
    @Option(names = "--fajr-offset", paramLabel = "<minutes>",
            defaultValue = "${env:FAJR_OFFSET:-2}",
            description = "Minutes added to Fajr. Default: ${DEFAULT-VALUE}")
    int fajrOffset;
    @Option(names = "--sunrise-offset", paramLabel = "<minutes>",
            defaultValue = "${env:SUNRISE_OFFSET:-0}",
            description = "Minutes added to sunrise. Default: ${DEFAULT-VALUE}")
    int sunriseOffset;
    @Option(names = "--zawal-offset", paramLabel = "<minutes>",
            defaultValue = "${env:ZAWAL_OFFSET:-0}",
            description = "Minutes added to zawal (solar noon). Default: ${DEFAULT-VALUE}")
    int zawalOffset;
    @Option(names = "--asr-offset", paramLabel = "<minutes>",
            defaultValue = "${env:ASR_OFFSET:-0}",
            description = "Minutes added to Asr. Default: ${DEFAULT-VALUE}")
    int asrOffset;
    @Option(names = "--maghrib-offset", paramLabel = "<minutes>",
            defaultValue = "${env:MAGHRIB_OFFSET:-4}",
            description = "Minutes added to Maghrib. Default: ${DEFAULT-VALUE}")
    int maghribOffset;
    @Option(names = "--isha-offset", paramLabel = "<minutes>",
            defaultValue = "${env:ISHA_OFFSET:-2}",
            description = "Minutes added to Isha. Default: ${DEFAULT-VALUE}")
    int ishaOffset;
    @Option(names = "--hijri-offset", paramLabel = "<days>",
            defaultValue = "${env:HIJRI_OFFSET:-0}",
            description = "Days added to the date before the Hijri conversion, to match local moon sighting. " +
                          "Default: ${DEFAULT-VALUE}")
    int hijriOffset;
    @Option(names = "--json",
            defaultValue = "${env:JSON:-false}",
            description = "Print one JSON object per day instead of a table. Default: ${DEFAULT-VALUE}")
    boolean json;
    @Option(names = "--verbose",
            description = "Log the resolved configuration and the prayer times of the first day.")
    boolean verbose;

    Clock clock = Clock.systemUTC();

    private final ObjectMapper mapper;

    public SalatTimes() {
        mapper = new ObjectMapper();
    }

    public static void main(String[] args) {
        int execute = createCommandLine(new SalatTimes()).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    static CommandLine createCommandLine(SalatTimes salatTimes) {
        return new CommandLine(salatTimes).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        assertConfigurationParameters();
        String locationName = resolveLocationName();
        Location location = resolveLocation();
        PrayerCalculationSettings settings = createSettings();
        LocalDate startDate = date != null ? date : LocalDate.now(clock.withZone(toZoneOffset(location)));
        if (verbose) {
            LOG.info("Location: {} {}", locationName, location);
            LOG.info("Settings: {}", settings);
        } else {
            LOG.debug("Location: {} {}, settings: {}", locationName, location, settings);
        }

        PrayerTimesCalculator calculator = new PrayerTimesCalculatorImpl(location);
        if (verbose) {
            LOG.info("Current prayer times:\n{}", calculator.toDebugString(startDate, settings));
        }
        List<PrayerTimesReport> reports = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            LocalDate day = startDate.plusDays(i);
            PrayerTimes prayerTimes = calculator.calculate(day, settings);
            HijriDate hijriDate = HijriCalendar.toHijri(day, hijriOffset);
            Optional<IslamicEvent> event = IslamicEvents.lookup(hijriDate);
            reports.add(PrayerTimesReport.of(prayerTimes, hijriDate, event));
        }
        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            printJson(out, reports);
        } else {
            printTable(out, locationName, location, settings, reports);
        }
        out.flush();
    }

    private void assertConfigurationParameters() {
        if (city != null && (latitude != null || longitude != null || utcOffset != null)) {
            fail("--city cannot be combined with --lat, --long or --utc-offset");
        }
        if (city == null && (latitude != null || longitude != null || utcOffset != null)
            && (latitude == null || longitude == null || utcOffset == null)) {
            fail("--lat, --long and --utc-offset have to be set together");
        }
        if (latitude != null && (!Double.isFinite(latitude) || latitude < -90 || latitude > 90)) {
            fail("--lat must be between -90 and 90 degrees");
        }
        if (longitude != null && (!Double.isFinite(longitude) || longitude < -180 || longitude > 180)) {
            fail("--long must be between -180 and 180 degrees");
        }
        if (utcOffset != null && (!Double.isFinite(utcOffset) || utcOffset < -14 || utcOffset > 14)) {
            fail("--utc-offset must be between -14 and +14 hours");
        }
        if (city != null && Cities.find(city).isEmpty()) {
            fail("Unknown --city '" + city + "'");
        }
        if (days < 1 || days > MAX_DAYS) {
            fail("--days must be between 1 and " + MAX_DAYS);
        }
    }

    private void fail(String msg) {
        if (spec != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        throw new IllegalArgumentException(msg);
    }

    private String resolveLocationName() {
        if (latitude != null) {
            return "Custom";
        }
        return resolveCity().name();
    }

    private Location resolveLocation() {
        if (latitude != null) {
            return Location.of(latitude, longitude, utcOffset);
        }
        return resolveCity().toLocation();
    }

    private City resolveCity() {
        if (city == null) {
            return Cities.getDefault();
        }
        return Cities.require(city);
    }

    private PrayerCalculationSettings createSettings() {
        return PrayerCalculationSettings.builder()
                                        .method(method)
                                        .asrSchool(asrSchool)
                                        .highLatitudeRule(highLatitudeRule)
                                        .offsets(PrayerOffsets.builder()
                                                              .fajr(fajrOffset)
                                                              .sunrise(sunriseOffset)
                                                              .zawal(zawalOffset)
                                                              .asr(asrOffset)
                                                              .maghrib(maghribOffset)
                                                              .isha(ishaOffset)
                                                              .build())
                                        .hijriDayOffset(hijriOffset)
                                        .build();
    }

    private static ZoneOffset toZoneOffset(Location location) {
        return ZoneOffset.ofTotalSeconds((int) Math.round(location.utcOffsetHours() * 3600));
    }

    private void printJson(PrintWriter out, List<PrayerTimesReport> reports) {
        for (PrayerTimesReport report : reports) {
            try {
                out.println(mapper.writeValueAsString(report));
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException("Failed to serialize prayer times of " + report.date(), e);
            }
        }
    }

    private static void printTable(PrintWriter out, String locationName, Location location,
                                   PrayerCalculationSettings settings, List<PrayerTimesReport> reports) {
        out.println(locationName + " " + location + " - " + settings.getMethod().getDisplayName() +
                    ", Asr " + settings.getAsrSchool().name().toLowerCase(Locale.ENGLISH));
        for (PrayerTimesReport report : reports) {
            PrayerTimesReport.Hijri hijri = report.hijri();
            out.println();
            out.println(report.date() + " | " + hijri.day() + " " + hijri.monthName() + " " + hijri.year() + " AH" +
                        (report.event() != null ? " | " + report.event() : ""));
            report.times().forEach((prayer, time) ->
                    out.printf(Locale.ROOT, "  %-8s %8s%n", prayer, time != null ? time : PrayerTime.UNREACHABLE_TEXT));
        }
    }

    static final class UtcOffsetConverter implements CommandLine.ITypeConverter<Double> {
        @Override
        public Double convert(String value) {
            String trimmed = value.trim();
            if (!trimmed.contains(":")) {
                return Double.parseDouble(trimmed);
            }
            if (!trimmed.startsWith("+") && !trimmed.startsWith("-")) {
                trimmed = "+" + trimmed;
            }
            if (trimmed.length() == 5) { // +H:MM
                trimmed = trimmed.charAt(0) + "0" + trimmed.substring(1);
            }
            return ZoneOffset.of(trimmed).getTotalSeconds() / 3600.0;
        }
    }

    static final class AsrSchoolConverter implements CommandLine.ITypeConverter<AsrSchool> {
        @Override
        public AsrSchool convert(String value) {
            try {
                return AsrSchool.parse(value);
            } catch (InvalidPropertyValue e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
