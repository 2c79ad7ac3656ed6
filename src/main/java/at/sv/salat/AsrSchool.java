package at.sv.salat;

import java.util.Locale;

/**
 * Jurisprudential school for the start of Asr, expressed as the shadow length factor.
 */
public enum AsrSchool {
    /**
     * Shafi'i, Maliki and Hanbali: shadow equals the object height plus its noon shadow.
     */
    STANDARD(1),
    /**
     * Hanafi: shadow equals twice the object height plus its noon shadow.
     */
    HANAFI(2);

    private final int shadowFactor;

    AsrSchool(int shadowFactor) {
        this.shadowFactor = shadowFactor;
    }

    public int getShadowFactor() {
        return shadowFactor;
    }

    public static AsrSchool ofShadowFactor(int shadowFactor) {
        for (AsrSchool school : values()) {
            if (school.shadowFactor == shadowFactor) {
                return school;
            }
        }
        throw new InvalidPropertyValue("Invalid Asr shadow factor '" + shadowFactor + "'. Supported values: [1, 2]");
    }

    /**
     * @param value a school name (case insensitive) or its shadow factor
     * @return the matching school
     */
    public static AsrSchool parse(String value) {
        String trimmed = value.trim();
        if (trimmed.matches("\\d+")) {
            try {
                return ofShadowFactor(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                throw new InvalidPropertyValue("Invalid Asr shadow factor '" + trimmed + "'. Supported values: [1, 2]");
            }
        }
        switch (trimmed.toLowerCase(Locale.ENGLISH)) {
            case "standard":
            case "shafi":
                return STANDARD;
            case "hanafi":
                return HANAFI;
            default:
                throw new InvalidPropertyValue("Unknown Asr school '" + value + "'. " +
                                               "Supported values (case insensitive): [standard|shafi|1, hanafi|2]");
        }
    }
}
