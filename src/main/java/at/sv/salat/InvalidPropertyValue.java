package at.sv.salat;

/**
 * Signals a configuration value outside the supported range or set.
 */
public final class InvalidPropertyValue extends IllegalArgumentException {
    public InvalidPropertyValue(String message) {
        super(message);
    }
}
