package at.sv.salat.time;

/**
 * Trigonometric functions on degrees. The inverse functions return degrees.
 */
public final class AngleMath {

    private AngleMath() {
    }

    public static double sin(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    public static double cos(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }

    public static double tan(double degrees) {
        return Math.tan(Math.toRadians(degrees));
    }

    public static double asin(double value) {
        return Math.toDegrees(Math.asin(clamp(value)));
    }

    /**
     * @param value the cosine, clamped to [-1, 1] before inversion
     * @return the angle in degrees within [0, 180]
     */
    public static double acos(double value) {
        return Math.toDegrees(Math.acos(clamp(value)));
    }

    public static double atan(double value) {
        return Math.toDegrees(Math.atan(value));
    }

    static double clamp(double value) {
        return Math.min(1.0, Math.max(-1.0, value));
    }
}
