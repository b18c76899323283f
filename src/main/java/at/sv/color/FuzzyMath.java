package at.sv.color;

/**
 * Floating point comparisons that treat numbers within {@link #EPSILON} of each other as equal.
 */
public final class FuzzyMath {

    /**
     * Ten decimal digits of precision.
     */
    public static final double EPSILON = 1e-11;

    private FuzzyMath() {
    }

    public static boolean fuzzyEquals(double number1, double number2) {
        return Math.abs(number1 - number2) < EPSILON;
    }

    /**
     * Like {@link #fuzzyEquals(double, double)}, but two missing values are equal as well.
     */
    public static boolean fuzzyEqualsNullable(Double number1, Double number2) {
        if (number1 == null || number2 == null) {
            return number1 == null && number2 == null;
        }
        return fuzzyEquals(number1, number2);
    }

    public static boolean fuzzyLessThanOrEquals(double number1, double number2) {
        return number1 < number2 || fuzzyEquals(number1, number2);
    }

    public static boolean fuzzyGreaterThanOrEquals(double number1, double number2) {
        return number1 > number2 || fuzzyEquals(number1, number2);
    }

    public static boolean fuzzyInRange(double number, double min, double max) {
        return fuzzyGreaterThanOrEquals(number, min) && fuzzyLessThanOrEquals(number, max);
    }

    /**
     * Returns a hash code for the given number that is the same for numbers that round to the same multiple of
     * {@link #EPSILON}.
     */
    public static int fuzzyHashCode(double number) {
        if (!Double.isFinite(number)) {
            return Double.hashCode(number);
        }
        return Double.hashCode(Math.round(number / EPSILON) * EPSILON);
    }

    public static int fuzzyHashCode(Double number) {
        return number == null ? 0 : fuzzyHashCode(number.doubleValue());
    }

    /**
     * Clamps like CSS does, i.e. NaN resolves to the lower bound.
     */
    public static double clampLikeCss(double number, double lower, double upper) {
        if (Double.isNaN(number)) {
            return lower;
        }
        return Math.max(lower, Math.min(upper, number));
    }

    /**
     * Normalizes the given angle in degrees into [0, 360).
     */
    public static double normalizeHue(double hue) {
        double r = hue % 360.0;
        return r < 0 ? r + 360.0 : r;
    }
}
