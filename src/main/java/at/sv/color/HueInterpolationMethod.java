package at.sv.color;

import java.util.Arrays;
import java.util.Locale;

/**
 * How hues are interpolated, see
 * <a href="https://www.w3.org/TR/css-color-4/#hue-interpolation">CSS Color 4</a>.
 */
public enum HueInterpolationMethod {
    /**
     * Angles are adjusted so that {@code h2 - h1} is in [-180, 180].
     */
    SHORTER,
    /**
     * Angles are adjusted so that {@code h2 - h1} is 0 or in [180, 360).
     */
    LONGER,
    /**
     * Angles are adjusted so that {@code h2 - h1} is in [0, 360).
     */
    INCREASING,
    /**
     * Angles are adjusted so that {@code h2 - h1} is in (-360, 0].
     */
    DECREASING,
    /**
     * No fixup is performed.
     */
    SPECIFIED;

    /**
     * The lower case CSS name, e.g. {@code shorter}.
     */
    public String getName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static HueInterpolationMethod fromName(String name) {
        return Arrays.stream(values())
                     .filter(method -> method.getName().equalsIgnoreCase(name))
                     .findFirst()
                     .orElseThrow(() -> new IllegalArgumentException("Unknown hue interpolation method \"" + name + "\"."));
    }
}
