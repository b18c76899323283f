package at.sv.color.space;

import at.sv.color.Color;
import at.sv.color.ColorChannel;
import at.sv.color.LinearChannel;

import java.util.List;

import static at.sv.color.FuzzyMath.fuzzyEquals;

final class ColorSpaceUtils {

    private ColorSpaceUtils() {
    }

    /**
     * Used to convert Lab to and from XYZ: 29^3/3^3
     */
    static final double LAB_KAPPA = 24389.0 / 27;

    /**
     * Used to convert Lab to and from XYZ: 6^3/29^3
     */
    static final double LAB_EPSILON = 216.0 / 24389;

    static final List<ColorChannel> RGB_CHANNELS = List.of(
            LinearChannel.of("red", 0, 1),
            LinearChannel.of("green", 0, 1),
            LinearChannel.of("blue", 0, 1));

    static final List<ColorChannel> XYZ_CHANNELS = List.of(
            LinearChannel.of("x", 0, 1),
            LinearChannel.of("y", 0, 1),
            LinearChannel.of("z", 0, 1));

    /**
     * Converts a legacy HSL/HWB hue to an RGB channel, see
     * <a href="http://www.w3.org/TR/css3-color/#hsl-color">CSS3 Color</a>.
     */
    static double hueToRgb(double m1, double m2, double hue) {
        if (hue < 0) {
            hue += 1;
        }
        if (hue > 1) {
            hue -= 1;
        }

        if (hue < 1.0 / 6) {
            return m1 + (m2 - m1) * hue * 6;
        } else if (hue < 1.0 / 2) {
            return m2;
        } else if (hue < 2.0 / 3) {
            return m1 + (m2 - m1) * (2.0 / 3 - hue) * 6;
        } else {
            return m1;
        }
    }

    /**
     * Gamma-encoded srgb / display-p3 channel to linear light.
     */
    static double srgbAndDisplayP3ToLinear(double channel) {
        double abs = Math.abs(channel);
        return abs < 0.04045 ? channel / 12.92 : Math.signum(channel) * Math.pow((abs + 0.055) / 1.055, 2.4);
    }

    /**
     * Linear-light srgb / display-p3 channel to gamma-encoded form.
     */
    static double srgbAndDisplayP3FromLinear(double channel) {
        double abs = Math.abs(channel);
        return abs <= 0.0031308 ? channel * 12.92 : Math.signum(channel) * (1.055 * Math.pow(abs, 1 / 2.4) - 0.055);
    }

    /**
     * Converts a Lab or Oklab color to LCH or Oklch respectively. The hue is missing for achromatic colors.
     */
    static Color labToLch(ColorSpace dest, Double lightness, Double a, Double b, Double alpha,
                          MissingChannels missing) {
        double aValue = a == null ? 0 : a;
        double bValue = b == null ? 0 : b;
        double chroma = Math.sqrt(aValue * aValue + bValue * bValue);
        Double hue = null;
        if (!missing.isMissingHue() && !fuzzyEquals(chroma, 0)) {
            double degrees = Math.toDegrees(Math.atan2(bValue, aValue));
            hue = degrees >= 0 ? degrees : degrees + 360;
        }
        return Color.forSpace(dest,
                missing.isMissingLightness() ? null : lightness,
                missing.isMissingChroma() ? null : chroma,
                hue, alpha);
    }

    static double[] multiply(double[] matrix, double x, double y, double z) {
        return new double[]{
                matrix[0] * x + matrix[1] * y + matrix[2] * z,
                matrix[3] * x + matrix[4] * y + matrix[5] * z,
                matrix[6] * x + matrix[7] * y + matrix[8] * z};
    }

    static double orZero(Double value) {
        return value == null ? 0 : value;
    }
}
