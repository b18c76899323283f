package at.sv.color;

import at.sv.color.space.ColorSpace;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders colors in CSS syntax.
 */
final class ColorFormatter {

    private static final int PRECISION = 10;

    private ColorFormatter() {
    }

    static String format(Color color) {
        ColorSpace space = color.getSpace();
        boolean anyMissing = color.isChannel0Missing() || color.isChannel1Missing() || color.isChannel2Missing()
                             || color.isAlphaMissing();
        if (space == ColorSpace.RGB && !anyMissing) {
            return formatLegacy(color, "rgb", "", "");
        } else if (space == ColorSpace.HSL && !anyMissing) {
            return formatLegacy(color, "hsl", "%", "%");
        }

        StringBuilder builder = new StringBuilder();
        if (space == ColorSpace.RGB || space == ColorSpace.HSL || space == ColorSpace.HWB || space == ColorSpace.LAB
            || space == ColorSpace.LCH || space == ColorSpace.OKLAB || space == ColorSpace.OKLCH) {
            builder.append(space.getName()).append('(');
        } else {
            builder.append("color(").append(space.getName()).append(' ');
        }
        builder.append(formatChannel(color.getChannel0OrNull(), percentSuffix(space, 0))).append(' ')
               .append(formatChannel(color.getChannel1OrNull(), percentSuffix(space, 1))).append(' ')
               .append(formatChannel(color.getChannel2OrNull(), percentSuffix(space, 2)));
        Double alpha = color.getAlphaOrNull();
        if (alpha == null || !isOpaque(alpha)) {
            builder.append(" / ").append(formatAlpha(alpha));
        }
        return builder.append(')').toString();
    }

    private static String formatLegacy(Color color, String name, String suffix1, String suffix2) {
        double alpha = color.getAlpha();
        boolean opaque = isOpaque(alpha);
        StringBuilder builder = new StringBuilder(name);
        if (!opaque) {
            builder.append('a');
        }
        builder.append('(')
               .append(formatNumber(color.getChannel0())).append(", ")
               .append(formatNumber(color.getChannel1())).append(suffix1).append(", ")
               .append(formatNumber(color.getChannel2())).append(suffix2);
        if (!opaque) {
            builder.append(", ").append(formatAlpha(alpha));
        }
        return builder.append(')').toString();
    }

    /**
     * Lab and LCH lightness, as well as the legacy percentages, are written with {@code %}.
     */
    private static String percentSuffix(ColorSpace space, int index) {
        ColorChannel channel = space.getChannels().get(index);
        if (channel instanceof LinearChannel linear && linear.isRequiresPercent()) {
            return "%";
        }
        if ((space == ColorSpace.LAB || space == ColorSpace.LCH) && index == 0) {
            return "%";
        }
        return "";
    }

    private static boolean isOpaque(double alpha) {
        return FuzzyMath.fuzzyEquals(FuzzyMath.clampLikeCss(alpha, 0, 1), 1);
    }

    private static String formatChannel(Double value, String suffix) {
        return value == null ? "none" : formatNumber(value) + suffix;
    }

    private static String formatAlpha(Double alpha) {
        return alpha == null ? "none" : formatNumber(FuzzyMath.clampLikeCss(alpha, 0, 1));
    }

    static String formatNumber(double value) {
        if (Double.isNaN(value)) {
            return "calc(NaN)";
        } else if (Double.isInfinite(value)) {
            return value > 0 ? "calc(infinity)" : "calc(-infinity)";
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(PRECISION, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.toPlainString();
    }
}
