package at.sv.color;

import at.sv.color.space.ColorSpace;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Mixes two colors channel by channel in the space of an {@link InterpolationMethod}, following
 * <a href="https://www.w3.org/TR/css-color-4/#interpolation">CSS Color 4 interpolation</a>.
 */
@RequiredArgsConstructor
public final class ColorInterpolator {

    @Getter
    private final InterpolationMethod method;

    /**
     * Interpolates and converts the result back to the space of {@code color1}.
     */
    public Color interpolate(Color color1, Color color2, double weight) {
        return interpolateInSpace(color1, color2, weight).toSpace(color1.getSpace());
    }

    /**
     * Interpolates and returns the result in the interpolation space.
     * <p>
     * P = P1 + weight * (P2 - P1)
     *
     * @throws IllegalArgumentException if {@code weight} isn't in [0, 1]
     */
    public Color interpolateInSpace(Color color1, Color color2, double weight) {
        if (Double.isNaN(weight) || !FuzzyMath.fuzzyInRange(weight, 0, 1)) {
            throw new IllegalArgumentException("Expected weight to be in [0, 1], was " + weight);
        }
        ColorSpace space = method.getSpace();
        Color converted1 = color1.toSpace(space);
        Color converted2 = color2.toSpace(space);

        Double[] mixed = new Double[3];
        List<ColorChannel> channels = space.getChannels();
        for (int i = 0; i < 3; i++) {
            Double value1 = isAnalogousChannelMissing(color1, converted1, i) ? null : converted1.getChannelsOrNull().get(i);
            Double value2 = isAnalogousChannelMissing(color2, converted2, i) ? null : converted2.getChannelsOrNull().get(i);
            if (channels.get(i).isPolarAngle()) {
                mixed[i] = interpolateHue(value1, value2, weight);
            } else {
                mixed[i] = interpolateValue(value1, value2, weight);
            }
        }
        Double alpha = interpolateValue(converted1.getAlphaOrNull(), converted2.getAlphaOrNull(), weight);
        return Color.forSpace(space, mixed[0], mixed[1], mixed[2], alpha);
    }

    /**
     * A channel of the converted color counts as missing if it is missing itself or if the original color had the
     * analogous channel missing.
     */
    private static boolean isAnalogousChannelMissing(Color original, Color converted, int index) {
        if (converted.getChannelsOrNull().get(index) == null) {
            return true;
        }
        if (original == converted) {
            return false;
        }
        ColorChannel convertedChannel = converted.getSpace().getChannels().get(index);
        return original.getSpace().getChannels().stream()
                       .filter(convertedChannel::isAnalogous)
                       .findFirst()
                       .map(channel -> original.isChannelMissing(channel.getName()))
                       .orElse(false);
    }

    private static Double interpolateValue(Double value1, Double value2, double weight) {
        if (value1 == null && value2 == null) {
            return null;
        }
        if (value1 == null) {
            return value2;
        }
        if (value2 == null) {
            return value1;
        }
        return value1 + weight * (value2 - value1);
    }

    private Double interpolateHue(Double hue1, Double hue2, double weight) {
        if (hue1 == null || hue2 == null) {
            return interpolateValue(hue1, hue2, weight);
        }
        HueInterpolationMethod hueMethod = method.getHue();
        double h1 = hue1;
        double h2 = hue2;
        if (hueMethod != HueInterpolationMethod.SPECIFIED) {
            h1 = FuzzyMath.normalizeHue(h1);
            h2 = FuzzyMath.normalizeHue(h2);
        }
        double delta = h2 - h1;
        switch (hueMethod) {
            case SHORTER -> {
                if (delta > 180) {
                    h1 += 360;
                } else if (delta < -180) {
                    h2 += 360;
                }
            }
            case LONGER -> {
                if (delta > 0 && delta < 180) {
                    h1 += 360;
                } else if (delta > -180 && delta <= 0) {
                    h2 += 360;
                }
            }
            case INCREASING -> {
                if (h2 < h1) {
                    h2 += 360;
                }
            }
            case DECREASING -> {
                if (h1 < h2) {
                    h1 += 360;
                }
            }
            case SPECIFIED -> {
            }
        }
        return FuzzyMath.normalizeHue(h1 + weight * (h2 - h1));
    }
}
