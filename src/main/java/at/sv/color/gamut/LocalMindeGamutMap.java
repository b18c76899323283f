package at.sv.color.gamut;

import at.sv.color.Color;
import at.sv.color.ColorChannel;
import at.sv.color.LinearChannel;
import at.sv.color.space.ColorSpace;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

import static at.sv.color.FuzzyMath.fuzzyGreaterThanOrEquals;
import static at.sv.color.FuzzyMath.fuzzyLessThanOrEquals;

/**
 * Binary search over Oklch chroma, accepting the clipped candidate once it is within a just noticeable difference of
 * the unclipped one.
 */
@Slf4j
final class LocalMindeGamutMap extends GamutMapMethod {

    /**
     * The just noticeable difference in ΔEOK.
     */
    static final double JND = 0.02;

    /**
     * The minimum chroma difference the search resolves.
     */
    static final double EPSILON = 0.0001;

    LocalMindeGamutMap() {
        super("local-minde");
    }

    @Override
    public Color map(Color color) {
        ColorSpace space = color.getSpace();
        Color original = color.toSpace(ColorSpace.OKLCH);
        Double lightness = original.getChannel0OrNull();
        Double hue = original.getChannel2OrNull();
        Double alpha = color.getAlphaOrNull();

        if (fuzzyGreaterThanOrEquals(original.getChannel0(), 1)) {
            return white(space, alpha);
        } else if (fuzzyLessThanOrEquals(original.getChannel0(), 0)) {
            return Color.rgb(0.0, 0.0, 0.0, alpha).toSpace(space);
        }

        Color clipped = CLIP.map(color);
        if (deltaEok(clipped, color) < JND) {
            return clipped;
        }

        double min = 0;
        double max = original.getChannel1();
        boolean minInGamut = true;
        int steps = 0;
        while (max - min > EPSILON) {
            steps++;
            double chroma = (min + max) / 2;
            Color current = ColorSpace.OKLCH.convert(space, lightness, chroma, hue, alpha);
            if (minInGamut && current.isInGamut()) {
                min = chroma;
                continue;
            }

            clipped = CLIP.map(current);
            double e = deltaEok(clipped, current);
            if (e < JND) {
                if (JND - e < EPSILON) {
                    break;
                }
                minInGamut = false;
                min = chroma;
            } else {
                max = chroma;
            }
        }
        log.trace("Mapped {} to {} in {} steps", color, clipped, steps);
        return clipped;
    }

    private static Color white(ColorSpace space, Double alpha) {
        if (space.isLegacy()) {
            return Color.rgb(255.0, 255.0, 255.0, alpha).toSpace(space);
        }
        List<ColorChannel> channels = space.getChannels();
        return Color.forSpace(space, maxOf(channels.get(0)), maxOf(channels.get(1)), maxOf(channels.get(2)), alpha);
    }

    private static Double maxOf(ColorChannel channel) {
        return channel instanceof LinearChannel linear ? linear.getMax() : 0.0;
    }

    /**
     * The Euclidean distance between two colors in Oklab.
     */
    static double deltaEok(Color color1, Color color2) {
        Color lab1 = color1.toSpace(ColorSpace.OKLAB);
        Color lab2 = color2.toSpace(ColorSpace.OKLAB);
        double dl = lab1.getChannel0() - lab2.getChannel0();
        double da = lab1.getChannel1() - lab2.getChannel1();
        double db = lab1.getChannel2() - lab2.getChannel2();
        return Math.sqrt(dl * dl + da * da + db * db);
    }
}
