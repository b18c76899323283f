package at.sv.color.space;

import at.sv.color.Color;
import at.sv.color.ColorChannel;
import at.sv.color.LinearChannel;

import java.util.List;

import static at.sv.color.space.ColorSpaceUtils.hueToRgb;
import static at.sv.color.space.ColorSpaceUtils.orZero;

/**
 * The legacy <a href="https://www.w3.org/TR/css-color-4/#the-hwb-notation">HWB</a> space.
 */
final class HwbColorSpace extends ColorSpace {

    HwbColorSpace() {
        super("hwb", List.of(
                ColorChannel.HUE,
                LinearChannel.builder().name("whiteness").min(0).max(100).requiresPercent(true).build(),
                LinearChannel.builder().name("blackness").min(0).max(100).requiresPercent(true).build()));
    }

    @Override
    public boolean isBounded() {
        return true;
    }

    @Override
    public boolean isLegacy() {
        return true;
    }

    @Override
    public boolean isPolar() {
        return true;
    }

    @Override
    Color convert(ColorSpace dest, Double hue, Double whiteness, Double blackness, Double alpha,
                  MissingChannels missing) {
        // From https://www.w3.org/TR/css-color-4/#hwb-to-rgb
        double scaledHue = (orZero(hue) % 360) / 360;
        if (scaledHue < 0) {
            scaledHue += 1;
        }
        double scaledWhiteness = orZero(whiteness) / 100;
        double scaledBlackness = orZero(blackness) / 100;

        double sum = scaledWhiteness + scaledBlackness;
        if (sum > 1) {
            scaledWhiteness /= sum;
            scaledBlackness /= sum;
        }

        double factor = 1 - scaledWhiteness - scaledBlackness;
        double white = scaledWhiteness;
        return SRGB.convert(dest,
                hueToRgb(0, 1, scaledHue + 1.0 / 3) * factor + white,
                hueToRgb(0, 1, scaledHue) * factor + white,
                hueToRgb(0, 1, scaledHue - 1.0 / 3) * factor + white,
                alpha,
                MissingChannels.builder().missingHue(hue == null).build());
    }
}
