package at.sv.color.space;

import at.sv.color.Color;
import at.sv.color.ColorChannel;
import at.sv.color.LinearChannel;

import java.util.List;

import static at.sv.color.space.ColorSpaceUtils.hueToRgb;
import static at.sv.color.space.ColorSpaceUtils.orZero;

/**
 * The legacy <a href="https://www.w3.org/TR/css-color-4/#the-hsl-notation">HSL</a> space.
 */
final class HslColorSpace extends ColorSpace {

    HslColorSpace() {
        super("hsl", List.of(
                ColorChannel.HUE,
                LinearChannel.builder().name("saturation").min(0).max(100)
                             .requiresPercent(true).lowerClamped(true).build(),
                LinearChannel.builder().name("lightness").min(0).max(100)
                             .requiresPercent(true).lowerClamped(true).upperClamped(true).build()));
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
    Color convert(ColorSpace dest, Double hue, Double saturation, Double lightness, Double alpha,
                  MissingChannels missing) {
        // See http://www.w3.org/TR/css3-color/#hsl-color
        double scaledHue = (orZero(hue) / 360) % 1;
        if (scaledHue < 0) {
            scaledHue += 1;
        }
        double scaledSaturation = orZero(saturation) / 100;
        double scaledLightness = orZero(lightness) / 100;

        double m2 = scaledLightness <= 0.5
                ? scaledLightness * (scaledSaturation + 1)
                : scaledLightness + scaledSaturation - scaledLightness * scaledSaturation;
        double m1 = scaledLightness * 2 - m2;

        return SRGB.convert(dest,
                hueToRgb(m1, m2, scaledHue + 1.0 / 3),
                hueToRgb(m1, m2, scaledHue),
                hueToRgb(m1, m2, scaledHue - 1.0 / 3),
                alpha,
                MissingChannels.builder()
                               .missingLightness(lightness == null)
                               .missingChroma(saturation == null)
                               .missingHue(hue == null)
                               .build());
    }
}
