package at.sv.color.space;

import at.sv.color.Color;
import at.sv.color.ColorChannel;
import at.sv.color.LinearChannel;

import java.util.List;

import static at.sv.color.space.ColorSpaceUtils.orZero;

/**
 * The polar form of {@link ColorSpace#OKLAB}.
 */
final class OklchColorSpace extends ColorSpace {

    OklchColorSpace() {
        super("oklch", List.of(
                LinearChannel.builder().name("lightness").min(0).max(1)
                             .lowerClamped(true).upperClamped(true).conventionallyPercent(true).build(),
                LinearChannel.builder().name("chroma").min(0).max(0.4).lowerClamped(true).build(),
                ColorChannel.HUE));
    }

    @Override
    public boolean isBounded() {
        return false;
    }

    @Override
    public boolean isPolar() {
        return true;
    }

    @Override
    Color convert(ColorSpace dest, Double lightness, Double chroma, Double hue, Double alpha,
                  MissingChannels missing) {
        double hueRadians = Math.toRadians(orZero(hue));
        return OKLAB.convert(dest,
                lightness,
                orZero(chroma) * Math.cos(hueRadians),
                orZero(chroma) * Math.sin(hueRadians),
                alpha,
                MissingChannels.builder()
                               .missingLightness(lightness == null)
                               .missingChroma(chroma == null)
                               .missingHue(hue == null)
                               .build());
    }
}
