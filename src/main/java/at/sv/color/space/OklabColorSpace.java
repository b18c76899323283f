package at.sv.color.space;

import at.sv.color.Color;
import at.sv.color.LinearChannel;

import java.util.List;

import static at.sv.color.space.ColorSpaceUtils.labToLch;
import static at.sv.color.space.ColorSpaceUtils.orZero;
import static at.sv.color.space.ConversionMatrices.OKLAB_TO_LMS;

/**
 * <a href="https://bottosson.github.io/posts/oklab/">Oklab</a>, reached through {@link ColorSpace#LMS}.
 */
final class OklabColorSpace extends ColorSpace {

    OklabColorSpace() {
        super("oklab", List.of(
                LinearChannel.builder().name("lightness").min(0).max(1)
                             .lowerClamped(true).upperClamped(true).conventionallyPercent(true).build(),
                LinearChannel.of("a", -0.4, 0.4),
                LinearChannel.of("b", -0.4, 0.4)));
    }

    @Override
    public boolean isBounded() {
        return false;
    }

    @Override
    Color convert(ColorSpace dest, Double lightness, Double a, Double b, Double alpha, MissingChannels missing) {
        if (dest == OKLCH) {
            return labToLch(dest, lightness, a, b, alpha, missing);
        } else if (dest == OKLAB) {
            return Color.oklab(missing.isMissingLightness() ? null : lightness,
                    missing.isMissingA() ? null : a,
                    missing.isMissingB() ? null : b,
                    alpha);
        }

        MissingChannels forwarded = missing.toBuilder()
                                           .missingLightness(missing.isMissingLightness() || lightness == null)
                                           .missingA(missing.isMissingA() || a == null)
                                           .missingB(missing.isMissingB() || b == null)
                                           .build();
        double l = orZero(lightness);
        double aValue = orZero(a);
        double bValue = orZero(b);
        return LMS.convert(dest,
                cube(OKLAB_TO_LMS[0] * l + OKLAB_TO_LMS[1] * aValue + OKLAB_TO_LMS[2] * bValue),
                cube(OKLAB_TO_LMS[3] * l + OKLAB_TO_LMS[4] * aValue + OKLAB_TO_LMS[5] * bValue),
                cube(OKLAB_TO_LMS[6] * l + OKLAB_TO_LMS[7] * aValue + OKLAB_TO_LMS[8] * bValue),
                alpha,
                forwarded);
    }

    private static double cube(double value) {
        return value * value * value;
    }
}
