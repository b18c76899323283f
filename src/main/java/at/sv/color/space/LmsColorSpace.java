package at.sv.color.space;

import at.sv.color.Color;
import at.sv.color.LinearChannel;

import java.util.List;

import static at.sv.color.space.ColorSpaceUtils.labToLch;
import static at.sv.color.space.ColorSpaceUtils.orZero;
import static at.sv.color.space.ConversionMatrices.*;

/**
 * The cone-response space Oklab is defined on top of.
 */
final class LmsColorSpace extends ColorSpace {

    LmsColorSpace() {
        super("lms", List.of(
                LinearChannel.of("long", 0, 1),
                LinearChannel.of("medium", 0, 1),
                LinearChannel.of("short", 0, 1)));
    }

    @Override
    public boolean isBounded() {
        return false;
    }

    @Override
    Color convert(ColorSpace dest, Double longChannel, Double mediumChannel, Double shortChannel, Double alpha,
                  MissingChannels missing) {
        if (dest != OKLAB && dest != OKLCH) {
            return convertLinear(dest, longChannel, mediumChannel, shortChannel, alpha, missing);
        }
        // Algorithm from https://drafts.csswg.org/css-color-4/#color-conversion-code
        double longScaled = Math.cbrt(orZero(longChannel));
        double mediumScaled = Math.cbrt(orZero(mediumChannel));
        double shortScaled = Math.cbrt(orZero(shortChannel));
        double[] lab = ColorSpaceUtils.multiply(LMS_TO_OKLAB, longScaled, mediumScaled, shortScaled);

        Double lightness = missing.isMissingLightness() ? null : lab[0];
        Double a = missing.isMissingA() ? null : lab[1];
        Double b = missing.isMissingB() ? null : lab[2];
        if (dest == OKLAB) {
            return Color.oklab(lightness, a, b, alpha);
        }
        return labToLch(OKLCH, lightness, a, b, alpha, missing);
    }

    @Override
    protected double toLinear(double channel) {
        return channel;
    }

    @Override
    protected double fromLinear(double channel) {
        return channel;
    }

    @Override
    protected double[] transformationMatrix(ColorSpace dest) {
        if (dest == SRGB_LINEAR || dest == SRGB || dest == RGB) {
            return LMS_TO_LINEAR_SRGB;
        } else if (dest == A98_RGB) {
            return LMS_TO_LINEAR_A98_RGB;
        } else if (dest == PROPHOTO_RGB) {
            return LMS_TO_LINEAR_PROPHOTO_RGB;
        } else if (dest == DISPLAY_P3) {
            return LMS_TO_LINEAR_DISPLAY_P3;
        } else if (dest == REC2020) {
            return LMS_TO_LINEAR_REC2020;
        } else if (dest == XYZ_D65) {
            return LMS_TO_XYZ_D65;
        } else if (dest == XYZ_D50) {
            return LMS_TO_XYZ_D50;
        }
        return super.transformationMatrix(dest);
    }
}
