package at.sv.color.space;

import at.sv.color.Color;

import static at.sv.color.FuzzyMath.fuzzyEquals;
import static at.sv.color.FuzzyMath.fuzzyGreaterThanOrEquals;
import static at.sv.color.FuzzyMath.normalizeHue;
import static at.sv.color.space.ColorSpaceUtils.RGB_CHANNELS;
import static at.sv.color.space.ColorSpaceUtils.orZero;
import static at.sv.color.space.ColorSpaceUtils.srgbAndDisplayP3FromLinear;
import static at.sv.color.space.ColorSpaceUtils.srgbAndDisplayP3ToLinear;
import static at.sv.color.space.ConversionMatrices.*;

final class SrgbColorSpace extends ColorSpace {

    SrgbColorSpace() {
        super("srgb", RGB_CHANNELS);
    }

    @Override
    public boolean isBounded() {
        return true;
    }

    @Override
    Color convert(ColorSpace dest, Double red, Double green, Double blue, Double alpha, MissingChannels missing) {
        if (dest == HSL || dest == HWB) {
            return toHslOrHwb(dest, orZero(red), orZero(green), orZero(blue), alpha, missing);
        } else if (dest == RGB) {
            return Color.rgb(scaleUp(red), scaleUp(green), scaleUp(blue), alpha);
        } else if (dest == SRGB_LINEAR) {
            return Color.forSpace(dest, linearize(red), linearize(green), linearize(blue), alpha);
        }
        return convertLinear(dest, red, green, blue, alpha, missing);
    }

    /**
     * See <a href="https://drafts.csswg.org/css-color-4/#rgb-to-hsl">rgb to hsl</a>
     */
    private static Color toHslOrHwb(ColorSpace dest, double red, double green, double blue, Double alpha,
                                    MissingChannels missing) {
        double max = Math.max(Math.max(red, green), blue);
        double min = Math.min(Math.min(red, green), blue);
        double delta = max - min;

        double hue;
        if (max == min) {
            hue = 0;
        } else if (max == red) {
            hue = 60 * (green - blue) / delta + 360;
        } else if (max == green) {
            hue = 60 * (blue - red) / delta + 120;
        } else {
            hue = 60 * (red - green) / delta + 240;
        }

        if (dest == HSL) {
            double lightness = (min + max) / 2;
            double saturation = lightness == 0 || lightness == 1
                    ? 0.0
                    : 100 * (max - lightness) / Math.min(lightness, 1 - lightness);
            if (saturation < 0) {
                hue += 180;
                saturation = Math.abs(saturation);
            }
            return Color.hsl(
                    missing.isMissingHue() || fuzzyEquals(saturation, 0) ? null : normalizeHue(hue),
                    missing.isMissingChroma() ? null : saturation,
                    missing.isMissingLightness() ? null : lightness * 100,
                    alpha);
        }

        double whiteness = min * 100;
        double blackness = 100 - max * 100;
        return Color.hwb(
                missing.isMissingHue() || fuzzyGreaterThanOrEquals(whiteness + blackness, 100) ? null : normalizeHue(hue),
                whiteness,
                blackness,
                alpha);
    }

    private static Double scaleUp(Double channel) {
        return channel == null ? null : channel * 255;
    }

    private static Double linearize(Double channel) {
        return channel == null ? null : srgbAndDisplayP3ToLinear(channel);
    }

    @Override
    protected double toLinear(double channel) {
        return srgbAndDisplayP3ToLinear(channel);
    }

    @Override
    protected double fromLinear(double channel) {
        return srgbAndDisplayP3FromLinear(channel);
    }

    @Override
    protected double[] transformationMatrix(ColorSpace dest) {
        if (dest == DISPLAY_P3) {
            return LINEAR_SRGB_TO_LINEAR_DISPLAY_P3;
        } else if (dest == A98_RGB) {
            return LINEAR_SRGB_TO_LINEAR_A98_RGB;
        } else if (dest == PROPHOTO_RGB) {
            return LINEAR_SRGB_TO_LINEAR_PROPHOTO_RGB;
        } else if (dest == REC2020) {
            return LINEAR_SRGB_TO_LINEAR_REC2020;
        } else if (dest == XYZ_D65) {
            return LINEAR_SRGB_TO_XYZ_D65;
        } else if (dest == XYZ_D50) {
            return LINEAR_SRGB_TO_XYZ_D50;
        } else if (dest == LMS) {
            return LINEAR_SRGB_TO_LMS;
        }
        return super.transformationMatrix(dest);
    }
}
