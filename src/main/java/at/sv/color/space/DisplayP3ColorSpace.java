package at.sv.color.space;

import static at.sv.color.space.ColorSpaceUtils.RGB_CHANNELS;
import static at.sv.color.space.ColorSpaceUtils.srgbAndDisplayP3FromLinear;
import static at.sv.color.space.ColorSpaceUtils.srgbAndDisplayP3ToLinear;
import static at.sv.color.space.ConversionMatrices.*;

/**
 * Uses the sRGB transfer curve with the wider P3 primaries.
 */
final class DisplayP3ColorSpace extends ColorSpace {

    DisplayP3ColorSpace() {
        super("display-p3", RGB_CHANNELS);
    }

    @Override
    public boolean isBounded() {
        return true;
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
        if (dest == SRGB_LINEAR || dest == SRGB || dest == RGB) {
            return LINEAR_DISPLAY_P3_TO_LINEAR_SRGB;
        } else if (dest == A98_RGB) {
            return LINEAR_DISPLAY_P3_TO_LINEAR_A98_RGB;
        } else if (dest == PROPHOTO_RGB) {
            return LINEAR_DISPLAY_P3_TO_LINEAR_PROPHOTO_RGB;
        } else if (dest == REC2020) {
            return LINEAR_DISPLAY_P3_TO_LINEAR_REC2020;
        } else if (dest == XYZ_D65) {
            return LINEAR_DISPLAY_P3_TO_XYZ_D65;
        } else if (dest == XYZ_D50) {
            return LINEAR_DISPLAY_P3_TO_XYZ_D50;
        } else if (dest == LMS) {
            return LINEAR_DISPLAY_P3_TO_LMS;
        }
        return super.transformationMatrix(dest);
    }
}
