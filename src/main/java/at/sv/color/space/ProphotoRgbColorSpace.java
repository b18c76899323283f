package at.sv.color.space;

import static at.sv.color.space.ColorSpaceUtils.RGB_CHANNELS;
import static at.sv.color.space.ConversionMatrices.*;

/**
 * ProPhoto RGB, a D50-based space with a gamma 1.8 curve and a linear segment near black.
 */
final class ProphotoRgbColorSpace extends ColorSpace {

    ProphotoRgbColorSpace() {
        super("prophoto-rgb", RGB_CHANNELS);
    }

    @Override
    public boolean isBounded() {
        return true;
    }

    @Override
    protected double toLinear(double channel) {
        double abs = Math.abs(channel);
        return abs <= 16.0 / 512 ? channel / 16 : Math.signum(channel) * Math.pow(abs, 1.8);
    }

    @Override
    protected double fromLinear(double channel) {
        double abs = Math.abs(channel);
        return abs >= 1.0 / 512 ? Math.signum(channel) * Math.pow(abs, 1 / 1.8) : 16 * channel;
    }

    @Override
    protected double[] transformationMatrix(ColorSpace dest) {
        if (dest == SRGB_LINEAR || dest == SRGB || dest == RGB) {
            return LINEAR_PROPHOTO_RGB_TO_LINEAR_SRGB;
        } else if (dest == A98_RGB) {
            return LINEAR_PROPHOTO_RGB_TO_LINEAR_A98_RGB;
        } else if (dest == DISPLAY_P3) {
            return LINEAR_PROPHOTO_RGB_TO_LINEAR_DISPLAY_P3;
        } else if (dest == REC2020) {
            return LINEAR_PROPHOTO_RGB_TO_LINEAR_REC2020;
        } else if (dest == XYZ_D65) {
            return LINEAR_PROPHOTO_RGB_TO_XYZ_D65;
        } else if (dest == XYZ_D50) {
            return LINEAR_PROPHOTO_RGB_TO_XYZ_D50;
        } else if (dest == LMS) {
            return LINEAR_PROPHOTO_RGB_TO_LMS;
        }
        return super.transformationMatrix(dest);
    }
}
