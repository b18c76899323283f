package at.sv.color.space;

import static at.sv.color.space.ColorSpaceUtils.RGB_CHANNELS;
import static at.sv.color.space.ConversionMatrices.*;

final class A98RgbColorSpace extends ColorSpace {

    private static final double GAMMA = 563.0 / 256;

    A98RgbColorSpace() {
        super("a98-rgb", RGB_CHANNELS);
    }

    @Override
    public boolean isBounded() {
        return true;
    }

    @Override
    protected double toLinear(double channel) {
        return Math.signum(channel) * Math.pow(Math.abs(channel), GAMMA);
    }

    @Override
    protected double fromLinear(double channel) {
        return Math.signum(channel) * Math.pow(Math.abs(channel), 1 / GAMMA);
    }

    @Override
    protected double[] transformationMatrix(ColorSpace dest) {
        if (dest == SRGB_LINEAR || dest == SRGB || dest == RGB) {
            return LINEAR_A98_RGB_TO_LINEAR_SRGB;
        } else if (dest == DISPLAY_P3) {
            return LINEAR_A98_RGB_TO_LINEAR_DISPLAY_P3;
        } else if (dest == PROPHOTO_RGB) {
            return LINEAR_A98_RGB_TO_LINEAR_PROPHOTO_RGB;
        } else if (dest == REC2020) {
            return LINEAR_A98_RGB_TO_LINEAR_REC2020;
        } else if (dest == XYZ_D65) {
            return LINEAR_A98_RGB_TO_XYZ_D65;
        } else if (dest == XYZ_D50) {
            return LINEAR_A98_RGB_TO_XYZ_D50;
        } else if (dest == LMS) {
            return LINEAR_A98_RGB_TO_LMS;
        }
        return super.transformationMatrix(dest);
    }
}
