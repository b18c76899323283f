package at.sv.color.space;

import static at.sv.color.space.ColorSpaceUtils.XYZ_CHANNELS;
import static at.sv.color.space.ConversionMatrices.*;

final class XyzD65ColorSpace extends ColorSpace {

    XyzD65ColorSpace() {
        super("xyz-d65", XYZ_CHANNELS);
    }

    @Override
    public boolean isBounded() {
        return false;
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
            return XYZ_D65_TO_LINEAR_SRGB;
        } else if (dest == A98_RGB) {
            return XYZ_D65_TO_LINEAR_A98_RGB;
        } else if (dest == PROPHOTO_RGB) {
            return XYZ_D65_TO_LINEAR_PROPHOTO_RGB;
        } else if (dest == DISPLAY_P3) {
            return XYZ_D65_TO_LINEAR_DISPLAY_P3;
        } else if (dest == REC2020) {
            return XYZ_D65_TO_LINEAR_REC2020;
        } else if (dest == XYZ_D50) {
            return XYZ_D65_TO_XYZ_D50;
        } else if (dest == LMS) {
            return XYZ_D65_TO_LMS;
        }
        return super.transformationMatrix(dest);
    }
}
