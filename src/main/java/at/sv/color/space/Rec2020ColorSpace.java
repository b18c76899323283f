package at.sv.color.space;

import static at.sv.color.space.ColorSpaceUtils.RGB_CHANNELS;
import static at.sv.color.space.ConversionMatrices.*;

final class Rec2020ColorSpace extends ColorSpace {

    private static final double ALPHA = 1.09929682680944;
    private static final double BETA = 0.018053968510807;

    Rec2020ColorSpace() {
        super("rec2020", RGB_CHANNELS);
    }

    @Override
    public boolean isBounded() {
        return true;
    }

    @Override
    protected double toLinear(double channel) {
        double abs = Math.abs(channel);
        return abs < BETA * 4.5
                ? channel / 4.5
                : Math.signum(channel) * Math.pow((abs + ALPHA - 1) / ALPHA, 1 / 0.45);
    }

    @Override
    protected double fromLinear(double channel) {
        double abs = Math.abs(channel);
        return abs > BETA
                ? Math.signum(channel) * (ALPHA * Math.pow(abs, 0.45) - (ALPHA - 1))
                : 4.5 * channel;
    }

    @Override
    protected double[] transformationMatrix(ColorSpace dest) {
        if (dest == SRGB_LINEAR || dest == SRGB || dest == RGB) {
            return LINEAR_REC2020_TO_LINEAR_SRGB;
        } else if (dest == A98_RGB) {
            return LINEAR_REC2020_TO_LINEAR_A98_RGB;
        } else if (dest == DISPLAY_P3) {
            return LINEAR_REC2020_TO_LINEAR_DISPLAY_P3;
        } else if (dest == PROPHOTO_RGB) {
            return LINEAR_REC2020_TO_LINEAR_PROPHOTO_RGB;
        } else if (dest == XYZ_D65) {
            return LINEAR_REC2020_TO_XYZ_D65;
        } else if (dest == XYZ_D50) {
            return LINEAR_REC2020_TO_XYZ_D50;
        } else if (dest == LMS) {
            return LINEAR_REC2020_TO_LMS;
        }
        return super.transformationMatrix(dest);
    }
}
