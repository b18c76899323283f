package at.sv.color.space;

import at.sv.color.Color;

import static at.sv.color.space.ColorSpaceUtils.LAB_EPSILON;
import static at.sv.color.space.ColorSpaceUtils.LAB_KAPPA;
import static at.sv.color.space.ColorSpaceUtils.XYZ_CHANNELS;
import static at.sv.color.space.ColorSpaceUtils.labToLch;
import static at.sv.color.space.ColorSpaceUtils.orZero;
import static at.sv.color.space.ConversionMatrices.*;

/**
 * CIE XYZ relative to the D50 white point. This is the hub for Lab and LCH.
 */
final class XyzD50ColorSpace extends ColorSpace {

    XyzD50ColorSpace() {
        super("xyz-d50", XYZ_CHANNELS);
    }

    @Override
    public boolean isBounded() {
        return false;
    }

    @Override
    Color convert(ColorSpace dest, Double x, Double y, Double z, Double alpha, MissingChannels missing) {
        if (dest != LAB && dest != LCH) {
            return convertLinear(dest, x, y, z, alpha, missing);
        }
        // https://www.w3.org/TR/css-color-4/#color-conversion-code and
        // http://www.brucelindbloom.com/index.html?Eqn_RGB_XYZ_Matrix.html
        double f0 = labF(orZero(x) / D50[0]);
        double f1 = labF(orZero(y) / D50[1]);
        double f2 = labF(orZero(z) / D50[2]);

        Double lightness = missing.isMissingLightness() ? null : 116 * f1 - 16;
        Double a = missing.isMissingA() ? null : 500 * (f0 - f1);
        Double b = missing.isMissingB() ? null : 200 * (f1 - f2);

        if (dest == LAB) {
            return Color.lab(lightness, a, b, alpha);
        }
        return labToLch(LCH, lightness, a, b, alpha, missing);
    }

    private static double labF(double component) {
        return component > LAB_EPSILON ? Math.cbrt(component) : (LAB_KAPPA * component + 16) / 116;
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
            return XYZ_D50_TO_LINEAR_SRGB;
        } else if (dest == A98_RGB) {
            return XYZ_D50_TO_LINEAR_A98_RGB;
        } else if (dest == PROPHOTO_RGB) {
            return XYZ_D50_TO_LINEAR_PROPHOTO_RGB;
        } else if (dest == DISPLAY_P3) {
            return XYZ_D50_TO_LINEAR_DISPLAY_P3;
        } else if (dest == REC2020) {
            return XYZ_D50_TO_LINEAR_REC2020;
        } else if (dest == XYZ_D65) {
            return XYZ_D50_TO_XYZ_D65;
        } else if (dest == LMS) {
            return XYZ_D50_TO_LMS;
        }
        return super.transformationMatrix(dest);
    }
}
