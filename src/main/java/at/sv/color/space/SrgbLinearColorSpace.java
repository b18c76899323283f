package at.sv.color.space;

import at.sv.color.Color;

import static at.sv.color.space.ColorSpaceUtils.RGB_CHANNELS;
import static at.sv.color.space.ColorSpaceUtils.srgbAndDisplayP3FromLinear;
import static at.sv.color.space.ConversionMatrices.*;

final class SrgbLinearColorSpace extends ColorSpace {

    SrgbLinearColorSpace() {
        super("srgb-linear", RGB_CHANNELS);
    }

    @Override
    public boolean isBounded() {
        return true;
    }

    @Override
    Color convert(ColorSpace dest, Double red, Double green, Double blue, Double alpha, MissingChannels missing) {
        if (dest == RGB || dest == HSL || dest == HWB || dest == SRGB) {
            return SRGB.convert(dest, gammaEncode(red), gammaEncode(green), gammaEncode(blue), alpha, missing);
        }
        return convertLinear(dest, red, green, blue, alpha, missing);
    }

    private static Double gammaEncode(Double channel) {
        return channel == null ? null : srgbAndDisplayP3FromLinear(channel);
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
        return SRGB.transformationMatrix(dest);
    }
}
