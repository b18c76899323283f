package at.sv.color.space;

import at.sv.color.Color;
import at.sv.color.LinearChannel;

import java.util.List;

import static at.sv.color.space.ColorSpaceUtils.srgbAndDisplayP3FromLinear;
import static at.sv.color.space.ColorSpaceUtils.srgbAndDisplayP3ToLinear;

/**
 * The legacy RGB color space: sRGB with channels scaled to [0, 255].
 */
final class RgbColorSpace extends ColorSpace {

    RgbColorSpace() {
        super("rgb", List.of(
                LinearChannel.builder().name("red").min(0).max(255).lowerClamped(true).upperClamped(true).build(),
                LinearChannel.builder().name("green").min(0).max(255).lowerClamped(true).upperClamped(true).build(),
                LinearChannel.builder().name("blue").min(0).max(255).lowerClamped(true).upperClamped(true).build()));
    }

    @Override
    public boolean isBounded() {
        return true;
    }

    @Override
    public boolean isLegacy() {
        return true;
    }

    @Override
    Color convert(ColorSpace dest, Double red, Double green, Double blue, Double alpha, MissingChannels missing) {
        return SRGB.convert(dest, scaleDown(red), scaleDown(green), scaleDown(blue), alpha, missing);
    }

    private static Double scaleDown(Double channel) {
        return channel == null ? null : channel / 255;
    }

    @Override
    protected double toLinear(double channel) {
        return srgbAndDisplayP3ToLinear(channel / 255);
    }

    @Override
    protected double fromLinear(double channel) {
        return srgbAndDisplayP3FromLinear(channel) * 255;
    }

    @Override
    protected double[] transformationMatrix(ColorSpace dest) {
        return SRGB.transformationMatrix(dest);
    }
}
