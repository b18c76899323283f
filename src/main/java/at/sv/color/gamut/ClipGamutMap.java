package at.sv.color.gamut;

import at.sv.color.Color;
import at.sv.color.ColorChannel;
import at.sv.color.LinearChannel;
import at.sv.color.space.ColorSpace;

final class ClipGamutMap extends GamutMapMethod {

    ClipGamutMap() {
        super("clip");
    }

    @Override
    public Color map(Color color) {
        ColorSpace space = color.getSpace();
        return Color.forSpace(space,
                clampChannel(space.getChannels().get(0), color.getChannel0OrNull()),
                clampChannel(space.getChannels().get(1), color.getChannel1OrNull()),
                clampChannel(space.getChannels().get(2), color.getChannel2OrNull()),
                color.getAlphaOrNull());
    }

    private static Double clampChannel(ColorChannel channel, Double value) {
        if (value == null || !(channel instanceof LinearChannel linear)) {
            return value;
        }
        return linear.clamp(value);
    }
}
