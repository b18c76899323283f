package at.sv.color;

import at.sv.color.space.ColorSpace;
import lombok.Getter;

/**
 * Signals that a channel was requested by a name the color space doesn't have.
 */
@Getter
public final class ChannelNotFoundException extends ColorException {

    private final String channel;
    private final ColorSpace space;

    public ChannelNotFoundException(String channel, ColorSpace space) {
        super("Color space " + space + " doesn't have a channel with name \"" + channel + "\".");
        this.channel = channel;
        this.space = space;
    }
}
