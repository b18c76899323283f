package at.sv.color;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

/**
 * Metadata about a single channel of a color space.
 */
@Getter
@EqualsAndHashCode
public class ColorChannel {

    /**
     * The alpha channel that is shared across all colors.
     */
    public static final LinearChannel ALPHA = LinearChannel.of("alpha", 0, 1);

    /**
     * The hue channel shared across all polar color spaces.
     */
    public static final ColorChannel HUE = new ColorChannel("hue", true);

    private final String name;
    /**
     * Whether this channel is an angle in degrees around a circle. True if and only if this is not a
     * {@link LinearChannel}.
     */
    private final boolean polarAngle;

    protected ColorChannel(String name, boolean polarAngle) {
        this.name = name;
        this.polarAngle = polarAngle;
    }

    /**
     * The unit conventionally associated with this channel, or null if values are unitless.
     */
    public @Nullable String getAssociatedUnit() {
        return polarAngle ? "deg" : null;
    }

    /**
     * Returns whether this channel is <a href="https://www.w3.org/TR/css-color-4/#interpolation-missing">analogous</a>
     * to the given channel.
     */
    public boolean isAnalogous(ColorChannel other) {
        switch (name) {
            case "red":
            case "x":
                return other.name.equals("red") || other.name.equals("x");
            case "green":
            case "y":
                return other.name.equals("green") || other.name.equals("y");
            case "blue":
            case "z":
                return other.name.equals("blue") || other.name.equals("z");
            case "chroma":
            case "saturation":
                return other.name.equals("chroma") || other.name.equals("saturation");
            case "lightness":
            case "hue":
                return other.name.equals(name);
            default:
                return false;
        }
    }

    @Override
    public String toString() {
        return name;
    }
}
