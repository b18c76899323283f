package at.sv.color;

import at.sv.color.space.ColorSpace;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * The color space and, for polar spaces, the hue interpolation method used to mix two colors.
 */
@Getter
@EqualsAndHashCode
public final class InterpolationMethod {

    private static final List<ColorSpace> SUPPORTED_SPACES = List.of(ColorSpace.SRGB, ColorSpace.SRGB_LINEAR,
            ColorSpace.LAB, ColorSpace.OKLAB, ColorSpace.XYZ_D50, ColorSpace.XYZ_D65, ColorSpace.HSL, ColorSpace.HWB,
            ColorSpace.LCH, ColorSpace.OKLCH);

    private final ColorSpace space;
    /**
     * Non-null if and only if {@link #space} is polar.
     */
    private final @Nullable HueInterpolationMethod hue;

    public InterpolationMethod(ColorSpace space, @Nullable HueInterpolationMethod hue) {
        if (!SUPPORTED_SPACES.contains(space)) {
            throw new IllegalArgumentException("Colors can't be interpolated in " + space + ".");
        }
        if (space.isPolar()) {
            this.hue = hue == null ? HueInterpolationMethod.SHORTER : hue;
        } else if (hue != null) {
            throw new IllegalArgumentException("Hue interpolation method \"" + hue.getName()
                                               + "\" may not be set for rectangular color space " + space + ".");
        } else {
            this.hue = null;
        }
        this.space = space;
    }

    public InterpolationMethod(ColorSpace space) {
        this(space, null);
    }

    /**
     * Parses a CSS color interpolation method without the leading {@code in}, e.g. {@code oklch longer hue}.
     *
     * @throws IllegalArgumentException if the text is malformed
     * @throws UnknownColorSpaceException if the space is unknown
     */
    public static InterpolationMethod parse(String text) {
        String[] parts = text.trim().toLowerCase(Locale.ROOT).split("\\s+");
        if (parts.length == 0 || parts[0].isEmpty()) {
            throw new IllegalArgumentException("Expected a color interpolation method, got: \"" + text + "\"");
        }
        ColorSpace space = ColorSpace.fromName(parts[0]);
        if (parts.length == 1) {
            return new InterpolationMethod(space);
        }
        if (parts.length != 3 || !parts[2].equals("hue")) {
            throw new IllegalArgumentException("Expected \"<space> [<method> hue]\", got: \"" + text + "\"");
        }
        return new InterpolationMethod(space, HueInterpolationMethod.fromName(parts[1]));
    }

    @Override
    public String toString() {
        return hue == null ? space.getName() : space.getName() + " " + hue.getName() + " hue";
    }
}
