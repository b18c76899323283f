package at.sv.color;

import at.sv.color.gamut.GamutMapMethod;
import at.sv.color.space.ColorSpace;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static at.sv.color.FuzzyMath.fuzzyEquals;
import static at.sv.color.FuzzyMath.fuzzyEqualsNullable;
import static at.sv.color.FuzzyMath.fuzzyGreaterThanOrEquals;
import static at.sv.color.FuzzyMath.fuzzyHashCode;
import static at.sv.color.FuzzyMath.fuzzyInRange;

/**
 * An immutable color value in one of the known {@link ColorSpace color spaces}.
 * <p>
 * Each of the three channels and the alpha value may be missing (the CSS {@code none} keyword), which is represented
 * by {@code null} and is distinct from zero. Every operation returns a new color.
 */
public final class Color {

    @Getter
    private final ColorSpace space;
    private final @Nullable Double channel0;
    private final @Nullable Double channel1;
    private final @Nullable Double channel2;
    private final @Nullable Double alpha;

    private Color(ColorSpace space, Double channel0, Double channel1, Double channel2, Double alpha) {
        this.space = space;
        if (space.isStrictlyBounded()) {
            this.channel0 = clampIfLinear(space, 0, channel0);
            this.channel1 = clampIfLinear(space, 1, channel1);
            this.channel2 = clampIfLinear(space, 2, channel2);
        } else if (space.isLegacy() && space.isPolar()) {
            this.channel0 = channel0 == null ? null : FuzzyMath.normalizeHue(channel0);
            this.channel1 = channel1;
            this.channel2 = channel2;
        } else {
            this.channel0 = channel0;
            this.channel1 = channel1;
            this.channel2 = channel2;
        }
        this.alpha = alpha;
    }

    private static Double clampIfLinear(ColorSpace space, int index, Double value) {
        if (value != null && space.getChannels().get(index) instanceof LinearChannel linear) {
            return linear.clamp(value);
        }
        return value;
    }

    /**
     * Creates a color in the given space. Null channels and a null alpha are missing.
     */
    public static Color forSpace(ColorSpace space, Double channel0, Double channel1, Double channel2, Double alpha) {
        return new Color(space, channel0, channel1, channel2, alpha);
    }

    public static Color forSpace(ColorSpace space, Double channel0, Double channel1, Double channel2) {
        return forSpace(space, channel0, channel1, channel2, 1.0);
    }

    /**
     * A legacy RGB color with channels in [0, 255].
     */
    public static Color rgb(Double red, Double green, Double blue, Double alpha) {
        return forSpace(ColorSpace.RGB, red, green, blue, alpha);
    }

    public static Color rgb(Double red, Double green, Double blue) {
        return rgb(red, green, blue, 1.0);
    }

    /**
     * A legacy HSL color. Saturation and lightness are percentages in [0, 100].
     */
    public static Color hsl(Double hue, Double saturation, Double lightness, Double alpha) {
        return forSpace(ColorSpace.HSL, hue, saturation, lightness, alpha);
    }

    public static Color hsl(Double hue, Double saturation, Double lightness) {
        return hsl(hue, saturation, lightness, 1.0);
    }

    public static Color hwb(Double hue, Double whiteness, Double blackness, Double alpha) {
        return forSpace(ColorSpace.HWB, hue, whiteness, blackness, alpha);
    }

    public static Color hwb(Double hue, Double whiteness, Double blackness) {
        return hwb(hue, whiteness, blackness, 1.0);
    }

    public static Color srgb(Double red, Double green, Double blue) {
        return forSpace(ColorSpace.SRGB, red, green, blue, 1.0);
    }

    public static Color lab(Double lightness, Double a, Double b, Double alpha) {
        return forSpace(ColorSpace.LAB, lightness, a, b, alpha);
    }

    public static Color lab(Double lightness, Double a, Double b) {
        return lab(lightness, a, b, 1.0);
    }

    public static Color lch(Double lightness, Double chroma, Double hue, Double alpha) {
        return forSpace(ColorSpace.LCH, lightness, chroma, hue, alpha);
    }

    public static Color lch(Double lightness, Double chroma, Double hue) {
        return lch(lightness, chroma, hue, 1.0);
    }

    public static Color oklab(Double lightness, Double a, Double b, Double alpha) {
        return forSpace(ColorSpace.OKLAB, lightness, a, b, alpha);
    }

    public static Color oklab(Double lightness, Double a, Double b) {
        return oklab(lightness, a, b, 1.0);
    }

    public static Color oklch(Double lightness, Double chroma, Double hue, Double alpha) {
        return forSpace(ColorSpace.OKLCH, lightness, chroma, hue, alpha);
    }

    public static Color oklch(Double lightness, Double chroma, Double hue) {
        return oklch(lightness, chroma, hue, 1.0);
    }

    public boolean isLegacy() {
        return space.isLegacy();
    }

    /**
     * The value of the first channel, or 0 if it's missing.
     */
    public double getChannel0() {
        return channel0 == null ? 0 : channel0;
    }

    public double getChannel1() {
        return channel1 == null ? 0 : channel1;
    }

    public double getChannel2() {
        return channel2 == null ? 0 : channel2;
    }

    public @Nullable Double getChannel0OrNull() {
        return channel0;
    }

    public @Nullable Double getChannel1OrNull() {
        return channel1;
    }

    public @Nullable Double getChannel2OrNull() {
        return channel2;
    }

    public boolean isChannel0Missing() {
        return channel0 == null;
    }

    public boolean isChannel1Missing() {
        return channel1 == null;
    }

    public boolean isChannel2Missing() {
        return channel2 == null;
    }

    /**
     * The alpha value, or 0 if it's missing.
     */
    public double getAlpha() {
        return alpha == null ? 0 : alpha;
    }

    public @Nullable Double getAlphaOrNull() {
        return alpha;
    }

    public boolean isAlphaMissing() {
        return alpha == null;
    }

    /**
     * The three channel values in channel order, with missing channels as 0.
     */
    public List<Double> getChannels() {
        return List.of(getChannel0(), getChannel1(), getChannel2());
    }

    /**
     * The three channel values in channel order, with missing channels as null.
     */
    public List<Double> getChannelsOrNull() {
        return Collections.unmodifiableList(Arrays.asList(channel0, channel1, channel2));
    }

    /**
     * Returns the value of the channel with the given name, or 0 if it's missing. {@code alpha} is accepted as well.
     *
     * @throws ChannelNotFoundException if this color's space has no such channel
     */
    public double channel(String channelName) {
        Double value = channelOrNull(channelName);
        return value == null ? 0 : value;
    }

    /**
     * Returns the value of the named channel after converting this color to {@code space}.
     */
    public double channel(String channelName, ColorSpace space) {
        return toSpace(space).channel(channelName);
    }

    public boolean isChannelMissing(String channelName) {
        return channelOrNull(channelName) == null;
    }

    private Double channelOrNull(String channelName) {
        if ("alpha".equals(channelName)) {
            return alpha;
        }
        return switch (indexOf(channelName)) {
            case 0 -> channel0;
            case 1 -> channel1;
            default -> channel2;
        };
    }

    private int indexOf(String channelName) {
        int index = space.indexOfChannel(channelName);
        if (index < 0) {
            throw new ChannelNotFoundException(channelName, space);
        }
        return index;
    }

    /**
     * Returns the channel metadata for the given name, including {@code alpha}.
     */
    public Optional<ColorChannel> findChannel(String channelName) {
        if ("alpha".equals(channelName)) {
            return Optional.of(ColorChannel.ALPHA);
        }
        return space.getChannels().stream()
                    .filter(channel -> channel.getName().equals(channelName))
                    .findFirst();
    }

    /**
     * Returns whether the named channel is
     * <a href="https://www.w3.org/TR/css-color-4/#powerless">powerless</a>, i.e. changing it wouldn't change how the
     * color is displayed.
     *
     * @throws ChannelNotFoundException if this color's space has no such channel
     */
    public boolean isChannelPowerless(String channelName) {
        if ("alpha".equals(channelName)) {
            return false;
        }
        int index = indexOf(channelName);
        if (space == ColorSpace.HSL) {
            return index == 0 && fuzzyEquals(getChannel1(), 0);
        } else if (space == ColorSpace.HWB) {
            return index == 0 && fuzzyGreaterThanOrEquals(getChannel1() + getChannel2(), 100);
        } else if (space == ColorSpace.LCH || space == ColorSpace.OKLCH) {
            return index == 2 && fuzzyEquals(getChannel1(), 0);
        }
        return false;
    }

    public boolean isChannelPowerless(String channelName, ColorSpace space) {
        return toSpace(space).isChannelPowerless(channelName);
    }

    /**
     * Converts this color to {@code dest}. Returns this color if it already is in that space.
     */
    public Color toSpace(ColorSpace dest) {
        if (space == dest) {
            return this;
        }
        return space.convert(dest, channel0, channel1, channel2, alpha);
    }

    /**
     * Whether every linear channel is within its bounds. Colors in unbounded spaces are always in gamut.
     */
    public boolean isInGamut() {
        if (!space.isBounded()) {
            return true;
        }
        List<ColorChannel> channels = space.getChannels();
        return isChannelInGamut(channels.get(0), getChannel0())
               && isChannelInGamut(channels.get(1), getChannel1())
               && isChannelInGamut(channels.get(2), getChannel2());
    }

    private static boolean isChannelInGamut(ColorChannel channel, double value) {
        if (channel instanceof LinearChannel linear) {
            return fuzzyInRange(value, linear.getMin(), linear.getMax());
        }
        return true;
    }

    /**
     * Maps this color into its space's gamut using {@link GamutMapMethod#LOCAL_MINDE}.
     */
    public Color toGamut() {
        return toGamut(GamutMapMethod.LOCAL_MINDE);
    }

    public Color toGamut(GamutMapMethod method) {
        return isInGamut() ? this : method.map(this);
    }

    /**
     * Maps this color into the gamut of {@code space} and returns the result in this color's space.
     */
    public Color toGamut(GamutMapMethod method, ColorSpace space) {
        return toSpace(space).toGamut(method).toSpace(this.space);
    }

    /**
     * Returns a copy with the given channels replaced. A null value marks the channel missing, {@code alpha} is
     * accepted as a channel name.
     *
     * @throws ChannelNotFoundException if a name isn't a channel of this color's space
     */
    public Color changeChannels(Map<String, Double> newValues) {
        Double[] channels = {channel0, channel1, channel2};
        Double newAlpha = alpha;
        for (Map.Entry<String, Double> entry : newValues.entrySet()) {
            if ("alpha".equals(entry.getKey())) {
                newAlpha = entry.getValue();
            } else {
                channels[indexOf(entry.getKey())] = entry.getValue();
            }
        }
        return new Color(space, channels[0], channels[1], channels[2], newAlpha);
    }

    public Color changeAlpha(Double newAlpha) {
        return new Color(space, channel0, channel1, channel2, newAlpha);
    }

    /**
     * Mixes this color with {@code other}. A weight of 0 returns this color, 1 returns {@code other}.
     */
    public Color interpolate(Color other, InterpolationMethod method, double weight) {
        return new ColorInterpolator(method).interpolate(this, other, weight);
    }

    public Color interpolate(Color other, InterpolationMethod method) {
        return interpolate(other, method, 0.5);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Color other)) return false;
        if (isLegacy()) {
            if (!other.isLegacy()) return false;
            if (!fuzzyEqualsNullable(alpha, other.alpha)) return false;
            if (space == other.space) {
                return hasEqualChannels(other);
            }
            return toSpace(ColorSpace.RGB).equals(other.toSpace(ColorSpace.RGB));
        }
        return space == other.space && hasEqualChannels(other) && fuzzyEqualsNullable(alpha, other.alpha);
    }

    private boolean hasEqualChannels(Color other) {
        return fuzzyEqualsNullable(channel0, other.channel0)
               && fuzzyEqualsNullable(channel1, other.channel1)
               && fuzzyEqualsNullable(channel2, other.channel2);
    }

    @Override
    public int hashCode() {
        if (isLegacy()) {
            Color rgb = toSpace(ColorSpace.RGB);
            return 31 * (31 * (31 * fuzzyHashCode(rgb.channel0) + fuzzyHashCode(rgb.channel1))
                         + fuzzyHashCode(rgb.channel2)) + fuzzyHashCode(alpha);
        }
        return 31 * (31 * (31 * (31 * space.hashCode() + fuzzyHashCode(channel0)) + fuzzyHashCode(channel1))
                     + fuzzyHashCode(channel2)) + fuzzyHashCode(alpha);
    }

    /**
     * Returns this color in CSS syntax, e.g. {@code rgb(255, 0, 128)} or {@code oklch(0.7 0.1 250 / 0.5)}.
     */
    @Override
    public String toString() {
        return ColorFormatter.format(this);
    }
}
