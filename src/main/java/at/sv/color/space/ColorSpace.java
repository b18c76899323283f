package at.sv.color.space;

import at.sv.color.Color;
import at.sv.color.ColorChannel;
import at.sv.color.UnknownColorSpaceException;
import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import static at.sv.color.space.ColorSpaceUtils.multiply;
import static at.sv.color.space.ColorSpaceUtils.orZero;

/**
 * A color space whose channel names and semantics are known.
 * <p>
 * The set of spaces is closed: every instance is one of the constants below, so spaces can be compared by identity.
 * Instances are immutable and shared.
 */
@Getter
public abstract class ColorSpace {

    /**
     * The legacy RGB color space, channels in [0, 255].
     */
    public static final ColorSpace RGB = new RgbColorSpace();
    public static final ColorSpace HSL = new HslColorSpace();
    public static final ColorSpace HWB = new HwbColorSpace();
    /**
     * <a href="https://www.w3.org/TR/css-color-4/#predefined-sRGB">sRGB</a>
     */
    public static final ColorSpace SRGB = new SrgbColorSpace();
    /**
     * <a href="https://www.w3.org/TR/css-color-4/#predefined-sRGB-linear">linear-light sRGB</a>
     */
    public static final ColorSpace SRGB_LINEAR = new SrgbLinearColorSpace();
    /**
     * <a href="https://www.w3.org/TR/css-color-4/#predefined-display-p3">display-p3</a>
     */
    public static final ColorSpace DISPLAY_P3 = new DisplayP3ColorSpace();
    /**
     * <a href="https://www.w3.org/TR/css-color-4/#predefined-a98-rgb">a98-rgb</a>
     */
    public static final ColorSpace A98_RGB = new A98RgbColorSpace();
    /**
     * <a href="https://www.w3.org/TR/css-color-4/#predefined-prophoto-rgb">prophoto-rgb</a>
     */
    public static final ColorSpace PROPHOTO_RGB = new ProphotoRgbColorSpace();
    /**
     * <a href="https://www.w3.org/TR/css-color-4/#predefined-rec2020">rec2020</a>
     */
    public static final ColorSpace REC2020 = new Rec2020ColorSpace();
    /**
     * <a href="https://www.w3.org/TR/css-color-4/#predefined-xyz">xyz-d65</a>, also known as {@code xyz}.
     */
    public static final ColorSpace XYZ_D65 = new XyzD65ColorSpace();
    public static final ColorSpace XYZ_D50 = new XyzD50ColorSpace();
    /**
     * <a href="https://www.w3.org/TR/css-color-4/#cie-lab">CIE Lab</a>
     */
    public static final ColorSpace LAB = new LabColorSpace();
    public static final ColorSpace LCH = new LchColorSpace();
    /**
     * Intermediate space for conversions to and from Oklab and Oklch. Not resolvable by {@link #fromName(String)}.
     */
    public static final ColorSpace LMS = new LmsColorSpace();
    /**
     * <a href="https://www.w3.org/TR/css-color-4/#ok-lab">Oklab</a>
     */
    public static final ColorSpace OKLAB = new OklabColorSpace();
    public static final ColorSpace OKLCH = new OklchColorSpace();

    private static final List<ColorSpace> KNOWN_SPACES = List.of(RGB, HSL, HWB, SRGB, SRGB_LINEAR, DISPLAY_P3,
            A98_RGB, PROPHOTO_RGB, REC2020, XYZ_D65, XYZ_D50, LAB, LCH, OKLAB, OKLCH);

    /**
     * The CSS name of the color space.
     */
    private final String name;
    private final List<ColorChannel> channels;

    ColorSpace(String name, List<ColorChannel> channels) {
        this.name = name;
        this.channels = List.copyOf(channels);
    }

    /**
     * Returns the known color space with the given (case-insensitive) name.
     *
     * @throws UnknownColorSpaceException if there is no such space
     */
    public static ColorSpace fromName(String name) {
        return lookup(name).orElseThrow(() -> new UnknownColorSpaceException(name));
    }

    public static Optional<ColorSpace> lookup(String name) {
        ColorSpace space = switch (name.toLowerCase(Locale.ROOT)) {
            case "rgb" -> RGB;
            case "hwb" -> HWB;
            case "hsl" -> HSL;
            case "srgb" -> SRGB;
            case "srgb-linear" -> SRGB_LINEAR;
            case "display-p3" -> DISPLAY_P3;
            case "a98-rgb" -> A98_RGB;
            case "prophoto-rgb" -> PROPHOTO_RGB;
            case "rec2020" -> REC2020;
            case "xyz", "xyz-d65" -> XYZ_D65;
            case "xyz-d50" -> XYZ_D50;
            case "lab" -> LAB;
            case "lch" -> LCH;
            case "oklab" -> OKLAB;
            case "oklch" -> OKLCH;
            default -> null;
        };
        return Optional.ofNullable(space);
    }

    /**
     * All spaces resolvable by name, in catalog order.
     */
    public static List<ColorSpace> knownSpaces() {
        return KNOWN_SPACES;
    }

    /**
     * Whether this space has a meaningful gamut.
     */
    public abstract boolean isBounded();

    /**
     * Whether channel values outside their bounds are meaningless and therefore clamped, rather than being valid but
     * out-of-gamut. Only ever true if {@link #isBounded()} is.
     */
    public boolean isStrictlyBounded() {
        return false;
    }

    public boolean isLegacy() {
        return false;
    }

    public boolean isPolar() {
        return false;
    }

    /**
     * Returns the index of the channel with the given name, or -1.
     */
    public int indexOfChannel(String channelName) {
        for (int i = 0; i < channels.size(); i++) {
            if (channels.get(i).getName().equals(channelName)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Converts a color with the given channels from this color space to {@code dest}. Null channels are missing.
     */
    public final Color convert(ColorSpace dest, Double channel0, Double channel1, Double channel2, Double alpha) {
        return convert(dest, channel0, channel1, channel2, alpha, MissingChannels.NONE);
    }

    /**
     * Spaces that need more than a linear transformation to reach some destinations override this and fall back to
     * {@link #convertLinear} for everything else.
     */
    Color convert(ColorSpace dest, Double channel0, Double channel1, Double channel2, Double alpha,
                  MissingChannels missing) {
        return convertLinear(dest, channel0, channel1, channel2, alpha, missing);
    }

    /**
     * Linear transformation from RGB- or XYZ-like channels into a linear destination space, which may then further
     * convert to a polar or legacy space.
     */
    final Color convertLinear(ColorSpace dest, Double red, Double green, Double blue, Double alpha,
                              MissingChannels missing) {
        ColorSpace linearDest = linearDestinationFor(dest);

        Double transformedRed;
        Double transformedGreen;
        Double transformedBlue;
        if (linearDest == this) {
            transformedRed = red;
            transformedGreen = green;
            transformedBlue = blue;
        } else {
            double[] linear = multiply(transformationMatrix(linearDest),
                    toLinear(orZero(red)), toLinear(orZero(green)), toLinear(orZero(blue)));
            transformedRed = linearDest.fromLinear(linear[0]);
            transformedGreen = linearDest.fromLinear(linear[1]);
            transformedBlue = linearDest.fromLinear(linear[2]);
        }

        if (linearDest != dest) {
            return linearDest.convert(dest, transformedRed, transformedGreen, transformedBlue, alpha, missing);
        }
        return Color.forSpace(dest,
                red == null ? null : transformedRed,
                green == null ? null : transformedGreen,
                blue == null ? null : transformedBlue,
                alpha);
    }

    private static ColorSpace linearDestinationFor(ColorSpace dest) {
        if (dest == HSL || dest == HWB) {
            return SRGB;
        } else if (dest == LAB || dest == LCH) {
            return XYZ_D50;
        } else if (dest == OKLAB || dest == OKLCH) {
            return LMS;
        }
        return dest;
    }

    /**
     * Converts a channel of this space into an element of a vector that {@link #transformationMatrix} can be applied
     * to. For every supported {@code dest}, {@code dest.fromLinear(M * toLinear(channels))} converts from this space
     * to {@code dest}.
     */
    protected double toLinear(double channel) {
        throw new IllegalStateException("[BUG] Color space " + this + " doesn't support linear conversions.");
    }

    /**
     * The inverse of {@link #toLinear(double)}.
     */
    protected double fromLinear(double channel) {
        throw new IllegalStateException("[BUG] Color space " + this + " doesn't support linear conversions.");
    }

    /**
     * Returns the row-major matrix transforming linear channels of this space into linear channels of {@code dest}.
     */
    protected double[] transformationMatrix(ColorSpace dest) {
        throw new IllegalStateException("[BUG] Color space conversion from " + this + " to " + dest
                                        + " not implemented.");
    }

    @Override
    public String toString() {
        return name;
    }
}
