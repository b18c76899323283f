package at.sv.color.gamut;

import at.sv.color.Color;
import at.sv.color.UnknownGamutMapMethodException;
import lombok.Getter;

import java.util.List;
import java.util.Locale;

/**
 * A method for mapping an out-of-gamut color into the gamut of its color space.
 */
@Getter
public abstract class GamutMapMethod {

    /**
     * Clamps each channel into its bounds. Fast, but may change the perceived hue and lightness.
     */
    public static final GamutMapMethod CLIP = new ClipGamutMap();

    /**
     * The perceptual <a href="https://www.w3.org/TR/css-color-4/#css-gamut-mapping">CSS gamut mapping</a>
     * algorithm, which reduces chroma in Oklch until the clipped color is close enough.
     */
    public static final GamutMapMethod LOCAL_MINDE = new LocalMindeGamutMap();

    private static final List<GamutMapMethod> METHODS = List.of(CLIP, LOCAL_MINDE);

    private final String name;

    GamutMapMethod(String name) {
        this.name = name;
    }

    /**
     * @throws UnknownGamutMapMethodException if there is no method with the given (case-insensitive) name
     */
    public static GamutMapMethod fromName(String name) {
        String lowerCase = name.toLowerCase(Locale.ROOT);
        return METHODS.stream()
                      .filter(method -> method.name.equals(lowerCase))
                      .findFirst()
                      .orElseThrow(() -> new UnknownGamutMapMethodException(name));
    }

    /**
     * Maps {@code color} into its space's gamut. The result is in the same space and keeps the alpha value.
     * <p>
     * Callers should prefer {@link Color#toGamut(GamutMapMethod)}, which skips colors that are already in gamut.
     */
    public abstract Color map(Color color);

    @Override
    public String toString() {
        return name;
    }
}
