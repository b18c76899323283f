package at.sv.color.cli;

import at.sv.color.Color;
import at.sv.color.ColorChannel;
import at.sv.color.LinearChannel;
import at.sv.color.UnknownColorSpaceException;
import at.sv.color.space.ColorSpace;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses colors in CSS syntax, e.g. {@code rgb(18 52 86)}, {@code hsl(210, 65%, 20%)}, {@code #123456},
 * {@code oklch(70% 0.1 250deg / 0.3)} or {@code color(display-p3 1 0 none)}.
 */
public final class ColorParser {

    /**
     * A CSS number followed by an optional unit, e.g. {@code -1.5e2}, {@code 50%} or {@code 0.25turn}.
     */
    private static final Pattern NUMBER_WITH_UNIT =
            Pattern.compile("([+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:e[+-]?\\d+)?)(%|[a-z]*)");
    private static final Map<String, Double> DEGREES_PER_UNIT = Map.of(
            "deg", 1.0,
            "grad", 0.9,
            "rad", 180 / Math.PI,
            "turn", 360.0);

    private static final List<ColorSpace> PREDEFINED_SPACES = List.of(ColorSpace.SRGB, ColorSpace.SRGB_LINEAR,
            ColorSpace.DISPLAY_P3, ColorSpace.A98_RGB, ColorSpace.PROPHOTO_RGB, ColorSpace.REC2020,
            ColorSpace.XYZ_D65, ColorSpace.XYZ_D50);

    private ColorParser() {
    }

    /**
     * @throws IllegalArgumentException if the input is invalid
     */
    public static Color parse(String input) {
        String s = input.trim();
        if (s.startsWith("#")) {
            return parseHex(s);
        }
        int open = s.indexOf('(');
        if (open <= 0 || !s.endsWith(")")) {
            throw new IllegalArgumentException("Invalid color format. Expected: <function>(...) or #hex, got: " + input);
        }
        String function = s.substring(0, open).trim().toLowerCase(Locale.ROOT);
        String arguments = s.substring(open + 1, s.length() - 1).trim();
        return switch (function) {
            case "rgb", "rgba" -> parseChannels(ColorSpace.RGB, arguments, input);
            case "hsl", "hsla" -> parseChannels(ColorSpace.HSL, arguments, input);
            case "hwb" -> parseChannels(ColorSpace.HWB, arguments, input);
            case "lab" -> parseChannels(ColorSpace.LAB, arguments, input);
            case "lch" -> parseChannels(ColorSpace.LCH, arguments, input);
            case "oklab" -> parseChannels(ColorSpace.OKLAB, arguments, input);
            case "oklch" -> parseChannels(ColorSpace.OKLCH, arguments, input);
            case "color" -> parseColorFunction(arguments, input);
            default -> throw new IllegalArgumentException("Unknown color function '" + function + "' in: " + input);
        };
    }

    private static Color parseColorFunction(String arguments, String input) {
        String[] spaceAndRest = arguments.split("\\s+", 2);
        if (spaceAndRest.length < 2) {
            throw new IllegalArgumentException("Expected: color(<space> c1 c2 c3), got: " + input);
        }
        ColorSpace space;
        try {
            space = ColorSpace.fromName(spaceAndRest[0]);
        } catch (UnknownColorSpaceException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
        if (!PREDEFINED_SPACES.contains(space)) {
            throw new IllegalArgumentException("Color space " + space + " can't be used in color(), got: " + input);
        }
        return parseChannels(space, spaceAndRest[1], input);
    }

    private static Color parseChannels(ColorSpace space, String arguments, String input) {
        String alphaToken = null;
        String channelPart = arguments;
        int slash = arguments.indexOf('/');
        if (slash >= 0) {
            channelPart = arguments.substring(0, slash).trim();
            alphaToken = arguments.substring(slash + 1).trim();
        }

        String[] parts;
        if (channelPart.contains(",")) {
            parts = channelPart.split("\\s*,\\s*");
        } else {
            parts = channelPart.trim().split("\\s+");
        }
        if (parts.length == 4 && alphaToken == null && channelPart.contains(",")) {
            alphaToken = parts[3];
        } else if (parts.length != 3) {
            throw new IllegalArgumentException("Expected three channels for " + space + ", got: " + input);
        }

        List<ColorChannel> channels = space.getChannels();
        Double alpha = alphaToken == null ? Double.valueOf(1.0) : parseChannel(ColorChannel.ALPHA, alphaToken, input);
        return Color.forSpace(space,
                parseChannel(channels.get(0), parts[0], input),
                parseChannel(channels.get(1), parts[1], input),
                parseChannel(channels.get(2), parts[2], input),
                alpha);
    }

    private static Double parseChannel(ColorChannel channel, String token, String input) {
        String t = token.trim().toLowerCase(Locale.ROOT);
        if (t.equals("none")) {
            return null;
        }
        Matcher matcher = NUMBER_WITH_UNIT.matcher(t);
        if (!matcher.matches()) {
            throw invalidValue(channel, token, input);
        }
        double number = Double.parseDouble(matcher.group(1));
        String unit = matcher.group(2);
        if (unit.isEmpty()) {
            return number;
        }
        if (channel.isPolarAngle()) {
            Double degreesPerUnit = DEGREES_PER_UNIT.get(unit);
            if (degreesPerUnit == null) {
                throw invalidValue(channel, token, input);
            }
            return number * degreesPerUnit;
        }
        if (unit.equals("%")) {
            return number / 100.0 * ((LinearChannel) channel).getMax();
        }
        throw invalidValue(channel, token, input);
    }

    private static IllegalArgumentException invalidValue(ColorChannel channel, String token, String input) {
        return new IllegalArgumentException("Invalid value '" + token + "' for channel " + channel + " in: " + input);
    }

    private static Color parseHex(String s) {
        String hex = s.substring(1);
        if (!hex.matches("[0-9a-fA-F]+")) {
            throw new IllegalArgumentException("Invalid hex color: " + s);
        }
        return switch (hex.length()) {
            case 3, 4 -> Color.rgb(
                    (double) Integer.parseInt(hex.substring(0, 1).repeat(2), 16),
                    (double) Integer.parseInt(hex.substring(1, 2).repeat(2), 16),
                    (double) Integer.parseInt(hex.substring(2, 3).repeat(2), 16),
                    hex.length() == 4 ? Integer.parseInt(hex.substring(3, 4).repeat(2), 16) / 255.0 : 1.0);
            case 6, 8 -> Color.rgb(
                    (double) Integer.parseInt(hex.substring(0, 2), 16),
                    (double) Integer.parseInt(hex.substring(2, 4), 16),
                    (double) Integer.parseInt(hex.substring(4, 6), 16),
                    hex.length() == 8 ? Integer.parseInt(hex.substring(6, 8), 16) / 255.0 : 1.0);
            default -> throw new IllegalArgumentException("Invalid hex color length: " + s);
        };
    }
}
