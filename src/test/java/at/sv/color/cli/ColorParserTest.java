package at.sv.color.cli;

import at.sv.color.Color;
import at.sv.color.space.ColorSpace;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ColorParserTest {

    private static final double EPS = 1e-9;

    @Test
    void rgb_commaAndSpaceSyntax() {
        assertThat(ColorParser.parse("rgb(18, 52, 86)")).isEqualTo(Color.rgb(18.0, 52.0, 86.0));
        assertThat(ColorParser.parse("rgb(18 52 86)")).isEqualTo(Color.rgb(18.0, 52.0, 86.0));
        assertThat(ColorParser.parse("RGBA(18, 52, 86, 0.5)")).isEqualTo(Color.rgb(18.0, 52.0, 86.0, 0.5));
        assertThat(ColorParser.parse("rgb(18 52 86 / 50%)")).isEqualTo(Color.rgb(18.0, 52.0, 86.0, 0.5));
    }

    @Test
    void rgb_percentages_areScaledByChannelMax() {
        Color color = ColorParser.parse("rgb(100% 50% 0%)");

        assertThat(color.getChannel0()).isCloseTo(255, within(EPS));
        assertThat(color.getChannel1()).isCloseTo(127.5, within(EPS));
        assertThat(color.getChannel2()).isZero();
    }

    @Test
    void rgb_outOfRange_isKept() {
        Color color = ColorParser.parse("rgb(300, -10, 128)");

        assertThat(color.getChannel0()).isEqualTo(300);
        assertThat(color.getChannel1()).isEqualTo(-10);
    }

    @Test
    void hex() {
        assertThat(ColorParser.parse("#123456")).isEqualTo(Color.rgb(18.0, 52.0, 86.0));
        assertThat(ColorParser.parse("#f00")).isEqualTo(Color.rgb(255.0, 0.0, 0.0));
        assertThat(ColorParser.parse("#ff000080").getAlpha()).isCloseTo(128 / 255.0, within(EPS));
        assertThat(ColorParser.parse("#f008").getAlpha()).isCloseTo(136 / 255.0, within(EPS));
    }

    @Test
    void hsl_equalsRgbVector() {
        Color hsl = ColorParser.parse("hsl(210, 65.3846153846154%, 20.392156862745097%)");

        assertThat(hsl.getSpace()).isSameAs(ColorSpace.HSL);
        assertThat(hsl).isEqualTo(Color.rgb(18.0, 52.0, 86.0));
    }

    @Test
    void hue_angleUnits() {
        double[] hues = {
                ColorParser.parse("oklch(0.7 0.1 250)").getChannel2(),
                ColorParser.parse("oklch(0.7 0.1 250deg)").getChannel2(),
                ColorParser.parse("oklch(0.7 0.1 4.36332313rad)").getChannel2(),
                ColorParser.parse("oklch(0.7 0.1 277.7777778grad)").getChannel2(),
                ColorParser.parse("oklch(0.7 0.1 0.6944444444turn)").getChannel2()};

        for (double hue : hues) {
            assertThat(hue).isCloseTo(250, within(1e-6));
        }
    }

    @Test
    void oklch_percentLightness() {
        Color color = ColorParser.parse("oklch(70% 0.1 250 / 0.3)");

        assertThat(color.getChannel0()).isCloseTo(0.7, within(EPS));
        assertThat(color.getAlpha()).isCloseTo(0.3, within(EPS));
    }

    @Test
    void lab_lch_oklab_hwb() {
        assertThat(ColorParser.parse("lab(50% 20 -30)")).isEqualTo(Color.lab(50.0, 20.0, -30.0));
        assertThat(ColorParser.parse("lch(50 30 120)")).isEqualTo(Color.lch(50.0, 30.0, 120.0));
        assertThat(ColorParser.parse("oklab(0.5 0.1 -0.1)")).isEqualTo(Color.oklab(0.5, 0.1, -0.1));
        assertThat(ColorParser.parse("hwb(120 10% 20%)")).isEqualTo(Color.hwb(120.0, 10.0, 20.0));
    }

    @Test
    void none_isMissing() {
        Color color = ColorParser.parse("oklch(none 0.1 120 / none)");

        assertThat(color.isChannel0Missing()).isTrue();
        assertThat(color.isAlphaMissing()).isTrue();
    }

    @Test
    void colorFunction() {
        Color color = ColorParser.parse("color(display-p3 1 0 none)");

        assertThat(color.getSpace()).isSameAs(ColorSpace.DISPLAY_P3);
        assertThat(color.getChannelsOrNull()).containsExactly(1.0, 0.0, null);
        assertThat(ColorParser.parse("color(xyz 0.5 50% 0.2)").getChannel1()).isCloseTo(0.5, within(EPS));
    }

    @Test
    void toString_isParsedBack() {
        Color color = Color.oklch(0.7, 0.1, 250.0, 0.3);

        assertThat(ColorParser.parse(color.toString())).isEqualTo(color);
        assertThat(ColorParser.parse(Color.lab(50.0, 20.0, -30.0).toString())).isEqualTo(Color.lab(50.0, 20.0, -30.0));
    }

    @Test
    void invalidInput_throws() {
        assertThatThrownBy(() -> ColorParser.parse("red")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColorParser.parse("rgb(1 2)")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColorParser.parse("rgb(1 2 x)"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'x'");
        assertThatThrownBy(() -> ColorParser.parse("cmyk(1 2 3 4)")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColorParser.parse("color(cmyk 1 2 3)")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColorParser.parse("color(lab 1 2 3)")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColorParser.parse("#12345")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColorParser.parse("#ggg")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unitMismatch_throws() {
        assertThatThrownBy(() -> ColorParser.parse("oklch(0.7 0.1 50%)"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'50%'");
        assertThatThrownBy(() -> ColorParser.parse("oklch(0.7 0.1 2em)"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'2em'");
        assertThatThrownBy(() -> ColorParser.parse("rgb(10deg 0 0)"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'10deg'");
    }

    @Test
    void exponentNotation() {
        assertThat(ColorParser.parse("color(srgb 5e-1 .25 1E0)"))
                .isEqualTo(Color.forSpace(ColorSpace.SRGB, 0.5, 0.25, 1.0));
    }
}
