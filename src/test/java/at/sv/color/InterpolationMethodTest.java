package at.sv.color;

import at.sv.color.space.ColorSpace;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InterpolationMethodTest {

    @Test
    void polarSpace_defaultsToShorter() {
        assertThat(new InterpolationMethod(ColorSpace.OKLCH).getHue()).isEqualTo(HueInterpolationMethod.SHORTER);
        assertThat(new InterpolationMethod(ColorSpace.HWB).getHue()).isEqualTo(HueInterpolationMethod.SHORTER);
    }

    @Test
    void rectangularSpace_hasNoHue() {
        assertThat(new InterpolationMethod(ColorSpace.OKLAB).getHue()).isNull();
    }

    @Test
    void rectangularSpace_withHue_throws() {
        assertThatThrownBy(() -> new InterpolationMethod(ColorSpace.SRGB, HueInterpolationMethod.LONGER))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("rectangular");
    }

    @Test
    void unsupportedSpace_throws() {
        assertThatThrownBy(() -> new InterpolationMethod(ColorSpace.DISPLAY_P3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InterpolationMethod(ColorSpace.RGB))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void parse() {
        assertThat(InterpolationMethod.parse("oklch longer hue"))
                .isEqualTo(new InterpolationMethod(ColorSpace.OKLCH, HueInterpolationMethod.LONGER));
        assertThat(InterpolationMethod.parse("  Lab ")).isEqualTo(new InterpolationMethod(ColorSpace.LAB));
        assertThat(InterpolationMethod.parse("hsl")).hasToString("hsl shorter hue");
    }

    @Test
    void parse_invalid() {
        assertThatThrownBy(() -> InterpolationMethod.parse("oklch longer"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InterpolationMethod.parse("oklch sideways hue"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InterpolationMethod.parse("cmyk"))
                .isInstanceOf(UnknownColorSpaceException.class);
        assertThatThrownBy(() -> InterpolationMethod.parse(""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void hueInterpolationMethod_fromName() {
        assertThat(HueInterpolationMethod.fromName("Decreasing")).isEqualTo(HueInterpolationMethod.DECREASING);
        assertThat(HueInterpolationMethod.SPECIFIED.getName()).isEqualTo("specified");
    }
}
