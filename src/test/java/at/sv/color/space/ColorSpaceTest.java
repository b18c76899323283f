package at.sv.color.space;

import at.sv.color.ColorChannel;
import at.sv.color.LinearChannel;
import at.sv.color.UnknownColorSpaceException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ColorSpaceTest {

    @Test
    void fromName_isCaseInsensitive() {
        assertThat(ColorSpace.fromName("sRGB")).isSameAs(ColorSpace.SRGB);
        assertThat(ColorSpace.fromName("Display-P3")).isSameAs(ColorSpace.DISPLAY_P3);
        assertThat(ColorSpace.fromName("OKLCH")).isSameAs(ColorSpace.OKLCH);
    }

    @Test
    void fromName_xyz_isAliasOfXyzD65() {
        assertThat(ColorSpace.fromName("xyz")).isSameAs(ColorSpace.XYZ_D65);
    }

    @Test
    void fromName_unknown_throwsWithName() {
        assertThatThrownBy(() -> ColorSpace.fromName("cmyk"))
                .isInstanceOf(UnknownColorSpaceException.class)
                .hasMessage("Unknown color space \"cmyk\".")
                .extracting(e -> ((UnknownColorSpaceException) e).getSpaceName())
                .isEqualTo("cmyk");
    }

    @Test
    void fromName_lms_isInternal() {
        assertThat(ColorSpace.lookup("lms")).isEmpty();
    }

    @Test
    void lookup_returnsOptional() {
        assertThat(ColorSpace.lookup("rec2020")).contains(ColorSpace.REC2020);
        assertThat(ColorSpace.lookup("nope")).isEmpty();
    }

    @Test
    void knownSpaces_allResolvableByTheirName() {
        assertThat(ColorSpace.knownSpaces()).hasSize(15);
        for (ColorSpace space : ColorSpace.knownSpaces()) {
            assertThat(ColorSpace.fromName(space.getName())).isSameAs(space);
            assertThat(space.getChannels()).hasSize(3);
        }
    }

    @Test
    void flags() {
        assertThat(ColorSpace.RGB.isLegacy()).isTrue();
        assertThat(ColorSpace.RGB.isPolar()).isFalse();
        assertThat(ColorSpace.HSL.isLegacy()).isTrue();
        assertThat(ColorSpace.HWB.isPolar()).isTrue();
        assertThat(ColorSpace.SRGB.isLegacy()).isFalse();
        assertThat(ColorSpace.SRGB.isBounded()).isTrue();
        assertThat(ColorSpace.REC2020.isBounded()).isTrue();
        assertThat(ColorSpace.XYZ_D50.isBounded()).isFalse();
        assertThat(ColorSpace.LAB.isBounded()).isFalse();
        assertThat(ColorSpace.OKLCH.isBounded()).isFalse();
        assertThat(ColorSpace.OKLCH.isPolar()).isTrue();
        assertThat(ColorSpace.LCH.isPolar()).isTrue();
        assertThat(ColorSpace.OKLAB.isPolar()).isFalse();
        for (ColorSpace space : ColorSpace.knownSpaces()) {
            assertThat(space.isStrictlyBounded()).as(space.getName()).isFalse();
        }
    }

    @Test
    void hueChannel_positionDependsOnSpace() {
        assertThat(ColorSpace.HSL.indexOfChannel("hue")).isZero();
        assertThat(ColorSpace.HWB.indexOfChannel("hue")).isZero();
        assertThat(ColorSpace.LCH.indexOfChannel("hue")).isEqualTo(2);
        assertThat(ColorSpace.OKLCH.indexOfChannel("hue")).isEqualTo(2);
        assertThat(ColorSpace.SRGB.indexOfChannel("hue")).isEqualTo(-1);
        assertThat(ColorSpace.LCH.getChannels().get(2)).isSameAs(ColorChannel.HUE);
    }

    @Test
    void channelMetadata() {
        LinearChannel red = (LinearChannel) ColorSpace.RGB.getChannels().get(0);
        assertThat(red.getMax()).isEqualTo(255);
        assertThat(red.isLowerClamped()).isTrue();
        assertThat(red.isUpperClamped()).isTrue();
        assertThat(red.getAssociatedUnit()).isNull();

        LinearChannel saturation = (LinearChannel) ColorSpace.HSL.getChannels().get(1);
        assertThat(saturation.isRequiresPercent()).isTrue();
        assertThat(saturation.isLowerClamped()).isTrue();
        assertThat(saturation.isUpperClamped()).isFalse();
        assertThat(saturation.getAssociatedUnit()).isEqualTo("%");

        LinearChannel oklabLightness = (LinearChannel) ColorSpace.OKLAB.getChannels().get(0);
        assertThat(oklabLightness.getMax()).isEqualTo(1);
        assertThat(oklabLightness.isRequiresPercent()).isFalse();
        assertThat(oklabLightness.getAssociatedUnit()).isEqualTo("%");

        LinearChannel lchChroma = (LinearChannel) ColorSpace.LCH.getChannels().get(1);
        assertThat(lchChroma.getMax()).isEqualTo(150);
        assertThat(ColorSpace.LCH.getChannels().get(2).getAssociatedUnit()).isEqualTo("deg");
    }

    @Test
    void linearConversion_unsupportedPair_isABug() {
        assertThatThrownBy(() -> ColorSpace.HSL.transformationMatrix(ColorSpace.SRGB))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageStartingWith("[BUG]");
    }

    @Test
    void toString_isName() {
        assertThat(ColorSpace.PROPHOTO_RGB).hasToString("prophoto-rgb");
    }
}
