package at.sv.color;

import at.sv.color.space.ColorSpace;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ColorTest {

    @Test
    void equals_isFuzzy() {
        Color color = Color.srgb(0.1, 0.2, 0.3);
        Color almost = Color.srgb(0.1 + 1e-13, 0.2, 0.3 - 1e-13);

        assertThat(color).isEqualTo(almost);
        assertThat(color).isNotEqualTo(Color.srgb(0.1 + 1e-6, 0.2, 0.3));
    }

    @Test
    void equals_missingChannel_isNotZero() {
        assertThat(Color.srgb(null, 0.2, 0.3)).isNotEqualTo(Color.srgb(0.0, 0.2, 0.3));
        assertThat(Color.srgb(null, 0.2, 0.3)).isEqualTo(Color.srgb(null, 0.2, 0.3));
    }

    @Test
    void equals_legacyColors_compareAsRgb() {
        Color red = Color.rgb(255.0, 0.0, 0.0);
        Color hslRed = Color.hsl(0.0, 100.0, 50.0);
        Color hwbRed = Color.hwb(0.0, 0.0, 0.0);

        assertThat(red).isEqualTo(hslRed);
        assertThat(hslRed).isEqualTo(hwbRed);
        assertThat(red).hasSameHashCodeAs(hslRed);
        assertThat(red).isNotEqualTo(Color.hsl(0.0, 100.0, 50.0, 0.5));
    }

    @Test
    void equals_nonLegacy_requiresSameSpace() {
        assertThat(Color.srgb(1.0, 0.0, 0.0)).isNotEqualTo(Color.rgb(255.0, 0.0, 0.0));
        assertThat(Color.srgb(1.0, 0.0, 0.0))
                .isNotEqualTo(Color.forSpace(ColorSpace.DISPLAY_P3, 1.0, 0.0, 0.0));
    }

    @Test
    void hashCode_consistentWithEquals() {
        assertThat(Color.oklch(0.5, 0.1, 30.0)).hasSameHashCodeAs(Color.oklch(0.5, 0.1, 30.0));
        assertThat(Color.oklch(0.5, null, 30.0)).hasSameHashCodeAs(Color.oklch(0.5, null, 30.0));
    }

    @Test
    void construction_legacyHue_isNormalized() {
        assertThat(Color.hsl(-30.0, 50.0, 50.0).getChannel0()).isCloseTo(330, within(1e-12));
        assertThat(Color.hwb(720.0, 10.0, 10.0).getChannel0()).isZero();
        assertThat(Color.lch(50.0, 10.0, 400.0).getChannel2()).isEqualTo(400);
    }

    @Test
    void construction_outOfRange_isKept() {
        Color color = Color.rgb(300.0, -10.0, 128.0);

        assertThat(color.getChannel0()).isEqualTo(300);
        assertThat(color.getChannel1()).isEqualTo(-10);
        assertThat(color.isInGamut()).isFalse();
    }

    @Test
    void accessors_missingChannels() {
        Color color = Color.forSpace(ColorSpace.SRGB, 0.2, null, 0.4, null);

        assertThat(color.getChannel1()).isZero();
        assertThat(color.getChannel1OrNull()).isNull();
        assertThat(color.isChannel1Missing()).isTrue();
        assertThat(color.getAlpha()).isZero();
        assertThat(color.isAlphaMissing()).isTrue();
        assertThat(color.getChannels()).containsExactly(0.2, 0.0, 0.4);
        assertThat(color.getChannelsOrNull()).containsExactly(0.2, null, 0.4);
    }

    @Test
    void channel_byName() {
        Color color = Color.hsl(210.0, 50.0, 40.0, 0.8);

        assertThat(color.channel("hue")).isEqualTo(210);
        assertThat(color.channel("saturation")).isEqualTo(50);
        assertThat(color.channel("lightness")).isEqualTo(40);
        assertThat(color.channel("alpha")).isEqualTo(0.8);
        assertThat(color.channel("red", ColorSpace.RGB)).isCloseTo(51, within(1e-9));
    }

    @Test
    void channel_unknownName_throws() {
        Color color = Color.srgb(0.1, 0.2, 0.3);

        assertThatThrownBy(() -> color.channel("hue"))
                .isInstanceOf(ChannelNotFoundException.class)
                .hasMessage("Color space srgb doesn't have a channel with name \"hue\".");
        assertThatThrownBy(() -> color.isChannelMissing("lightness"))
                .isInstanceOf(ChannelNotFoundException.class);
    }

    @Test
    void isChannelMissing() {
        Color color = Color.oklch(null, 0.1, 40.0);

        assertThat(color.isChannelMissing("lightness")).isTrue();
        assertThat(color.isChannelMissing("chroma")).isFalse();
        assertThat(color.isChannelMissing("alpha")).isFalse();
    }

    @Test
    void findChannel() {
        Color color = Color.lab(50.0, 10.0, 10.0);

        assertThat(color.findChannel("a")).contains(ColorSpace.LAB.getChannels().get(1));
        assertThat(color.findChannel("alpha")).contains(ColorChannel.ALPHA);
        assertThat(color.findChannel("hue")).isEmpty();
    }

    @Test
    void isChannelPowerless() {
        assertThat(Color.hsl(120.0, 0.0, 50.0).isChannelPowerless("hue")).isTrue();
        assertThat(Color.hsl(120.0, 10.0, 50.0).isChannelPowerless("hue")).isFalse();
        assertThat(Color.hsl(120.0, 0.0, 50.0).isChannelPowerless("saturation")).isFalse();
        assertThat(Color.hwb(120.0, 60.0, 40.0).isChannelPowerless("hue")).isTrue();
        assertThat(Color.hwb(120.0, 30.0, 40.0).isChannelPowerless("hue")).isFalse();
        assertThat(Color.oklch(0.5, 0.0, 120.0).isChannelPowerless("hue")).isTrue();
        assertThat(Color.lch(50.0, 30.0, 120.0).isChannelPowerless("hue")).isFalse();
        assertThat(Color.srgb(0.5, 0.5, 0.5).isChannelPowerless("red")).isFalse();
        assertThat(Color.rgb(128.0, 128.0, 128.0).isChannelPowerless("hue", ColorSpace.HSL)).isTrue();
    }

    @Test
    void isInGamut() {
        assertThat(Color.srgb(1.0, 0.0, 0.5).isInGamut()).isTrue();
        assertThat(Color.srgb(1.0 + 1e-12, 0.0, 0.5).isInGamut()).isTrue();
        assertThat(Color.srgb(1.01, 0.0, 0.5).isInGamut()).isFalse();
        assertThat(Color.srgb(null, 0.0, 0.5).isInGamut()).isTrue();
        assertThat(Color.hsl(400.0, 50.0, 50.0).isInGamut()).isTrue();
        assertThat(Color.lab(150.0, 300.0, -300.0).isInGamut()).isTrue();
        assertThat(Color.forSpace(ColorSpace.DISPLAY_P3, 1.0, 0.0, 0.0).toSpace(ColorSpace.SRGB).isInGamut()).isFalse();
    }

    @Test
    void changeChannels() {
        Color color = Color.oklch(0.5, 0.1, 40.0, 0.5);
        Map<String, Double> changes = new HashMap<>();
        changes.put("chroma", 0.2);
        changes.put("hue", null);
        changes.put("alpha", 1.0);

        Color changed = color.changeChannels(changes);

        assertThat(changed).isEqualTo(Color.oklch(0.5, 0.2, null, 1.0));
        assertThat(color).isEqualTo(Color.oklch(0.5, 0.1, 40.0, 0.5));
    }

    @Test
    void changeChannels_outOfRange_isNotClamped() {
        Color changed = Color.srgb(0.5, 0.5, 0.5).changeChannels(Map.of("red", 2.0));

        assertThat(changed.getChannel0()).isEqualTo(2);
    }

    @Test
    void changeChannels_unknownChannel_throws() {
        assertThatThrownBy(() -> Color.srgb(0.5, 0.5, 0.5).changeChannels(Map.of("lightness", 2.0)))
                .isInstanceOf(ChannelNotFoundException.class)
                .extracting(e -> ((ChannelNotFoundException) e).getSpace())
                .isEqualTo(ColorSpace.SRGB);
    }

    @Test
    void changeAlpha() {
        Color color = Color.rgb(1.0, 2.0, 3.0);

        assertThat(color.changeAlpha(0.3).getAlpha()).isEqualTo(0.3);
        assertThat(color.changeAlpha(null).isAlphaMissing()).isTrue();
        assertThat(color.getAlpha()).isEqualTo(1);
    }

    @Test
    void toString_cssSyntax() {
        assertThat(Color.rgb(255.0, 0.0, 128.0)).hasToString("rgb(255, 0, 128)");
        assertThat(Color.rgb(255.0, 0.0, 128.0, 0.5)).hasToString("rgba(255, 0, 128, 0.5)");
        assertThat(Color.rgb(null, 0.0, 128.0)).hasToString("rgb(none 0 128)");
        assertThat(Color.hsl(210.0, 65.0, 20.0)).hasToString("hsl(210, 65%, 20%)");
        assertThat(Color.hwb(210.0, 10.0, 20.0, 0.25)).hasToString("hwb(210 10% 20% / 0.25)");
        assertThat(Color.lab(50.0, 20.0, -30.0)).hasToString("lab(50% 20 -30)");
        assertThat(Color.oklch(0.7, 0.1, 250.0, 0.3)).hasToString("oklch(0.7 0.1 250 / 0.3)");
        assertThat(Color.forSpace(ColorSpace.DISPLAY_P3, 1.0, 0.0, null))
                .hasToString("color(display-p3 1 0 none)");
        assertThat(Color.srgb(0.1, 0.2, 0.3).changeAlpha(1.5)).hasToString("color(srgb 0.1 0.2 0.3)");
        assertThat(Color.srgb(0.1, 0.2, 0.3).changeAlpha(null)).hasToString("color(srgb 0.1 0.2 0.3 / none)");
    }

    @Test
    void toString_roundsToTenDigits() {
        assertThat(Color.srgb(1.0 / 3, 0.0, 0.0)).hasToString("color(srgb 0.3333333333 0 0)");
        assertThat(Color.srgb(Double.NaN, 0.0, 0.0)).hasToString("color(srgb calc(NaN) 0 0)");
    }
}
