package at.sv.color;

import at.sv.color.space.ColorSpace;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ColorChannelTest {

    @Test
    void isAnalogous_table() {
        ColorChannel red = ColorSpace.SRGB.getChannels().get(0);
        ColorChannel x = ColorSpace.XYZ_D65.getChannels().get(0);
        ColorChannel saturation = ColorSpace.HSL.getChannels().get(1);
        ColorChannel chroma = ColorSpace.OKLCH.getChannels().get(1);
        ColorChannel labLightness = ColorSpace.LAB.getChannels().get(0);
        ColorChannel hslLightness = ColorSpace.HSL.getChannels().get(2);
        ColorChannel whiteness = ColorSpace.HWB.getChannels().get(1);
        ColorChannel a = ColorSpace.LAB.getChannels().get(1);

        assertThat(red.isAnalogous(x)).isTrue();
        assertThat(x.isAnalogous(red)).isTrue();
        assertThat(saturation.isAnalogous(chroma)).isTrue();
        assertThat(labLightness.isAnalogous(hslLightness)).isTrue();
        assertThat(ColorChannel.HUE.isAnalogous(ColorChannel.HUE)).isTrue();
        assertThat(red.isAnalogous(ColorSpace.SRGB.getChannels().get(1))).isFalse();
        assertThat(whiteness.isAnalogous(whiteness)).isFalse();
        assertThat(a.isAnalogous(ColorSpace.OKLAB.getChannels().get(1))).isFalse();
    }

    @Test
    void hue_isPolar() {
        assertThat(ColorChannel.HUE.isPolarAngle()).isTrue();
        assertThat(ColorChannel.HUE.getAssociatedUnit()).isEqualTo("deg");
        assertThat(ColorChannel.ALPHA.isPolarAngle()).isFalse();
    }

    @Test
    void linearChannel_clamp() {
        LinearChannel channel = LinearChannel.of("red", 0, 1);

        assertThat(channel.clamp(1.5)).isEqualTo(1);
        assertThat(channel.clamp(-0.5)).isZero();
        assertThat(channel.clamp(Double.NaN)).isZero();
        assertThat(channel.clamp(0.25)).isEqualTo(0.25);
    }

    @Test
    void linearChannel_isInRange_isFuzzy() {
        LinearChannel channel = LinearChannel.of("red", 0, 1);

        assertThat(channel.isInRange(1 + 1e-12)).isTrue();
        assertThat(channel.isInRange(-1e-12)).isTrue();
        assertThat(channel.isInRange(1.001)).isFalse();
    }

    @Test
    void linearChannel_requiresPercent_impliesConventionallyPercent() {
        LinearChannel channel = LinearChannel.builder().name("saturation").min(0).max(100).requiresPercent(true).build();

        assertThat(channel.isConventionallyPercent()).isTrue();
        assertThat(channel.getAssociatedUnit()).isEqualTo("%");
    }
}
