package at.sv.color.gamut;

import at.sv.color.Color;
import at.sv.color.space.ColorSpace;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClipGamutMapTest {

    @Test
    void clip_rgb() {
        Color clipped = Color.rgb(300.0, -10.0, 128.0, 0.5).toGamut(GamutMapMethod.CLIP);

        assertThat(clipped).isEqualTo(Color.rgb(255.0, 0.0, 128.0, 0.5));
        assertThat(clipped).hasToString("rgba(255, 0, 128, 0.5)");
    }

    @Test
    void clip_keepsMissingChannelsAndAlpha() {
        Color clipped = GamutMapMethod.CLIP.map(Color.forSpace(ColorSpace.SRGB, null, 1.5, -0.5, null));

        assertThat(clipped.isChannel0Missing()).isTrue();
        assertThat(clipped.getChannel1()).isEqualTo(1);
        assertThat(clipped.getChannel2()).isZero();
        assertThat(clipped.isAlphaMissing()).isTrue();
    }

    @Test
    void clip_leavesHueUntouched() {
        Color clipped = GamutMapMethod.CLIP.map(Color.hsl(200.0, 150.0, -20.0));

        assertThat(clipped.getChannel0()).isEqualTo(200);
        assertThat(clipped.getChannel1()).isEqualTo(100);
        assertThat(clipped.getChannel2()).isZero();
    }

    @Test
    void clip_nan_becomesMin() {
        Color clipped = GamutMapMethod.CLIP.map(Color.srgb(Double.NaN, 0.5, 0.5));

        assertThat(clipped.getChannel0()).isZero();
    }

    @Test
    void clip_isIdempotent() {
        Color once = Color.forSpace(ColorSpace.REC2020, 1.3, 0.2, -0.1).toGamut(GamutMapMethod.CLIP);

        assertThat(once.toGamut(GamutMapMethod.CLIP)).isSameAs(once);
    }
}
