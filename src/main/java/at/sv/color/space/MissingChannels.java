package at.sv.color.space;

import lombok.Builder;
import lombok.Getter;

/**
 * Which perceptual channels were missing in the color a conversion started from, so that the analogous channels of
 * the destination color can be marked missing again.
 */
@Getter
@Builder(toBuilder = true)
final class MissingChannels {

    static final MissingChannels NONE = builder().build();

    private final boolean missingLightness;
    private final boolean missingChroma;
    private final boolean missingHue;
    private final boolean missingA;
    private final boolean missingB;
}
