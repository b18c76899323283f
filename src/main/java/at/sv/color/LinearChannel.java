package at.sv.color;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.jetbrains.annotations.Nullable;

/**
 * A color channel with a linear (as opposed to polar) value.
 * <p>
 * {@link #getMin()} and {@link #getMax()} are reference bounds: they define what 100% means and what counts as
 * in-gamut for bounded color spaces. Unless the space is strictly bounded, values outside of them are still valid.
 */
@Getter
@EqualsAndHashCode(callSuper = true)
public final class LinearChannel extends ColorChannel {

    private final double min;
    private final double max;
    /**
     * Whether values must be given with unit {@code %}, forbidding unitless numbers.
     */
    private final boolean requiresPercent;
    /**
     * Whether values below {@link #min} are clamped by the legacy color functions.
     */
    private final boolean lowerClamped;
    /**
     * Whether values above {@link #max} are clamped by the legacy color functions.
     */
    private final boolean upperClamped;
    private final boolean conventionallyPercent;

    @Builder
    private LinearChannel(String name, double min, double max, boolean requiresPercent, boolean lowerClamped,
                          boolean upperClamped, boolean conventionallyPercent) {
        super(name, false);
        this.min = min;
        this.max = max;
        this.requiresPercent = requiresPercent;
        this.lowerClamped = lowerClamped;
        this.upperClamped = upperClamped;
        this.conventionallyPercent = conventionallyPercent || requiresPercent;
    }

    public static LinearChannel of(String name, double min, double max) {
        return builder().name(name).min(min).max(max).build();
    }

    @Override
    public @Nullable String getAssociatedUnit() {
        return conventionallyPercent ? "%" : null;
    }

    /**
     * Clamps the given value into [min, max]. NaN resolves to min.
     */
    public double clamp(double value) {
        return FuzzyMath.clampLikeCss(value, min, max);
    }

    public boolean isInRange(double value) {
        return FuzzyMath.fuzzyInRange(value, min, max);
    }
}
