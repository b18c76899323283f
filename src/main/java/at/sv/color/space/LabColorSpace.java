package at.sv.color.space;

import at.sv.color.Color;
import at.sv.color.LinearChannel;

import java.util.List;

import static at.sv.color.space.ColorSpaceUtils.LAB_EPSILON;
import static at.sv.color.space.ColorSpaceUtils.LAB_KAPPA;
import static at.sv.color.space.ColorSpaceUtils.labToLch;
import static at.sv.color.space.ColorSpaceUtils.orZero;
import static at.sv.color.space.ConversionMatrices.D50;

/**
 * <a href="https://www.w3.org/TR/css-color-4/#cie-lab">CIE Lab</a>, relative to D50.
 */
final class LabColorSpace extends ColorSpace {

    LabColorSpace() {
        super("lab", List.of(
                LinearChannel.builder().name("lightness").min(0).max(100)
                             .lowerClamped(true).upperClamped(true).conventionallyPercent(true).build(),
                LinearChannel.of("a", -125, 125),
                LinearChannel.of("b", -125, 125)));
    }

    @Override
    public boolean isBounded() {
        return false;
    }

    @Override
    Color convert(ColorSpace dest, Double lightness, Double a, Double b, Double alpha, MissingChannels missing) {
        if (dest == LCH) {
            return labToLch(dest, lightness, a, b, alpha, missing);
        } else if (dest == LAB) {
            return Color.lab(missing.isMissingLightness() ? null : lightness,
                    missing.isMissingA() ? null : a,
                    missing.isMissingB() ? null : b,
                    alpha);
        }

        double lightnessValue = orZero(lightness);
        double f1 = (lightnessValue + 16) / 116;
        double x = fToXorZ(orZero(a) / 500 + f1) * D50[0];
        double y = (lightnessValue > LAB_KAPPA * LAB_EPSILON
                ? Math.pow((lightnessValue + 16) / 116, 3)
                : lightnessValue / LAB_KAPPA) * D50[1];
        double z = fToXorZ(f1 - orZero(b) / 200) * D50[2];

        return XYZ_D50.convert(dest, x, y, z, alpha,
                missing.toBuilder()
                       .missingLightness(missing.isMissingLightness() || lightness == null)
                       .missingA(missing.isMissingA() || a == null)
                       .missingB(missing.isMissingB() || b == null)
                       .build());
    }

    private static double fToXorZ(double component) {
        double cubed = component * component * component;
        return cubed > LAB_EPSILON ? cubed : (116 * component - 16) / LAB_KAPPA;
    }
}
