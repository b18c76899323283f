package at.sv.color.cli;

import at.sv.color.Color;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * The JSON representation of a color printed by {@code --json}. Missing channels and alpha are {@code null}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ColorView(String space, List<Double> channels, Double alpha, String css, boolean inGamut) {

    public static ColorView of(Color color) {
        return new ColorView(color.getSpace().getName(), color.getChannelsOrNull(), color.getAlphaOrNull(),
                color.toString(), color.isInGamut());
    }
}
