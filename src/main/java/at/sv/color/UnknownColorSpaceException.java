package at.sv.color;

import lombok.Getter;

@Getter
public final class UnknownColorSpaceException extends ColorException {

    private final String spaceName;

    public UnknownColorSpaceException(String spaceName) {
        super("Unknown color space \"" + spaceName + "\".");
        this.spaceName = spaceName;
    }
}
