package at.sv.color;

import lombok.Getter;

@Getter
public final class UnknownGamutMapMethodException extends ColorException {

    private final String methodName;

    public UnknownGamutMapMethodException(String methodName) {
        super("Unknown gamut map method \"" + methodName + "\".");
        this.methodName = methodName;
    }
}
