package at.sv.color;

/**
 * Base class of the errors raised for invalid color input, e.g. unknown names.
 */
public class ColorException extends RuntimeException {
    public ColorException(String message) {
        super(message);
    }
}
