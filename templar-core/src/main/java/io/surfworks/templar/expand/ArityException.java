package io.surfworks.templar.expand;

import java.util.Locale;

/**
 * Thrown when a call site supplies more actual inputs or outputs than the
 * function declares.
 *
 * <p>Nothing is appended to the target graph when this is thrown.
 */
public class ArityException extends RuntimeException {

    public enum Direction {
        INPUT,
        OUTPUT;

        String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Direction direction;
    private final String nodeName;
    private final int formalCount;
    private final int actualCount;

    public ArityException(Direction direction, String nodeName, int formalCount, int actualCount) {
        super(String.format("%s for function node %s is out of bounds: %d actual, %d formal",
                capitalize(direction.label()), nodeName, actualCount, formalCount));
        this.direction = direction;
        this.nodeName = nodeName;
        this.formalCount = formalCount;
        this.actualCount = actualCount;
    }

    /**
     * Used in strict mode, when the body references a formal the call site left unbound.
     */
    public ArityException(Direction direction, String nodeName, String formalName, int formalCount, int actualCount) {
        super(String.format("Function node %s leaves formal %s '%s' unbound but the body references it: %d actual, %d formal",
                nodeName, direction.label(), formalName, actualCount, formalCount));
        this.direction = direction;
        this.nodeName = nodeName;
        this.formalCount = formalCount;
        this.actualCount = actualCount;
    }

    public Direction getDirection() {
        return direction;
    }

    public String getNodeName() {
        return nodeName;
    }

    public int getFormalCount() {
        return formalCount;
    }

    public int getActualCount() {
        return actualCount;
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
