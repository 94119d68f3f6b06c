package com.apidocs.generator.exception;

/**
 * A partial binding supplies more positional values than the callable declares.
 */
public class OverBoundArgSpecException extends DocGenerationException {

    private static final long serialVersionUID = 1L;
    private final int boundCount;
    private final int declaredCount;

    public OverBoundArgSpecException(int boundCount, int declaredCount) {
        super("Partial binding supplies " + boundCount + " positional values but only "
                + declaredCount + " named parameters remain");
        this.boundCount = boundCount;
        this.declaredCount = declaredCount;
    }

    public int getBoundCount() {
        return boundCount;
    }

    public int getDeclaredCount() {
        return declaredCount;
    }
}
