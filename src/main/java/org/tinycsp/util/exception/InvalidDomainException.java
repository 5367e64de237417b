/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.util.exception;

/**
 * Raised at model-building time when a variable is declared
 * with malformed bounds ({@code lower > upper}), too many values
 * or an empty set of values.
 */
public class InvalidDomainException extends IllegalArgumentException {

    private static final long serialVersionUID = -4206323870452912264L;

    private final int lower;
    private final int upper;

    public InvalidDomainException(int lower, int upper) {
        super(String.format("invalid domain [%d, %d]: lower bound exceeds upper bound", lower, upper));
        this.lower = lower;
        this.upper = upper;
    }

    public InvalidDomainException(int lower, int upper, String reason) {
        super(String.format("invalid domain [%d, %d]: %s", lower, upper, reason));
        this.lower = lower;
        this.upper = upper;
    }

    public InvalidDomainException(String message) {
        super(message);
        this.lower = 0;
        this.upper = -1;
    }

    public int getLower() {
        return lower;
    }

    public int getUpper() {
        return upper;
    }
}
