/*
 * MaxiCP is under MIT License
 * Copyright (c)  2023 UCLouvain
 */

package org.tinycsp.util.exception;

/**
 * Internal fault: an attempt to assign a variable to a value
 * that is not in its current domain.
 * A correct search never raises it.
 */
public class ValueOutOfDomainException extends IllegalStateException {

    private static final long serialVersionUID = 7731538127419822147L;

    public ValueOutOfDomainException(String variable, int value) {
        super(String.format("value %d is not in the domain of %s", value, variable));
    }
}
