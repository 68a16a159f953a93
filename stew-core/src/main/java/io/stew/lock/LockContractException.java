package io.stew.lock;

import io.stew.core.StewException;

/**
 * Thrown when lock lifecycle calls arrive out of order, e.g. an unlock without a
 * matching lock or a release hook while nothing is held.
 */
public class LockContractException extends StewException {

    public LockContractException(String message) {
        super(message);
    }
}
