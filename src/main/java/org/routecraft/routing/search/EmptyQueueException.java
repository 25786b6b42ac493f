package org.routecraft.routing.search;

/**
 * Raised by {@link OpenSetQueue} reads that need an entry while the open set is empty.
 */
public class EmptyQueueException extends IllegalStateException {
    public EmptyQueueException(String operation) {
        super("cannot " + operation + ": open set is empty");
    }
}
