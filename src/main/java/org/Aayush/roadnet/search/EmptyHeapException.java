package org.Aayush.roadnet.search;

/**
 * Thrown when attempting to poll an empty {@link NodeHeap}.
 */
public class EmptyHeapException extends IllegalStateException {
    public EmptyHeapException(String message) {
        super(message);
    }
}
