package de.mirkosertic.naivecmp;

/**
 * Signals a defect in tree construction or index usage, never an external condition.
 */
public class InternalConsistencyException extends IllegalStateException {

    public InternalConsistencyException(final String message) {
        super(message);
    }
}
