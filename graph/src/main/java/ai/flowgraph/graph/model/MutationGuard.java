package ai.flowgraph.graph.model;

import ai.flowgraph.graph.exceptions.ReentrancyViolationException;

/**
 * Rejects store mutations issued from inside change-notification callbacks.
 */
public final class MutationGuard {
    private int dispatchDepth = 0;

    public void checkMutable(String operation) throws ReentrancyViolationException {
        if (dispatchDepth > 0) {
            throw new ReentrancyViolationException(
                "Cannot " + operation + " while change notifications are being dispatched");
        }
    }

    public void dispatch(Runnable notification) {
        dispatchDepth++;
        try {
            notification.run();
        } finally {
            dispatchDepth--;
        }
    }

    public boolean isDispatching() {
        return dispatchDepth > 0;
    }
}
