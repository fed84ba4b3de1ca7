package me.internalizable.sessionhub.servermanager.poll;

import java.util.concurrent.CancellationException;

/**
 * Raised through a {@link CancellablePoll} when polling stops before the
 * predicate became true, either on timeout or on an explicit cancel.
 */
public class PollingCancelledException extends CancellationException {

    private static final long serialVersionUID = 1L;

    public PollingCancelledException() {
        super("Polling cancelled");
    }
}
