package migrator.governor;

import migrator.remote.RemoteServiceException;

/**
 * A single call to the remote service, run (and possibly re-run) by {@link RateGovernor#executeWithRetry(RemoteCall)}.
 *
 * @param <T> Result type.
 */
@FunctionalInterface
public interface RemoteCall<T> {

    T execute() throws RemoteServiceException;
}
