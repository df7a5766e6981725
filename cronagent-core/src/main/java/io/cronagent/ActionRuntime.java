package io.cronagent;

import io.cronagent.core.ActionResult;
import io.cronagent.core.JobPayload;

/**
 * The external collaborator that performs a job's payload (for example an agent turn whose reply is
 * delivered to a chat channel). The scheduler calls it from a worker thread and records the result.
 *
 * <p>Returning {@link ActionResult#failure(String)} and throwing are equivalent: both are recorded as
 * an error run. Implementations should respond to thread interruption, which is how a run that exceeds
 * the configured maximum duration is cancelled.
 */
@FunctionalInterface
public interface ActionRuntime {

    ActionResult execute(JobPayload payload) throws Exception;
}
