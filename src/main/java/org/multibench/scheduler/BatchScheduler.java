package org.multibench.scheduler;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Narrow view of an external batch scheduler. The engine never runs jobs itself; it submits rendered scripts,
 * queries their state in batches and cancels them.
 */
public interface BatchScheduler {
    String name();

    JobHandle submit(Path script) throws SubmissionException;

    /**
     * Status of every requested handle in one request. Handles missing from the returned map are treated the same
     * as {@link RawJobStatus#UNKNOWN}.
     */
    Map<JobHandle, RawJobStatus> queryStatus(Set<JobHandle> handles) throws SchedulerQueryException;

    void cancel(JobHandle handle) throws SchedulerQueryException;
}
