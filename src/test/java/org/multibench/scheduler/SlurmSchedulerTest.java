package org.multibench.scheduler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SlurmSchedulerTest {
    private final List<List<String>> commands = new ArrayList<>();

    @Test
    void submitParsesTheJobIdFromSbatchOutput() throws Exception {
        SlurmScheduler scheduler = scheduler(new CommandResult(0, "Submitted batch job 123456\n", ""));

        JobHandle handle = scheduler.submit(Path.of("/scratch/run/job.sh"));

        assertEquals("123456", handle.jobId());
        assertEquals(List.of(List.of("sbatch", "/scratch/run/job.sh")), commands);
    }

    @Test
    void rejectedSubmissionRaisesSubmissionException() {
        SlurmScheduler scheduler = scheduler(new CommandResult(1, "", "sbatch: error: invalid partition specified\n"));

        SubmissionException error = assertThrows(SubmissionException.class, () -> scheduler.submit(Path.of("job.sh")));

        assertTrue(error.getMessage().contains("exited with code 1"));
        assertTrue(error.getMessage().contains("invalid partition"));
    }

    @Test
    void outputWithoutJobIdIsMalformed() {
        SlurmScheduler scheduler = scheduler(new CommandResult(0, "queued somewhere\n", ""));

        assertThrows(SubmissionException.class, () -> scheduler.submit(Path.of("job.sh")));
    }

    @Test
    void sbatchThatCannotStartIsASubmissionFailure() {
        SlurmScheduler scheduler = new SlurmScheduler((command, timeout) -> {
            throw new IOException("No such file or directory");
        }, Duration.ofSeconds(1));

        SubmissionException error = assertThrows(SubmissionException.class, () -> scheduler.submit(Path.of("job.sh")));
        assertTrue(error.getMessage().contains("No such file or directory"));
    }

    @Test
    void statusesOfAllJobsComeFromOneSqueueCall() throws Exception {
        SlurmScheduler scheduler = scheduler(new CommandResult(0, "11 RUNNING\n12 PENDING\n", ""));
        Set<JobHandle> handles = handles("11", "12", "13");

        Map<JobHandle, RawJobStatus> statuses = scheduler.queryStatus(handles);

        assertEquals(1, commands.size());
        assertEquals(List.of("squeue", "-h", "-o", "%i %T", "-j", "11,12,13"), commands.get(0));
        assertEquals(RawJobStatus.RUNNING, statuses.get(new JobHandle("11")));
        assertEquals(RawJobStatus.PENDING, statuses.get(new JobHandle("12")));
        assertEquals(RawJobStatus.UNKNOWN, statuses.get(new JobHandle("13")));
    }

    @Test
    void jobsNoLongerQueuedAreUnknown() throws Exception {
        SlurmScheduler scheduler = scheduler(
                new CommandResult(1, "", "slurm_load_jobs error: " + SlurmScheduler.UNQUEUED_MESSAGE + "\n"));

        Map<JobHandle, RawJobStatus> statuses = scheduler.queryStatus(handles("21", "22"));

        assertEquals(Map.of(new JobHandle("21"), RawJobStatus.UNKNOWN, new JobHandle("22"), RawJobStatus.UNKNOWN), statuses);
    }

    @Test
    void otherSqueueFailuresRaiseQueryException() {
        SlurmScheduler scheduler = scheduler(new CommandResult(1, "", "slurm_load_jobs error: Socket timed out\n"));

        assertThrows(SchedulerQueryException.class, () -> scheduler.queryStatus(handles("1")));
    }

    @Test
    void emptyQueryDoesNotCallSqueue() throws Exception {
        SlurmScheduler scheduler = scheduler(new CommandResult(0, "", ""));

        assertTrue(scheduler.queryStatus(Set.of()).isEmpty());
        assertTrue(commands.isEmpty());
    }

    @Test
    void translatesSlurmStates() {
        assertEquals(RawJobStatus.PENDING, SlurmScheduler.translate("CONFIGURING"));
        assertEquals(RawJobStatus.RUNNING, SlurmScheduler.translate("COMPLETING"));
        assertEquals(RawJobStatus.COMPLETED, SlurmScheduler.translate("COMPLETED"));
        assertEquals(RawJobStatus.FAILED, SlurmScheduler.translate("TIMEOUT"));
        assertEquals(RawJobStatus.FAILED, SlurmScheduler.translate("CANCELLED by 1001"));
        assertEquals(RawJobStatus.UNKNOWN, SlurmScheduler.translate("SOMETHING_NEW"));
    }

    @Test
    void parseQueueSkipsBlankLines() {
        Map<String, RawJobStatus> parsed = SlurmScheduler.parseQueue("\n 5 RUNNING \n\n6 OUT_OF_MEMORY\n");

        assertEquals(Map.of("5", RawJobStatus.RUNNING, "6", RawJobStatus.FAILED), parsed);
    }

    @Test
    void cancelRunsScancel() throws Exception {
        SlurmScheduler scheduler = scheduler(new CommandResult(0, "", ""));

        scheduler.cancel(new JobHandle("77"));

        assertEquals(List.of(List.of("scancel", "77")), commands);
    }

    private SlurmScheduler scheduler(CommandResult result) {
        return new SlurmScheduler((command, timeout) -> {
            commands.add(command);
            return result;
        }, Duration.ofSeconds(5));
    }

    private static Set<JobHandle> handles(String... ids) {
        Set<JobHandle> handles = new LinkedHashSet<>();
        for (String id : ids) {
            handles.add(new JobHandle(id));
        }
        return handles;
    }
}
