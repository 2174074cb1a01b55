package org.promoharvest.cli.commands;

import com.typesafe.config.Config;
import org.promoharvest.cli.CommandLineInterface;
import org.promoharvest.cli.RunLock;
import org.promoharvest.pipeline.resources.storage.AtomicFiles;
import org.promoharvest.pipeline.resources.storage.CheckpointStore;
import org.promoharvest.pipeline.resources.storage.FailedIdentityLedger;
import org.promoharvest.pipeline.services.ProgressReporter;
import org.promoharvest.pipeline.utils.PathExpansion;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Prints the state files next to the record log. Reads only; never creates anything.
 */
@Command(
    name = "status",
    description = "Shows progress, heartbeat, resume point and failed identities of the last run."
)
public class StatusCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getConfig();
        if (!config.hasPath("pipeline.recordLog")) {
            throw new IllegalArgumentException("Configuration has no 'pipeline.recordLog'");
        }
        final Path recordLog = PathExpansion.resolve(config.getString("pipeline.recordLog"));
        final PrintWriter out = spec.commandLine().getOut();

        out.printf("Record log: %s (%s)%n", recordLog, Files.isRegularFile(recordLog) ? "present" : "missing");

        final Optional<Map<String, Object>> progress =
            ProgressReporter.read(AtomicFiles.sibling(recordLog, ProgressReporter.PROGRESS_SUFFIX));
        if (progress.isPresent()) {
            final Map<String, Object> p = progress.get();
            out.printf("Status: %s at %s%n", p.get("status"), p.get("timestamp"));
            out.printf("Progress: %s/%s processed, %s succeeded, %s failed, %s empty, %s skipped, %s deferred%n",
                p.get("processed"), p.get("total"), p.get("succeeded"), p.get("failed"), p.get("empty"),
                p.get("skipped"), p.get("deferred"));
            out.printf("Rate: %s/min, last identity %s%n", p.get("rate_per_minute"), p.get("last_identity"));
        } else {
            out.println("Status: no run recorded");
        }

        ProgressReporter.read(AtomicFiles.sibling(recordLog, ProgressReporter.HEARTBEAT_SUFFIX))
            .ifPresent(h -> out.printf("Heartbeat: %s at %s (%s)%n", h.get("status"), h.get("timestamp"), h.get("message")));

        final CheckpointStore checkpoints = new CheckpointStore(recordLog);
        checkpoints.readResumePoint().ifPresent(r ->
            out.printf("Resume point: after '%s' (%d attempted)%n", r.lastAttemptedIdentity(), r.attempted()));
        checkpoints.readCheckpoint().ifPresent(c ->
            out.printf("Checkpoint: '%s' at line %d%n", c.lastValidIdentity(), c.lastValidLine()));

        final int failed = new FailedIdentityLedger(recordLog).load().size();
        out.printf("Failed identities: %d%n", failed);

        final Path lock = AtomicFiles.sibling(recordLog, RunLock.SUFFIX);
        if (Files.exists(lock)) {
            out.printf("Locked by PID %s%n", Files.readString(lock).trim());
        }
        out.flush();
        return 0;
    }
}
