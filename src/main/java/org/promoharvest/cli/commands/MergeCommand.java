package org.promoharvest.cli.commands;

import org.promoharvest.cli.CommandLineInterface;
import org.promoharvest.cli.PipelineFactory;
import org.promoharvest.cli.RunLock;
import org.promoharvest.pipeline.api.records.DuplicatePolicy;
import org.promoharvest.pipeline.resources.storage.MergeReport;
import org.promoharvest.pipeline.resources.storage.RecordBatcher;
import org.promoharvest.pipeline.resources.storage.RecordLogRepairer;
import org.promoharvest.pipeline.resources.storage.RepairReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "merge",
    description = "Merges batch files into the record log without fetching."
)
public class MergeCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = "--keep-last", description = "Let later batches replace earlier records with the same identity.")
    private boolean keepLast;

    @Option(names = "--delete-batches", description = "Delete batch files after a successful merge.")
    private boolean deleteBatches;

    @Option(names = "--force", description = "Merge even if an ingest run appears to hold the lock.")
    private boolean force;

    @Override
    public Integer call() throws Exception {
        final PipelineFactory factory = parent.createFactory();
        final RecordBatcher batcher = factory.resource("batcher", RecordBatcher.class);
        final RecordLogRepairer repairer = factory.resource("repairer", RecordLogRepairer.class);
        final PrintWriter out = spec.commandLine().getOut();

        try (RunLock lock = RunLock.acquire(batcher.getRecordLog(), force)) {
            final MergeReport merged = batcher.merge(DuplicatePolicy.fromFlag(keepLast), deleteBatches);
            final RepairReport validated = repairer.validate();
            out.printf("Merged %d batch files into %s: %d records written, %d duplicates, %d anonymous, %d invalid%n",
                merged.batchFiles(), batcher.getRecordLog(), merged.written(), merged.duplicates(),
                merged.anonymous(), merged.invalid());
            out.printf("Checkpoint: last identity %s at line %d%n", validated.lastIdentity(), validated.survivors());
        } catch (RunLock.LockHeldException e) {
            spec.commandLine().getErr().println(e.getMessage());
            return 1;
        }
        out.flush();
        return 0;
    }
}
