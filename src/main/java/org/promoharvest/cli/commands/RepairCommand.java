package org.promoharvest.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValueFactory;
import org.promoharvest.cli.CommandLineInterface;
import org.promoharvest.cli.PipelineFactory;
import org.promoharvest.pipeline.api.records.DuplicatePolicy;
import org.promoharvest.pipeline.resources.storage.RecordLogRepairer;
import org.promoharvest.pipeline.resources.storage.RepairReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(
    name = "repair",
    description = "Removes corrupt and duplicate lines from the record log and rewrites its checkpoint."
)
public class RepairCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = "--validate", description = "Only rewrite the log when it is damaged; otherwise refresh the checkpoint.")
    private boolean validateOnly;

    @Option(names = "--keep-last", description = "Keep the last occurrence of a duplicate identity instead of the first.")
    private boolean keepLast;

    @Option(names = "--no-backup", description = "Do not copy the log to <log>.bak before rewriting.")
    private boolean noBackup;

    @Parameters(index = "0", arity = "0..1", paramLabel = "LOG", description = "Record log to repair (default: configured log).")
    private String recordLog;

    @Override
    public Integer call() throws Exception {
        final RecordLogRepairer repairer = createRepairer();
        final PrintWriter out = spec.commandLine().getOut();
        final RepairReport report;
        if (validateOnly) {
            report = repairer.validate();
        } else {
            report = repairer.repair(DuplicatePolicy.fromFlag(keepLast), !noBackup);
        }
        out.printf("%s: %d lines, %d documents, %d valid, %d invalid, %d duplicates, %d kept%n",
            repairer.getRecordLog(), report.totalLines(), report.documents(), report.valid(), report.invalid(),
            report.duplicates(), report.survivors());
        out.println(report.repaired() ? "Log rewritten" : "Log unchanged");
        out.flush();
        return 0;
    }

    private RecordLogRepairer createRepairer() {
        final PipelineFactory factory = parent.createFactory();
        if (recordLog == null) {
            return factory.resource("repairer", RecordLogRepairer.class);
        }
        final Config block = factory.pipelineConfig().getConfig("resources.repairer")
            .withValue("options.recordLog", ConfigValueFactory.fromAnyRef(recordLog));
        return PipelineFactory.create("repairer", RecordLogRepairer.class, block);
    }
}
