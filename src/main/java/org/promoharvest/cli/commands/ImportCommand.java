package org.promoharvest.cli.commands;

import com.typesafe.config.ConfigFactory;
import org.promoharvest.cli.CommandLineInterface;
import org.promoharvest.pipeline.api.services.IService;
import org.promoharvest.pipeline.services.CatalogImportService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "import",
    description = "Pushes the merged record log to the catalog webhook."
)
public class ImportCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = "--dry-run", description = "Read and count records without sending them.")
    private boolean dryRun;

    @Option(names = "--batch-size", description = "Records per submission.")
    private Integer batchSize;

    @Override
    public Integer call() throws Exception {
        final Map<String, Object> overrides = new HashMap<>();
        if (dryRun) {
            overrides.put("dryRun", true);
        }
        if (batchSize != null) {
            overrides.put("batchSize", batchSize);
        }
        final CatalogImportService service = parent.createFactory()
            .service("catalogImport", CatalogImportService.class, ConfigFactory.parseMap(overrides));
        service.start();
        service.awaitTermination(0);

        final PrintWriter out = spec.commandLine().getOut();
        out.printf("%s%d accepted, %d rejected, %d skipped%n", dryRun ? "Dry run: " : "",
            service.getAccepted(), service.getRejected(), service.getSkipped());
        out.flush();
        if (service.getCurrentState() == IService.State.ERROR) {
            return 1;
        }
        return 0;
    }
}
