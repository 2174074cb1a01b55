package org.promoharvest.cli;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CommandLineInterfaceTest {

    @Test
    void commandLine_registersAllSubcommands() {
        CommandLine cmd = CommandLineInterface.newCommandLine();

        assertThat(cmd.getCommandName()).isEqualTo("promoharvest");
        assertThat(cmd.getSubcommands()).containsKeys("ingest", "repair", "merge", "import", "status", "help");
    }

    @Test
    void version_printsVersionAndExitsZero() {
        CommandLine cmd = CommandLineInterface.newCommandLine();
        StringWriter out = new StringWriter();
        cmd.setOut(new PrintWriter(out));

        int exitCode = cmd.execute("--version");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("promoharvest 0.1.0");
    }

    @Test
    void unknownOption_isUsageError() {
        CommandLine cmd = CommandLineInterface.newCommandLine();
        cmd.setErr(new PrintWriter(new StringWriter()));

        assertThat(cmd.execute("status", "--bogus")).isEqualTo(2);
    }
}
