package com.dbprobe.prober.cli;

import com.dbprobe.prober.DbProbeCli;
import com.dbprobe.prober.connect.ConfiguredAlias;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "connections",
        description = "List configured database aliases and their types",
        mixinStandardHelpOptions = true
)
public class ConnectionsCommand implements Callable<Integer> {

    @ParentCommand
    private DbProbeCli parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<ConfiguredAlias> aliases = parent.connections().listAvailable();
        if (aliases.isEmpty()) {
            out.println(VerifyConnectionsCommand.NOTHING_CONFIGURED);
        }
        for (ConfiguredAlias alias : aliases) {
            out.println(String.format("%-20s %s", alias.alias(), alias.dialect()));
        }
        out.flush();
        return 0;
    }
}
