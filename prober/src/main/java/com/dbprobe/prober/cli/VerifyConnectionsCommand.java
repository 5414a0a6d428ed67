package com.dbprobe.prober.cli;

import com.dbprobe.prober.DbProbeCli;
import com.dbprobe.prober.connect.ConfiguredAlias;
import com.dbprobe.prober.connect.ConnectionVerifier;
import com.dbprobe.prober.connect.VerificationResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

@Command(
        name = "verify-connections",
        description = "Open each configured database and run a ping query",
        mixinStandardHelpOptions = true
)
public class VerifyConnectionsCommand implements Callable<Integer> {
    static final String NOTHING_CONFIGURED =
            "No database connections configured (expected <ALIAS>_TYPE, _HOST, _DSN or _URL variables).";

    @ParentCommand
    private DbProbeCli parent;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "0..*", paramLabel = "ALIAS", description = "Aliases to verify (default: all configured)")
    private List<String> aliases = new ArrayList<>();

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        List<ConfiguredAlias> available = parent.connections().listAvailable();
        if (available.isEmpty()) {
            out.println(NOTHING_CONFIGURED);
            out.flush();
            return 1;
        }

        List<ConfiguredAlias> selected = new ArrayList<>(available);
        if (!aliases.isEmpty()) {
            Map<String, ConfiguredAlias> byName = new LinkedHashMap<>();
            available.forEach(alias -> byName.put(alias.alias(), alias));
            TreeSet<String> unknown = new TreeSet<>();
            selected.clear();
            for (String requested : aliases) {
                String name = requested.trim().toUpperCase(Locale.ROOT);
                if (name.isEmpty()) {
                    continue;
                }
                ConfiguredAlias alias = byName.get(name);
                if (alias == null) {
                    unknown.add(name);
                } else if (!selected.contains(alias)) {
                    selected.add(alias);
                }
            }
            if (!unknown.isEmpty()) {
                out.println("Unknown alias(es): " + String.join(", ", unknown));
                out.println("Available: " + available.stream().map(ConfiguredAlias::alias).collect(Collectors.joining(", ")));
                out.flush();
                return 1;
            }
        }

        ConnectionVerifier verifier = parent.verifier();
        out.println("Verifying " + selected.size() + " connection(s)...");
        out.println();
        out.flush();

        int failed = 0;
        for (VerificationResult result : verifier.verify(selected)) {
            if (result.ok()) {
                out.println(String.format("  OK   %-20s (%s)", result.alias(), result.dialect()));
            } else {
                failed++;
                out.println(String.format("  FAIL %-20s (%s): %s", result.alias(), result.dialect(), result.error()));
            }
        }
        out.println();
        out.println("Result: " + (selected.size() - failed) + " OK, " + failed + " FAIL");
        out.flush();
        return failed == 0 ? 0 : 1;
    }
}
