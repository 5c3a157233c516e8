package org.procsim.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.procsim.cli.CommandLineInterface;
import org.procsim.node.SimulationNode;
import org.procsim.node.api.resources.records.IRecordStore;
import org.procsim.node.api.resources.records.LifecycleRecord;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "records",
    description = "Inspect and maintain persisted instance records"
)
public class RecordsCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    @Command(name = "list", description = "Print all persisted records as JSON")
    int list(
            @Option(names = {"-k", "--class"}, description = "Only records of this simulator type") String className) {
        PrintWriter out = spec.commandLine().getOut();
        try {
            IRecordStore store = SimulationNode.createStore(parent.getConfig());
            List<Map<String, Object>> result = new ArrayList<>();
            for (String id : store.keys()) {
                LifecycleRecord record = store.getItem(id);
                if (className != null && !className.equals(record.className())) {
                    continue;
                }
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("id", record.id());
                entry.put("className", record.className());
                entry.put("args", record.args());
                result.add(entry);
            }
            Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();
            out.println(gson.toJson(result));
            out.flush();
            return 0;
        } catch (IOException | RuntimeException e) {
            spec.commandLine().getErr().println("Error reading records: " + e.getMessage());
            return 1;
        }
    }

    @Command(name = "remove", description = "Delete persisted records so they are not restored")
    int remove(@Parameters(paramLabel = "ID", arity = "1..*", description = "Instance ids to remove") List<String> ids) {
        PrintWriter out = spec.commandLine().getOut();
        int failures = 0;
        IRecordStore store;
        try {
            store = SimulationNode.createStore(parent.getConfig());
        } catch (RuntimeException e) {
            spec.commandLine().getErr().println("Error opening record store: " + e.getMessage());
            return 1;
        }
        for (String id : ids) {
            try {
                store.removeItem(id);
                out.println("Removed " + id);
            } catch (IOException | RuntimeException e) {
                failures++;
                spec.commandLine().getErr().println("Failed to remove " + id + ": " + e.getMessage());
            }
        }
        out.flush();
        return failures == 0 ? 0 : 1;
    }
}
