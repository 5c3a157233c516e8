package org.procsim.cli.commands;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.procsim.node.SimulationNode;
import org.procsim.node.persistence.RestoreReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

@Command(
    name = "run",
    description = "Start the node, restore persisted instances and keep simulating until stopped"
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(NodeRunCommand.class);

    @Option(
        names = {"-d", "--duration"},
        description = "Stop automatically after this many seconds (default: run until interrupted)"
    )
    private long durationSeconds = 0;

    @ParentCommand
    private NodeCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        Config config = parent.getParent().getConfig();

        SimulationNode node = new SimulationNode(config);
        CountDownLatch shutdownSignal = new CountDownLatch(1);
        AtomicBoolean closed = new AtomicBoolean(false);
        Runnable closeOnce = () -> {
            if (closed.compareAndSet(false, true)) {
                node.close();
            }
        };

        Thread shutdownHook = new Thread(() -> {
            shutdownSignal.countDown();
            closeOnce.run();
        }, "procsim-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            RestoreReport report = node.start();
            spec.commandLine().getOut().printf("Node ready: %d instance(s) running, %d restored, %d broken record(s) purged%n",
                    node.getRegistry().size(), report.restored().size(), report.purged().size());
            spec.commandLine().getOut().flush();

            if (durationSeconds > 0) {
                shutdownSignal.await(durationSeconds, TimeUnit.SECONDS);
            } else {
                shutdownSignal.await();
            }
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Node run interrupted");
            return 1;
        } finally {
            closeOnce.run();
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                log.debug("JVM is already shutting down");
            }
        }
    }
}
