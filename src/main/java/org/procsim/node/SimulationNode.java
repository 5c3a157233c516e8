package org.procsim.node;

import java.io.File;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.procsim.node.api.resources.records.IRecordStore;
import org.procsim.node.persistence.InstancePersistor;
import org.procsim.node.persistence.RestoreReport;
import org.procsim.node.registry.InstanceCreationException;
import org.procsim.node.registry.InstanceRegistry;
import org.procsim.node.resources.records.FileSystemRecordStore;
import org.procsim.node.resources.records.InMemoryRecordStore;
import org.procsim.runtime.api.SimulationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * A running process-simulation node: one record store, one instance registry and the
 * persistor that connects them.
 * <p>
 * {@link #start()} subscribes the persistor, restores every persisted instance and then
 * creates the bootstrap instances declared under {@code node.instances} that do not exist
 * yet. {@link #close()} stops all instances (keeping their records), drains pending
 * record writes and closes the store.
 */
public class SimulationNode implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulationNode.class);

    private final Config config;
    private final IRecordStore store;
    private final InstanceRegistry registry;
    private final InstancePersistor persistor;
    private volatile boolean ready = false;

    /**
     * Builds a node from the root configuration (sections {@code node}, {@code simulation}
     * and {@code persistence}).
     */
    public SimulationNode(Config rootConfig) {
        this(rootConfig, SimulationContext.fromConfig(section(rootConfig, "simulation")));
    }

    public SimulationNode(Config rootConfig, SimulationContext context) {
        this.config = rootConfig;
        Config nodeConfig = section(rootConfig, "node");
        Config persistenceConfig = section(rootConfig, "persistence");

        log.info("\u001B[34m========== Node Initialization ==========\u001B[0m");
        this.store = createStoreOrFallback(persistenceConfig, agentName(nodeConfig));
        this.registry = new InstanceRegistry(context);
        if (nodeConfig.hasPath("simulators")) {
            registry.registerAll(nodeConfig.getConfig("simulators"));
        }
        this.persistor = new InstancePersistor(store, registry, persistenceConfig);
    }

    /**
     * Restores persisted instances and creates missing bootstrap instances.
     *
     * @return the restore outcome.
     * @throws InterruptedException if interrupted while restoring.
     */
    public RestoreReport start() throws InterruptedException {
        log.info("\u001B[34m========== Restoring Instances ==========\u001B[0m");
        if (!persistor.initialize()) {
            log.warn("Continuing without persistence, instances will not survive a restart");
        }
        RestoreReport report = persistor.restore();
        createBootstrapInstances();
        ready = true;
        log.info("Node '{}' ready with {} instance(s)", agentName(section(config, "node")), registry.size());
        return report;
    }

    private void createBootstrapInstances() {
        Config nodeConfig = section(config, "node");
        if (!nodeConfig.hasPath("instances")) {
            return;
        }
        for (Config instance : nodeConfig.getConfigList("instances")) {
            String id = instance.hasPath("id") ? instance.getString("id") : null;
            String className = instance.getString("className");
            if (id != null && registry.contains(id)) {
                log.debug("Bootstrap instance '{}' already restored", id);
                continue;
            }
            List<Object> args = instance.hasPath("args")
                    ? new ArrayList<>(instance.getList("args").unwrapped())
                    : List.of();
            try {
                registry.create(className, args, id);
            } catch (InstanceCreationException e) {
                log.error("Failed to create bootstrap instance '{}' ({}): {}", id, className, e.getMessage());
            }
        }
    }

    public boolean isReady() {
        return ready;
    }

    public InstanceRegistry getRegistry() {
        return registry;
    }

    public InstancePersistor getPersistor() {
        return persistor;
    }

    public IRecordStore getStore() {
        return store;
    }

    @Override
    public void close() {
        log.info("\u001B[34m========== Node Shutdown ==========\u001B[0m");
        ready = false;
        registry.shutdown();
        persistor.close();
        if (store instanceof AutoCloseable closeable) {
            try {
                closeable.close();
                log.info("Closed record store: {}", store.getResourceName());
            } catch (Exception e) {
                log.error("Failed to close record store '{}': {}", store.getResourceName(), e.getMessage());
            }
        }
    }

    /**
     * Instantiates the record store of a root configuration without starting a node,
     * e.g. for inspecting records from the command line.
     *
     * @throws IllegalStateException if the store cannot be created.
     */
    public static IRecordStore createStore(Config rootConfig) {
        return instantiateStore(section(rootConfig, "persistence"), agentName(section(rootConfig, "node")));
    }

    private static IRecordStore createStoreOrFallback(Config persistenceConfig, String agentName) {
        try {
            return instantiateStore(persistenceConfig, agentName);
        } catch (IllegalStateException e) {
            log.error("{}. Continuing with an in-memory record store, instances will not survive a restart.", e.getMessage());
            return new InMemoryRecordStore("instance-records", ConfigFactory.empty());
        }
    }

    /**
     * Instantiates the record store named in {@code persistence.store} through its
     * {@code (String name, Config options)} constructor. A file system store without a
     * {@code rootDirectory} is placed under {@code <java.io.tmpdir>/<agent name>}.
     */
    static IRecordStore instantiateStore(Config persistenceConfig, String agentName) {
        Config storeConfig = persistenceConfig.hasPath("store") ? persistenceConfig.getConfig("store") : ConfigFactory.empty();
        String className = storeConfig.hasPath("className")
                ? storeConfig.getString("className")
                : FileSystemRecordStore.class.getName();
        String name = storeConfig.hasPath("name") ? storeConfig.getString("name") : "instance-records";
        Config options = storeConfig.hasPath("options") ? storeConfig.getConfig("options") : ConfigFactory.empty();
        if (!options.hasPath("rootDirectory")) {
            String defaultDir = new File(System.getProperty("java.io.tmpdir"), agentName).getAbsolutePath();
            options = options.withFallback(ConfigFactory.parseMap(Map.of("rootDirectory", defaultDir)));
        }

        try {
            IRecordStore store = (IRecordStore) Class.forName(className)
                    .getConstructor(String.class, Config.class)
                    .newInstance(name, options);
            if (store instanceof FileSystemRecordStore fileStore) {
                log.info("Persisting to: {}", fileStore.getRootDirectory().getAbsolutePath());
            } else {
                log.info("Instantiated record store '{}' of type {}", name, className);
            }
            return store;
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String errorMsg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            throw new IllegalStateException("Failed to instantiate record store '" + name + "': " + errorMsg, e);
        }
    }

    private static String agentName(Config nodeConfig) {
        return nodeConfig.hasPath("agent") ? nodeConfig.getString("agent") : "Process Simulations";
    }

    private static Config section(Config rootConfig, String path) {
        return rootConfig.hasPath(path) ? rootConfig.getConfig(path) : ConfigFactory.empty();
    }
}
