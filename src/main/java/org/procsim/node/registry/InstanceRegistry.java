package org.procsim.node.registry;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.procsim.runtime.api.ISimulator;
import org.procsim.runtime.api.SimulationContext;
import org.procsim.runtime.api.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;

/**
 * Owns all live simulator instances of a node.
 * <p>
 * Simulator types are registered under a class tag (e.g. {@code "SiloSimulator"}) and
 * instantiated by reflection through their
 * {@code (String id, Config options, SimulationContext context)} constructor. The first
 * construction argument, if present, must be an object; it becomes the simulator's
 * options.
 * <p>
 * Creation and deletion are announced to {@link IInstanceLifecycleListener}s after the
 * registry state has changed. Creations and deletions are serialized together with their
 * notifications, so listeners always see an instance's creation before its deletion.
 * Listeners must therefore return quickly and must not block on other threads that
 * create or delete instances.
 */
public class InstanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    private final SimulationContext context;
    private final Map<String, Constructor<? extends ISimulator>> simulatorTypes = new ConcurrentHashMap<>();
    // Insertion-ordered so shutdown stops instances in creation order
    private final Map<String, ManagedInstance> instances = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<IInstanceLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final Object lifecycleLock = new Object();

    public InstanceRegistry(SimulationContext context) {
        this.context = context;
    }

    /**
     * Registers every simulator type of a {@code simulators} configuration block:
     * <pre>
     * simulators {
     *   EnergySimulator = "org.procsim.runtime.simulators.ConsumptionSimulator"
     *   SiloSimulator = "org.procsim.runtime.simulators.SiloSimulator"
     * }
     * </pre>
     * Types that cannot be loaded are logged and skipped.
     */
    public void registerAll(Config simulators) {
        for (String className : simulators.root().keySet()) {
            String implementation = null;
            try {
                implementation = simulators.getString(ConfigUtil.joinPath(className));
                Class<?> type = Class.forName(implementation);
                if (!ISimulator.class.isAssignableFrom(type)) {
                    log.error("Simulator type '{}' ({}) does not implement ISimulator. Skipping.", className, implementation);
                    continue;
                }
                register(className, type.asSubclass(ISimulator.class));
            } catch (ClassNotFoundException e) {
                log.error("Simulator class not found for '{}': {}", className, implementation);
            } catch (ConfigException | IllegalArgumentException e) {
                log.error("Failed to register simulator type '{}': {}", className, e.getMessage());
            }
        }
    }

    /**
     * Registers a simulator type under a class tag, replacing any previous registration.
     *
     * @throws IllegalArgumentException if the type lacks the required constructor.
     */
    public void register(String className, Class<? extends ISimulator> type) {
        try {
            Constructor<? extends ISimulator> constructor =
                    type.getConstructor(String.class, Config.class, SimulationContext.class);
            simulatorTypes.put(className, constructor);
            log.info("Registered simulator type '{}' of type {}", className, type.getName());
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("Simulator type " + type.getName()
                    + " has no (String, Config, SimulationContext) constructor", e);
        }
    }

    public Set<String> getSimulatorTypes() {
        return Collections.unmodifiableSet(simulatorTypes.keySet());
    }

    /**
     * Creates an instance with a generated id.
     *
     * @return the new instance id.
     * @throws InstanceCreationException if the instance cannot be created.
     */
    public String create(String className, List<Object> args) {
        return create(className, args, null);
    }

    /**
     * Creates an instance under an explicit id, as done when recreating persisted instances.
     *
     * @param id instance id, or {@code null} to generate one.
     * @return the instance id.
     * @throws InstanceCreationException if the class tag is unknown, the id is taken, the
     *                                   arguments are malformed or the constructor fails.
     */
    public String create(String className, List<Object> args, String id) {
        Constructor<? extends ISimulator> constructor = simulatorTypes.get(className);
        if (constructor == null) {
            throw new InstanceCreationException(String.format(
                    "Unknown simulator type '%s'. Registered types: %s", className, simulatorTypes.keySet()));
        }
        String instanceId = id != null ? id : UUID.randomUUID().toString();
        List<Object> safeArgs = args == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(args));

        synchronized (lifecycleLock) {
            ManagedInstance managed;
            synchronized (instances) {
                if (instances.containsKey(instanceId)) {
                    throw new InstanceCreationException("Instance '" + instanceId + "' already exists");
                }
                ISimulator simulator = instantiate(constructor, instanceId, className, safeArgs);
                managed = new ManagedInstance(instanceId, className, safeArgs, simulator);
                instances.put(instanceId, managed);
            }
            log.info("Created instance '{}' ({})", instanceId, className);
            notifyCreated(managed.toEvent());
        }
        return instanceId;
    }

    /**
     * Stops and removes an instance.
     *
     * @return {@code true} if the instance existed.
     */
    public boolean delete(String id) {
        synchronized (lifecycleLock) {
            ManagedInstance managed = instances.remove(id);
            if (managed == null) {
                return false;
            }
            managed.simulator().stop();
            log.info("Deleted instance '{}' ({})", id, managed.className());
            notifyDeleted(managed.toEvent());
            return true;
        }
    }

    private void notifyCreated(InstanceEvent event) {
        for (IInstanceLifecycleListener listener : listeners) {
            try {
                listener.onCreated(event);
            } catch (RuntimeException e) {
                log.warn("Lifecycle listener failed on creation of '{}' ({}): {}", event.id(), event.className(), e.getMessage());
                log.debug("Exception details:", e);
            }
        }
    }

    private void notifyDeleted(InstanceEvent event) {
        for (IInstanceLifecycleListener listener : listeners) {
            try {
                listener.onDeleted(event);
            } catch (RuntimeException e) {
                log.warn("Lifecycle listener failed on deletion of '{}' ({}): {}", event.id(), event.className(), e.getMessage());
                log.debug("Exception details:", e);
            }
        }
    }

    public Optional<ISimulator> get(String id) {
        ManagedInstance managed = instances.get(id);
        return managed == null ? Optional.empty() : Optional.of(managed.simulator());
    }

    /**
     * Returns the instance with the given id if it is of the expected type.
     */
    public <T extends ISimulator> Optional<T> get(String id, Class<T> expectedType) {
        return get(id).filter(expectedType::isInstance).map(expectedType::cast);
    }

    public Optional<String> getClassName(String id) {
        ManagedInstance managed = instances.get(id);
        return managed == null ? Optional.empty() : Optional.of(managed.className());
    }

    public boolean contains(String id) {
        return instances.containsKey(id);
    }

    public Set<String> ids() {
        synchronized (instances) {
            return new LinkedHashSet<>(instances.keySet());
        }
    }

    public int size() {
        return instances.size();
    }

    /**
     * Registers a lifecycle listener.
     *
     * @return subscription that removes the listener when cancelled.
     */
    public Subscription addListener(IInstanceLifecycleListener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Stops every instance and forgets it without emitting deletion events, so persisted
     * records survive for the next start.
     */
    public void shutdown() {
        List<ManagedInstance> snapshot;
        synchronized (instances) {
            snapshot = new ArrayList<>(instances.values());
            instances.clear();
        }
        for (ManagedInstance managed : snapshot) {
            try {
                managed.simulator().stop();
            } catch (RuntimeException e) {
                log.warn("Failed to stop instance '{}': {}", managed.id(), e.getMessage());
            }
        }
        log.info("Stopped {} instance(s)", snapshot.size());
    }

    private ISimulator instantiate(Constructor<? extends ISimulator> constructor, String id, String className,
                                   List<Object> args) {
        Config options;
        try {
            options = toOptions(args);
        } catch (IllegalArgumentException | ConfigException e) {
            throw new InstanceCreationException(String.format(
                    "Invalid construction arguments for '%s' (%s): %s", id, className, e.getMessage()), e);
        }
        try {
            return constructor.newInstance(id, options, context);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new InstanceCreationException(String.format(
                    "Constructor of '%s' (%s) failed: %s", id, className, cause.getMessage()), cause);
        } catch (ReflectiveOperationException e) {
            throw new InstanceCreationException(String.format(
                    "Cannot instantiate '%s' (%s): %s", id, className, e.getMessage()), e);
        }
    }

    /**
     * Converts construction arguments into simulator options. No arguments (or a leading
     * {@code null}) yields empty options; otherwise the first argument must be an object.
     */
    static Config toOptions(List<Object> args) {
        if (args.isEmpty() || args.get(0) == null) {
            return ConfigFactory.empty();
        }
        Object first = args.get(0);
        if (!(first instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("first argument must be an object, got " + first.getClass().getSimpleName());
        }
        Map<String, Object> options = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            options.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return ConfigFactory.parseMap(options, "construction arguments");
    }

    private record ManagedInstance(String id, String className, List<Object> args, ISimulator simulator) {
        InstanceEvent toEvent() {
            return new InstanceEvent(id, className, args, simulator);
        }
    }
}
