package org.procsim.node.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.procsim.runtime.api.ISimulator;
import org.procsim.runtime.api.SimulationContext;
import org.procsim.runtime.api.Subscription;
import org.procsim.runtime.simulators.ConsumptionSimulator;
import org.procsim.runtime.simulators.SiloSimulator;
import org.procsim.testsupport.UpdatableTestSimulator;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class InstanceRegistryTest {

    private InstanceRegistry registry;
    private final List<String> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        registry = new InstanceRegistry(new SimulationContext(Clock.systemUTC(), () -> 0.5, 1000, false));
        registry.registerAll(ConfigFactory.parseMap(Map.of(
                "EnergySimulator", ConsumptionSimulator.class.getName(),
                "SiloSimulator", SiloSimulator.class.getName())));
        registry.addListener(new IInstanceLifecycleListener() {
            @Override
            public void onCreated(InstanceEvent event) {
                events.add("created:" + event.id() + ":" + event.className());
            }

            @Override
            public void onDeleted(InstanceEvent event) {
                events.add("deleted:" + event.id() + ":" + event.className());
            }
        });
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    void createsInstanceWithGeneratedId() {
        String id = registry.create("SiloSimulator", List.of(Map.of("capacity", 50)));

        assertThat(id).isNotBlank();
        assertThat(registry.contains(id)).isTrue();
        assertThat(registry.get(id, SiloSimulator.class)).hasValueSatisfying(silo ->
                assertThat(silo.getCapacity()).isEqualTo(50.0));
        assertThat(registry.getClassName(id)).contains("SiloSimulator");
        assertThat(events).containsExactly("created:" + id + ":SiloSimulator");
    }

    @Test
    void createsInstanceWithExplicitIdAndRejectsDuplicates() {
        registry.create("EnergySimulator", List.of(Map.of("power", 3500)), "meter-1");

        assertThatThrownBy(() -> registry.create("SiloSimulator", List.of(), "meter-1"))
                .isInstanceOf(InstanceCreationException.class)
                .hasMessageContaining("already exists");
        assertThat(registry.get("meter-1", ConsumptionSimulator.class)).isPresent();
        assertThat(registry.size()).isEqualTo(1);
        assertThat(events).hasSize(1);
    }

    @Test
    void unknownTypeIsRejected() {
        assertThatThrownBy(() -> registry.create("Windmill", List.of()))
                .isInstanceOf(InstanceCreationException.class)
                .hasMessageContaining("Windmill")
                .hasMessageContaining("SiloSimulator");
        assertThat(registry.size()).isZero();
        assertThat(events).isEmpty();
    }

    @Test
    void constructorFailureIsWrapped() {
        assertThatThrownBy(() -> registry.create("SiloSimulator", List.of(Map.of("capacity", -1)), "bad"))
                .isInstanceOf(InstanceCreationException.class)
                .hasMessageContaining("capacity")
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThat(registry.contains("bad")).isFalse();
    }

    @Test
    void firstArgumentMustBeAnObject() {
        assertThatThrownBy(() -> registry.create("SiloSimulator", List.of("capacity=5")))
                .isInstanceOf(InstanceCreationException.class)
                .hasMessageContaining("must be an object");
    }

    @Test
    void missingOrNullArgumentsUseDefaults() {
        String noArgs = registry.create("SiloSimulator", null);
        String nullArg = registry.create("SiloSimulator", Arrays.asList((Object) null));

        assertThat(registry.get(noArgs, SiloSimulator.class).orElseThrow().getCapacity()).isEqualTo(100.0);
        assertThat(registry.get(nullArg, SiloSimulator.class).orElseThrow().getCapacity()).isEqualTo(100.0);
    }

    @Test
    void deleteStopsInstanceAndNotifies() {
        registry.create("SiloSimulator", List.of(), "silo");
        ISimulator silo = registry.get("silo").orElseThrow();
        silo.start();

        assertThat(registry.delete("silo")).isTrue();
        assertThat(registry.delete("silo")).isFalse();

        assertThat(silo.isRunning()).isFalse();
        assertThat(registry.contains("silo")).isFalse();
        assertThat(events).containsExactly("created:silo:SiloSimulator", "deleted:silo:SiloSimulator");
    }

    @Test
    void failingListenerDoesNotAbortCreation() {
        Subscription failing = registry.addListener(new IInstanceLifecycleListener() {
            @Override
            public void onCreated(InstanceEvent event) {
                throw new IllegalStateException("listener down");
            }
        });

        String id = registry.create("SiloSimulator", List.of());
        failing.cancel();
        String second = registry.create("SiloSimulator", List.of());

        assertThat(registry.ids()).containsExactly(id, second);
        assertThat(events).hasSize(2);
    }

    @Test
    void shutdownStopsInstancesWithoutDeletionEvents() {
        registry.create("SiloSimulator", List.of(), "a");
        registry.create("EnergySimulator", List.of(), "b");
        registry.get("a").orElseThrow().start();

        registry.shutdown();

        assertThat(registry.size()).isZero();
        assertThat(events).noneMatch(event -> event.startsWith("deleted"));
    }

    @Test
    void registerAllSkipsUnusableTypes() {
        registry.registerAll(ConfigFactory.parseMap(Map.of(
                "Missing", "org.procsim.does.not.Exist",
                "NotASimulator", String.class.getName(),
                "Updatable", UpdatableTestSimulator.class.getName())));

        assertThat(registry.getSimulatorTypes())
                .contains("Updatable", "SiloSimulator", "EnergySimulator")
                .doesNotContain("Missing", "NotASimulator");
    }

    @Test
    void deletionWaitsForCreationToBeAnnounced() throws Exception {
        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch creationAnnounced = new CountDownLatch(1);
        CountDownLatch releaseCreation = new CountDownLatch(1);
        registry.addListener(new IInstanceLifecycleListener() {
            @Override
            public void onCreated(InstanceEvent event) {
                creationAnnounced.countDown();
                try {
                    releaseCreation.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                order.add("created");
            }

            @Override
            public void onDeleted(InstanceEvent event) {
                order.add("deleted");
            }
        });

        Thread creator = new Thread(() -> registry.create("SiloSimulator", List.of(), "racy"));
        creator.start();
        assertThat(creationAnnounced.await(5, TimeUnit.SECONDS)).isTrue();
        Thread deleter = new Thread(() -> registry.delete("racy"));
        deleter.start();

        Thread.sleep(100);
        assertThat(order).isEmpty();
        releaseCreation.countDown();
        creator.join(5000);
        deleter.join(5000);

        assertThat(order).containsExactly("created", "deleted");
        assertThat(registry.contains("racy")).isFalse();
    }
}
