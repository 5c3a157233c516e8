package org.procsim.runtime.simulators;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.procsim.runtime.api.SimulationContext;
import org.procsim.runtime.internal.services.JavaRandomProvider;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class ConsumptionSimulatorTest {

    // 06:00 is where the power cycle crosses zero
    private static final Clock SIX_AM = Clock.fixed(Instant.parse("2024-03-01T06:00:00Z"), ZoneOffset.UTC);

    private static Config options(double power, double gas, double water) {
        return ConfigFactory.parseMap(Map.of("power", power, "gas", gas, "water", water));
    }

    private static SimulationContext manualContext(Clock clock, double random) {
        return new SimulationContext(clock, () -> random, 1000, false);
    }

    @Test
    void averagePerSecondFollowsAnnualTotal() {
        ConsumptionSimulator simulator = new ConsumptionSimulator("meter", options(8760, 0, 0), manualContext(SIX_AM, 0.5));

        ChannelConfig power = simulator.getChannelConfig(Channel.POWER);
        assertThat(power.annual()).isEqualTo(8760.0);
        assertThat(power.avgPerSecond()).isCloseTo(0.0002778, within(1e-7));
        assertThat(power.phaseShift()).isEqualTo(-Math.PI / 2);
        assertThat(power.amplitude()).isEqualTo(0.6);
    }

    @Test
    void flatLiveRateAtZeroCrossingWithoutNoise() {
        ConsumptionSimulator simulator = new ConsumptionSimulator("meter", options(8760, 0, 0), manualContext(SIX_AM, 0.5));

        simulator.tick();

        assertThat(simulator.getLiveValue("power")).isCloseTo(1.0, within(1e-9));
        assertThat(simulator.getAggregatedValue(Channel.POWER)).isCloseTo(8760.0 / ConsumptionSimulator.SECONDS_IN_YEAR, within(1e-12));
        assertThat(simulator.getLiveValue("gas")).isZero();
        assertThat(simulator.getAggregatedValue("water")).isZero();
    }

    @Test
    void totalsNeverDecreaseAndRatesStayNonNegative() {
        SimulationContext context = new SimulationContext(Clock.systemUTC(), new JavaRandomProvider(7), 1000, false);
        ConsumptionSimulator simulator = new ConsumptionSimulator("meter", options(3500, 1200, 40), context);

        double[] previous = new double[Channel.values().length];
        for (int i = 0; i < 500; i++) {
            simulator.tick();
            for (Channel channel : Channel.values()) {
                double total = simulator.getAggregatedValue(channel);
                assertThat(total).isGreaterThanOrEqualTo(previous[channel.ordinal()]);
                assertThat(simulator.getLiveValue(channel)).isGreaterThanOrEqualTo(0.0);
                previous[channel.ordinal()] = total;
            }
        }
        assertThat(simulator.getTicksProcessed()).isEqualTo(500);
    }

    @Test
    void hotWaterBottomsOutAtNoonWithLowestNoise() {
        Clock noon = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
        ConsumptionSimulator simulator = new ConsumptionSimulator("meter", options(0, 0, 100), manualContext(noon, 0.0));

        simulator.tick();

        double avgPerSecond = 100 / ConsumptionSimulator.SECONDS_IN_YEAR;
        assertThat(simulator.getLiveValue(Channel.WATER)).isCloseTo(avgPerSecond * 0.1 * 3600, within(1e-9));
        assertThat(simulator.getLiveValue(Channel.WATER)).isPositive();
    }

    @Test
    void channelNamesAreCaseInsensitive() {
        ConsumptionSimulator simulator = new ConsumptionSimulator("meter", options(8760, 0, 0), manualContext(SIX_AM, 0.5));
        simulator.tick();

        assertThat(simulator.getLiveValue("POWER")).isEqualTo(simulator.getLiveValue("power"));
        assertThat(simulator.getAggregatedValue("Power")).isEqualTo(simulator.getAggregatedValue(Channel.POWER));
    }

    @Test
    void unknownChannelIsRejected() {
        ConsumptionSimulator simulator = new ConsumptionSimulator("meter", options(8760, 0, 0), manualContext(SIX_AM, 0.5));

        assertThatThrownBy(() -> simulator.getLiveValue("steam"))
                .isInstanceOf(UnknownChannelException.class)
                .hasMessageContaining("steam")
                .hasMessageContaining("power, gas, water");
        assertThatThrownBy(() -> simulator.getAggregatedValue((String) null))
                .isInstanceOf(UnknownChannelException.class);
    }

    @Test
    void missingChannelsDefaultToZero() {
        ConsumptionSimulator simulator = new ConsumptionSimulator("meter", ConfigFactory.empty(), manualContext(SIX_AM, 0.5));

        simulator.tick();

        for (Channel channel : Channel.values()) {
            assertThat(simulator.getChannelConfig(channel).annual()).isZero();
            assertThat(simulator.getAggregatedValue(channel)).isZero();
        }
    }

    @Test
    void negativeAnnualConsumptionIsRejected() {
        assertThatThrownBy(() -> new ConsumptionSimulator("meter", options(-1, 0, 0), manualContext(SIX_AM, 0.5)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("integration")
    void stopKeepsTotalsAndHaltsAccumulation() throws InterruptedException {
        SimulationContext context = new SimulationContext(Clock.systemUTC(), new JavaRandomProvider(1), 10, true);
        ConsumptionSimulator simulator = new ConsumptionSimulator("meter", options(8760, 1000, 50), context);
        try {
            assertThat(simulator.isRunning()).isTrue();
            await().atMost(Duration.ofSeconds(5)).until(() -> simulator.getTicksProcessed() >= 3);

            assertThat(simulator.stop()).isTrue();
            assertThat(simulator.stop()).isTrue();
            assertThat(simulator.isRunning()).isFalse();
            Thread.sleep(50); // let an in-flight tick finish
            double total = simulator.getAggregatedValue(Channel.POWER);
            long ticks = simulator.getTicksProcessed();

            Thread.sleep(100);
            assertThat(simulator.getTicksProcessed()).isEqualTo(ticks);
            assertThat(simulator.getAggregatedValue(Channel.POWER)).isEqualTo(total);
            assertThat(total).isPositive();
        } finally {
            simulator.stop();
        }
    }

    @Test
    void metricsExposeLiveAndTotalValues() {
        ConsumptionSimulator simulator = new ConsumptionSimulator("meter", options(8760, 0, 0), manualContext(SIX_AM, 0.5));
        simulator.tick();

        assertThat(simulator.getMetrics())
                .containsKeys("error_count", "ticks_processed", "power_live", "power_total", "gas_live", "water_total");
        assertThat(simulator.getMetrics().get("ticks_processed")).isEqualTo(1L);
        assertThat(simulator.isHealthy()).isTrue();
    }
}
