package org.procsim.runtime.simulators;

import java.time.LocalTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import org.procsim.runtime.api.SimulationContext;

import com.typesafe.config.Config;

/**
 * Simulates the consumption of power, gas and hot water of a household.
 * <p>
 * Every channel follows a daily sine cycle around its yearly average with uniform
 * jitter of ±10 %. Each tick represents one second of consumption:
 * <pre>
 *   cycle         = sin(2π · secondsIntoDay / 86400 + phaseShift)
 *   instantaneous = max(0, avgPerSecond · (1 + cycle · amplitude + noise))
 *   total        += instantaneous
 *   live          = instantaneous · 3600
 * </pre>
 * Power peaks in the evening (phase -π/2, ±60 %), gas in the evening (-π/3, ±50 %) and
 * hot water in the morning (π/2, ±80 %). Totals start at zero with every new instance.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>power</b>: annual power consumption in kWh (default: 0).</li>
 *   <li><b>gas</b>: annual gas consumption in m³ (default: 0).</li>
 *   <li><b>water</b>: annual hot water consumption in m³ (default: 0).</li>
 * </ul>
 */
public class ConsumptionSimulator extends AbstractSimulator {

    public static final double SECONDS_IN_YEAR = 365 * 24 * 3600;
    public static final double SECONDS_IN_DAY = 24 * 3600;
    static final double NOISE = 0.1;

    private final Map<Channel, ChannelConfig> channels;
    private final double[] liveValues = new double[Channel.values().length];
    private final double[] aggregatedValues = new double[Channel.values().length];

    public ConsumptionSimulator(String id, Config options, SimulationContext context) {
        super(id, options, context);
        EnumMap<Channel, ChannelConfig> configs = new EnumMap<>(Channel.class);
        configs.put(Channel.POWER, ChannelConfig.of(annual(options, Channel.POWER), -Math.PI / 2, 0.6));
        configs.put(Channel.GAS, ChannelConfig.of(annual(options, Channel.GAS), -Math.PI / 3, 0.5));
        configs.put(Channel.WATER, ChannelConfig.of(annual(options, Channel.WATER), Math.PI / 2, 0.8));
        this.channels = Collections.unmodifiableMap(configs);
        autoStart();
    }

    private static double annual(Config options, Channel channel) {
        return options.hasPath(channel.wireName()) ? options.getDouble(channel.wireName()) : 0.0;
    }

    @Override
    protected void onTick() {
        int secondsIntoDay = LocalTime.now(context.clock()).toSecondOfDay();

        // Compute every channel before publishing so a failing tick leaves no partial update
        double[] instantaneous = new double[liveValues.length];
        for (Map.Entry<Channel, ChannelConfig> entry : channels.entrySet()) {
            ChannelConfig config = entry.getValue();
            double cycleFactor = Math.sin((secondsIntoDay * 2 * Math.PI) / SECONDS_IN_DAY + config.phaseShift());
            double noise = context.randomProvider().uniform(-NOISE, NOISE);
            double consumption = config.avgPerSecond() * (1 + cycleFactor * config.amplitude() + noise);
            instantaneous[entry.getKey().ordinal()] = Math.max(0, consumption);
        }
        for (int i = 0; i < instantaneous.length; i++) {
            aggregatedValues[i] += instantaneous[i];
            liveValues[i] = instantaneous[i] * 3600;
        }
    }

    /**
     * Returns the live consumption rate: kW for power, m³/h for gas and hot water.
     *
     * @throws UnknownChannelException if {@code channel} is not power, gas or water.
     */
    public double getLiveValue(String channel) {
        return getLiveValue(Channel.fromName(channel));
    }

    public double getLiveValue(Channel channel) {
        synchronized (stateLock) {
            return liveValues[channel.ordinal()];
        }
    }

    /**
     * Returns the consumption accumulated since this instance was created:
     * kWh for power, m³ for gas and hot water.
     *
     * @throws UnknownChannelException if {@code channel} is not power, gas or water.
     */
    public double getAggregatedValue(String channel) {
        return getAggregatedValue(Channel.fromName(channel));
    }

    public double getAggregatedValue(Channel channel) {
        synchronized (stateLock) {
            return aggregatedValues[channel.ordinal()];
        }
    }

    public ChannelConfig getChannelConfig(Channel channel) {
        return channels.get(channel);
    }

    @Override
    protected void logStarted() {
        log.info("Energy simulator '{}' started (power={} kWh, gas={} m³, water={} m³ per year)", id,
                channels.get(Channel.POWER).annual(), channels.get(Channel.GAS).annual(),
                channels.get(Channel.WATER).annual());
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        for (Channel channel : Channel.values()) {
            metrics.put(channel.wireName() + "_live", getLiveValue(channel));
            metrics.put(channel.wireName() + "_total", getAggregatedValue(channel));
        }
    }
}
