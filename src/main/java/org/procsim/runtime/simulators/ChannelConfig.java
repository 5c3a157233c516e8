package org.procsim.runtime.simulators;

/**
 * Immutable model parameters of one consumption channel.
 *
 * @param annual       target consumption per year.
 * @param avgPerSecond baseline consumption per second ({@code annual / seconds in a year}).
 * @param phaseShift   shift of the daily sine in radians; aligns the peak with a time of day.
 * @param amplitude    fractional deviation from the baseline at the peak of the cycle.
 */
public record ChannelConfig(double annual, double avgPerSecond, double phaseShift, double amplitude) {

    public static ChannelConfig of(double annual, double phaseShift, double amplitude) {
        if (annual < 0 || Double.isNaN(annual) || Double.isInfinite(annual)) {
            throw new IllegalArgumentException("Annual consumption must be a finite, non-negative number: " + annual);
        }
        return new ChannelConfig(annual, annual / ConsumptionSimulator.SECONDS_IN_YEAR, phaseShift, amplitude);
    }
}
