package org.procsim.runtime.simulators;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Utility flows modelled by the {@link ConsumptionSimulator}.
 */
public enum Channel {
    /** Electric power: live value in kW, total in kWh. */
    POWER("power"),
    /** Gas: live value in m³/h, total in m³. */
    GAS("gas"),
    /** Hot water: live value in m³/h, total in m³. */
    WATER("water");

    private final String wireName;

    Channel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a channel from its name, ignoring case.
     *
     * @throws UnknownChannelException if the name is not a known channel.
     */
    public static Channel fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (Channel channel : values()) {
                if (channel.wireName.equals(normalized)) {
                    return channel;
                }
            }
        }
        throw new UnknownChannelException(name);
    }

    static String validNames() {
        return Arrays.stream(values()).map(Channel::wireName).collect(Collectors.joining(", "));
    }
}
