package org.procsim.runtime.simulators;

/**
 * Thrown when a caller asks a consumption simulator for a channel it does not model.
 */
public class UnknownChannelException extends IllegalArgumentException {

    private final String channel;

    public UnknownChannelException(String channel) {
        super(String.format("Invalid media type \"%s\". Please use one of: %s.", channel, Channel.validNames()));
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
