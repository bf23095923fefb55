package com.pricetracker.scraper.domain.exceptions;

public class ChannelDeliveryException extends RuntimeException {

    private ChannelDeliveryException(String message) {
        super(message);
    }

    private ChannelDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ChannelDeliveryException of(String channel, String reason) {
        return new ChannelDeliveryException(channel + " delivery failed: " + reason);
    }

    public static ChannelDeliveryException of(String channel, Throwable cause) {
        return new ChannelDeliveryException(
                channel + " delivery failed: " + cause.getMessage(), cause);
    }
}
