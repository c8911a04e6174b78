package io.trading.pricestream.hub;

/**
 * A command sent by a hub client.
 *
 * @param action What the client asks for
 * @param symbol Target symbol, null for {@link Action#SUBSCRIPTIONS}
 */
public record HubCommand(Action action, String symbol) {

    public HubCommand {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
    }

    public enum Action {
        SUBSCRIBE,
        UNSUBSCRIBE,
        SUBSCRIPTIONS
    }
}
