package io.trading.pricestream;

import io.trading.pricestream.config.GatewayConfig;
import io.trading.pricestream.core.GatewayController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Collectors;

/**
 * Main entry point for the Price Stream Gateway application.
 * All settings come from the environment, see {@link GatewayConfig#fromEnv()}.
 */
public class PriceStreamGateway {

    private static final Logger LOGGER = LoggerFactory.getLogger(PriceStreamGateway.class);

    public static void main(String[] args) {
        LOGGER.info("Price Stream Gateway starting...");

        GatewayConfig config;
        try {
            config = GatewayConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        logConfiguration(config);

        try (GatewayController controller = new GatewayController(config)) {
            Runtime.getRuntime().addShutdownHook(new Thread(
                () -> controller.getShutdownBarrier().signal(),
                "shutdown-signal"
            ));

            controller.start();
            controller.waitForShutdown();
        } catch (Exception e) {
            LOGGER.error("Fatal error in Price Stream Gateway", e);
            System.exit(1);
        }

        LOGGER.info("Price Stream Gateway exited");
    }

    private static void logConfiguration(GatewayConfig config) {
        String mappings = config.feedSymbols().stream()
            .map(mapping -> mapping.symbol() + "->" + mapping.vendorToken())
            .collect(Collectors.joining(", "));
        LOGGER.info("Gateway {}: hub port {}, http port {}", config.gatewayId(), config.hubPort(), config.httpPort());
        LOGGER.info("Feed {} with {} mapped symbol(s): {}", config.feedUrl(), config.feedSymbols().size(), mappings);
        LOGGER.info("Instruments offered: {}", config.instruments().size());
        LOGGER.info("Cold read budget {} ms, subscriber queue {}, {}",
            config.coldReadTimeoutMs(), config.subscriberQueueCapacity(), config.reconnectPolicy());
    }
}
