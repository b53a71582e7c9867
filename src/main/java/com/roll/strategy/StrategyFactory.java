package com.roll.strategy;

import com.roll.config.RollConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating RollStrategy instances.
 */
public class StrategyFactory {

    private static final Logger log = LoggerFactory.getLogger(StrategyFactory.class);

    /**
     * Create a RollStrategy based on configuration.
     *
     * @param type   Strategy type
     * @param config Roll configuration supplying pool size and thread names
     * @return RollStrategy instance
     */
    public static RollStrategy create(StrategyType type, RollConfig config) {
        if (type == null) {
            log.info("No strategy type provided, defaulting to SEQUENTIAL");
            type = StrategyType.SEQUENTIAL;
        }

        log.debug("Creating RollStrategy: {}", type);

        String prefix = config.threadNamePrefix();
        return switch (type) {
            case SEQUENTIAL -> new SequentialExecutor(prefix);
            case FAN_OUT -> new FanOutExecutor(prefix);
            case BUFFERED -> new BufferedAggregator(prefix);
            case UNBUFFERED -> new UnbufferedAggregator(prefix);
            case BOUNDED_POOL -> new BoundedPoolAggregator(config.poolSize(), prefix);
        };
    }
}
