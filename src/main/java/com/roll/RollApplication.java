package com.roll;

import com.roll.spring.EnableRoll;
import com.roll.strategy.StrategyRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot application running every configured strategy once.
 * N and P can be overridden with {@code --roll.task-count} and {@code --roll.pool-size}.
 */
@SpringBootApplication
@EnableRoll
public class RollApplication {

    private static final Logger log = LoggerFactory.getLogger(RollApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(RollApplication.class, args);
    }

    @Bean
    public CommandLineRunner rollDemo(ObjectProvider<StrategyRunner> runnerProvider) {
        return args -> {
            StrategyRunner runner = runnerProvider.getIfAvailable();
            if (runner == null) {
                log.info("Roll runs disabled (roll.enabled=false)");
                return;
            }
            log.info("=== Roll Demo Started ===");
            runner.runAll();
            log.info("=== All Strategies Completed ===");
        };
    }
}
