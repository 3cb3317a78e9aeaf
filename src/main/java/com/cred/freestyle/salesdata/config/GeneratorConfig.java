package com.cred.freestyle.salesdata.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Random;

/**
 * Infrastructure beans shared by the generator components.
 *
 * @author Sales Data Team
 */
@Configuration
public class GeneratorConfig {

    private static final Logger logger = LoggerFactory.getLogger(GeneratorConfig.class);

    /**
     * Clock in the configured generator zone. "Today" for the simulation window comes from here.
     *
     * @param properties Sales data properties
     * @return Clock
     */
    @Bean
    public Clock generatorClock(SalesDataProperties properties) {
        return Clock.system(ZoneId.of(properties.getGenerator().getZone()));
    }

    /**
     * Random source for demand noise, basket sampling and metric derivation.
     * Seeded only when salesdata.generator.seed is set.
     *
     * @param properties Sales data properties
     * @return Random
     */
    @Bean
    public Random generatorRandom(SalesDataProperties properties) {
        Long seed = properties.getGenerator().getSeed();
        if (seed != null) {
            logger.info("Using seeded random source: {}", seed);
            return new Random(seed);
        }
        return new Random();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
