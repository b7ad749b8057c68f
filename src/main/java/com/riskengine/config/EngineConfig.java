package com.riskengine.config;

import com.riskengine.service.DiceRoller;
import com.riskengine.service.RandomDiceRoller;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Randomness for the whole engine comes from the one {@link Random} published here.
 */
@Configuration
@EnableConfigurationProperties(GameProperties.class)
@Slf4j
public class EngineConfig {

    @Bean
    public Random gameRandom(GameProperties properties) {
        long seed = properties.getSeed() != null ? properties.getSeed() : new SecureRandom().nextLong();
        log.info("Random source seeded with {}", seed);
        return new Random(seed);
    }

    @Bean
    public DiceRoller diceRoller(Random gameRandom) {
        return new RandomDiceRoller(gameRandom);
    }
}
