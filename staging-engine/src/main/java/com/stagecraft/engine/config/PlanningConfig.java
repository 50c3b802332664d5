package com.stagecraft.engine.config;

import com.stagecraft.engine.plan.ExampleSampler;
import com.stagecraft.engine.plan.RoomCatalogue;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Beans for plan building. Set {@code stagecraft.plan.seed} to make example
 * sampling (and so every instruction) reproducible.
 */
@Configuration
public class PlanningConfig {

    @Bean
    public RoomCatalogue roomCatalogue() {
        return RoomCatalogue.standard();
    }

    @Bean
    public RandomGenerator planRandom(@Value("${stagecraft.plan.seed:#{null}}") Long seed) {
        return seed == null ? new Random() : new Random(seed);
    }

    @Bean
    public ExampleSampler exampleSampler(RandomGenerator planRandom) {
        return new ExampleSampler(planRandom);
    }
}
