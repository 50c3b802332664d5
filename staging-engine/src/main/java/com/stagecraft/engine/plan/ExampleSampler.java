package com.stagecraft.engine.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Picks a bounded sample of example items for an instruction using a
 * Fisher-Yates shuffle without replacement.
 *
 * This is the only non-deterministic part of plan building; inject a seeded
 * RandomGenerator to make plans reproducible.
 */
public class ExampleSampler {

    private final RandomGenerator random;

    public ExampleSampler(RandomGenerator random) {
        this.random = random;
    }

    public <T> List<T> sample(List<T> items, int n) {
        if (items == null || items.isEmpty() || n <= 0) return List.of();

        List<T> copy = new ArrayList<>(items);
        for (int i = copy.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            T tmp = copy.get(i);
            copy.set(i, copy.get(j));
            copy.set(j, tmp);
        }
        return List.copyOf(copy.subList(0, Math.min(n, copy.size())));
    }
}
