package io.unistr.benchmarks;

import io.unistr.store.UniqueStrings;
import io.unistr.store.UniqueStringsStats;

/**
 * Quick footprint report without the JMH harness.
 */
public class BenchmarkRunner {
    public static void main(String[] args) {
        int[] sizes = {100_000, 1_000_000, 10_000_000};

        for (int size : sizes) {
            System.out.println("\n=== Build: " + size + " tokens ===");
            String[] tokens = UserAgentTokens.generate(size, 5_000);

            try (UniqueStrings store = UniqueStrings.create()) {
                long start = System.nanoTime();
                for (String token : tokens) {
                    store.add(token);
                }
                long buildNs = System.nanoTime() - start;
                UniqueStringsStats building = store.stats();

                start = System.nanoTime();
                store.freeze();
                long freezeNs = System.nanoTime() - start;
                UniqueStringsStats frozen = store.stats();

                System.out.printf("add():    %d ms (%d distinct, hit ratio %.4f, %d growth events)%n",
                        buildNs / 1_000_000, building.distinctStrings(), building.hitRatio(), building.growthEvents());
                System.out.printf("freeze(): %d us (%d -> %d bytes reserved)%n",
                        freezeNs / 1_000, building.capacityBytes(), frozen.capacityBytes());
            }
        }
    }
}
