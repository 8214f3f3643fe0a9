package rsv.sync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Bounds the number of entities that reach the triple-level comparison.
 */
public class Sampler {

    private final Random random;

    public Sampler() {
        this(new Random());
    }

    public Sampler(Random random) {
        this.random = random;
    }

    public static Sampler seeded(long seed) {
        return new Sampler(new Random(seed));
    }

    // Whole population when it fits, otherwise exactly maxSize distinct members. Always sorted.
    public List<String> sample(Collection<String> population, int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("Sample size must be at least 1, got " + maxSize);
        }
        List<String> selected = population.size() <= maxSize
                ? new ArrayList<>(population)
                : reservoirSampling(population, maxSize);
        Collections.sort(selected);
        return selected;
    }

    // Standard reservoir sampling: uniform, without replacement.
    private List<String> reservoirSampling(Collection<String> population, int sampleSize) {
        List<String> reservoir = new ArrayList<>(sampleSize);
        int count = 0;
        for (String entity : population) {
            if (count < sampleSize) {
                reservoir.add(entity);
            } else {
                int r = random.nextInt(count + 1);
                if (r < sampleSize) {
                    reservoir.set(r, entity);
                }
            }
            count++;
        }
        return reservoir;
    }
}
