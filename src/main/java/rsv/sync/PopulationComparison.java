package rsv.sync;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Entity populations of two stores split into shared and store-specific IRIs.
 */
public class PopulationComparison {

    private final SortedSet<String> onlyInFirst;
    private final SortedSet<String> onlyInSecond;
    private final SortedSet<String> shared;

    private PopulationComparison(SortedSet<String> onlyInFirst, SortedSet<String> onlyInSecond, SortedSet<String> shared) {
        this.onlyInFirst = Collections.unmodifiableSortedSet(onlyInFirst);
        this.onlyInSecond = Collections.unmodifiableSortedSet(onlyInSecond);
        this.shared = Collections.unmodifiableSortedSet(shared);
    }

    public static PopulationComparison compare(SortedSet<String> first, SortedSet<String> second) {
        SortedSet<String> shared = new TreeSet<>(first);
        shared.retainAll(second);
        SortedSet<String> onlyInFirst = new TreeSet<>(first);
        onlyInFirst.removeAll(second);
        SortedSet<String> onlyInSecond = new TreeSet<>(second);
        onlyInSecond.removeAll(first);
        return new PopulationComparison(onlyInFirst, onlyInSecond, shared);
    }

    public SortedSet<String> getOnlyInFirst() {
        return onlyInFirst;
    }

    public SortedSet<String> getOnlyInSecond() {
        return onlyInSecond;
    }

    public SortedSet<String> getShared() {
        return shared;
    }

    // Both stores hold exactly the same entities.
    public boolean isAligned() {
        return onlyInFirst.isEmpty() && onlyInSecond.isEmpty();
    }

    @Override
    public String toString() {
        return "PopulationComparison{shared=" + shared.size()
                + ", onlyInFirst=" + onlyInFirst.size()
                + ", onlyInSecond=" + onlyInSecond.size() + '}';
    }
}
