package org.Aayush.cpusim.process;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Stable sorted views over process lists.
 *
 * <p>Sorting never touches the source list. Equal keys keep their input order,
 * which {@link List#sort(Comparator)} guarantees.</p>
 */
@UtilityClass
public final class ProcessOrdering {

    /**
     * Selectable ascending sort keys.
     */
    public enum SortKey {
        ARRIVAL(Comparator.comparingInt(ProcessSpec::getArrivalTime)),
        BURST(Comparator.comparingInt(ProcessSpec::getBurstTime));

        private final Comparator<ProcessSpec> comparator;

        SortKey(Comparator<ProcessSpec> comparator) {
            this.comparator = comparator;
        }

        public Comparator<ProcessSpec> comparator() {
            return comparator;
        }
    }

    /**
     * Returns a new list ordered by {@code key}, stable for ties.
     */
    public static List<ProcessSpec> sorted(List<ProcessSpec> processes, SortKey key) {
        Objects.requireNonNull(key, "key");
        return sorted(processes, key.comparator());
    }

    /**
     * Returns a new list ordered by {@code comparator}, stable for ties.
     */
    public static <T> List<T> sorted(List<T> items, Comparator<? super T> comparator) {
        Objects.requireNonNull(items, "items");
        Objects.requireNonNull(comparator, "comparator");
        List<T> copy = new ArrayList<>(items);
        copy.sort(comparator);
        return copy;
    }
}
