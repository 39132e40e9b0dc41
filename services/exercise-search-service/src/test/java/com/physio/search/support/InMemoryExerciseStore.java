package com.physio.search.support;

import com.physio.search.execution.SortColumn;
import com.physio.search.execution.SortSpec;
import com.physio.search.predicate.PredicateSet;
import com.physio.search.query.SortOrder;
import com.physio.search.store.ExerciseRecord;
import com.physio.search.store.ExerciseStore;
import com.physio.search.store.ListFacet;
import com.physio.search.store.ScalarFacet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exercise store over a fixed list, evaluating predicates with {@code matches}.
 */
public class InMemoryExerciseStore implements ExerciseStore {
    private final List<ExerciseRecord> records;
    private final AtomicInteger findCalls = new AtomicInteger();
    private volatile RuntimeException failure;

    public InMemoryExerciseStore(List<ExerciseRecord> records) {
        this.records = List.copyOf(records);
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public int findCalls() {
        return findCalls.get();
    }

    @Override
    public List<ExerciseRecord> find(PredicateSet predicates, SortSpec sort, int limit, int offset, boolean includeMedia) {
        findCalls.incrementAndGet();
        List<ExerciseRecord> matches = matching(predicates);
        matches.sort(comparator(sort));
        List<ExerciseRecord> page = new ArrayList<>();
        for (int i = offset; i < matches.size() && page.size() < limit; i++) {
            ExerciseRecord record = matches.get(i);
            page.add(includeMedia ? record : record.withMedia(List.of()));
        }
        return page;
    }

    @Override
    public long count(PredicateSet predicates) {
        return matching(predicates).size();
    }

    @Override
    public Map<String, Long> countBy(PredicateSet predicates, ScalarFacet facet) {
        Map<String, Long> counts = new TreeMap<>();
        for (ExerciseRecord record : matching(predicates)) {
            String value = facet.valueOf(record);
            if (value != null) {
                counts.merge(value, 1L, Long::sum);
            }
        }
        return counts;
    }

    @Override
    public Map<String, Long> countListValues(PredicateSet predicates, ListFacet facet, int limit) {
        Map<String, Long> counts = new TreeMap<>();
        for (ExerciseRecord record : matching(predicates)) {
            for (String value : facet.valuesOf(record)) {
                counts.merge(value, 1L, Long::sum);
            }
        }
        List<Map.Entry<String, Long>> entries = new ArrayList<>(counts.entrySet());
        entries.sort(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.comparingByKey()));
        Map<String, Long> top = new LinkedHashMap<>();
        for (Map.Entry<String, Long> entry : entries) {
            if (top.size() >= limit) {
                break;
            }
            top.put(entry.getKey(), entry.getValue());
        }
        return top;
    }

    private List<ExerciseRecord> matching(PredicateSet predicates) {
        RuntimeException current = failure;
        if (current != null) {
            throw current;
        }
        List<ExerciseRecord> matches = new ArrayList<>();
        for (ExerciseRecord record : records) {
            if (predicates.matches(record)) {
                matches.add(record);
            }
        }
        return matches;
    }

    private static Comparator<ExerciseRecord> comparator(SortSpec sort) {
        Comparator<ExerciseRecord> comparator = null;
        for (SortSpec.Key key : sort.keys()) {
            Comparator<ExerciseRecord> next = column(key.column(), key.order());
            comparator = comparator == null ? next : comparator.thenComparing(next);
        }
        Comparator<ExerciseRecord> byId = Comparator.comparing(ExerciseRecord::id);
        return comparator == null ? byId : comparator.thenComparing(byId);
    }

    private static Comparator<ExerciseRecord> column(SortColumn column, SortOrder order) {
        switch (column) {
            case NAME:
                return Comparator.comparing(ExerciseRecord::name, InMemoryExerciseStore.<String>directed(order));
            case CATEGORY:
                return Comparator.comparing(ExerciseRecord::category, InMemoryExerciseStore.<String>directed(order));
            case DIFFICULTY:
                return Comparator.comparing(ExerciseRecord::difficulty, InMemoryExerciseStore.<String>directed(order));
            case AI_CONFIDENCE:
                return Comparator.comparing(ExerciseRecord::aiConfidence, InMemoryExerciseStore.<Double>directed(order));
            case CREATED_AT:
            default:
                return Comparator.comparing(ExerciseRecord::createdAt, InMemoryExerciseStore.<Instant>directed(order));
        }
    }

    private static <T extends Comparable<? super T>> Comparator<T> directed(SortOrder order) {
        Comparator<T> natural = order == SortOrder.ASC ? Comparator.<T>naturalOrder() : Comparator.<T>reverseOrder();
        return Comparator.nullsLast(natural);
    }
}
