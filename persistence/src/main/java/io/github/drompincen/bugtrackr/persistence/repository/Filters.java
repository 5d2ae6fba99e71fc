package io.github.drompincen.bugtrackr.persistence.repository;

import java.util.Collection;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/** In-memory predicates where an absent criterion matches everything. */
public final class Filters {

    private Filters() {}

    public static <T, V> Predicate<T> equalTo(Function<T, V> attribute, V value) {
        if (value == null) {
            return entity -> true;
        }
        return entity -> Objects.equals(attribute.apply(entity), value);
    }

    public static <T, V> Predicate<T> memberOf(Function<T, V> attribute, Collection<V> values) {
        if (values == null || values.isEmpty()) {
            return entity -> true;
        }
        return entity -> values.contains(attribute.apply(entity));
    }
}
