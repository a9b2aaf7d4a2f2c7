package world.willfrog.agentstream.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 定长、不可变的有序序列。
 * <p>
 * 与 {@link List} 区分开：编码时保留为 tuple 形态，且只与另一个 Tuple 相等。
 */
public final class Tuple implements Iterable<Object> {

    private final List<Object> items;

    private Tuple(List<Object> items) {
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static Tuple of(Object... items) {
        return new Tuple(Arrays.asList(items));
    }

    public static Tuple fromList(List<?> items) {
        return new Tuple(new ArrayList<>(items));
    }

    public int size() {
        return items.size();
    }

    public Object get(int index) {
        return items.get(index);
    }

    @JsonValue
    public List<Object> items() {
        return items;
    }

    @Override
    public Iterator<Object> iterator() {
        return items.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Tuple other)) {
            return false;
        }
        return items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return 31 + items.hashCode();
    }

    @Override
    public String toString() {
        return items.stream().map(String::valueOf).collect(Collectors.joining(", ", "(", ")"));
    }
}
