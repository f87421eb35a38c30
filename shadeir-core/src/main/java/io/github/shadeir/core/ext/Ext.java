package io.github.shadeir.core.ext;

import org.jetbrains.annotations.NotNull;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A typed key for side data that can be attached to any {@link ExtContainer}.
 * <p>
 * Exts are ordered by creation, so iteration over a container's exts
 * is stable within one run, but not across versions.
 *
 * @param <T> The type of the attached value.
 */
public final class Ext<T> implements Comparable<Ext<?>> {
    private static final AtomicInteger ID_COUNTER = new AtomicInteger(0);

    private final Class<?> type;
    private final int id = ID_COUNTER.getAndIncrement();
    private final String name;

    private Ext(Class<?> type, String name) {
        this.type = type;
        this.name = name;
    }

    /**
     * Create a new ext.
     * <p>
     * Classes cannot name generic types, so {@code type} only has to be
     * a supertype of the value type. It is kept for debugging.
     *
     * @param type The most specific class of the value type.
     * @param name The name of the ext, for debugging.
     * @param <T>  The class type.
     * @param <R>  The value type.
     * @return The new ext.
     */
    public static <T, R extends T> Ext<R> create(Class<T> type, String name) {
        return new Ext<>(type, name);
    }

    /**
     * Get the name this ext was created with.
     *
     * @return The name.
     */
    public String getName() {
        return name;
    }

    /**
     * Get the value of this ext in the given container.
     *
     * @param ec The container.
     * @return The value, if attached.
     * @see ExtContainer#getExt(Ext)
     */
    public Optional<T> getIn(ExtContainer ec) {
        return ec.getExt(this);
    }

    @Override
    public int compareTo(@NotNull Ext<?> o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return name + ": " + type.getName();
    }
}
