package io.github.shadeir.core.ext;

import org.jetbrains.annotations.Nullable;

import java.util.Optional;

/**
 * Something that {@link Ext}s can be attached to.
 * See the {@link io.github.shadeir.core.ext package documentation}.
 */
public interface ExtContainer {
    /**
     * Attach {@code value} to this container under {@code ext}, replacing any previous value.
     *
     * @param ext   The ext.
     * @param value The value.
     * @param <T>   The value type.
     */
    <T> void attachExt(Ext<T> ext, T value);

    /**
     * Remove the value of {@code ext} from this container, if any.
     *
     * @param ext The ext.
     * @param <T> The value type.
     */
    <T> void removeExt(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container, or null if there is none.
     *
     * @param ext The ext.
     * @param <T> The value type.
     * @return The value, or null.
     */
    <T> @Nullable T getNullable(Ext<T> ext);

    /**
     * Get the value of {@code ext} in this container, if any.
     *
     * @param ext The ext.
     * @param <T> The value type.
     * @return The value.
     * @see #getNullable(Ext)
     */
    default <T> Optional<T> getExt(Ext<T> ext) {
        return Optional.ofNullable(getNullable(ext));
    }

    /**
     * Get the value of {@code ext} in this container, throwing if there is none.
     *
     * @param ext The ext.
     * @param <T> The value type.
     * @return The value.
     * @throws RuntimeException If the ext is not attached.
     */
    default <T> T getExtOrThrow(Ext<T> ext) {
        T nullable = getNullable(ext);
        if (nullable != null) return nullable;
        throw new RuntimeException("Ext not present: " + ext.getName());
    }
}
