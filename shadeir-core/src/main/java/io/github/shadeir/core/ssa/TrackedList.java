package io.github.shadeir.core.ssa;

import java.util.AbstractList;
import java.util.ArrayList;
import java.util.List;
import java.util.RandomAccess;

/**
 * A list that is notified whenever an element enters or leaves it,
 * so that owners can keep back-references up to date.
 * <p>
 * Every mutation, including through iterators and sublists, goes
 * through {@link #add(int, Object)}, {@link #set(int, Object)} or {@link #remove(int)}.
 *
 * @param <E> The element type.
 */
abstract class TrackedList<E> extends AbstractList<E> implements RandomAccess {
    private final List<E> backing = new ArrayList<>();

    protected abstract void onAdded(E elt);

    protected abstract void onRemoved(E elt);

    @Override
    public E get(int index) {
        return backing.get(index);
    }

    @Override
    public int size() {
        return backing.size();
    }

    @Override
    public E set(int index, E element) {
        E removed = backing.set(index, element);
        onRemoved(removed);
        onAdded(element);
        return removed;
    }

    @Override
    public void add(int index, E element) {
        backing.add(index, element);
        onAdded(element);
    }

    @Override
    public E remove(int index) {
        E removed = backing.remove(index);
        onRemoved(removed);
        return removed;
    }
}
