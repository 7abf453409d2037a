package ca.spottedleaf.lockguardedqueue.collection;

import ca.spottedleaf.lockguardedqueue.util.Validate;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Doubly linked double-ended sequence. Not thread-safe, callers are expected to provide their own synchronization.
 * <p>
 *     Null elements are not permitted, so {@code null} returned from the peek and poll methods always means empty.
 * </p>
 * <p>
 *     Iterators are fail-fast: any structural modification not made through the iterator itself causes the
 *     next iterator operation to throw {@link ConcurrentModificationException}.
 * </p>
 */
public final class LinkedDeque<E> implements Iterable<E> {

    private Link<E> head;
    private Link<E> tail;
    private int size;
    private int modCount;

    public LinkedDeque() {}

    public int size() {
        return this.size;
    }

    public boolean isEmpty() {
        return this.head == null;
    }

    public void clear() {
        // help GC
        for (Link<E> curr = this.head; curr != null;) {
            final Link<E> next = curr.next;
            curr.element = null;
            curr.prev = null;
            curr.next = null;
            curr = next;
        }
        this.head = this.tail = null;
        this.size = 0;
        ++this.modCount;
    }

    public E peekFirst() {
        final Link<E> head = this.head;
        return head == null ? null : head.element;
    }

    public E peekLast() {
        final Link<E> tail = this.tail;
        return tail == null ? null : tail.element;
    }

    /**
     * Replaces the first element.
     * @return the previous first element
     * @throws NoSuchElementException if this deque is empty
     */
    public E replaceFirst(final E element) {
        Validate.notNull(element, "Null element");
        final Link<E> head = this.head;
        if (head == null) {
            throw new NoSuchElementException();
        }
        final E ret = head.element;
        head.element = element;
        return ret;
    }

    /**
     * Replaces the last element.
     * @return the previous last element
     * @throws NoSuchElementException if this deque is empty
     */
    public E replaceLast(final E element) {
        Validate.notNull(element, "Null element");
        final Link<E> tail = this.tail;
        if (tail == null) {
            throw new NoSuchElementException();
        }
        final E ret = tail.element;
        tail.element = element;
        return ret;
    }

    private void removeNode(final Link<E> node) {
        final Link<E> prev = node.prev;
        final Link<E> next = node.next;

        // help GC
        node.element = null;
        node.prev = null;
        node.next = null;

        if (prev == null) {
            this.head = next;
        } else {
            prev.next = next;
        }

        if (next == null) {
            this.tail = prev;
        } else {
            next.prev = prev;
        }

        --this.size;
        ++this.modCount;
    }

    public E pollFirst() {
        final Link<E> head = this.head;
        if (head == null) {
            return null;
        }

        final E ret = head.element;
        this.removeNode(head);
        return ret;
    }

    public E pollLast() {
        final Link<E> tail = this.tail;
        if (tail == null) {
            return null;
        }

        final E ret = tail.element;
        this.removeNode(tail);
        return ret;
    }

    public void addLast(final E element) {
        Validate.notNull(element, "Null element");
        final Link<E> curr = this.tail;
        if (curr != null) {
            curr.next = this.tail = new Link<>(element, curr, null);
        } else {
            this.head = this.tail = new Link<>(element, null, null);
        }
        ++this.size;
        ++this.modCount;
    }

    public void addFirst(final E element) {
        Validate.notNull(element, "Null element");
        final Link<E> curr = this.head;
        if (curr != null) {
            curr.prev = this.head = new Link<>(element, null, curr);
        } else {
            this.head = this.tail = new Link<>(element, null, null);
        }
        ++this.size;
        ++this.modCount;
    }

    /**
     * Returns a read-only iterator from first to last. {@link Iterator#remove()} is not supported.
     */
    @Override
    public Iterator<E> iterator() {
        return new Itr();
    }

    /**
     * Returns an iterator from first to last which supports {@link Cursor#set(Object)} and {@link Cursor#remove()}.
     */
    public Cursor<E> cursor() {
        return new CursorImpl();
    }

    /**
     * Mutable iterator over a {@link LinkedDeque}.
     */
    public static interface Cursor<E> extends Iterator<E> {

        /**
         * Replaces the element last returned by {@link #next()}.
         * @return the replaced element
         * @throws IllegalStateException if {@link #next()} has not been called, or the element was removed
         */
        public E set(final E element);

        /**
         * Removes the element last returned by {@link #next()}.
         * @throws IllegalStateException if {@link #next()} has not been called, or the element was already removed
         */
        @Override
        public void remove();
    }

    private class Itr implements Iterator<E> {

        protected Link<E> next = LinkedDeque.this.head;
        protected Link<E> lastReturned;
        protected int expectedModCount = LinkedDeque.this.modCount;

        protected final void checkModCount() {
            if (LinkedDeque.this.modCount != this.expectedModCount) {
                throw new ConcurrentModificationException();
            }
        }

        @Override
        public boolean hasNext() {
            this.checkModCount();
            return this.next != null;
        }

        @Override
        public E next() {
            this.checkModCount();
            final Link<E> next = this.next;
            if (next == null) {
                throw new NoSuchElementException();
            }
            this.next = next.next;
            this.lastReturned = next;
            return next.element;
        }
    }

    private final class CursorImpl extends Itr implements Cursor<E> {

        @Override
        public E set(final E element) {
            Validate.notNull(element, "Null element");
            this.checkModCount();
            final Link<E> last = this.lastReturned;
            if (last == null) {
                throw new IllegalStateException();
            }
            final E ret = last.element;
            last.element = element;
            return ret;
        }

        @Override
        public void remove() {
            this.checkModCount();
            final Link<E> last = this.lastReturned;
            if (last == null) {
                throw new IllegalStateException();
            }
            this.lastReturned = null;
            LinkedDeque.this.removeNode(last);
            this.expectedModCount = LinkedDeque.this.modCount;
        }
    }

    private static final class Link<E> {
        private E element;
        private Link<E> prev;
        private Link<E> next;

        private Link(final E element, final Link<E> prev, final Link<E> next) {
            this.element = element;
            this.prev = prev;
            this.next = next;
        }
    }
}
