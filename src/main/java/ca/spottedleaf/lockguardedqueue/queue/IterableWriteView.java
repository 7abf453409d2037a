package ca.spottedleaf.lockguardedqueue.queue;

import ca.spottedleaf.lockguardedqueue.lock.WriteLock;
import java.util.Iterator;

/**
 * Read-write view over the live contents of a {@link LockGuardedQueue}, obtained through
 * {@link LockGuardedQueue#acquireIterableWriteView(WriteLock)}.
 * <p>
 *     {@link #iterator()} supports replacing and removing elements in place. Such changes through one iterator
 *     invalidate every other iterator of this queue, as do pushes and pops. Use after the write handle is released
 *     throws {@link IllegalStateException}.
 * </p>
 */
public final class IterableWriteView<T> implements Iterable<T> {

    private final LockGuardedQueue<T> queue;
    private final WriteLock lock;

    IterableWriteView(final LockGuardedQueue<T> queue, final WriteLock lock) {
        this.queue = queue;
        this.lock = lock;
    }

    @Override
    public WriteIterator<T> iterator() {
        this.queue.checkLock(this.lock);
        return new LockGuardedQueue.GuardedCursor<>(this.queue, this.lock, this.queue.elements().cursor());
    }

    public Iterator<T> readOnlyIterator() {
        this.queue.checkLock(this.lock);
        return new LockGuardedQueue.GuardedIterator<>(this.queue, this.lock, this.queue.elements().iterator());
    }

    /**
     * Iterator over a {@link IterableWriteView} which can change the queue in place.
     */
    public static interface WriteIterator<T> extends Iterator<T> {

        /**
         * Replaces the element last returned by {@link #next()}.
         * @return the replaced element
         * @throws IllegalStateException if {@link #next()} has not been called, the element was removed, or the
         *                               write handle has been released
         */
        public T set(final T element);

        /**
         * Removes the element last returned by {@link #next()}.
         * @throws IllegalStateException if {@link #next()} has not been called, the element was already removed, or
         *                               the write handle has been released
         */
        @Override
        public void remove();
    }
}
