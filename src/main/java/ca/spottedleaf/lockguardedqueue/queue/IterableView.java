package ca.spottedleaf.lockguardedqueue.queue;

import ca.spottedleaf.lockguardedqueue.lock.ReadLock;
import java.util.Iterator;

/**
 * Read-only view over the live contents of a {@link LockGuardedQueue}, obtained through
 * {@link LockGuardedQueue#acquireIterableView(ReadLock)}.
 * <p>
 *     Does not copy. Every iterator step re-validates the read handle, so using the view or its iterators after the
 *     handle is released throws {@link IllegalStateException}. {@link Iterator#remove()} is not supported.
 * </p>
 */
public final class IterableView<T> implements Iterable<T> {

    private final LockGuardedQueue<T> queue;
    private final ReadLock lock;

    IterableView(final LockGuardedQueue<T> queue, final ReadLock lock) {
        this.queue = queue;
        this.lock = lock;
    }

    @Override
    public Iterator<T> iterator() {
        this.queue.checkLock(this.lock);
        return new LockGuardedQueue.GuardedIterator<>(this.queue, this.lock, this.queue.elements().iterator());
    }
}
