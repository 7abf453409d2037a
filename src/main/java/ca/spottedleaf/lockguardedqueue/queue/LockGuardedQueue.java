package ca.spottedleaf.lockguardedqueue.queue;

import ca.spottedleaf.lockguardedqueue.collection.LinkedDeque;
import ca.spottedleaf.lockguardedqueue.lock.LockHandle;
import ca.spottedleaf.lockguardedqueue.lock.ReadLock;
import ca.spottedleaf.lockguardedqueue.lock.ReadWriteMutex;
import ca.spottedleaf.lockguardedqueue.lock.WriteLock;
import ca.spottedleaf.lockguardedqueue.util.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * FIFO queue guarded by a reader/writer mutex, where every accessor takes the lock handle as a parameter.
 * <p>
 *     Handles are obtained from this queue through {@link #acquireReadLock()} or {@link #acquireWriteLock()} (or
 *     their timed and interruptible variants) and are accepted only by the queue which issued them, only while they
 *     are held, and only on the thread that acquired them. Any other handle is a programming error and is rejected
 *     with {@link IllegalStateException} before the queue is touched. The mutex itself is never exposed.
 * </p>
 * <p>
 *     Retrieval from an empty queue ({@link #front(ReadLock)}, {@link #back(ReadLock)}, {@link #pop(WriteLock)} and
 *     friends) throws {@link NoSuchElementException}; callers should check {@link #isEmpty(ReadLock)} or
 *     {@link #size(ReadLock)} first. Null elements are not permitted.
 * </p>
 * <p>
 *     Locking follows the policy of {@link ReadWriteMutex}: writer-preferring and not re-entrant.
 * </p>
 * <pre>
 *     try (final WriteLock lock = queue.acquireWriteLock()) {
 *         queue.push(task, lock);
 *     }
 *
 *     try (final WriteLock lock = queue.acquireWriteLock()) {
 *         while (!queue.isEmpty(lock)) {
 *             process(queue.pop(lock));
 *         }
 *     }
 * </pre>
 */
public final class LockGuardedQueue<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(LockGuardedQueue.class);

    private final ReadWriteMutex mutex = new ReadWriteMutex();
    private final LinkedDeque<T> elements = new LinkedDeque<>();

    public LockGuardedQueue() {}

    /**
     * Constructs a queue holding the specified elements, in iteration order.
     * @throws NullPointerException if the iterable or any element is {@code null}
     */
    public LockGuardedQueue(final Iterable<? extends T> initial) {
        Validate.notNull(initial, "Null initial elements");
        for (final T element : initial) {
            this.elements.addLast(Validate.notNull(element, "Null element"));
        }
    }

    /**
     * Ensures the handle was issued by this queue, is still held and is owned by the current thread.
     */
    void checkLock(final LockHandle lock) {
        Validate.notNull(lock, "Null lock");
        if (!lock.isIssuedBy(this.mutex)) {
            LOGGER.warn("Rejected " + lock + " presented to " + this + " on thread '" + Thread.currentThread().getName() + "'");
            throw new IllegalStateException("Lock handle was not issued by this queue");
        }
        if (!lock.isHeld()) {
            LOGGER.warn("Rejected " + lock + " presented to " + this + " on thread '" + Thread.currentThread().getName() + "'");
            throw new IllegalStateException("Lock handle has been released");
        }
        if (!lock.isOwnedByCurrentThread()) {
            LOGGER.warn("Rejected " + lock + " presented to " + this + " on thread '" + Thread.currentThread().getName() + "'");
            throw new IllegalStateException("Lock handle is owned by thread '" + lock.getOwner().getName() + "'");
        }
    }

    /**
     * Returns whether the specified handle was issued by this queue and is still held.
     */
    public boolean isHeldBy(final LockHandle lock) {
        return lock != null && lock.isIssuedBy(this.mutex) && lock.isHeld();
    }

    LinkedDeque<T> elements() {
        return this.elements;
    }

    /* read */

    private T front0() {
        final T ret = this.elements.peekFirst();
        if (ret == null) {
            throw new NoSuchElementException("Queue is empty");
        }
        return ret;
    }

    private T back0() {
        final T ret = this.elements.peekLast();
        if (ret == null) {
            throw new NoSuchElementException("Queue is empty");
        }
        return ret;
    }

    /**
     * Returns the element at the front of this queue, which is the next element {@link #pop(WriteLock)} returns.
     * @throws NoSuchElementException if this queue is empty
     */
    public T front(final ReadLock lock) {
        this.checkLock(lock);
        return this.front0();
    }

    public T front(final WriteLock lock) {
        this.checkLock(lock);
        return this.front0();
    }

    /**
     * Returns the element at the back of this queue, which is the most recently pushed element.
     * @throws NoSuchElementException if this queue is empty
     */
    public T back(final ReadLock lock) {
        this.checkLock(lock);
        return this.back0();
    }

    public T back(final WriteLock lock) {
        this.checkLock(lock);
        return this.back0();
    }

    public boolean isEmpty(final ReadLock lock) {
        this.checkLock(lock);
        return this.elements.isEmpty();
    }

    public boolean isEmpty(final WriteLock lock) {
        this.checkLock(lock);
        return this.elements.isEmpty();
    }

    public int size(final ReadLock lock) {
        this.checkLock(lock);
        return this.elements.size();
    }

    public int size(final WriteLock lock) {
        this.checkLock(lock);
        return this.elements.size();
    }

    /* write */

    /**
     * Appends the element to the back of this queue. The reference is stored as is; no copy is made.
     * @throws NullPointerException if the element is {@code null}
     */
    public void push(final T element, final WriteLock lock) {
        this.checkLock(lock);
        this.elements.addLast(Validate.notNull(element, "Null element"));
    }

    /**
     * Appends a copy of the element to the back of this queue. The copy is made while the write lock is held.
     * If the copier throws, this queue is left unchanged.
     * @throws NullPointerException if the element, the copier or the copy is {@code null}
     */
    public void pushCopy(final T element, final UnaryOperator<T> copier, final WriteLock lock) {
        this.checkLock(lock);
        Validate.notNull(element, "Null element");
        Validate.notNull(copier, "Null copier");
        this.elements.addLast(Validate.notNull(copier.apply(element), "Copier returned null"));
    }

    /**
     * Appends all elements, in iteration order. If any element is {@code null}, nothing is appended.
     * @return the number of elements appended
     */
    public int pushAll(final Iterable<? extends T> elements, final WriteLock lock) {
        this.checkLock(lock);
        Validate.notNull(elements, "Null elements");

        final ArrayList<T> toAdd = new ArrayList<>();
        for (final T element : elements) {
            toAdd.add(Validate.notNull(element, "Null element"));
        }
        for (int i = 0, len = toAdd.size(); i < len; ++i) {
            this.elements.addLast(toAdd.get(i));
        }
        return toAdd.size();
    }

    /**
     * Removes and returns the element at the front of this queue.
     * @throws NoSuchElementException if this queue is empty
     */
    public T pop(final WriteLock lock) {
        this.checkLock(lock);
        final T ret = this.elements.pollFirst();
        if (ret == null) {
            throw new NoSuchElementException("Queue is empty");
        }
        return ret;
    }

    /**
     * Replaces the element at the front of this queue in place.
     * @return the replaced element
     * @throws NoSuchElementException if this queue is empty
     */
    public T replaceFront(final T element, final WriteLock lock) {
        this.checkLock(lock);
        return this.elements.replaceFirst(element);
    }

    /**
     * Replaces the element at the back of this queue in place.
     * @return the replaced element
     * @throws NoSuchElementException if this queue is empty
     */
    public T replaceBack(final T element, final WriteLock lock) {
        this.checkLock(lock);
        return this.elements.replaceLast(element);
    }

    /**
     * Pops every element, front to back, into the consumer. If the consumer throws, the element it was given has
     * already been removed and the remaining elements stay queued.
     * @return the number of elements drained
     */
    public int drain(final WriteLock lock, final Consumer<? super T> consumer) {
        this.checkLock(lock);
        Validate.notNull(consumer, "Null consumer");

        int drained = 0;
        T element;
        while ((element = this.elements.pollFirst()) != null) {
            ++drained;
            consumer.accept(element);
        }
        return drained;
    }

    public void clear(final WriteLock lock) {
        this.checkLock(lock);
        this.elements.clear();
    }

    /* locks */

    /**
     * Blocks until the mutex can be held in shared mode. Does not respond to interrupts.
     */
    public ReadLock acquireReadLock() {
        return this.mutex.lockRead();
    }

    /**
     * Blocks until the mutex can be held in exclusive mode. Does not respond to interrupts.
     */
    public WriteLock acquireWriteLock() {
        return this.mutex.lockWrite();
    }

    public ReadLock acquireReadLockInterruptibly() throws InterruptedException {
        return this.mutex.lockReadInterruptibly();
    }

    public WriteLock acquireWriteLockInterruptibly() throws InterruptedException {
        return this.mutex.lockWriteInterruptibly();
    }

    /** @return the handle, or {@code null} if the read lock is not immediately available */
    public ReadLock tryAcquireReadLock() {
        return this.mutex.tryLockRead();
    }

    /** @return the handle, or {@code null} if the write lock is not immediately available */
    public WriteLock tryAcquireWriteLock() {
        return this.mutex.tryLockWrite();
    }

    /** @return the handle, or {@code null} if the timeout elapsed first */
    public ReadLock tryAcquireReadLock(final long timeout, final TimeUnit unit) throws InterruptedException {
        return this.mutex.tryLockRead(timeout, unit);
    }

    /** @return the handle, or {@code null} if the timeout elapsed first */
    public WriteLock tryAcquireWriteLock(final long timeout, final TimeUnit unit) throws InterruptedException {
        return this.mutex.tryLockWrite(timeout, unit);
    }

    /**
     * Atomically converts a write handle of this queue into a read handle, so that the state just written can be read
     * without another writer getting in between. The write handle is released by this call.
     */
    public ReadLock downgrade(final WriteLock lock) {
        this.checkLock(lock);
        return this.mutex.downgrade(lock);
    }

    /**
     * Runs the function with a read handle held for exactly its duration. The handle is released on return, including
     * exceptional return, and must not be retained by the function.
     */
    public <R> R withReadLock(final Function<? super ReadLock, ? extends R> function) {
        Validate.notNull(function, "Null function");
        try (final ReadLock lock = this.acquireReadLock()) {
            return function.apply(lock);
        }
    }

    /**
     * Runs the function with a write handle held for exactly its duration. The handle is released on return, including
     * exceptional return, and must not be retained by the function.
     */
    public <R> R withWriteLock(final Function<? super WriteLock, ? extends R> function) {
        Validate.notNull(function, "Null function");
        try (final WriteLock lock = this.acquireWriteLock()) {
            return function.apply(lock);
        }
    }

    /* views */

    /**
     * Returns a read-only view over the live contents of this queue, front to back. The view is usable only while the
     * handle is held, and its iterators fail once this queue is modified.
     */
    public IterableView<T> acquireIterableView(final ReadLock lock) {
        this.checkLock(lock);
        return new IterableView<>(this, lock);
    }

    /**
     * Returns a read-write view over the live contents of this queue, front to back. The view is usable only while the
     * handle is held. Its iterators fail once this queue is modified by anything other than the iterator itself.
     */
    public IterableWriteView<T> acquireIterableWriteView(final WriteLock lock) {
        this.checkLock(lock);
        return new IterableWriteView<>(this, lock);
    }

    @Override
    public String toString() {
        return "LockGuardedQueue@" + Integer.toHexString(System.identityHashCode(this));
    }

    /**
     * Iterator which re-validates the originating handle before every step.
     */
    static class GuardedIterator<T> implements Iterator<T> {

        protected final LockGuardedQueue<T> queue;
        protected final LockHandle lock;
        protected final Iterator<T> delegate;

        GuardedIterator(final LockGuardedQueue<T> queue, final LockHandle lock, final Iterator<T> delegate) {
            this.queue = queue;
            this.lock = lock;
            this.delegate = delegate;
        }

        @Override
        public boolean hasNext() {
            this.queue.checkLock(this.lock);
            return this.delegate.hasNext();
        }

        @Override
        public T next() {
            this.queue.checkLock(this.lock);
            return this.delegate.next();
        }
    }

    static final class GuardedCursor<T> extends GuardedIterator<T> implements IterableWriteView.WriteIterator<T> {

        GuardedCursor(final LockGuardedQueue<T> queue, final WriteLock lock, final LinkedDeque.Cursor<T> delegate) {
            super(queue, lock, delegate);
        }

        @Override
        public T set(final T element) {
            this.queue.checkLock(this.lock);
            return ((LinkedDeque.Cursor<T>)this.delegate).set(element);
        }

        @Override
        public void remove() {
            this.queue.checkLock(this.lock);
            this.delegate.remove();
        }
    }
}
