package ca.spottedleaf.lockguardedqueue.lock;

import ca.spottedleaf.lockguardedqueue.util.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Writer-preferring, non-reentrant reader/writer mutex which hands out {@link LockHandle} capabilities.
 * <p>
 *     Fairness policy: a reader is admitted only when no writer holds the mutex <b>and</b> no writer is waiting for it.
 *     A writer is admitted when no reader and no writer holds the mutex. On release of the write lock, waiting writers
 *     are woken in preference to readers. Consequently writers cannot be starved by a continuous stream of readers,
 *     while readers can be starved by a continuous stream of writers. No FIFO ordering is provided among writers or
 *     among readers.
 * </p>
 * <p>
 *     The mutex is not re-entrant. Acquiring either lock while the current thread owns the write lock throws
 *     {@link IllegalStateException}. Acquiring a read lock while the current thread holds a read lock is not detected,
 *     and will deadlock if a writer has started waiting in between. Upgrading is not supported either: a thread
 *     holding a read handle that calls {@link #lockWrite()} waits forever, since a writer is admitted only once every
 *     read handle is released. The timed {@link #tryLockWrite(long, TimeUnit)} gives up instead, returning
 *     {@code null}. Use {@link #downgrade(WriteLock)} for the opposite direction.
 * </p>
 * <p>
 *     The blocking acquire methods wait indefinitely and ignore interrupts, preserving the interrupt status of the thread.
 *     Use the interruptible or timed variants for cancellable acquisition.
 * </p>
 */
public final class ReadWriteMutex {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReadWriteMutex.class);

    private final ReentrantLock stateLock = new ReentrantLock();
    private final Condition readable = this.stateLock.newCondition();
    private final Condition writable = this.stateLock.newCondition();

    /* all guarded by stateLock */
    private int readers;
    private Thread writer;
    private int waitingWriters;

    public ReadWriteMutex() {}

    private boolean canRead() {
        return this.writer == null && this.waitingWriters == 0;
    }

    private boolean canWrite() {
        return this.writer == null && this.readers == 0;
    }

    private void checkNotWriter(final Thread thread) {
        if (this.writer == thread) {
            throw new IllegalStateException("Write lock is not re-entrant, already held by thread '" + thread.getName() + "'");
        }
    }

    // must hold stateLock, called when a waiting writer gives up
    private void cancelWaitingWriter() {
        if (--this.waitingWriters == 0 && this.writer == null) {
            this.readable.signalAll();
        }
    }

    /* read */

    public ReadLock lockRead() {
        final Thread currThread = Thread.currentThread();
        this.stateLock.lock();
        try {
            this.checkNotWriter(currThread);
            while (!this.canRead()) {
                this.readable.awaitUninterruptibly();
            }
            ++this.readers;
        } finally {
            this.stateLock.unlock();
        }
        return new ReadLock(this, currThread);
    }

    public ReadLock lockReadInterruptibly() throws InterruptedException {
        final Thread currThread = Thread.currentThread();
        this.stateLock.lockInterruptibly();
        try {
            this.checkNotWriter(currThread);
            while (!this.canRead()) {
                try {
                    this.readable.await();
                } catch (final InterruptedException ex) {
                    LOGGER.debug("Thread '" + currThread.getName() + "' interrupted while waiting for read lock on " + this);
                    throw ex;
                }
            }
            ++this.readers;
        } finally {
            this.stateLock.unlock();
        }
        return new ReadLock(this, currThread);
    }

    /**
     * Acquires the read lock only if it is immediately available.
     * @return the handle, or {@code null} if the read lock could not be acquired
     */
    public ReadLock tryLockRead() {
        final Thread currThread = Thread.currentThread();
        this.stateLock.lock();
        try {
            this.checkNotWriter(currThread);
            if (!this.canRead()) {
                return null;
            }
            ++this.readers;
        } finally {
            this.stateLock.unlock();
        }
        return new ReadLock(this, currThread);
    }

    /**
     * Waits up to the specified time for the read lock.
     * @return the handle, or {@code null} if the timeout elapsed before the read lock was acquired
     */
    public ReadLock tryLockRead(final long timeout, final TimeUnit unit) throws InterruptedException {
        Validate.notNull(unit, "Null unit");
        final Thread currThread = Thread.currentThread();
        long nanos = unit.toNanos(timeout);
        this.stateLock.lockInterruptibly();
        try {
            this.checkNotWriter(currThread);
            while (!this.canRead()) {
                if (nanos <= 0L) {
                    LOGGER.debug("Timed out after " + timeout + " " + unit + " waiting for read lock on " + this);
                    return null;
                }
                try {
                    nanos = this.readable.awaitNanos(nanos);
                } catch (final InterruptedException ex) {
                    LOGGER.debug("Thread '" + currThread.getName() + "' interrupted while waiting for read lock on " + this);
                    throw ex;
                }
            }
            ++this.readers;
        } finally {
            this.stateLock.unlock();
        }
        return new ReadLock(this, currThread);
    }

    void unlockRead() {
        this.stateLock.lock();
        try {
            if (this.readers <= 0) {
                throw new IllegalStateException("Read lock not held");
            }
            if (--this.readers == 0 && this.waitingWriters != 0) {
                this.writable.signalAll();
            }
        } finally {
            this.stateLock.unlock();
        }
    }

    /* write */

    public WriteLock lockWrite() {
        final Thread currThread = Thread.currentThread();
        this.stateLock.lock();
        try {
            this.checkNotWriter(currThread);
            if (!this.canWrite()) {
                ++this.waitingWriters;
                do {
                    this.writable.awaitUninterruptibly();
                } while (!this.canWrite());
                --this.waitingWriters;
            }
            this.writer = currThread;
        } finally {
            this.stateLock.unlock();
        }
        return new WriteLock(this, currThread);
    }

    public WriteLock lockWriteInterruptibly() throws InterruptedException {
        final Thread currThread = Thread.currentThread();
        this.stateLock.lockInterruptibly();
        try {
            this.checkNotWriter(currThread);
            if (!this.canWrite()) {
                ++this.waitingWriters;
                do {
                    try {
                        this.writable.await();
                    } catch (final InterruptedException ex) {
                        this.cancelWaitingWriter();
                        LOGGER.debug("Thread '" + currThread.getName() + "' interrupted while waiting for write lock on " + this);
                        throw ex;
                    }
                } while (!this.canWrite());
                --this.waitingWriters;
            }
            this.writer = currThread;
        } finally {
            this.stateLock.unlock();
        }
        return new WriteLock(this, currThread);
    }

    /**
     * Acquires the write lock only if it is immediately available.
     * @return the handle, or {@code null} if the write lock could not be acquired
     */
    public WriteLock tryLockWrite() {
        final Thread currThread = Thread.currentThread();
        this.stateLock.lock();
        try {
            this.checkNotWriter(currThread);
            if (!this.canWrite()) {
                return null;
            }
            this.writer = currThread;
        } finally {
            this.stateLock.unlock();
        }
        return new WriteLock(this, currThread);
    }

    /**
     * Waits up to the specified time for the write lock. While waiting, this thread counts as a waiting writer and
     * so blocks new readers.
     * @return the handle, or {@code null} if the timeout elapsed before the write lock was acquired
     */
    public WriteLock tryLockWrite(final long timeout, final TimeUnit unit) throws InterruptedException {
        Validate.notNull(unit, "Null unit");
        final Thread currThread = Thread.currentThread();
        long nanos = unit.toNanos(timeout);
        this.stateLock.lockInterruptibly();
        try {
            this.checkNotWriter(currThread);
            if (!this.canWrite()) {
                if (nanos <= 0L) {
                    return null;
                }
                ++this.waitingWriters;
                do {
                    if (nanos <= 0L) {
                        this.cancelWaitingWriter();
                        LOGGER.debug("Timed out after " + timeout + " " + unit + " waiting for write lock on " + this);
                        return null;
                    }
                    try {
                        nanos = this.writable.awaitNanos(nanos);
                    } catch (final InterruptedException ex) {
                        this.cancelWaitingWriter();
                        LOGGER.debug("Thread '" + currThread.getName() + "' interrupted while waiting for write lock on " + this);
                        throw ex;
                    }
                } while (!this.canWrite());
                --this.waitingWriters;
            }
            this.writer = currThread;
        } finally {
            this.stateLock.unlock();
        }
        return new WriteLock(this, currThread);
    }

    void unlockWrite(final Thread owner) {
        this.stateLock.lock();
        try {
            if (this.writer != owner) {
                throw new IllegalStateException("Write lock not held by thread '" + owner.getName() + "'");
            }
            this.writer = null;
            if (this.waitingWriters != 0) {
                this.writable.signalAll();
            } else {
                this.readable.signalAll();
            }
        } finally {
            this.stateLock.unlock();
        }
    }

    /**
     * Atomically converts the specified write handle into a read handle. No writer can acquire the mutex in between.
     * The write handle is released by this call.
     * @throws IllegalStateException if the handle was not issued by this mutex, is not held, or is not owned by the
     *                               current thread
     */
    public ReadLock downgrade(final WriteLock lock) {
        Validate.notNull(lock, "Null lock");
        final Thread currThread = Thread.currentThread();
        if (!lock.isIssuedBy(this)) {
            throw new IllegalStateException("Write lock was not issued by this mutex");
        }
        if (!lock.isHeld()) {
            throw new IllegalStateException("Write lock already released");
        }
        if (!lock.isOwnedByCurrentThread()) {
            throw new IllegalStateException("Write lock owned by thread '" + lock.getOwner().getName() + "' downgraded from thread '" + currThread.getName() + "'");
        }

        this.stateLock.lock();
        try {
            if (this.writer != currThread) {
                throw new IllegalStateException("Write lock not held by thread '" + currThread.getName() + "'");
            }
            this.writer = null;
            ++this.readers;
            lock.invalidate();
            if (this.waitingWriters == 0) {
                this.readable.signalAll();
            }
        } finally {
            this.stateLock.unlock();
        }
        return new ReadLock(this, currThread);
    }

    /* introspection, values may be stale by the time they are returned */

    public int getReadLockCount() {
        this.stateLock.lock();
        try {
            return this.readers;
        } finally {
            this.stateLock.unlock();
        }
    }

    public boolean isWriteLocked() {
        this.stateLock.lock();
        try {
            return this.writer != null;
        } finally {
            this.stateLock.unlock();
        }
    }

    public boolean isWriteLockedByCurrentThread() {
        this.stateLock.lock();
        try {
            return this.writer == Thread.currentThread();
        } finally {
            this.stateLock.unlock();
        }
    }

    public int getQueuedWriterCount() {
        this.stateLock.lock();
        try {
            return this.waitingWriters;
        } finally {
            this.stateLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "ReadWriteMutex@" + Integer.toHexString(System.identityHashCode(this));
    }
}
