package ca.spottedleaf.lockguardedqueue.lock;

/**
 * Capability proving that the acquiring thread holds a {@link ReadWriteMutex} in some mode.
 * <p>
 *     A handle is bound to the mutex which issued it and to the thread which acquired it. It is valid from the moment
 *     it is returned until it is released, either through {@link #release()} or by closing it (which makes it usable in
 *     try-with-resources). Handles must not be passed to other threads; every thread acquires its own.
 * </p>
 */
public abstract class LockHandle implements AutoCloseable {

    protected final ReadWriteMutex mutex;
    protected final Thread owner;
    private volatile boolean released;

    LockHandle(final ReadWriteMutex mutex, final Thread owner) {
        this.mutex = mutex;
        this.owner = owner;
    }

    /**
     * Returns whether this handle was issued by the specified mutex. Released handles still report the mutex
     * that issued them.
     */
    public final boolean isIssuedBy(final ReadWriteMutex mutex) {
        return this.mutex == mutex;
    }

    /**
     * Returns whether this handle has not yet been released.
     */
    public final boolean isHeld() {
        return !this.released;
    }

    public final Thread getOwner() {
        return this.owner;
    }

    public final boolean isOwnedByCurrentThread() {
        return this.owner == Thread.currentThread();
    }

    /** @return {@code true} for write handles, {@code false} for read handles */
    public abstract boolean isExclusive();

    protected abstract void unlock();

    /**
     * Releases the mutex. Must be called from the owning thread.
     * @throws IllegalStateException if this handle is already released, or the calling thread is not the owner
     */
    public final void release() {
        if (this.owner != Thread.currentThread()) {
            throw new IllegalStateException("Lock handle owned by thread '" + this.owner.getName() + "' released from thread '" + Thread.currentThread().getName() + "'");
        }
        if (this.released) {
            throw new IllegalStateException("Lock handle already released");
        }
        this.released = true;
        this.unlock();
    }

    // marks this handle released without touching the mutex state, used when ownership is converted
    final void invalidate() {
        this.released = true;
    }

    /**
     * Releases this handle if it is still held. Unlike {@link #release()}, this is a no-op on released handles.
     */
    @Override
    public final void close() {
        if (!this.released) {
            this.release();
        }
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + "{" +
            "mutex=" + this.mutex +
            ", owner=" + this.owner.getName() +
            ", held=" + !this.released +
            '}';
    }
}
