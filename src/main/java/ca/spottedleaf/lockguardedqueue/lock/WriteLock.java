package ca.spottedleaf.lockguardedqueue.lock;

/**
 * Exclusive ownership of a {@link ReadWriteMutex}. While held, no other read or write handle exists.
 */
public final class WriteLock extends LockHandle {

    WriteLock(final ReadWriteMutex mutex, final Thread owner) {
        super(mutex, owner);
    }

    @Override
    public boolean isExclusive() {
        return true;
    }

    @Override
    protected void unlock() {
        this.mutex.unlockWrite(this.owner);
    }
}
