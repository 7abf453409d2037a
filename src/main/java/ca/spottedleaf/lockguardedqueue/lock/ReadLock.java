package ca.spottedleaf.lockguardedqueue.lock;

/**
 * Shared ownership of a {@link ReadWriteMutex}. Any number of read handles may be held at once.
 */
public final class ReadLock extends LockHandle {

    ReadLock(final ReadWriteMutex mutex, final Thread owner) {
        super(mutex, owner);
    }

    @Override
    public boolean isExclusive() {
        return false;
    }

    @Override
    protected void unlock() {
        this.mutex.unlockRead();
    }
}
