package ca.spottedleaf.lockguardedqueue.lock;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReadWriteMutex")
class ReadWriteMutexTest {

    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        this.pool = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        this.pool.shutdownNow();
    }

    @Nested
    @DisplayName("Handles")
    class Handles {

        @Test
        @DisplayName("handles report their mutex, mode and owner")
        void handleIdentity() {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final ReadWriteMutex other = new ReadWriteMutex();

            final ReadLock read = mutex.lockRead();
            assertTrue(read.isIssuedBy(mutex));
            assertFalse(read.isIssuedBy(other));
            assertFalse(read.isExclusive());
            assertTrue(read.isHeld());
            assertTrue(read.isOwnedByCurrentThread());
            assertSame(Thread.currentThread(), read.getOwner());
            read.release();
            assertFalse(read.isHeld());
            assertTrue(read.isIssuedBy(mutex));

            final WriteLock write = mutex.lockWrite();
            assertTrue(write.isExclusive());
            assertTrue(mutex.isWriteLocked());
            assertTrue(mutex.isWriteLockedByCurrentThread());
            write.release();
            assertFalse(mutex.isWriteLocked());
        }

        @Test
        @DisplayName("release twice -> IllegalStateException, close is idempotent")
        void doubleRelease() {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final WriteLock write = mutex.lockWrite();
            write.release();
            assertThrows(IllegalStateException.class, write::release);
            write.close();

            final ReadLock read = mutex.lockRead();
            read.close();
            read.close();
            assertEquals(0, mutex.getReadLockCount());
        }

        @Test
        @DisplayName("upgrading a held read lock times out instead of being granted")
        void upgradeFromRead() throws InterruptedException {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final ReadLock read = mutex.lockRead();

            assertNull(mutex.tryLockWrite(50L, TimeUnit.MILLISECONDS));
            assertNull(mutex.tryLockWrite());
            assertEquals(0, mutex.getQueuedWriterCount());
            assertEquals(1, mutex.getReadLockCount());

            read.release();
            final WriteLock write = mutex.tryLockWrite();
            assertNotNull(write);
            write.release();
        }

        @Test
        @DisplayName("release from another thread -> IllegalStateException, lock stays held")
        void releaseFromOtherThread() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final WriteLock write = mutex.lockWrite();

            final Future<?> f = pool.submit(write::release);
            final ExecutionException ex = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
            assertTrue(ex.getCause() instanceof IllegalStateException);

            assertTrue(write.isHeld());
            assertTrue(mutex.isWriteLockedByCurrentThread());
            write.release();
        }

        @Test
        @DisplayName("re-acquiring while holding the write lock -> IllegalStateException")
        void notReentrant() {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            try (final WriteLock write = mutex.lockWrite()) {
                assertThrows(IllegalStateException.class, mutex::lockWrite);
                assertThrows(IllegalStateException.class, mutex::lockRead);
                assertThrows(IllegalStateException.class, mutex::tryLockWrite);
                assertThrows(IllegalStateException.class, mutex::tryLockRead);
                assertTrue(write.isHeld());
            }
            assertFalse(mutex.isWriteLocked());
        }
    }

    @Nested
    @DisplayName("Exclusion")
    class Exclusion {

        @Test
        @DisplayName("readers share the mutex")
        void readersShare() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final int readers = 4;
            final CyclicBarrier allInside = new CyclicBarrier(readers);

            final Future<?>[] futures = new Future<?>[readers];
            for (int i = 0; i < readers; ++i) {
                futures[i] = pool.submit(() -> {
                    try (final ReadLock lock = mutex.lockRead()) {
                        // every reader must be inside at the same time to pass
                        allInside.await(5, TimeUnit.SECONDS);
                        assertTrue(lock.isHeld());
                    }
                    return null;
                });
            }

            for (final Future<?> f : futures) {
                getOrDump(f, 10, "readersShare");
            }
            assertEquals(0, mutex.getReadLockCount());
        }

        @Test
        @DisplayName("write lock excludes readers and writers")
        void writerExcludes() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final WriteLock write = mutex.lockWrite();

            final Future<Boolean> tryRead = pool.submit(() -> mutex.tryLockRead() == null);
            final Future<Boolean> tryWrite = pool.submit(() -> mutex.tryLockWrite() == null);
            assertTrue(getOrDump(tryRead, 5, "tryRead"));
            assertTrue(getOrDump(tryWrite, 5, "tryWrite"));

            write.release();

            final Future<Boolean> readAfter = pool.submit(() -> {
                final ReadLock lock = mutex.tryLockRead();
                if (lock == null) {
                    return false;
                }
                lock.release();
                return true;
            });
            assertTrue(getOrDump(readAfter, 5, "readAfter"));
        }

        @Test
        @DisplayName("read lock excludes writers")
        void readerExcludesWriter() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            try (final ReadLock read = mutex.lockRead()) {
                final Future<Boolean> tryWrite = pool.submit(() -> mutex.tryLockWrite() == null);
                assertTrue(getOrDump(tryWrite, 5, "tryWrite"));
                assertEquals(1, mutex.getReadLockCount());
            }
        }

        @Test
        @DisplayName("blocked writer proceeds once all readers release")
        void writerWaitsForReaders() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final ReadLock read = mutex.lockRead();
            final AtomicInteger state = new AtomicInteger();

            final Future<?> writer = pool.submit(() -> {
                try (final WriteLock lock = mutex.lockWrite()) {
                    state.set(1);
                }
            });

            waitUntil(() -> mutex.getQueuedWriterCount() == 1, "writer queued");
            assertEquals(0, state.get());

            read.release();
            getOrDump(writer, 5, "writerWaitsForReaders");
            assertEquals(1, state.get());
            assertEquals(0, mutex.getQueuedWriterCount());
        }
    }

    @Nested
    @DisplayName("Writer preference")
    class WriterPreference {

        @Test
        @DisplayName("a waiting writer blocks new readers")
        void waitingWriterBlocksReaders() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final ReadLock first = mutex.lockRead();

            final CountDownLatch writerAcquired = new CountDownLatch(1);
            final CountDownLatch releaseWriter = new CountDownLatch(1);
            final Future<?> writer = pool.submit(() -> {
                try (final WriteLock lock = mutex.lockWrite()) {
                    writerAcquired.countDown();
                    releaseWriter.await();
                }
                return null;
            });

            waitUntil(() -> mutex.getQueuedWriterCount() == 1, "writer queued");

            // a reader arriving now must not overtake the queued writer
            final Future<Boolean> lateReader = pool.submit(() -> mutex.tryLockRead() == null);
            assertTrue(getOrDump(lateReader, 5, "lateReader"));

            final Future<Long> blockedReader = pool.submit(() -> {
                try (final ReadLock lock = mutex.lockRead()) {
                    return System.nanoTime();
                }
            });

            first.release();
            assertTrue(writerAcquired.await(5, TimeUnit.SECONDS));
            assertFalse(blockedReader.isDone());
            final long writerReleased = System.nanoTime();
            releaseWriter.countDown();

            getOrDump(writer, 5, "writer");
            assertTrue(getOrDump(blockedReader, 5, "blockedReader") >= writerReleased);
        }
    }

    @Nested
    @DisplayName("Timed and interruptible acquisition")
    class Cancellable {

        @Test
        @DisplayName("timed read returns null when a writer holds the mutex")
        void timedReadTimesOut() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            try (final WriteLock write = mutex.lockWrite()) {
                final Future<ReadLock> f = pool.submit(() -> mutex.tryLockRead(50L, TimeUnit.MILLISECONDS));
                assertNull(getOrDump(f, 5, "timedRead"));
            }
        }

        @Test
        @DisplayName("timed write gives up and re-admits readers")
        void timedWriteTimesOut() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            try (final ReadLock read = mutex.lockRead()) {
                final Future<WriteLock> f = pool.submit(() -> mutex.tryLockWrite(50L, TimeUnit.MILLISECONDS));
                assertNull(getOrDump(f, 5, "timedWrite"));
                assertEquals(0, mutex.getQueuedWriterCount());

                final Future<Boolean> reader = pool.submit(() -> {
                    final ReadLock lock = mutex.tryLockRead();
                    if (lock == null) {
                        return false;
                    }
                    lock.release();
                    return true;
                });
                assertTrue(getOrDump(reader, 5, "reader"));
            }
        }

        @Test
        @DisplayName("timed write succeeds when released in time")
        void timedWriteSucceeds() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final ReadLock read = mutex.lockRead();

            final Future<Boolean> f = pool.submit(() -> {
                final WriteLock lock = mutex.tryLockWrite(10L, TimeUnit.SECONDS);
                if (lock == null) {
                    return false;
                }
                lock.release();
                return true;
            });

            waitUntil(() -> mutex.getQueuedWriterCount() == 1, "writer queued");
            read.release();
            assertTrue(getOrDump(f, 15, "timedWriteSucceeds"));
        }

        @Test
        @DisplayName("interrupted writer withdraws and unblocks waiting readers")
        void interruptedWriter() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final ReadLock read = mutex.lockRead();

            final Future<?> writer = pool.submit(() -> {
                mutex.lockWriteInterruptibly().release();
                return null;
            });
            waitUntil(() -> mutex.getQueuedWriterCount() == 1, "writer queued");

            final Future<Boolean> reader = pool.submit(() -> {
                mutex.lockRead().release();
                return true;
            });

            writer.cancel(true);
            assertTrue(getOrDump(reader, 5, "readerAfterInterrupt"));
            waitUntil(() -> mutex.getQueuedWriterCount() == 0, "writer withdrawn");
            assertFalse(mutex.isWriteLocked());
            read.release();
        }

        @Test
        @DisplayName("uninterruptible acquisition keeps the interrupt flag")
        void uninterruptibleKeepsFlag() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final WriteLock write = mutex.lockWrite();
            final CountDownLatch started = new CountDownLatch(1);

            final Future<Boolean> reader = pool.submit(() -> {
                Thread.currentThread().interrupt();
                started.countDown();
                try (final ReadLock lock = mutex.lockRead()) {
                    return Thread.interrupted();
                }
            });

            assertTrue(started.await(5, TimeUnit.SECONDS));
            write.release();
            assertTrue(getOrDump(reader, 5, "uninterruptible"));
        }
    }

    @Nested
    @DisplayName("Downgrade")
    class Downgrade {

        @Test
        @DisplayName("downgrade keeps writers out and lets readers in")
        void downgrade() throws Exception {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final WriteLock write = mutex.lockWrite();
            final ReadLock read = mutex.downgrade(write);

            assertFalse(write.isHeld());
            assertTrue(read.isHeld());
            assertFalse(mutex.isWriteLocked());
            assertEquals(1, mutex.getReadLockCount());
            assertThrows(IllegalStateException.class, write::release);

            final Future<Boolean> tryWrite = pool.submit(() -> mutex.tryLockWrite() == null);
            assertTrue(getOrDump(tryWrite, 5, "tryWrite"));

            final Future<Boolean> tryRead = pool.submit(() -> {
                final ReadLock lock = mutex.tryLockRead();
                if (lock == null) {
                    return false;
                }
                lock.release();
                return true;
            });
            assertTrue(getOrDump(tryRead, 5, "tryRead"));

            read.release();
            assertEquals(0, mutex.getReadLockCount());
        }

        @Test
        @DisplayName("downgrade rejects foreign or released handles")
        void downgradeMisuse() {
            final ReadWriteMutex mutex = new ReadWriteMutex();
            final ReadWriteMutex other = new ReadWriteMutex();

            try (final WriteLock foreign = other.lockWrite()) {
                assertThrows(IllegalStateException.class, () -> mutex.downgrade(foreign));
            }

            final WriteLock write = mutex.lockWrite();
            write.release();
            assertThrows(IllegalStateException.class, () -> mutex.downgrade(write));
            assertThrows(NullPointerException.class, () -> mutex.downgrade(null));
        }
    }

    // ------------------------------- helpers -------------------------------

    private static void waitUntil(final BooleanSupplier condition, final String tag) throws InterruptedException {
        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5L);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() - deadline > 0L) {
                dumpThreads();
                fail("Timeout waiting for: " + tag);
            }
            Thread.sleep(1L);
        }
    }

    private static <T> T getOrDump(final Future<T> f, final int sec, final String tag) throws Exception {
        try {
            return f.get(sec, TimeUnit.SECONDS);
        } catch (final TimeoutException e) {
            System.err.println("=== TIMEOUT [" + tag + "] thread dump ===");
            dumpThreads();
            throw new AssertionError("Timeout: " + tag, e);
        }
    }

    private static void dumpThreads() {
        final ThreadMXBean mx = ManagementFactory.getThreadMXBean();
        for (final ThreadInfo ti : mx.dumpAllThreads(true, true)) {
            System.err.println(ti.toString());
        }
    }
}
