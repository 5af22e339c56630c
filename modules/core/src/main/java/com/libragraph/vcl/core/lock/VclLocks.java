package com.libragraph.vcl.core.lock;

import com.libragraph.vcl.util.ContentHash;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped in-process mutual exclusion keyed by file id and by content digest.
 *
 * <p>Lock order is always file before digest. Code holding a digest lock must never
 * acquire a file lock.
 */
@ApplicationScoped
public class VclLocks {

    static final int STRIPES = 256;

    private final ReentrantLock[] fileLocks = newStripes();
    private final ReentrantLock[] digestLocks = newStripes();

    public <T> T withFileLock(long fileId, Supplier<T> action) {
        return locked(fileLocks[fileStripe(fileId)], action);
    }

    public <T> T withDigestLock(ContentHash digest, Supplier<T> action) {
        return locked(digestLocks[digestStripe(digest)], action);
    }

    static int fileStripe(long fileId) {
        return Math.floorMod(Long.hashCode(fileId), STRIPES);
    }

    static int digestStripe(ContentHash digest) {
        return Math.floorMod(digest.hashCode(), STRIPES);
    }

    private static <T> T locked(ReentrantLock lock, Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static ReentrantLock[] newStripes() {
        ReentrantLock[] locks = new ReentrantLock[STRIPES];
        for (int i = 0; i < STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }
}
