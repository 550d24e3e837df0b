package dev.nuclr.plugin.core.render.parallel.backend;

import java.util.concurrent.locks.ReentrantLock;

/**
 * The single mutual-exclusion lock for a {@link RenderDocument}.
 *
 * <p>Load, render and hand-off of a page all happen inside one critical
 * section. Holding the lock is witnessed by a {@link Guard}, which only
 * {@link #acquire()} can produce; operations that must run with exclusive
 * access to the document take a guard as a parameter.
 */
public final class DocumentLock {

    private final ReentrantLock lock = new ReentrantLock();

    public Guard acquire() {
        lock.lock();
        return new Guard(this);
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    /** Proof of ownership of a {@link DocumentLock}; closing it unlocks. */
    public static final class Guard implements AutoCloseable {

        private final DocumentLock owner;
        private boolean released;

        private Guard(DocumentLock owner) {
            this.owner = owner;
        }

        /** True if this guard belongs to {@code lock} and is still held by the calling thread. */
        public boolean guards(DocumentLock lock) {
            return !released && owner == lock && owner.lock.isHeldByCurrentThread();
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                owner.lock.unlock();
            }
        }
    }
}
