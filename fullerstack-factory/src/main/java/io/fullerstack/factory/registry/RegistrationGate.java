package io.fullerstack.factory.registry;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Storage cell value telling whether registration is still open for a storage.
 * <p>
 * Open by default. Once closed it stays closed: there is no way back to open.
 * <p>
 * Registrations run between {@link #enter()} and {@link #exit()} under the read lock;
 * {@link #close()} takes the write lock, so it waits for registrations in flight and no
 * registration can start after it returns.
 */
public final class RegistrationGate {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean closed;

    /**
     * Enter the gate for one registration.
     * A successful call must be paired with {@link #exit()}.
     *
     * @return true if registration is open, false if closed (the gate is not held)
     */
    public boolean enter() {
        lock.readLock().lock();
        if (closed) {
            lock.readLock().unlock();
            return false;
        }
        return true;
    }

    /**
     * Leave the gate after a registration started with {@link #enter()}.
     */
    public void exit() {
        lock.readLock().unlock();
    }

    /**
     * Close registration.
     *
     * @return true if this call closed the gate, false if it was already closed
     */
    public boolean close() {
        lock.writeLock().lock();
        try {
            if (closed) {
                return false;
            }
            closed = true;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return "RegistrationGate[closed=" + closed + "]";
    }
}
