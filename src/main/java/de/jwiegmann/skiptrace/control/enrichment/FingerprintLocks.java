package de.jwiegmann.skiptrace.control.enrichment;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Eine Sperre pro Fingerprint, solange mindestens ein Thread sie hält oder darauf wartet.
 * Danach wird sie wieder entfernt, damit die Tabelle nicht mit der Zahl der Adressen wächst.
 */
@Component
public class FingerprintLocks {

    private static final class RefCountedLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int refs;   // nur innerhalb von compute() verändert
    }

    private final Map<String, RefCountedLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String fingerprint, Supplier<T> action) {
        RefCountedLock holder = locks.compute(fingerprint, (k, v) -> {
            RefCountedLock h = v == null ? new RefCountedLock() : v;
            h.refs++;
            return h;
        });
        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            locks.computeIfPresent(fingerprint, (k, v) -> --v.refs == 0 ? null : v);
        }
    }

    int activeCount() {
        return locks.size();
    }
}
