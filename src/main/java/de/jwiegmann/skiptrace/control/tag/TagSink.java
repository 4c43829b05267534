package de.jwiegmann.skiptrace.control.tag;

import java.util.Set;

/**
 * Nimmt Tags pro Datensatz entgegen. Muss idempotent sein.
 */
public interface TagSink {

    void accept(String recordId, Set<String> tags);
}
