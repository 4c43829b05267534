package de.jwiegmann.skiptrace.control.tag;

import de.jwiegmann.skiptrace.entity.PipelineResult;
import de.jwiegmann.skiptrace.entity.RecordStage;
import de.jwiegmann.skiptrace.entity.SkipTraceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class TagApplier {

    private final TagSink sink;

    /**
     * Vergibt die Tags des Uploads an angereicherte Datensätze. Alle anderen Ergebnisse bleiben ungetaggt.
     *
     * @return true, wenn Tags vergeben wurden
     */
    public boolean apply(SkipTraceRecord record, PipelineResult result, List<String> tags) {
        if (result == null || !result.isEnriched() || record.hasCompleted(RecordStage.TAGGED)) {
            return false;
        }
        Set<String> tagSet = new LinkedHashSet<>();
        if (tags != null) {
            tags.stream().filter(t -> t != null && !t.isBlank()).map(String::trim).forEach(tagSet::add);
        }
        if (!tagSet.isEmpty()) {
            sink.accept(record.getRecordId(), tagSet);
        }
        record.setTags(new ArrayList<>(tagSet));
        record.complete(RecordStage.TAGGED);
        log.debug("Datensatz {} getaggt: {}", record.getRecordId(), tagSet);
        return true;
    }
}
