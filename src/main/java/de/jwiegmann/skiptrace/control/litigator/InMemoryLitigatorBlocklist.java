package de.jwiegmann.skiptrace.control.litigator;

import de.jwiegmann.skiptrace.control.normalize.Fingerprints;
import de.jwiegmann.skiptrace.entity.LitigatorRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Repository
public class InMemoryLitigatorBlocklist implements LitigatorBlocklist {

    // Map<name@address-fingerprint, LitigatorRecord>
    private final Map<String, LitigatorRecord> byFingerprint = new ConcurrentHashMap<>();
    // Map<phone, LitigatorRecord>
    private final Map<String, LitigatorRecord> byPhone = new ConcurrentHashMap<>();

    /**
     * Nimmt einen Eintrag auf. Ohne verwertbaren Namen+Adresse wird er nur über die Rufnummern gefunden.
     */
    public void register(LitigatorRecord record) {
        Fingerprints.person(record.getFirstName(), record.getLastName(), record.getAddress())
                .ifPresent(fp -> byFingerprint.put(fp, record));
        record.getPhones().forEach(p -> Fingerprints.phone(p).ifPresent(digits -> byPhone.put(digits, record)));
        log.debug("Sperrlisteneintrag {} ({}) aufgenommen", record.getLitigatorId(), record.getType());
    }

    @Override
    public Optional<LitigatorRecord> findByFingerprint(String fingerprint) {
        return Optional.ofNullable(byFingerprint.get(fingerprint));
    }

    @Override
    public Optional<LitigatorRecord> findByPhone(String phone) {
        return Optional.ofNullable(byPhone.get(phone));
    }
}
