package de.jwiegmann.skiptrace.control.litigator;

import de.jwiegmann.skiptrace.control.normalize.Fingerprints;
import de.jwiegmann.skiptrace.entity.CanonicalRecord;
import de.jwiegmann.skiptrace.entity.ContactMetadata;
import de.jwiegmann.skiptrace.entity.PostalAddress;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Prüft einen Datensatz gegen die Sperrliste.
 *
 * <p>Reihenfolge: Name+Objektadresse, Name+Postadresse (jeweils auch nur über den Nachnamen),
 * eingereichte Rufnummern, vom Anbieter gelieferte Rufnummern.
 * Der erste Treffer gewinnt.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LitigatorMatcher {

    private final LitigatorBlocklist blocklist;

    public LitigatorMatch match(CanonicalRecord record, ContactMetadata enrichment) {
        List<PostalAddress> addresses = new ArrayList<>();
        addresses.add(record.getPropertyAddress());
        addresses.add(record.getMailingAddress());
        for (PostalAddress address : addresses) {
            // Einträge ohne Vornamen sind nur unter dem Nachnamen gelistet
            Set<String> keys = new LinkedHashSet<>();
            Fingerprints.person(record.getFirstName(), record.getLastName(), address).ifPresent(keys::add);
            Fingerprints.person(null, record.getLastName(), address).ifPresent(keys::add);
            for (String fp : keys) {
                Optional<LitigatorMatch> hit = blocklist.findByFingerprint(fp).map(l -> LitigatorMatch.of(l, fp));
                if (hit.isPresent()) {
                    return logged(record, hit.get());
                }
            }
        }

        Set<String> phones = new LinkedHashSet<>(record.getPhones());
        if (enrichment != null) {
            enrichment.getPhones().forEach(p -> Fingerprints.phone(p).ifPresent(phones::add));
        }
        for (String phone : phones) {
            Optional<LitigatorMatch> hit = blocklist.findByPhone(phone).map(l -> LitigatorMatch.of(l, "phone:" + phone));
            if (hit.isPresent()) {
                return logged(record, hit.get());
            }
        }
        return LitigatorMatch.none();
    }

    private static LitigatorMatch logged(CanonicalRecord record, LitigatorMatch match) {
        log.info("Zeile {} steht auf der Sperrliste: {} ({}) über {}", record.getRowNumber(),
                match.getLitigator().getLitigatorId(), match.getLitigator().getType(), match.getMatchedOn());
        return match;
    }
}
