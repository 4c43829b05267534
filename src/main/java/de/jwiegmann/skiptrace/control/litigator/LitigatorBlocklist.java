package de.jwiegmann.skiptrace.control.litigator;

import de.jwiegmann.skiptrace.entity.LitigatorRecord;

import java.util.Optional;

/**
 * Nur lesender Zugriff auf die Sperrliste. Gepflegt wird sie außerhalb dieses Dienstes.
 */
public interface LitigatorBlocklist {

    /**
     * @param fingerprint Namensschlüssel + "@" + Adress-Fingerprint
     */
    Optional<LitigatorRecord> findByFingerprint(String fingerprint);

    /**
     * @param phone 10-stellige Rufnummer, nur Ziffern
     */
    Optional<LitigatorRecord> findByPhone(String phone);
}
