package de.jwiegmann.skiptrace.control.normalize;

import de.jwiegmann.skiptrace.entity.CanonicalRecord;
import de.jwiegmann.skiptrace.entity.PostalAddress;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprintsTest {

    @Test
    void address_ignoresCaseWhitespacePunctuationAndZipPlusFour() {
        PostalAddress a = new PostalAddress("12 Main St.", "Springfield", "IL", "62701-1234");
        PostalAddress b = new PostalAddress(" 12  MAIN st ", "springfield ", "il", "62701");

        assertThat(Fingerprints.address(a)).isEqualTo(Fingerprints.address(b));
        assertThat(Fingerprints.address(a)).contains("12 main st|springfield|il|62701");
    }

    @Test
    void address_requiresStreetAndZipOrCityState() {
        assertThat(Fingerprints.address(new PostalAddress(null, "Springfield", "IL", "62701"))).isEmpty();
        assertThat(Fingerprints.address(new PostalAddress("1 Main St", "Springfield", null, null))).isEmpty();
        assertThat(Fingerprints.address(new PostalAddress("1 Main St", "Springfield", "IL", null))).isPresent();
        assertThat(Fingerprints.address(new PostalAddress("1 Main St", null, null, "62701"))).isPresent();
    }

    @Test
    void nameKey_isLastNamePlusFirstInitial() {
        assertThat(Fingerprints.nameKey("Jonathan", "O'Neil")).contains("oneil:j");
        assertThat(Fingerprints.nameKey("J.", "ONEIL")).contains("oneil:j");
        assertThat(Fingerprints.nameKey("Jane", null)).isEmpty();
    }

    @Test
    void nameKey_ignoresTrailingSuffixes() {
        assertThat(Fingerprints.nameKey("John", "Smith Jr")).contains("smith:j");
        assertThat(Fingerprints.nameKey("John", "Smith, III")).contains("smith:j");
        assertThat(Fingerprints.nameKey(null, "Smith")).contains("smith:");
        // ein einzelnes Token bleibt Nachname
        assertThat(Fingerprints.nameKey("Anna", "Jr")).contains("jr:a");
    }

    @Test
    void duplicateKey_sameRowDifferentFormatting() {
        CanonicalRecord a = CanonicalRecord.builder().firstName("Jane").lastName("Doe")
                .propertyAddress(new PostalAddress("1 MAIN ST", "SPRINGFIELD", "IL", "62701")).build();
        CanonicalRecord b = CanonicalRecord.builder().firstName("JANE").lastName("doe")
                .propertyAddress(new PostalAddress("1 main st.", "Springfield", "IL", "62701-0001")).build();
        CanonicalRecord other = CanonicalRecord.builder().firstName("John").lastName("Doe")
                .propertyAddress(b.getPropertyAddress()).build();

        assertThat(Fingerprints.duplicateKey(a)).isEqualTo(Fingerprints.duplicateKey(b));
        assertThat(Fingerprints.duplicateKey(a)).isNotEqualTo(Fingerprints.duplicateKey(other));
        assertThat(Fingerprints.duplicateKey(CanonicalRecord.builder().lastName("Doe").build())).isEmpty();
    }

    @Test
    void phone_keepsTenDigits() {
        assertThat(Fingerprints.phone("+1 (217) 555-0100")).contains("2175550100");
        assertThat(Fingerprints.phone("555-0100")).isEmpty();
    }
}
