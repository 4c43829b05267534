package de.jwiegmann.skiptrace.control.litigator;

import de.jwiegmann.skiptrace.entity.CanonicalRecord;
import de.jwiegmann.skiptrace.entity.ContactMetadata;
import de.jwiegmann.skiptrace.entity.LitigatorRecord;
import de.jwiegmann.skiptrace.entity.LitigatorType;
import de.jwiegmann.skiptrace.entity.PostalAddress;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LitigatorMatcherTest {

    private final InMemoryLitigatorBlocklist blocklist = new InMemoryLitigatorBlocklist();
    private final LitigatorMatcher matcher = new LitigatorMatcher(blocklist);

    @BeforeEach
    void setUp() {
        blocklist.register(LitigatorRecord.builder()
                .litigatorId("L-1")
                .firstName("John")
                .lastName("Smith")
                .address(new PostalAddress("12 Main St", "Springfield", "IL", "62701"))
                .type(LitigatorType.SERIAL_LITIGATOR)
                .build());
        blocklist.register(LitigatorRecord.builder()
                .litigatorId("L-2")
                .lastName("Complainer")
                .phones(List.of("(312) 555-0199"))
                .type(LitigatorType.COMPLAINER)
                .build());
    }

    private static CanonicalRecord record(String first, String last, PostalAddress property) {
        return CanonicalRecord.builder()
                .rowNumber(1)
                .firstName(first)
                .lastName(last)
                .propertyAddress(property)
                .build();
    }

    @Test
    void matchesByNameKeyAndAddress_toleratingFormatting() {
        LitigatorMatch match = matcher.match(
                record("J.", "SMITH", new PostalAddress("12  MAIN ST.", "SPRINGFIELD", "IL", "62701-0001")), null);

        assertThat(match.isMatched()).isTrue();
        assertThat(match.getLitigator().getLitigatorId()).isEqualTo("L-1");
        assertThat(match.getLitigator().getType()).isEqualTo(LitigatorType.SERIAL_LITIGATOR);
    }

    @Test
    void doesNotMatchOtherPeopleAtSameAddress() {
        PostalAddress sameAddress = new PostalAddress("12 MAIN ST", "SPRINGFIELD", "IL", "62701");

        assertThat(matcher.match(record("Mary", "Smith", sameAddress), null).isMatched()).isFalse();
        assertThat(matcher.match(record("John", "Miller", sameAddress), null).isMatched()).isFalse();
    }

    @Test
    void matchesDespiteNameSuffix_andEntriesListedWithoutFirstName() {
        PostalAddress listed = new PostalAddress("12 MAIN ST", "SPRINGFIELD", "IL", "62701");
        assertThat(matcher.match(record("John", "Smith Jr", listed), null).getLitigator().getLitigatorId())
                .isEqualTo("L-1");

        blocklist.register(LitigatorRecord.builder()
                .litigatorId("L-3")
                .lastName("Baker")
                .address(new PostalAddress("7 Lake Dr", "Springfield", "IL", "62704"))
                .type(LitigatorType.PRE_LITIGATOR)
                .build());
        LitigatorMatch byLastName = matcher.match(
                record("Tom", "Baker", new PostalAddress("7 LAKE DR", "SPRINGFIELD", "IL", "62704")), null);

        assertThat(byLastName.isMatched()).isTrue();
        assertThat(byLastName.getLitigator().getLitigatorId()).isEqualTo("L-3");
        assertThat(byLastName.getMatchedOn()).isEqualTo("baker:@7 lake dr|springfield|il|62704");
    }

    @Test
    void matchesOnMailingAddress() {
        CanonicalRecord r = record("John", "Smith", new PostalAddress("99 OTHER RD", "SPRINGFIELD", "IL", "62702"));
        r.setMailingAddress(new PostalAddress("12 MAIN ST", "SPRINGFIELD", "IL", "62701"));

        assertThat(matcher.match(r, null).isMatched()).isTrue();
    }

    @Test
    void matchesOnSubmittedOrReturnedPhone() {
        CanonicalRecord submitted = record("Ann", "Other", new PostalAddress("5 ELM ST", "SPRINGFIELD", "IL", "62701"));
        submitted.setPhones(List.of("3125550199"));
        assertThat(matcher.match(submitted, null).getLitigator().getLitigatorId()).isEqualTo("L-2");

        CanonicalRecord clean = record("Ann", "Other", new PostalAddress("5 ELM ST", "SPRINGFIELD", "IL", "62701"));
        ContactMetadata enrichment = ContactMetadata.builder().phones(List.of("13125550199")).build();
        LitigatorMatch viaEnrichment = matcher.match(clean, enrichment);
        assertThat(viaEnrichment.isMatched()).isTrue();
        assertThat(viaEnrichment.getMatchedOn()).isEqualTo("phone:3125550199");

        assertThat(matcher.match(clean, null).isMatched()).isFalse();
    }
}
