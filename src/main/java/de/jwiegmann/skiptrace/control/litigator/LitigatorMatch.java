package de.jwiegmann.skiptrace.control.litigator;

import de.jwiegmann.skiptrace.entity.LitigatorRecord;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LitigatorMatch {

    private static final LitigatorMatch NONE = new LitigatorMatch(null, null);

    private final LitigatorRecord litigator;
    private final String matchedOn;

    public static LitigatorMatch of(LitigatorRecord litigator, String matchedOn) {
        return new LitigatorMatch(litigator, matchedOn);
    }

    public static LitigatorMatch none() {
        return NONE;
    }

    public boolean isMatched() {
        return litigator != null;
    }
}
