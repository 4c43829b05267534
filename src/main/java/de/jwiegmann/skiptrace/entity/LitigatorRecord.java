package de.jwiegmann.skiptrace.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LitigatorRecord {

    private String litigatorId;
    private String firstName;
    private String lastName;
    private PostalAddress address;

    @Builder.Default
    private List<String> phones = new ArrayList<>();

    @Builder.Default
    private LitigatorType type = LitigatorType.LITIGATOR;
}
