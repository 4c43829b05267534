package de.jwiegmann.skiptrace.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PostalAddress {

    private String street;
    private String city;
    private String state;
    private String zip;

    @JsonIgnore
    public boolean isBlank() {
        return empty(street) && empty(city) && empty(state) && empty(zip);
    }

    private static boolean empty(String value) {
        return value == null || value.isBlank();
    }
}
