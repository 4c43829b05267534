package de.jwiegmann.skiptrace.entity;

import lombok.Getter;

import java.util.List;

/**
 * Festes Zielschema, auf das die Spalten einer hochgeladenen Tabelle abgebildet werden.
 * Jedes Feld darf genau einer Spalte zugeordnet werden, nur {@link #PHONE} mehreren (bis zum Slot-Limit).
 */
@Getter
public enum CanonicalField {

    FULL_NAME("Full Name", "fullname", "name", "owner name", "owner full name", "owner"),
    FIRST_NAME("First Name", "firstname", "first", "fname", "owner first name", "given name"),
    LAST_NAME("Last Name", "lastname", "last", "lname", "surname", "owner last name"),

    MAILING_STREET("Mailing Address", "mailing street", "mail address", "mailing address 1", "owner address"),
    MAILING_CITY("Mailing City", "mail city", "owner city"),
    MAILING_STATE("Mailing State", "mail state", "owner state"),
    MAILING_ZIP("Mailing Zip", "mailing zipcode", "mailing zip code", "mail zip", "owner zip"),

    PROPERTY_STREET("Property Address", "property street", "street", "address", "site address", "situs address"),
    PROPERTY_CITY("Property City", "city", "site city"),
    PROPERTY_STATE("Property State", "state", "st", "site state"),
    PROPERTY_ZIP("Property Zip", "zip", "zipcode", "zip code", "postal code", "property zipcode"),

    PHONE("Phone", "phone number", "telephone", "mobile", "cell", "landline",
            "phone 1", "phone 2", "phone 3", "phone 4", "phone 5", "phone 6", "phone 7"),
    EMAIL("Email", "e-mail", "email address", "mail"),

    CUSTOM_1("Custom 1", "custom field 1"),
    CUSTOM_2("Custom 2", "custom field 2"),
    CUSTOM_3("Custom 3", "custom field 3");

    private final String displayName;
    private final List<String> defaultAliases;

    CanonicalField(String displayName, String... defaultAliases) {
        this.displayName = displayName;
        this.defaultAliases = List.of(defaultAliases);
    }

    /**
     * Telefonfelder teilen sich mehrere Spalten, alle anderen Felder sind exklusiv.
     */
    public boolean isMultiColumn() {
        return this == PHONE;
    }
}
