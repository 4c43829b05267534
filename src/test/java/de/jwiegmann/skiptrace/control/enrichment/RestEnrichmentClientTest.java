package de.jwiegmann.skiptrace.control.enrichment;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RestEnrichmentClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void parse_readsFirstResult() throws Exception {
        String json = """
                {"result":[{
                  "name":[{"first":"Jane","last":"Doe"},{"data":"Jane Q Doe"}],
                  "phone":[{"number":"(217) 555-0100","type":"mobile"},{"number":"2175550100"}],
                  "email":[{"data":" Jane@Example.com "}],
                  "address":[{"complete":"1 MAIN ST","city":"SPRINGFIELD","state":"IL","zip":"62701"}]
                }]}
                """;

        EnrichmentResponse response = RestEnrichmentClient.parse(objectMapper.readTree(json));

        assertThat(response.isFound()).isTrue();
        assertThat(response.getContact().getOwnerNames()).containsExactly("Jane Doe", "Jane Q Doe");
        assertThat(response.getContact().getPhones()).containsExactly("2175550100");
        assertThat(response.getContact().getEmails()).containsExactly("jane@example.com");
        assertThat(response.getContact().getAddressHistory()).hasSize(1);
        assertThat(response.getContact().getAddressHistory().get(0).getStreet()).isEqualTo("1 MAIN ST");
    }

    @Test
    void parse_emptyResultMeansNotFound() throws Exception {
        assertThat(RestEnrichmentClient.parse(objectMapper.readTree("{\"result\":[]}")).isFound()).isFalse();
        assertThat(RestEnrichmentClient.parse(objectMapper.readTree("{\"result\":[{\"name\":[]}]}")).isFound()).isFalse();
        assertThat(RestEnrichmentClient.parse(null).isFound()).isFalse();
    }
}
