package de.jwiegmann.skiptrace.control.enrichment;

import com.fasterxml.jackson.databind.JsonNode;
import de.jwiegmann.skiptrace.control.exception.ExternalServiceException;
import de.jwiegmann.skiptrace.control.exception.ExternalServiceException.Reason;
import de.jwiegmann.skiptrace.entity.ContactMetadata;
import de.jwiegmann.skiptrace.entity.PostalAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP-Anbindung des Skip-Trace-Anbieters.
 *
 * <p>Erwartete Antwort: {@code {"result":[{"name":[...],"phone":[...],"email":[...],"address":[...]}]}}.
 * Leeres {@code result} oder HTTP 404 bedeuten "nicht gefunden".
 */
@Slf4j
@Component
public class RestEnrichmentClient implements EnrichmentClient {

    private final RestClient restClient;

    public RestEnrichmentClient(RestClient.Builder builder,
                                @Value("${enrichment.client.base-url:http://localhost:8089/}") String baseUrl,
                                @Value("${enrichment.client.api-key:}") String apiKey,
                                @Value("${enrichment.client.timeout:PT10S}") Duration timeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) timeout.toMillis());
        requestFactory.setReadTimeout((int) timeout.toMillis());

        RestClient.Builder configured = builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory);
        if (!apiKey.isBlank()) {
            configured = configured.defaultHeader(HttpHeaders.AUTHORIZATION, apiKey);
        }
        this.restClient = configured.build();
    }

    @Override
    public EnrichmentResponse lookup(PostalAddress propertyAddress) {
        Map<String, String> request = new LinkedHashMap<>();
        request.put("address", propertyAddress.getStreet());
        request.put("city", propertyAddress.getCity());
        request.put("state", propertyAddress.getState());
        request.put("zip", propertyAddress.getZip());

        try {
            JsonNode body = restClient.post()
                    .uri("search")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
            return parse(body);
        } catch (HttpClientErrorException.NotFound e) {
            return EnrichmentResponse.notFound();
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new ExternalServiceException(Reason.RATE_LIMITED, "enrichment provider rate limit reached", e);
        } catch (RestClientResponseException e) {
            throw new ExternalServiceException(Reason.SERVICE_ERROR,
                    "enrichment provider answered " + e.getStatusCode().value(), e);
        } catch (ResourceAccessException e) {
            Reason reason = e.getCause() instanceof SocketTimeoutException ? Reason.TIMEOUT : Reason.SERVICE_ERROR;
            throw new ExternalServiceException(reason, "enrichment provider not reachable: " + e.getMessage(), e);
        }
    }

    static EnrichmentResponse parse(JsonNode body) {
        if (body == null || !body.path("result").isArray() || body.path("result").isEmpty()) {
            return EnrichmentResponse.notFound();
        }
        JsonNode result = body.path("result").get(0);
        ContactMetadata contact = new ContactMetadata();

        for (JsonNode name : result.path("name")) {
            String full = name.path("data").asText("");
            if (full.isBlank()) {
                full = (name.path("first").asText("") + " " + name.path("last").asText("")).trim();
            }
            if (!full.isBlank()) {
                contact.getOwnerNames().add(full);
            }
        }
        for (JsonNode phone : result.path("phone")) {
            String number = phone.path("number").asText("").replaceAll("\\D", "");
            if (!number.isEmpty() && !contact.getPhones().contains(number)) {
                contact.getPhones().add(number);
            }
        }
        for (JsonNode email : result.path("email")) {
            String data = email.path("data").asText("").trim().toLowerCase(Locale.ROOT);
            if (!data.isEmpty() && !contact.getEmails().contains(data)) {
                contact.getEmails().add(data);
            }
        }
        for (JsonNode address : result.path("address")) {
            contact.getAddressHistory().add(PostalAddress.builder()
                    .street(address.path("complete").asText(null))
                    .city(address.path("city").asText(null))
                    .state(address.path("state").asText(null))
                    .zip(address.path("zip").asText(null))
                    .build());
        }
        return contact.hasData() ? EnrichmentResponse.found(contact) : EnrichmentResponse.notFound();
    }
}
