package com.mikov.accountvalidator.connection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link AccountConnection} backed by an HTTP gateway in front of the messaging
 * network. HTTP errors are not caught here: the exception message carries the
 * status code (e.g. {@code 404 Not Found}) that the probe layer classifies.
 */
@Slf4j
public class GatewayAccountConnection implements AccountConnection {

    private static final ParameterizedTypeReference<List<ExistenceResult>> EXISTENCE_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public GatewayAccountConnection(final RestClient.Builder builder, final String baseUrl) {
        this.restClient = builder.baseUrl(baseUrl).build();
        log.info("Account gateway connection configured at {}", baseUrl);
    }

    @Override
    public List<ExistenceResult> checkExistence(final String jid) {
        final var results = restClient.get()
                .uri("/contacts/{jid}/exists", jid)
                .retrieve()
                .body(EXISTENCE_LIST);
        return results != null ? results : List.of();
    }

    @Override
    public Optional<StatusPayload> fetchStatus(final String jid) {
        return Optional.ofNullable(restClient.get()
                .uri("/contacts/{jid}/status", jid)
                .retrieve()
                .body(StatusPayload.class));
    }

    @Override
    public Optional<String> fetchProfilePicture(final String jid, final String size) {
        final var body = restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/contacts/{jid}/profile-picture")
                        .queryParam("size", size)
                        .build(jid))
                .retrieve()
                .body(JSON_OBJECT);
        if (body == null || body.get("url") == null) {
            return Optional.empty();
        }
        return Optional.of(body.get("url").toString());
    }

    @Override
    public Optional<Map<String, Object>> fetchBusinessProfile(final String jid) {
        return Optional.ofNullable(restClient.get()
                .uri("/contacts/{jid}/business-profile", jid)
                .retrieve()
                .body(JSON_OBJECT));
    }

    @Override
    public Optional<Map<String, Object>> subscribePresence(final String jid) {
        return Optional.ofNullable(restClient.post()
                .uri("/presence/{jid}/subscribe", jid)
                .retrieve()
                .body(JSON_OBJECT));
    }
}
