package com.capstone.drivesync.remote;

import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.exception.DriveSyncException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.OffsetDateTime;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConnectorAccessTokenProviderTest {

    private final AtomicInteger connectorCalls = new AtomicInteger();

    private ConnectorAccessTokenProvider providerWithConnector(String body) {
        WebClient.Builder builder = WebClient.builder()
                .exchangeFunction(request -> {
                    connectorCalls.incrementAndGet();
                    return Mono.just(ClientResponse.create(HttpStatus.OK)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                });
        ConnectorAccessTokenProvider provider = new ConnectorAccessTokenProvider(builder);
        ReflectionTestUtils.setField(provider, "staticToken", "");
        ReflectionTestUtils.setField(provider, "connectorUrl", "https://connector.test/connection");
        ReflectionTestUtils.setField(provider, "connectorSecret", "secret");
        return provider;
    }

    @Test
    void currentToken_shouldUseStaticTokenWhenConfigured() {
        ConnectorAccessTokenProvider provider = new ConnectorAccessTokenProvider(WebClient.builder());
        ReflectionTestUtils.setField(provider, "staticToken", "dev-token");

        assertThat(provider.currentToken()).isEqualTo("dev-token");
        assertThat(provider.isValid()).isTrue();
    }

    @Test
    void currentToken_shouldCacheConnectorTokenUntilExpiry() {
        String expiresAt = OffsetDateTime.now().plusHours(1).toString();
        ConnectorAccessTokenProvider provider = providerWithConnector(
                "{\"items\":[{\"settings\":{\"access_token\":\"abc\",\"expires_at\":\"" + expiresAt + "\"}}]}");

        assertThat(provider.currentToken()).isEqualTo("abc");
        assertThat(provider.currentToken()).isEqualTo("abc");
        assertThat(connectorCalls.get()).isEqualTo(1);
    }

    @Test
    void currentToken_shouldRefreshExpiredToken() {
        String expiresAt = OffsetDateTime.now().minusMinutes(5).toString();
        ConnectorAccessTokenProvider provider = providerWithConnector(
                "{\"items\":[{\"settings\":{\"oauth\":{\"credentials\":{\"access_token\":\"old\"}},\"expires_at\":\"" + expiresAt + "\"}}]}");

        provider.currentToken();
        provider.currentToken();

        assertThat(connectorCalls.get()).isEqualTo(2);
    }

    @Test
    void refresh_shouldFailAsAuthExpiredWhenNotConnected() {
        ConnectorAccessTokenProvider provider = providerWithConnector("{\"items\":[]}");

        assertThatThrownBy(provider::currentToken)
                .isInstanceOf(DriveSyncException.class)
                .extracting(e -> ((DriveSyncException) e).getKind())
                .isEqualTo(ErrorKind.AUTH_EXPIRED);
    }

    @Test
    void refresh_shouldFailWhenNothingConfigured() {
        ConnectorAccessTokenProvider provider = new ConnectorAccessTokenProvider(WebClient.builder());
        ReflectionTestUtils.setField(provider, "staticToken", "");
        ReflectionTestUtils.setField(provider, "connectorUrl", "");

        assertThatThrownBy(provider::refresh).isInstanceOf(DriveSyncException.class);
    }
}
