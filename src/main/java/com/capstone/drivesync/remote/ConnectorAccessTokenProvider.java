package com.capstone.drivesync.remote;

import com.capstone.drivesync.domain.DomainError;
import com.capstone.drivesync.domain.ErrorKind;
import com.capstone.drivesync.exception.DriveSyncException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * 토큰을 만료 직전까지 캐시한다. 클라이언트 객체는 캐시하지 않는다.
 * drive.auth.static-token 이 있으면 그 값을 쓰고, 없으면 커넥터 엔드포인트에서 발급받는다.
 */
@Slf4j
@Component
public class ConnectorAccessTokenProvider implements AccessTokenProvider {

    private static final Duration EXPIRY_SKEW = Duration.ofSeconds(60);
    private static final Duration DEFAULT_LIFETIME = Duration.ofMinutes(50);

    private final WebClient webClient;

    @Value("${drive.auth.static-token:}")
    private String staticToken;

    @Value("${drive.auth.connector-url:}")
    private String connectorUrl;

    @Value("${drive.auth.connector-secret:}")
    private String connectorSecret;

    private String cachedToken;
    private Instant expiresAt;

    public ConnectorAccessTokenProvider(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    @Override
    public synchronized String currentToken() {
        if (!isValid()) {
            refresh();
        }
        return cachedToken;
    }

    @Override
    public synchronized boolean isValid() {
        return cachedToken != null && expiresAt != null
                && Instant.now().isBefore(expiresAt.minus(EXPIRY_SKEW));
    }

    @Override
    public synchronized void refresh() {
        if (StringUtils.hasText(staticToken)) {
            cachedToken = staticToken;
            expiresAt = Instant.now().plus(DEFAULT_LIFETIME);
            return;
        }
        if (!StringUtils.hasText(connectorUrl)) {
            throw DriveSyncException.of(ErrorKind.AUTH_EXPIRED, "드라이브 연결 정보가 설정되지 않았습니다.");
        }

        JsonNode response;
        try {
            response = webClient.get()
                    .uri(connectorUrl)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + connectorSecret)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block();
        } catch (WebClientException e) {
            throw new DriveSyncException(DomainError.of(ErrorKind.AUTH_EXPIRED, "토큰 발급 실패: " + e.getMessage()), e);
        }

        JsonNode settings = response == null ? null : response.path("items").path(0).path("settings");
        String token = settings == null ? null : settings.path("access_token").asText(null);
        if (token == null && settings != null) {
            token = settings.path("oauth").path("credentials").path("access_token").asText(null);
        }
        if (!StringUtils.hasText(token)) {
            throw DriveSyncException.of(ErrorKind.AUTH_EXPIRED, "드라이브가 연결되어 있지 않습니다.");
        }

        cachedToken = token;
        expiresAt = parseExpiry(settings.path("expires_at").asText(null));
        log.info("드라이브 액세스 토큰 갱신, 만료 시각 {}", expiresAt);
    }

    private Instant parseExpiry(String value) {
        if (!StringUtils.hasText(value)) {
            return Instant.now().plus(DEFAULT_LIFETIME);
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("만료 시각 형식을 읽지 못함: {}", value);
            return Instant.now().plus(DEFAULT_LIFETIME);
        }
    }
}
