package com.capstone.drivesync.remote;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * 논리 작업마다 새 클라이언트를 연다. 토큰은 매번 공급자에게 묻는다.
 */
@Component
@RequiredArgsConstructor
public class RemoteDriveClientFactory {

    private final WebClient graphWebClient;
    private final AccessTokenProvider accessTokenProvider;

    @Value("${drive.graph.base-url:https://graph.microsoft.com/v1.0}")
    private String baseUrl;

    public RemoteDriveClient open() {
        return new GraphDriveClient(graphWebClient, baseUrl, accessTokenProvider.currentToken());
    }
}
