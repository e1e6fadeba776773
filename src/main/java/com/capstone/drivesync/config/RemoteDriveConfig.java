package com.capstone.drivesync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class RemoteDriveConfig {

    private static final int MAX_IN_MEMORY_BYTES = 64 * 1024 * 1024;

    // 파일 내용 요청은 302로 다운로드 URL에 보내지므로 리다이렉트를 따라간다
    @Bean
    public WebClient graphWebClient(WebClient.Builder builder) {
        return builder
                .clientConnector(new ReactorClientHttpConnector(HttpClient.create().followRedirect(true)))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_BYTES))
                .build();
    }
}
