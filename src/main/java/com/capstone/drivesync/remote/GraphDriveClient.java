package com.capstone.drivesync.remote;

import com.capstone.drivesync.exception.RemoteDriveException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Microsoft Graph(OneDrive) REST 구현. 토큰 하나에 묶여 있으며
 * {@link RemoteDriveClientFactory#open()}이 작업마다 새로 만든다.
 */
@Slf4j
public class GraphDriveClient implements RemoteDriveClient {

    private static final String DRIVE_ROOT = "/me/drive/root";
    private static final String DRIVE_ITEMS = "/me/drive/items/";

    private final WebClient webClient;
    private final String baseUrl;
    private final String accessToken;

    public GraphDriveClient(WebClient webClient, String baseUrl, String accessToken) {
        this.webClient = webClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.accessToken = accessToken;
    }

    @Override
    public List<DriveItem> listChildren(String pathOrId) {
        List<DriveItem> items = new ArrayList<>();
        URI next = toUri(resource(pathOrId, "children"));
        // @odata.nextLink 가 없을 때까지 페이지를 이어서 읽는다
        while (next != null) {
            DriveItemCollection page = send(webClient.get().uri(next), DriveItemCollection.class);
            if (page == null) {
                break;
            }
            if (page.value() != null) {
                items.addAll(page.value());
            }
            next = page.nextLink() != null ? URI.create(page.nextLink()) : null;
        }
        return items;
    }

    @Override
    public DriveItem getItem(String pathOrId) {
        return send(webClient.get().uri(toUri(resource(pathOrId, null))), DriveItem.class);
    }

    @Override
    public DriveItem createFolder(String parentPathOrId, String name) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("folder", Map.of());
        body.put("@microsoft.graph.conflictBehavior", "fail");

        log.debug("원격 폴더 생성: parent={}, name={}", parentPathOrId, name);
        return send(webClient.post()
                .uri(toUri(resource(parentPathOrId, "children")))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body), DriveItem.class);
    }

    @Override
    public DriveItem patchItem(String id, ItemPatch patch) {
        Map<String, Object> body = new LinkedHashMap<>();
        if (patch.name() != null) {
            body.put("name", patch.name());
        }
        if (patch.parentId() != null) {
            body.put("parentReference", Map.of("id", patch.parentId()));
        }

        log.debug("원격 항목 수정: id={}, fields={}", id, body.keySet());
        return send(webClient.patch()
                .uri(toUri(resource(id, null)))
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body), DriveItem.class);
    }

    @Override
    public byte[] getContent(String id) {
        byte[] content = send(webClient.get().uri(toUri(resource(id, "content"))), byte[].class);
        return content != null ? content : new byte[0];
    }

    @Override
    public DriveItem putContent(String pathOrId, byte[] content) {
        return send(webClient.put()
                .uri(toUri(resource(pathOrId, "content")))
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .bodyValue(content), DriveItem.class);
    }

    @Override
    public List<DriveItem> search(String query) {
        String escaped = UriUtils.encodePathSegment(query.replace("'", "''"), StandardCharsets.UTF_8);
        DriveItemCollection page = send(webClient.get()
                .uri(toUri(DRIVE_ROOT + "/search(q='" + escaped + "')")), DriveItemCollection.class);
        return page != null && page.value() != null ? page.value() : List.of();
    }

    private <T> T send(WebClient.RequestHeadersSpec<?> request, Class<T> type) {
        try {
            return request
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                    .retrieve()
                    .bodyToMono(type)
                    .block();
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new RemoteDriveException("원격 드라이브 요청 실패: HTTP " + status, status, null,
                    e.getResponseBodyAsByteArray(), e);
        } catch (WebClientRequestException e) {
            throw new RemoteDriveException("원격 드라이브에 연결할 수 없습니다: " + e.getMessage(), 0, null, null, e);
        }
    }

    static String resource(String pathOrId, String suffix) {
        String base;
        if (pathOrId == null || pathOrId.isBlank() || "/".equals(pathOrId) || "root".equals(pathOrId)) {
            return suffix == null ? DRIVE_ROOT : DRIVE_ROOT + "/" + suffix;
        }
        if (pathOrId.startsWith("/")) {
            base = DRIVE_ROOT + ":" + encodePath(pathOrId);
            return suffix == null ? base : base + ":/" + suffix;
        }
        base = DRIVE_ITEMS + UriUtils.encodePathSegment(pathOrId, StandardCharsets.UTF_8);
        return suffix == null ? base : base + "/" + suffix;
    }

    private static String encodePath(String path) {
        return Arrays.stream(path.split("/"))
                .filter(segment -> !segment.isEmpty())
                .map(segment -> UriUtils.encodePathSegment(segment, StandardCharsets.UTF_8))
                .collect(Collectors.joining("/", "/", ""));
    }

    private URI toUri(String resourcePath) {
        return URI.create(baseUrl + resourcePath);
    }
}
