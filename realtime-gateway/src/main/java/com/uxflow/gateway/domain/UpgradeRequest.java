package com.uxflow.gateway.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Parameters carried by the WebSocket upgrade URI.
 * Expected format: /ws?projectId=xxx&amp;workspaceId=yyy&amp;token=zzz
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpgradeRequest {

    public static final String ROOM_PARAM = "projectId";
    public static final String WORKSPACE_PARAM = "workspaceId";
    public static final String TOKEN_PARAM = "token";

    private String roomId;
    private String workspaceId;
    private String credential;

    public static UpgradeRequest fromUri(URI uri) {
        if (uri == null) {
            return new UpgradeRequest();
        }
        Map<String, String> params = UriComponentsBuilder.fromUri(uri)
                .build()
                .getQueryParams()
                .toSingleValueMap();
        String token = decode(params.get(TOKEN_PARAM));
        if (token != null && token.startsWith("Bearer ")) {
            token = token.substring(7);
        }
        return UpgradeRequest.builder()
                .roomId(decode(params.get(ROOM_PARAM)))
                .workspaceId(decode(params.get(WORKSPACE_PARAM)))
                .credential(token)
                .build();
    }

    private static String decode(String value) {
        return value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8);
    }
}
