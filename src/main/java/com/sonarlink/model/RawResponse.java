package com.sonarlink.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

/**
 * Successful HTTP response as received from SonarQube, before payload parsing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawResponse {

    private int statusCode;
    private HttpHeaders headers;
    private String body;

    public boolean isJson() {
        if (headers == null || headers.getContentType() == null) {
            return false;
        }
        MediaType contentType = headers.getContentType();
        return MediaType.APPLICATION_JSON.isCompatibleWith(contentType)
                || contentType.getSubtype().endsWith("+json");
    }
}
