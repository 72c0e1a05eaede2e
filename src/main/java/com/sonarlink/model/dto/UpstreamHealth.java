package com.sonarlink.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpstreamHealth {

    private boolean reachable;

    private boolean authenticated;

    private String baseUrl;
}
