package com.company.sentinel.transport;

import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

@Value
@Builder
public class HttpProbeResponse {
    int statusCode;
    String body;              // null for HEAD requests
    long contentSizeBytes;
    @Builder.Default
    Map<String, String> headers = Collections.emptyMap();
}
