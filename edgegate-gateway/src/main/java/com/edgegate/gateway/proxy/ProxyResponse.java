package com.edgegate.gateway.proxy;

import lombok.Value;
import org.springframework.http.HttpHeaders;

/**
 * Buffered downstream response, headers already stripped of hop-by-hop entries
 */
@Value
public class ProxyResponse {
    int status;
    HttpHeaders headers;
    byte[] body;
}
