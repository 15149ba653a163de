package com.edgegate.gateway.realtime;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Per-channel outcome of a subscribe request; a rejection never aborts the other channels
 */
@Value
public class SubscribeResult {
    List<String> accepted;

    /**
     * Rejected channel to reason code
     */
    Map<String, String> rejected;
}
