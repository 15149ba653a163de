package com.edgegate.common.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * One running copy of a logical service.
 *
 * Instances are immutable: the registry swaps in a new copy on every change, so
 * request paths reading the catalog never see a half-applied health update.
 * (serviceName, id) identifies an instance.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServiceInstance implements Serializable {
    private static final long serialVersionUID = 1L;

    String id;
    String serviceName;
    String address;
    Integer port;

    @Singular(ignoreNullCollections = true)
    Set<String> tags;

    @Singular(value = "metadataEntry", ignoreNullCollections = true)
    Map<String, String> metadata;

    boolean healthy;
    Instant lastHealthCheck;

    /**
     * Probes failed in a row since the last successful one
     */
    int consecutiveFailedChecks;

    @Builder.Default
    InstanceSource source = InstanceSource.REGISTRATION;

    public String getHostAndPort() {
        return address + ":" + port;
    }

    public String getBaseUrl() {
        return "http://" + getHostAndPort();
    }

    /**
     * Copy of this instance carrying the outcome of one health probe
     */
    public ServiceInstance withProbeResult(boolean success, Instant checkedAt) {
        return toBuilder()
                .healthy(success)
                .lastHealthCheck(checkedAt)
                .consecutiveFailedChecks(success ? 0 : consecutiveFailedChecks + 1)
                .build();
    }
}
