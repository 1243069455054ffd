package com.di.indexer.metadata;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Domain model for the {@code scan_records} table; also the shape of one
 * line of a bundle's scanprint stream (snake_case JSON).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScanRecord {

    @JsonIgnore
    private Long    id;
    @JsonIgnore
    private String  submissionUid;

    // ---- observation -------------------------------------------------------
    private Long    timestamp;
    private String  ip;
    private Integer port;
    private String  protocol;
    private String  state;

    // ---- fingerprints (optional) --------------------------------------------
    private String  service;
    private String  product;
    private String  version;
    private String  bannerSha256;
    private String  certFpr;
    private String  tlsJa3;
    private Integer latencyMs;

    // ---- provenance --------------------------------------------------------
    private String  tool;
    private String  toolVersion;
    private String  options;
    private String  vantage;

    /** Name of the first required field that is missing, or {@code null}. */
    @JsonIgnore
    public String missingRequiredField() {
        if (timestamp == null)   return "timestamp";
        if (isBlank(ip))         return "ip";
        if (port == null)        return "port";
        if (isBlank(protocol))   return "protocol";
        if (isBlank(state))      return "state";
        if (tool == null)        return "tool";
        if (toolVersion == null) return "tool_version";
        if (options == null)     return "options";
        if (vantage == null)     return "vantage";
        return null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
