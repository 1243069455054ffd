package com.di.indexer.bundle;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code manifest.json} at the root of a submission bundle.
 *
 * <pre>
 * {
 *   "schema": "scanprint/1",
 *   "namespace": "...", "dataset_type": "...",
 *   "scanprint": { "path": "scanprint.jsonl", "merkleRoot": "0x..." },
 *   "artifacts": [ { "path": "nmap.xml", "sha256": "...", "size": 1234 } ],
 *   "target_spec_cid": "...", "tool": "nmap", "tool_version": "7.94",
 *   "vantage": "...", "started_at": 1700000000, "finished_at": 1700000100,
 *   "notes": "..."
 * }
 * </pre>
 *
 * <p>Only the manifest's SHA-256 is persisted; the parsed form drives the fetch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class BundleManifest {

    private String         schema;
    private String         namespace;
    @JsonProperty("dataset_type")
    private String         datasetType;
    private Scanprint      scanprint;
    @Builder.Default
    private List<Artifact> artifacts = new ArrayList<>();
    @JsonProperty("target_spec_cid")
    private String         targetSpecCid;
    private String         tool;
    @JsonProperty("tool_version")
    private String         toolVersion;
    private String         vantage;
    @JsonProperty("started_at")
    private Long           startedAt;
    @JsonProperty("finished_at")
    private Long           finishedAt;
    private String         notes;

    /** Name of the first required field that is missing, or {@code null}. */
    @JsonIgnore
    public String missingRequiredField() {
        if (isBlank(schema))        return "schema";
        if (isBlank(namespace))     return "namespace";
        if (isBlank(datasetType))   return "dataset_type";
        if (scanprint == null)      return "scanprint";
        if (targetSpecCid == null)  return "target_spec_cid";
        if (isBlank(tool))          return "tool";
        if (toolVersion == null)    return "tool_version";
        if (vantage == null)        return "vantage";
        if (startedAt == null)      return "started_at";
        if (finishedAt == null)     return "finished_at";
        return null;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /* ---------------------------------------------------------------------- */

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Scanprint {

        /** Bundle-relative path of the JSON-lines record stream. */
        private String path;

        /** Declared stream digest; optional. */
        private String merkleRoot;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Artifact {

        private String path;
        private String sha256;
        private Long   size;
    }
}
