package com.di.indexer.stats;

import com.di.indexer.metadata.ScanRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything indexed about one host address.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HostReport {

    private String                  ip;
    private long                    totalRecords;
    private List<Integer>           openPorts;
    private List<String>            services;
    private List<ScanRecord>        recent;
    private List<SubmissionSummary> submissions;
}
