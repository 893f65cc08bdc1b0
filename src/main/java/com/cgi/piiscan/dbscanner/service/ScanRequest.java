package com.cgi.piiscan.dbscanner.service;

import com.cgi.piiscan.dbscanner.model.ConnectionParameters;
import com.cgi.piiscan.dbscanner.model.ScanMode;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything needed to run one scan.
 */
@Value
@Builder
public class ScanRequest {
    @NonNull
    ConnectionParameters connection;

    @Builder.Default
    ScanMode scanMode = ScanMode.SMART;

    /**
     * Optional cap on the number of tables scanned.
     */
    Integer maxTables;

    @Builder.Default
    ProgressSink progress = ProgressSink.none();
}
