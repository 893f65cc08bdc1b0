package com.cgi.piiscan.dbscanner.service;

import com.cgi.piiscan.dbscanner.model.ScanStats;
import com.cgi.piiscan.piidetector.model.Finding;
import lombok.Value;

import java.util.List;

/**
 * Findings and counters of the parallel phase.
 */
@Value
public class ParallelScanReport {
    List<Finding> findings;
    ScanStats stats;
}
