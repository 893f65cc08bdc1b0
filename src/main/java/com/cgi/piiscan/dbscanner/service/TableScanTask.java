package com.cgi.piiscan.dbscanner.service;

import com.cgi.piiscan.dbscanner.core.scanner.DatabaseScanner;
import com.cgi.piiscan.dbscanner.model.DataSample;
import com.cgi.piiscan.dbscanner.model.TableDescriptor;
import com.cgi.piiscan.piidetector.model.Finding;
import com.cgi.piiscan.piidetector.service.DetectorSet;
import org.springframework.util.StopWatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Samples one table and runs the detectors on every non-null cell.
 * Findings stay local to the task until the outcome is handed over.
 */
public class TableScanTask implements Callable<TableScanOutcome> {
    private final DatabaseScanner scanner;
    private final TableDescriptor table;
    private final int sampleSize;
    private final DetectorSet detectorSet;

    public TableScanTask(DatabaseScanner scanner, TableDescriptor table, int sampleSize, DetectorSet detectorSet) {
        this.scanner = scanner;
        this.table = table;
        this.sampleSize = sampleSize;
        this.detectorSet = detectorSet;
    }

    @Override
    public TableScanOutcome call() throws InterruptedException {
        StopWatch watch = new StopWatch();
        watch.start();

        DataSample sample = scanner.sampleTableData(table, sampleSize);

        List<Finding> findings = new ArrayList<>();
        for (Map<String, Object> row : sample.getRows()) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Scan of table " + table.getName() + " interrupted");
            }
            for (Map.Entry<String, Object> cell : row.entrySet()) {
                findings.addAll(detectorSet.detect(table.getName(), cell.getKey(), cell.getValue()));
            }
        }

        watch.stop();
        return TableScanOutcome.scanned(table.getName(), findings, sample.getSampleSize(), watch.getTotalTimeMillis());
    }

    public TableDescriptor getTable() {
        return table;
    }

    @Override
    public String toString() {
        return "TableScanTask{table='" + table.getName() + "', sampleSize=" + sampleSize + "}";
    }
}
