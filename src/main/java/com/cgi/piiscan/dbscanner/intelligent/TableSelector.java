package com.cgi.piiscan.dbscanner.intelligent;

import com.cgi.piiscan.dbscanner.model.ScanStrategy;
import com.cgi.piiscan.dbscanner.model.TableDescriptor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks the tables a strategy will scan: highest priority first, ties in discovery order.
 */
@Component
public class TableSelector {

    public List<TableDescriptor> select(List<TableDescriptor> tables, ScanStrategy strategy) {
        List<TableDescriptor> sorted = new ArrayList<>(tables);
        // List.sort is stable
        sorted.sort(Comparator.comparingDouble(TableDescriptor::getPriorityScore).reversed());
        int target = Math.min(strategy.getTargetTables(), sorted.size());
        return List.copyOf(sorted.subList(0, target));
    }
}
