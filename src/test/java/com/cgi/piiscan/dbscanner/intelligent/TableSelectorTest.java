package com.cgi.piiscan.dbscanner.intelligent;

import com.cgi.piiscan.dbscanner.model.ScanStrategy;
import com.cgi.piiscan.dbscanner.model.StrategyKind;
import com.cgi.piiscan.dbscanner.model.TableDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TableSelectorTest {

    private final TableSelector selector = new TableSelector();

    private static TableDescriptor table(String name, double score) {
        return TableDescriptor.builder().name(name).priorityScore(score).build();
    }

    private static ScanStrategy target(int tables) {
        return ScanStrategy.builder().kind(StrategyKind.PRIORITY).targetTables(tables).build();
    }

    @Test
    void picksHighestPriorityFirst() {
        // Given
        List<TableDescriptor> tables = List.of(
                table("logs", 1.5), table("users", 3.5), table("orders", 2.2), table("temp", 1.0));

        // When
        List<TableDescriptor> selected = selector.select(tables, target(2));

        // Then
        assertThat(selected).extracting(TableDescriptor::getName).containsExactly("users", "orders");
    }

    @Test
    void tiesKeepDiscoveryOrder() {
        List<TableDescriptor> tables = List.of(
                table("b", 2.0), table("a", 3.0), table("c", 2.0), table("d", 2.0));

        List<TableDescriptor> selected = selector.select(tables, target(4));

        assertThat(selected).extracting(TableDescriptor::getName).containsExactly("a", "b", "c", "d");
    }

    @Test
    void targetLargerThanSchemaReturnsAllTables() {
        List<TableDescriptor> tables = List.of(table("a", 1.0), table("b", 2.0));

        assertThat(selector.select(tables, target(10))).hasSize(2);
        assertThat(selector.select(List.of(), target(10))).isEmpty();
    }
}
