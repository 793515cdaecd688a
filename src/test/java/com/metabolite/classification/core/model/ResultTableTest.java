package com.metabolite.classification.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResultTableTest {

    private static MergedRecord failed(String name) {
        return new MergedRecord(name, HmdbRecord.idNotFound(), KeggRecord.idNotFound(), MetaboliteType.UNKNOWN);
    }

    @Test
    @DisplayName("Rows keep insertion order")
    void insertionOrder() {
        ResultTable table = new ResultTable();
        table.put(failed("b"));
        table.put(failed("a"));
        table.put(failed("c"));

        assertEquals(List.of("b", "a", "c"), table.names());
    }

    @Test
    @DisplayName("A repeated name replaces the earlier row in place")
    void lastWriteWins() {
        ResultTable table = new ResultTable();
        table.put(failed("a"));
        table.put(failed("b"));
        MergedRecord replacement = new MergedRecord("a", HmdbRecord.idNotFound(),
                KeggRecord.found("C00031", MetaboliteType.PRIMARY, Set.of(), ""), MetaboliteType.PRIMARY);
        table.put(replacement);

        assertEquals(2, table.size());
        assertEquals(List.of("a", "b"), table.names());
        assertSame(replacement, table.get("a").orElseThrow());
    }

    @Test
    @DisplayName("Columns only include fields some row populates")
    void columnsPresentOnly() {
        ResultTable table = new ResultTable();
        table.put(failed("a"));

        assertEquals(List.of(ResultColumns.HMDB_STATUS, ResultColumns.KEGG_STATUS, ResultColumns.FINAL_TYPE),
                table.columns());
        assertEquals(List.of(ResultColumns.FINAL_TYPE), table.displayColumns());
    }

    @Test
    @DisplayName("Display columns follow the summary order")
    void displayOrder() {
        ResultTable table = new ResultTable();
        table.put(failed("a"));
        table.put(new MergedRecord("b",
                HmdbRecord.found("HMDB1", "Lipids", "Unknown", "Unknown", List.of("p")),
                KeggRecord.found("C1", MetaboliteType.PRIMARY, Set.of("map1"), ""),
                MetaboliteType.PRIMARY));

        assertEquals(ResultColumns.DISPLAY, table.displayColumns());
        assertEquals(ResultColumns.HMDB_STATUS, table.columns().get(0));
    }
}
