package com.liftlog.plugins.fault;

import com.liftlog.config.PipelineConfig;
import com.liftlog.core.model.Row;
import com.liftlog.core.model.SheetHeaders;
import com.liftlog.core.partition.DevicePartitioner;
import com.liftlog.support.TestRows;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.liftlog.support.TestRows.content;
import static com.liftlog.support.TestRows.row;
import static org.junit.jupiter.api.Assertions.*;

class D240FaultMergerTest {

    private static final String D240 = "故障代码D240";
    private static final String T = "2025-12-08 10:18:05";

    private final D240FaultMerger merger = new D240FaultMerger(new PipelineConfig.FaultConfig(), new DevicePartitioner());

    @Test
    void sameInnerTimestampMergesSortedByCode() {
        List<Row> rows = List.of(
                row(1, T, "C1", D240, "[2025-12-08 10:18:04 120ms] ['697(门锁回路断开)']"),
                row(2, T, "C1", D240, "[2025-12-08 10:18:04 120ms] ['434(安全回路（#29）断开)']"));

        List<Row> out = merger.apply(rows, TestRows.HEADERS);

        assertEquals(1, out.size());
        assertEquals(1, out.get(0).id());
        assertEquals("[2025-12-08 10:18:04 120ms] ['434(安全回路（#29）断开)']['697(门锁回路断开)']", content(out.get(0)));
    }

    @Test
    void groupsFillOriginalSlotsInTimeOrder() {
        List<Row> rows = List.of(
                row(1, T, "C1", D240, "[2025-12-08 10:18:04 500ms] ['B1(x)']"),
                row(2, T, "C1", "门状态", "开门"),
                row(3, T, "C1", D240, "[2025-12-08 10:18:04 50ms] ['A2(y)']"),
                row(4, T, "C1", D240, "[2025-12-08 10:18:04 500ms] ['A1(z)']"));

        List<Row> out = merger.apply(rows, TestRows.HEADERS);

        assertEquals(List.of(1, 2, 3), out.stream().map(Row::id).toList());
        assertEquals("[2025-12-08 10:18:04 50ms] ['A2(y)']", content(out.get(0)), "ms se compara como número");
        assertEquals("开门", content(out.get(1)));
        assertEquals("[2025-12-08 10:18:04 500ms] ['A1(z)']['B1(x)']", content(out.get(2)));
    }

    @Test
    void severalEntriesInOneRowAreSplitAndSorted() {
        List<Row> rows = List.of(
                row(1, T, "C1", D240, "[2025-12-08 10:18:04 1ms] ['9(c)']['10(a)']"),
                row(2, T, "C1", D240, "[2025-12-08 10:18:04 1ms] ['2(b)']"));

        List<Row> out = merger.apply(rows, TestRows.HEADERS);

        // orden alfanumérico, no numérico
        assertEquals("[2025-12-08 10:18:04 1ms] ['10(a)']['2(b)']['9(c)']", content(out.get(0)));
    }

    @Test
    void entryWithoutLeadingCodeSortsByItsRawText() {
        List<Row> rows = List.of(
                row(1, T, "C1", D240, "[2025-12-08 10:18:04 120ms] ['abc(门)']"),
                row(2, T, "C1", D240, "[2025-12-08 10:18:04 120ms] ['（x）']"));

        List<Row> out = merger.apply(rows, TestRows.HEADERS);

        // la clave de '（x）' es "['（x）']" y '[' va antes que 'a'
        assertEquals("[2025-12-08 10:18:04 120ms] ['（x）']['abc(门)']", content(out.get(0)));
    }

    @Test
    void longMillisecondFieldsKeepTheirOwnStamp() {
        List<Row> rows = List.of(
                row(1, T, "C1", D240, "[2025-12-08 10:18:04 12345678901ms] ['2(b)']"),
                row(2, T, "C1", D240, "[2025-12-08 10:18:04 999ms] ['1(a)']"));

        List<Row> out = merger.apply(rows, TestRows.HEADERS);

        assertEquals(2, out.size());
        assertEquals("[2025-12-08 10:18:04 999ms] ['1(a)']", content(out.get(0)));
        assertEquals("[2025-12-08 10:18:04 12345678901ms] ['2(b)']", content(out.get(1)), "ms se compara como número");
    }

    @Test
    void rowWithoutInnerTimestampIsKeptVerbatim() {
        List<Row> rows = List.of(
                row(1, T, "C1", D240, "[2025-12-08 10:18:04 120ms] ['434(x)']"),
                row(2, T, "C1", "事件", D240 + " 无内部时间"));

        List<Row> out = merger.apply(rows, TestRows.HEADERS);

        assertEquals(2, out.size());
        assertEquals("[0000-00-00 00:00:00 0ms] " + D240 + " 无内部时间", content(out.get(0)));
        assertEquals("[2025-12-08 10:18:04 120ms] ['434(x)']", content(out.get(1)));
    }

    @Test
    void differentDeviceTimesAreNotMerged() {
        List<Row> rows = List.of(
                row(1, T, "C1", D240, "[2025-12-08 10:18:04 120ms] ['697(a)']"),
                row(2, "2025-12-08 10:18:06", "C1", D240, "[2025-12-08 10:18:04 120ms] ['434(b)']"));

        List<Row> out = merger.apply(rows, TestRows.HEADERS);

        assertEquals(2, out.size());
    }

    @Test
    void differentDevicesAreNotMerged() {
        List<Row> rows = List.of(
                row(1, T, "A", D240, "[2025-12-08 10:18:04 120ms] ['697(a)']"),
                row(2, T, "B", D240, "[2025-12-08 10:18:04 120ms] ['434(b)']"));

        List<Row> out = merger.apply(rows, TestRows.HEADERS);

        assertEquals(2, out.size());
        assertEquals("[2025-12-08 10:18:04 120ms] ['697(a)']", content(out.get(0)));
    }

    @Test
    void rowsWithoutMarkerAreUntouched() {
        List<Row> rows = List.of(row(1, T, "C1", "事件", "[2025-12-08 10:18:04 120ms] ['1(a)']"));

        assertSame(rows, merger.apply(rows, TestRows.HEADERS));
    }

    @Test
    void missingTimeColumnReturnsInput() {
        SheetHeaders headers = SheetHeaders.of("合同号", "设备", "信息内容");
        List<Row> rows = List.of(Row.builder().id(1).value("信息内容", D240).build());

        assertFalse(merger.supports(headers));
        assertSame(rows, merger.apply(rows, headers));
    }

    @Test
    void neverGrowsTheRowList() {
        List<Row> rows = List.of(
                row(1, T, "C1", D240, "[2025-12-08 10:18:04 120ms] ['1(a)']"),
                row(2, T, "C1", D240, "[2025-12-08 10:18:05 120ms] ['2(a)']"),
                row(3, T, "C1", D240, "[2025-12-08 10:18:04 120ms] ['3(a)']"));

        assertTrue(merger.apply(rows, TestRows.HEADERS).size() <= rows.size());
    }
}
