package io.instiflow.institutional.store;

import io.instiflow.institutional.Market;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class HistoryAccumulatorTest {
    @TempDir
    Path dir;

    private StorageLayout layout;
    private HistoryAccumulator history;

    @BeforeEach
    void setUp() {
        layout = new StorageLayout(dir);
        history = new HistoryAccumulator(layout);
    }

    static CsvTable day(String date, String net) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put("證券代號", "2330");
        row.put("證券名稱", "台積電");
        row.put("外資_買賣超股數", net);
        row.put("日期", date);
        return new CsvTable(List.of("證券代號", "證券名稱", "外資_買賣超股數", "日期"), List.of(row));
    }

    @Test
    void creates_history_with_bom_and_header() throws Exception {
        assertEquals(1, history.accumulate(Market.LISTED, "2330", day("2024-01-02", "6000")));

        Path file = layout.historyFile(Market.LISTED, "2330");
        assertEquals(dir.resolve("twse_raw").resolve("2330").resolve("2330.csv"), file);
        byte[] bytes = Files.readAllBytes(file);
        assertEquals((byte) 0xEF, bytes[0]);
        assertEquals((byte) 0xBB, bytes[1]);
        assertEquals((byte) 0xBF, bytes[2]);
        String text = new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        assertTrue(text.endsWith("證券名稱,外資_買賣超股數,日期\n2330,台積電,6000,2024-01-02\n"), text);
        assertEquals(List.of("證券代號", "證券名稱", "外資_買賣超股數", "日期"), history.read(Market.LISTED, "2330").header());
    }

    @Test
    void same_rows_twice_leave_history_unchanged() throws Exception {
        history.accumulate(Market.LISTED, "2330", day("2024-01-02", "6000"));
        byte[] first = Files.readAllBytes(layout.historyFile(Market.LISTED, "2330"));
        history.accumulate(Market.LISTED, "2330", day("2024-01-02", "6000"));
        assertArrayEquals(first, Files.readAllBytes(layout.historyFile(Market.LISTED, "2330")));
    }

    @Test
    void later_write_for_a_date_replaces_earlier_one() throws Exception {
        history.accumulate(Market.LISTED, "2330", day("2024-01-02", "6000"));
        history.accumulate(Market.LISTED, "2330", day("2024-01-02", "7000"));
        CsvTable table = history.read(Market.LISTED, "2330");
        assertEquals(1, table.size());
        assertEquals("7000", table.rows().get(0).get("外資_買賣超股數"));
    }

    @Test
    void rows_are_sorted_by_date() throws Exception {
        history.accumulate(Market.LISTED, "2330", day("2024-01-03", "3"));
        history.accumulate(Market.LISTED, "2330", day("2023-12-29", "1"));
        history.accumulate(Market.LISTED, "2330", day("2024-01-02", "2"));
        CsvTable table = history.read(Market.LISTED, "2330");
        assertEquals(List.of("2023-12-29", "2024-01-02", "2024-01-03"),
                table.rows().stream().map(r -> r.get("日期")).toList());
    }

    @Test
    void new_columns_are_appended_and_old_rows_left_blank() throws Exception {
        history.accumulate(Market.LISTED, "2330", day("2024-01-02", "6000"));
        Map<String, String> row = new LinkedHashMap<>();
        row.put("證券代號", "2330");
        row.put("證券名稱", "台積電");
        row.put("外資_買賣超股數", "1");
        row.put("投信_買賣超股數", "5");
        row.put("日期", "2024-01-03");
        history.accumulate(Market.LISTED, "2330", new CsvTable(
                List.of("證券代號", "證券名稱", "外資_買賣超股數", "投信_買賣超股數", "日期"), List.of(row)));

        CsvTable table = history.read(Market.LISTED, "2330");
        assertEquals(List.of("證券代號", "證券名稱", "外資_買賣超股數", "日期", "投信_買賣超股數"), table.header());
        assertEquals("", table.rows().get(0).get("投信_買賣超股數"));
        assertEquals("5", table.rows().get(1).get("投信_買賣超股數"));
    }

    @Test
    void invalid_date_is_a_persistence_failure() {
        assertThrows(IOException.class, () -> history.accumulate(Market.LISTED, "2330", day("not-a-date", "1")));
        assertFalse(Files.exists(layout.historyFile(Market.LISTED, "2330")));
    }

    @Test
    void accepts_dates_with_time_part() throws Exception {
        history.accumulate(Market.LISTED, "2330", day("2024-01-02 00:00:00", "1"));
        history.accumulate(Market.LISTED, "2330", day("2024-01-02", "2"));
        assertEquals(1, history.read(Market.LISTED, "2330").size());
    }

    @Test
    void missing_history_reads_as_empty() throws Exception {
        assertEquals(0, history.read(Market.OTC, "6488").size());
    }
}
