package io.instiflow.institutional;

import io.instiflow.institutional.parse.CanonicalRow;
import io.instiflow.institutional.store.CsvTable;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SecurityDaySliceTest {
    @Test
    void csv_columns_are_id_name_fields_then_date() {
        SecurityDaySlice slice = new SecurityDaySlice(new TrackedSecurity("2330", Market.LISTED), LocalDate.of(2024, 1, 2),
                List.of("外資_買賣超股數", "投信_買賣超股數"),
                List.of(new CanonicalRow("2330", "台積電", Map.of("外資_買賣超股數", 6000L, "投信_買賣超股數", -5L))));

        CsvTable table = slice.toCsvTable();
        assertEquals(List.of("證券代號", "證券名稱", "外資_買賣超股數", "投信_買賣超股數", "日期"), table.header());
        Map<String, String> row = table.rows().get(0);
        assertEquals("6000", row.get("外資_買賣超股數"));
        assertEquals("-5", row.get("投信_買賣超股數"));
        assertEquals("2024-01-02", row.get("日期"));
        assertEquals("2330@2024-01-02", slice.toString());
    }
}
