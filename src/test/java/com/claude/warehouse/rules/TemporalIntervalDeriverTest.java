package com.claude.warehouse.rules;

import com.claude.warehouse.entity.bronze.BronzeProductInfo;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TemporalIntervalDeriverTest {

    private final TemporalIntervalDeriver<BronzeProductInfo> deriver = new TemporalIntervalDeriver<>(
            product -> TextCleaner.cleanKey(product.getProductKey()),
            BronzeProductInfo::getStartDate,
            BronzeProductInfo::getEndDate);

    @Test
    @DisplayName("Should end each version the day before the next one starts")
    void testContiguousIntervals() {
        List<VersionInterval<BronzeProductInfo>> intervals = deriver.derive(List.of(
                product(1, "CO-RF-FR-R92R-58", LocalDate.of(2021, 1, 1), LocalDate.of(2021, 3, 1)),
                product(2, "CO-RF-FR-R92R-58", LocalDate.of(2022, 1, 1), LocalDate.of(2022, 5, 1)),
                product(3, "CO-RF-FR-R92R-58", LocalDate.of(2023, 1, 1), null)));

        assertEquals(3, intervals.size());
        assertEquals(LocalDate.of(2021, 12, 31), intervals.get(0).getEndDate());
        assertEquals(LocalDate.of(2022, 12, 31), intervals.get(1).getEndDate());
        assertNull(intervals.get(2).getEndDate());
    }

    @Test
    @DisplayName("Should keep the raw end date of the most recent version")
    void testLatestVersionKeepsRawEnd() {
        List<VersionInterval<BronzeProductInfo>> intervals = deriver.derive(List.of(
                product(1, "BI-MB", LocalDate.of(2021, 1, 1), LocalDate.of(2030, 6, 30))));

        assertEquals(LocalDate.of(2030, 6, 30), intervals.get(0).getEndDate());
    }

    @Test
    @DisplayName("Should sort versions by start date regardless of input order")
    void testOutOfOrderInput() {
        List<VersionInterval<BronzeProductInfo>> intervals = deriver.derive(List.of(
                product(3, "K", LocalDate.of(2023, 1, 1), null),
                product(1, "K", LocalDate.of(2021, 1, 1), null),
                product(2, "K", LocalDate.of(2022, 1, 1), null)));

        assertEquals(List.of(1, 2, 3), intervals.stream()
                .map(interval -> interval.getVersion().getProductId())
                .toList());
        assertEquals(LocalDate.of(2021, 12, 31), intervals.get(0).getEndDate());
    }

    @Test
    @DisplayName("Should derive intervals independently per product key")
    void testGroupsAreIndependent() {
        List<VersionInterval<BronzeProductInfo>> intervals = deriver.derive(List.of(
                product(1, "A", LocalDate.of(2021, 1, 1), LocalDate.of(2021, 2, 1)),
                product(2, "B", LocalDate.of(2022, 1, 1), LocalDate.of(2022, 2, 1)),
                product(3, " A ", LocalDate.of(2021, 6, 1), null)));

        assertEquals(3, intervals.size());
        assertEquals(1, intervals.get(0).getVersion().getProductId());
        assertEquals(LocalDate.of(2021, 5, 31), intervals.get(0).getEndDate());
        assertEquals(3, intervals.get(1).getVersion().getProductId());
        assertNull(intervals.get(1).getEndDate());
        assertEquals(LocalDate.of(2022, 2, 1), intervals.get(2).getEndDate());
    }

    @Test
    @DisplayName("Should place null start dates first and keep raw end when the next start is null")
    void testNullStartDates() {
        List<VersionInterval<BronzeProductInfo>> intervals = deriver.derive(List.of(
                product(2, "K", LocalDate.of(2022, 1, 1), null),
                product(1, "K", null, LocalDate.of(2020, 1, 1)),
                product(9, "K", null, LocalDate.of(2019, 1, 1))));

        assertEquals(1, intervals.get(0).getVersion().getProductId());
        assertEquals(LocalDate.of(2020, 1, 1), intervals.get(0).getEndDate());
        assertEquals(9, intervals.get(1).getVersion().getProductId());
        assertEquals(LocalDate.of(2021, 12, 31), intervals.get(1).getEndDate());
    }

    @Test
    @DisplayName("Should group products without a key together")
    void testNullKeyGroup() {
        List<VersionInterval<BronzeProductInfo>> intervals = deriver.derive(List.of(
                product(1, null, LocalDate.of(2021, 1, 1), null),
                product(2, "  ", LocalDate.of(2022, 1, 1), null)));

        assertEquals(LocalDate.of(2021, 12, 31), intervals.get(0).getEndDate());
        assertNull(intervals.get(1).getEndDate());
    }

    private static BronzeProductInfo product(Integer id, String key, LocalDate start, LocalDate end) {
        return BronzeProductInfo.builder()
                .productId(id)
                .productKey(key)
                .startDate(start)
                .endDate(end)
                .build();
    }
}
