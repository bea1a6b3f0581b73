package com.claude.warehouse.service;

import com.claude.warehouse.domain.Gender;
import com.claude.warehouse.domain.MaintenanceFlag;
import com.claude.warehouse.domain.MaritalStatus;
import com.claude.warehouse.domain.ProductLine;
import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.dto.SilverLoadResult;
import com.claude.warehouse.dto.SilverVerificationReport;
import com.claude.warehouse.entity.SilverLoadRun;
import com.claude.warehouse.entity.bronze.BronzeCustomerDemographic;
import com.claude.warehouse.entity.bronze.BronzeCustomerInfo;
import com.claude.warehouse.entity.bronze.BronzeCustomerLocation;
import com.claude.warehouse.entity.bronze.BronzeProductCategory;
import com.claude.warehouse.entity.bronze.BronzeProductInfo;
import com.claude.warehouse.entity.bronze.BronzeSalesDetail;
import com.claude.warehouse.entity.silver.SilverCustomerDemographic;
import com.claude.warehouse.entity.silver.SilverCustomerInfo;
import com.claude.warehouse.entity.silver.SilverCustomerLocation;
import com.claude.warehouse.entity.silver.SilverProductCategory;
import com.claude.warehouse.entity.silver.SilverProductInfo;
import com.claude.warehouse.entity.silver.SilverSalesDetail;
import com.claude.warehouse.repository.SilverLoadRunRepository;
import com.claude.warehouse.repository.bronze.BronzeCustomerDemographicRepository;
import com.claude.warehouse.repository.bronze.BronzeCustomerInfoRepository;
import com.claude.warehouse.repository.bronze.BronzeCustomerLocationRepository;
import com.claude.warehouse.repository.bronze.BronzeProductCategoryRepository;
import com.claude.warehouse.repository.bronze.BronzeProductInfoRepository;
import com.claude.warehouse.repository.bronze.BronzeSalesDetailRepository;
import com.claude.warehouse.repository.silver.SilverCustomerDemographicRepository;
import com.claude.warehouse.repository.silver.SilverCustomerInfoRepository;
import com.claude.warehouse.repository.silver.SilverCustomerLocationRepository;
import com.claude.warehouse.repository.silver.SilverProductCategoryRepository;
import com.claude.warehouse.repository.silver.SilverProductInfoRepository;
import com.claude.warehouse.repository.silver.SilverSalesDetailRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.domain.Sort;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class SilverLoadOrchestratorTest {

    private static final LocalDateTime LOADED_AT = LocalDateTime.of(2026, 3, 1, 2, 0);
    private static final Sort BY_ROW = Sort.by("rowId");

    @Autowired
    private SilverLoadOrchestrator orchestrator;

    @Autowired
    private SilverVerificationService verificationService;

    @Autowired
    private SilverLoadRunRepository runRepository;

    @Autowired
    private BronzeCustomerInfoRepository bronzeCustomers;
    @Autowired
    private BronzeProductInfoRepository bronzeProducts;
    @Autowired
    private BronzeSalesDetailRepository bronzeSales;
    @Autowired
    private BronzeCustomerDemographicRepository bronzeDemographics;
    @Autowired
    private BronzeCustomerLocationRepository bronzeLocations;
    @Autowired
    private BronzeProductCategoryRepository bronzeCategories;

    @Autowired
    private SilverCustomerInfoRepository silverCustomers;
    @Autowired
    private SilverProductInfoRepository silverProducts;
    @Autowired
    private SilverSalesDetailRepository silverSales;
    @Autowired
    private SilverCustomerDemographicRepository silverDemographics;
    @Autowired
    private SilverCustomerLocationRepository silverLocations;
    @Autowired
    private SilverProductCategoryRepository silverCategories;

    @BeforeEach
    void setUp() {
        runRepository.deleteAll();
        silverCustomers.deleteAllInBatch();
        silverProducts.deleteAllInBatch();
        silverSales.deleteAllInBatch();
        silverDemographics.deleteAllInBatch();
        silverLocations.deleteAllInBatch();
        silverCategories.deleteAllInBatch();
        bronzeCustomers.deleteAllInBatch();
        bronzeProducts.deleteAllInBatch();
        bronzeSales.deleteAllInBatch();
        bronzeDemographics.deleteAllInBatch();
        bronzeLocations.deleteAllInBatch();
        bronzeCategories.deleteAllInBatch();

        seedBronze();
    }

    // ========== Full Load Tests ==========

    @Test
    @DisplayName("Should load every entity and report one result per entity")
    void testLoadAll() {
        List<SilverLoadResult> results = orchestrator.loadAll(LOADED_AT);

        assertThat(results).hasSize(SilverEntity.values().length);
        assertThat(results).allMatch(SilverLoadResult::isSuccessful);
        assertThat(results).extracting(SilverLoadResult::getEntity)
                .containsExactly("crm_cust_info", "crm_prd_info", "crm_sales_details",
                        "erp_cust_demographics", "erp_cust_location", "erp_product_categories");

        SilverLoadResult customers = results.get(0);
        assertThat(customers.getSurvivorRecords()).isEqualTo(3);
        assertThat(customers.getPublishedRecords()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should keep the latest customer profile with canonical codes")
    void testCustomerSurvivorship() {
        orchestrator.load(SilverEntity.CRM_CUST_INFO, LOADED_AT);

        List<SilverCustomerInfo> rows = silverCustomers.findAll(BY_ROW);
        assertThat(rows).extracting(SilverCustomerInfo::getCustomerId).containsExactly(1, 2, 3);

        SilverCustomerInfo first = rows.get(0);
        assertThat(first.getMaritalStatus()).isEqualTo(MaritalStatus.MARRIED);
        assertThat(first.getLastName()).isEqualTo("Yang");
        assertThat(first.getDwhDateLoaded()).isEqualTo(LOADED_AT);

        assertThat(rows.get(2).getGender()).isEqualTo(Gender.UNKNOWN);
        assertThat(rows.get(2).getMaritalStatus()).isEqualTo(MaritalStatus.UNKNOWN);
        assertThat(rows).allSatisfy(row -> {
            assertThat(row.getFirstName()).isEqualTo(row.getFirstName().strip());
            assertThat(row.getLastName()).doesNotContain("\n", "\r");
        });
    }

    @Test
    @DisplayName("Should derive contiguous product intervals and product key parts")
    void testProductIntervals() {
        orchestrator.load(SilverEntity.CRM_PRD_INFO, LOADED_AT);

        Map<Integer, SilverProductInfo> products = silverProducts.findAll().stream()
                .collect(Collectors.toMap(SilverProductInfo::getProductId, Function.identity()));

        assertThat(products).hasSize(4);
        assertThat(products.get(211).getEndDate()).isEqualTo(LocalDate.of(2021, 12, 31));
        assertThat(products.get(212).getEndDate()).isEqualTo(LocalDate.of(2022, 12, 31));
        assertThat(products.get(213).getEndDate()).isNull();
        assertThat(products.get(213).getCategoryId()).isEqualTo("CO_RF");
        assertThat(products.get(213).getProductKeyClean()).isEqualTo("FR-R92R-58");
        assertThat(products.get(213).getProductLine()).isEqualTo(ProductLine.ROAD);
        assertThat(products.get(214).getCost()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(products.get(214).getProductLine()).isEqualTo(ProductLine.OTHER);
    }

    @Test
    @DisplayName("Should repair sales figures and dates")
    void testSalesRepair() {
        orchestrator.load(SilverEntity.CRM_SALES_DETAILS, LOADED_AT);

        Map<String, SilverSalesDetail> sales = silverSales.findAll().stream()
                .collect(Collectors.toMap(SilverSalesDetail::getOrderNumber, Function.identity()));

        assertThat(sales).hasSize(3);
        assertThat(sales.get("SO1").getSales()).isEqualByComparingTo("50");
        assertThat(sales.get("SO2").getQuantity()).isZero();
        assertThat(sales.get("SO2").getPrice()).isEqualByComparingTo("20");
        assertThat(sales.get("SO3").getOrderDate()).isNull();
        assertThat(sales.get("SO3").getShipDate()).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(sales.values()).allSatisfy(line -> {
            assertThat(line.getQuantity()).isGreaterThanOrEqualTo(0);
            assertThat(line.getPrice().signum()).isGreaterThanOrEqualTo(0);
        });
    }

    @Test
    @DisplayName("Should standardize ERP demographics, locations and categories")
    void testErpEntities() {
        orchestrator.load(SilverEntity.ERP_CUST_DEMOGRAPHICS, LOADED_AT);
        orchestrator.load(SilverEntity.ERP_CUST_LOCATION, LOADED_AT);
        orchestrator.load(SilverEntity.ERP_PRODUCT_CATEGORIES, LOADED_AT);

        List<SilverCustomerDemographic> demographics = silverDemographics.findAll(BY_ROW);
        assertThat(demographics).extracting(SilverCustomerDemographic::getCustomerKey)
                .containsExactly("123-NAS", "AW00011002");
        assertThat(demographics.get(1).getBirthDate()).isNull();
        assertThat(demographics.get(0).getGender()).isEqualTo(Gender.FEMALE);

        List<SilverCustomerLocation> locations = silverLocations.findAll(BY_ROW);
        assertThat(locations).extracting(SilverCustomerLocation::getCountry)
                .containsExactly("United States", "Germany", "n/a");

        List<SilverProductCategory> categories = silverCategories.findAll(BY_ROW);
        assertThat(categories).extracting(SilverProductCategory::getMaintenance)
                .containsExactly(MaintenanceFlag.YES, MaintenanceFlag.UNKNOWN);
        assertThat(categories.get(0).getSubcategory()).isEqualTo("Bike Racks");
    }

    // ========== Idempotence and Run Tracking Tests ==========

    @Test
    @DisplayName("Should produce identical Silver rows when re-run with the same load timestamp")
    void testIdempotentReload() {
        orchestrator.loadAll(LOADED_AT);
        List<SilverCustomerInfo> firstCustomers = withoutIds(silverCustomers.findAll(BY_ROW));
        List<SilverProductInfo> firstProducts = withoutProductIds(silverProducts.findAll(BY_ROW));

        orchestrator.loadAll(LOADED_AT);

        assertThat(withoutIds(silverCustomers.findAll(BY_ROW))).isEqualTo(firstCustomers);
        assertThat(withoutProductIds(silverProducts.findAll(BY_ROW))).isEqualTo(firstProducts);
        assertThat(silverCustomers.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should drop Silver rows whose Bronze source disappeared")
    void testFullReplace() {
        orchestrator.load(SilverEntity.ERP_PRODUCT_CATEGORIES, LOADED_AT);
        assertThat(silverCategories.count()).isEqualTo(2);

        bronzeCategories.deleteAllInBatch();
        SilverLoadResult result = orchestrator.load(SilverEntity.ERP_PRODUCT_CATEGORIES, LOADED_AT);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(silverCategories.count()).isZero();
    }

    @Test
    @DisplayName("Should record completed runs with selection statistics")
    void testRunTracking() {
        SilverLoadResult result = orchestrator.load(SilverEntity.CRM_CUST_INFO, LOADED_AT);

        List<SilverLoadRun> runs = orchestrator.getRuns(SilverEntity.CRM_CUST_INFO);
        assertThat(runs).hasSize(1);

        SilverLoadRun run = runs.get(0);
        assertThat(run.getId()).isEqualTo(result.getRunId());
        assertThat(run.getStatus()).isEqualTo(SilverLoadRun.RunStatus.COMPLETED);
        assertThat(run.getJobExecutionId()).isNotNull();
        assertThat(run.getLoadedAt()).isEqualTo(LOADED_AT);
        assertThat(run.getSelectionStatistics())
                .contains("\"rawRows\":5")
                .contains("\"nullKeyRows\":1")
                .contains("\"duplicateRows\":1");
    }

    @Test
    @DisplayName("Should skip an entity whose previous run is still running")
    void testSkipWhileRunning() {
        runRepository.save(SilverLoadRun.start(SilverEntity.CRM_CUST_INFO, LOADED_AT));

        SilverLoadResult result = orchestrator.load(SilverEntity.CRM_CUST_INFO, LOADED_AT);

        assertThat(result.getStatus()).isEqualTo(SilverLoadRun.RunStatus.SKIPPED);
        assertThat(silverCustomers.count()).isZero();
    }

    @Test
    @DisplayName("Should report Silver counts and vocabulary closure")
    void testVerification() {
        orchestrator.loadAll(LOADED_AT);

        SilverVerificationReport report = verificationService.verify();

        assertThat(report.getRowCounts()).containsEntry("silver_crm_cust_info", 3L)
                .containsEntry("silver_crm_sales_details", 3L);
        assertThat(report.getDistinctCustomers()).isEqualTo(3);
        assertThat(report.isVocabularyClosed()).isTrue();
    }

    private static List<SilverCustomerInfo> withoutIds(List<SilverCustomerInfo> rows) {
        rows.forEach(row -> row.setRowId(null));
        return rows;
    }

    private static List<SilverProductInfo> withoutProductIds(List<SilverProductInfo> rows) {
        rows.forEach(row -> row.setRowId(null));
        return rows;
    }

    private void seedBronze() {
        bronzeCustomers.saveAll(List.of(
                customer(1, "Jon", "Yang\r\n", "S", "M", LocalDate.of(2023, 1, 1)),
                customer(1, " Jon ", "Yang", "M", "M", LocalDate.of(2023, 6, 1)),
                customer(2, "Eugene", "Huang", "s", "female", LocalDate.of(2023, 1, 1)),
                customer(3, "Ruben", "Torres", "X", "?", null),
                customer(null, "Julio", "Ruiz", "S", "M", LocalDate.of(2023, 1, 1))));

        bronzeProducts.saveAll(List.of(
                product(211, "CO-RF-FR-R92R-58", "R", null, LocalDate.of(2021, 1, 1), LocalDate.of(2021, 6, 30)),
                product(212, "CO-RF-FR-R92R-58", "R", "1498.00", LocalDate.of(2022, 1, 1), null),
                product(213, "CO-RF-FR-R92R-58", "r ", "1520.00", LocalDate.of(2023, 1, 1), null),
                product(214, "AC-HE-HL-U509", "S", null, LocalDate.of(2021, 1, 1), null)));

        bronzeSales.saveAll(List.of(
                sale("SO1", 20240105, 20240110, null, 5, "10"),
                sale("SO2", 20240105, 20240110, "100", 0, "-20"),
                sale("SO3", 20240230, 20240301, "30", 3, "10"),
                sale("SO3", 20240101, 20240301, "99", 1, "99"),
                sale(null, 20240101, 20240301, "1", 1, "1")));

        bronzeDemographics.saveAll(List.of(
                demographic("AB-123-NAS", LocalDate.of(1985, 3, 2), "F"),
                demographic("AW00011002", LocalDate.of(2099, 1, 1), "M")));

        bronzeLocations.saveAll(List.of(
                location("AW-00011001", "USA"),
                location("AW-00011002", "DE "),
                location("AW-00011003", " "),
                location("AW-00011004", null),
                location("AW-00011001", "Canada")));

        bronzeCategories.saveAll(List.of(
                category("AC_BR", "Bike Racks\n", "Y"),
                category("CO_RF", "Road Frames", "maybe"),
                category("AC_BR", "Bike Racks (dup)", "No")));
    }

    private static BronzeCustomerInfo customer(Integer id, String firstName, String lastName,
                                               String maritalStatus, String gender, LocalDate createDate) {
        return BronzeCustomerInfo.builder()
                .customerId(id)
                .customerKey("AW0001100" + id)
                .firstName(firstName)
                .lastName(lastName)
                .maritalStatus(maritalStatus)
                .gender(gender)
                .createDate(createDate)
                .build();
    }

    private static BronzeProductInfo product(Integer id, String key, String line, String cost,
                                             LocalDate start, LocalDate end) {
        return BronzeProductInfo.builder()
                .productId(id)
                .productKey(key)
                .productName("Product " + id)
                .productLine(line)
                .cost(cost == null ? null : new BigDecimal(cost))
                .startDate(start)
                .endDate(end)
                .build();
    }

    private static BronzeSalesDetail sale(String orderNumber, Integer orderDate, Integer shipDate,
                                          String amount, Integer quantity, String price) {
        return BronzeSalesDetail.builder()
                .orderNumber(orderNumber)
                .productKey("BK-R93R-62")
                .customerId(1)
                .orderDate(orderDate)
                .shipDate(shipDate)
                .dueDate(shipDate)
                .sales(amount == null ? null : new BigDecimal(amount))
                .quantity(quantity)
                .price(price == null ? null : new BigDecimal(price))
                .build();
    }

    private static BronzeCustomerDemographic demographic(String key, LocalDate birthDate, String gender) {
        return BronzeCustomerDemographic.builder()
                .customerKey(key)
                .birthDate(birthDate)
                .gender(gender)
                .build();
    }

    private static BronzeCustomerLocation location(String key, String country) {
        return BronzeCustomerLocation.builder()
                .customerKey(key)
                .country(country)
                .build();
    }

    private static BronzeProductCategory category(String id, String subcategory, String maintenance) {
        return BronzeProductCategory.builder()
                .categoryId(id)
                .category("Accessories")
                .subcategory(subcategory)
                .maintenance(maintenance)
                .build();
    }
}
