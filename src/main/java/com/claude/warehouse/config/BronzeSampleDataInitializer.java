package com.claude.warehouse.config;

import com.claude.warehouse.entity.bronze.BronzeCustomerDemographic;
import com.claude.warehouse.entity.bronze.BronzeCustomerInfo;
import com.claude.warehouse.entity.bronze.BronzeCustomerLocation;
import com.claude.warehouse.entity.bronze.BronzeProductCategory;
import com.claude.warehouse.entity.bronze.BronzeProductInfo;
import com.claude.warehouse.entity.bronze.BronzeSalesDetail;
import com.claude.warehouse.repository.bronze.BronzeCustomerDemographicRepository;
import com.claude.warehouse.repository.bronze.BronzeCustomerInfoRepository;
import com.claude.warehouse.repository.bronze.BronzeCustomerLocationRepository;
import com.claude.warehouse.repository.bronze.BronzeProductCategoryRepository;
import com.claude.warehouse.repository.bronze.BronzeProductInfoRepository;
import com.claude.warehouse.repository.bronze.BronzeSalesDetailRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * 로컬 데모용 Bronze 샘플 데이터
 *
 * 중복 키, 앞뒤 공백, 개행 문자, 잘못된 코드값, 음수 가격, 잘못된 날짜 등
 * 정제 규칙을 모두 거치도록 구성한 더러운 원천 데이터.
 */
@Configuration
@ConditionalOnProperty(prefix = "warehouse.sample-data", name = "enabled", havingValue = "true")
@Slf4j
public class BronzeSampleDataInitializer {

    @Bean
    CommandLineRunner initBronzeData(BronzeCustomerInfoRepository customerInfoRepository,
                                     BronzeProductInfoRepository productInfoRepository,
                                     BronzeSalesDetailRepository salesDetailRepository,
                                     BronzeCustomerDemographicRepository demographicRepository,
                                     BronzeCustomerLocationRepository locationRepository,
                                     BronzeProductCategoryRepository categoryRepository) {
        return args -> {
            if (customerInfoRepository.count() > 0) {
                log.info("Bronze 데이터가 이미 존재하여 샘플 데이터 적재 생략");
                return;
            }

            customerInfoRepository.saveAll(createCustomers());
            productInfoRepository.saveAll(createProducts());
            salesDetailRepository.saveAll(createSales());
            demographicRepository.saveAll(createDemographics());
            locationRepository.saveAll(createLocations());
            categoryRepository.saveAll(createCategories());

            log.info("Bronze 샘플 데이터 적재 완료");
        };
    }

    private List<BronzeCustomerInfo> createCustomers() {
        return Arrays.asList(
            customer(11000, "AW00011000", " Jon", "Yang ", "M", "M", LocalDate.of(2025, 10, 6)),
            customer(11001, "AW00011001", "Eugene", "Huang", "S", "M", LocalDate.of(2025, 10, 6)),
            customer(11001, "AW00011001", "Eugene", "Huang\r\n", "M", "M", LocalDate.of(2026, 1, 10)),
            customer(11002, "AW00011002", "Ruben", "Torres", "m", "male", LocalDate.of(2025, 10, 6)),
            customer(11003, "AW00011003", "  ", "Zhu", null, "F", LocalDate.of(2025, 10, 6)),
            customer(11004, "AW00011004", "Elizabeth", "Johnson", "X", "?", null),
            customer(null, "AW00011005", "Julio", "Ruiz", "S", "M", LocalDate.of(2025, 10, 6))
        );
    }

    private BronzeCustomerInfo customer(Integer id, String key, String firstName, String lastName,
                                        String maritalStatus, String gender, LocalDate createDate) {
        return BronzeCustomerInfo.builder()
                .customerId(id)
                .customerKey(key)
                .firstName(firstName)
                .lastName(lastName)
                .maritalStatus(maritalStatus)
                .gender(gender)
                .createDate(createDate)
                .build();
    }

    private List<BronzeProductInfo> createProducts() {
        return Arrays.asList(
            product(210, "CO-RF-FR-R92B-58", "HL Road Frame - Black- 58", null, "R ",
                    LocalDate.of(2021, 7, 1), null),
            product(211, "CO-RF-FR-R92R-58", "HL Road Frame - Red- 58", new BigDecimal("1432.00"), "R",
                    LocalDate.of(2021, 7, 1), LocalDate.of(2022, 6, 30)),
            product(212, "CO-RF-FR-R92R-58", "HL Road Frame - Red- 58", new BigDecimal("1498.00"), "R",
                    LocalDate.of(2022, 1, 1), LocalDate.of(2022, 12, 31)),
            product(213, "CO-RF-FR-R92R-58", "HL Road Frame - Red- 58", new BigDecimal("1520.00"), "R",
                    LocalDate.of(2023, 1, 1), null),
            product(214, "BI-MB-BK-M82S-38", "Mountain-100 Silver- 38", new BigDecimal("1912.15"), "m",
                    LocalDate.of(2021, 7, 1), null),
            product(215, "AC-HE-HL-U509", "Sport-100 Helmet\n", new BigDecimal("12.00"), "S",
                    LocalDate.of(2021, 7, 1), null),
            product(216, "BI-TB", "Touring-1000", new BigDecimal("1481.94"), "T",
                    LocalDate.of(2021, 7, 1), null)
        );
    }

    private BronzeProductInfo product(Integer id, String key, String name, BigDecimal cost, String line,
                                      LocalDate startDate, LocalDate endDate) {
        return BronzeProductInfo.builder()
                .productId(id)
                .productKey(key)
                .productName(name)
                .cost(cost)
                .productLine(line)
                .startDate(startDate)
                .endDate(endDate)
                .build();
    }

    private List<BronzeSalesDetail> createSales() {
        return Arrays.asList(
            sale("SO43697", "BK-R93R-62", 11000, 20221229, 20230105, 20230110, null, 5, new BigDecimal("10.00")),
            sale("SO43698", "BK-M82S-44", 11001, 20221229, 20230105, 20230110,
                    new BigDecimal("100.00"), 0, new BigDecimal("-20.00")),
            sale("SO43699", "BK-M82S-38", 11002, 20240230, 20230105, 0,
                    new BigDecimal("3399.99"), 1, null),
            sale("SO43700", "BK-R50B-62", 11003, 20221229, 2023015, 20230110,
                    new BigDecimal("-699.10"), 1, new BigDecimal("699.10")),
            sale("SO43700", "BK-R50B-62", 11003, 20221230, 20230106, 20230111,
                    new BigDecimal("699.10"), 1, new BigDecimal("699.10")),
            sale(" SO43701 ", "BK-M82S-44", 11004, 20221230, 20230106, 20230111,
                    new BigDecimal("3374.99"), 1, new BigDecimal("3374.99")),
            sale(null, "BK-M82S-44", 11005, 20221230, 20230106, 20230111,
                    new BigDecimal("3374.99"), 1, new BigDecimal("3374.99"))
        );
    }

    private BronzeSalesDetail sale(String orderNumber, String productKey, Integer customerId,
                                   Integer orderDate, Integer shipDate, Integer dueDate,
                                   BigDecimal sales, Integer quantity, BigDecimal price) {
        return BronzeSalesDetail.builder()
                .orderNumber(orderNumber)
                .productKey(productKey)
                .customerId(customerId)
                .orderDate(orderDate)
                .shipDate(shipDate)
                .dueDate(dueDate)
                .sales(sales)
                .quantity(quantity)
                .price(price)
                .build();
    }

    private List<BronzeCustomerDemographic> createDemographics() {
        return Arrays.asList(
            demographic("NASAW00011000", LocalDate.of(1971, 10, 6), "Male"),
            demographic("AW00011001", LocalDate.of(1976, 5, 10), "M"),
            demographic("AB-123-NAS", LocalDate.of(1985, 3, 2), " f "),
            demographic("AW00011002", LocalDate.of(2099, 1, 1), null),
            demographic("AW00011002", LocalDate.of(1971, 2, 9), "M"),
            demographic(" ", LocalDate.of(1980, 1, 1), "F")
        );
    }

    private BronzeCustomerDemographic demographic(String key, LocalDate birthDate, String gender) {
        return BronzeCustomerDemographic.builder()
                .customerKey(key)
                .birthDate(birthDate)
                .gender(gender)
                .build();
    }

    private List<BronzeCustomerLocation> createLocations() {
        return Arrays.asList(
            location("AW-00011000", "Australia"),
            location("AW-00011001", "US"),
            location("AW-00011002", "DE "),
            location("AW-00011003", " "),
            location("AW-00011004", null),
            location("AW-00011001", "Canada"),
            location("AW-00011005", "USA\r")
        );
    }

    private BronzeCustomerLocation location(String key, String country) {
        return BronzeCustomerLocation.builder()
                .customerKey(key)
                .country(country)
                .build();
    }

    private List<BronzeProductCategory> createCategories() {
        return Arrays.asList(
            category("AC_BR", "Accessories", "Bike Racks", "Yes"),
            category("AC_BS", "Accessories", "Bike Stands", "no"),
            category("BI_MB", "Bikes", "Mountain Bikes", "Y"),
            category("BI_MB", "Bikes", "Mountain Bikes (dup)", "No"),
            category("CO_RF", "Components", "Road Frames\n", "maybe"),
            category(null, "Clothing", "Caps", "No")
        );
    }

    private BronzeProductCategory category(String id, String category, String subcategory, String maintenance) {
        return BronzeProductCategory.builder()
                .categoryId(id)
                .category(category)
                .subcategory(subcategory)
                .maintenance(maintenance)
                .build();
    }
}
