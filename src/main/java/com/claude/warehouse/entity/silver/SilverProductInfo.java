package com.claude.warehouse.entity.silver;

import com.claude.warehouse.domain.ProductLine;
import com.claude.warehouse.entity.converter.ProductLineConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 정제된 CRM 제품 정보 (prd_id 버전 당 1건, prd_key 별 유효기간 연속)
 */
@Entity
@Table(name = "silver_crm_prd_info")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilverProductInfo {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "row_id")
    private Long rowId;

    @Column(name = "prd_id")
    private Integer productId;

    @Column(name = "prd_key", length = 50)
    private String productKey;

    // prd_key 앞 5자리에서 추출한 카테고리 ID
    @Column(name = "cat_id", length = 50)
    private String categoryId;

    @Column(name = "prd_key_clean", length = 50)
    private String productKeyClean;

    @Column(name = "prd_nm")
    private String productName;

    @Column(name = "prd_cost", precision = 10, scale = 2)
    private BigDecimal cost;

    @Convert(converter = ProductLineConverter.class)
    @Column(name = "prd_line", length = 50)
    private ProductLine productLine;

    @Column(name = "prd_start_dt")
    private LocalDate startDate;

    @Column(name = "prd_end_dt")
    private LocalDate endDate;

    @Column(name = "dwh_date_loaded")
    private LocalDateTime dwhDateLoaded;
}
