package com.claude.warehouse.entity.bronze;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * CRM 제품 정보 원천 테이블 (source_crm/prd_info.csv)
 *
 * prd_id 는 버전 단위 키, prd_key 는 같은 제품의 버전들을 묶는 그룹 키
 */
@Entity
@Table(name = "bronze_crm_prd_info")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BronzeProductInfo {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "row_id")
    private Long rowId;

    @Column(name = "prd_id")
    private Integer productId;

    @Column(name = "prd_key", length = 50)
    private String productKey;

    @Column(name = "prd_nm")
    private String productName;

    @Column(name = "prd_cost", precision = 10, scale = 2)
    private BigDecimal cost;

    @Column(name = "prd_line", length = 50)
    private String productLine;

    @Column(name = "prd_start_dt")
    private LocalDate startDate;

    @Column(name = "prd_end_dt")
    private LocalDate endDate;
}
