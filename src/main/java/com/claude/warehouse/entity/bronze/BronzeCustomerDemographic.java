package com.claude.warehouse.entity.bronze;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * ERP 고객 인구통계 원천 테이블 (source_erp/CUST_AZ12.csv)
 */
@Entity
@Table(name = "bronze_erp_cust_demographics")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BronzeCustomerDemographic {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "row_id")
    private Long rowId;

    @Column(name = "cid", length = 50)
    private String customerKey;

    @Column(name = "bdate")
    private LocalDate birthDate;

    @Column(name = "gen", length = 20)
    private String gender;
}
