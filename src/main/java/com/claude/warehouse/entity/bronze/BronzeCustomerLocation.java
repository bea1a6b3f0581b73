package com.claude.warehouse.entity.bronze;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ERP 고객 위치 원천 테이블 (source_erp/LOC_A101.csv)
 */
@Entity
@Table(name = "bronze_erp_cust_location")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BronzeCustomerLocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "row_id")
    private Long rowId;

    @Column(name = "cid", length = 50)
    private String customerKey;

    @Column(name = "cntry", length = 100)
    private String country;
}
