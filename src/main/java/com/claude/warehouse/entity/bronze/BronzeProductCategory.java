package com.claude.warehouse.entity.bronze;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * ERP 제품 카테고리 원천 테이블 (source_erp/PX_CAT_G1V2.csv)
 */
@Entity
@Table(name = "bronze_erp_product_categories")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BronzeProductCategory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "row_id")
    private Long rowId;

    @Column(name = "id", length = 50)
    private String categoryId;

    @Column(name = "cat", length = 100)
    private String category;

    @Column(name = "subcat", length = 100)
    private String subcategory;

    @Column(name = "maintenance", length = 10)
    private String maintenance;
}
