package com.claude.warehouse.entity.bronze;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * CRM 판매 상세 원천 테이블 (source_crm/sales_details.csv)
 *
 * 날짜 컬럼은 원천 그대로 YYYYMMDD 정수로 저장된다.
 */
@Entity
@Table(name = "bronze_crm_sales_details")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BronzeSalesDetail {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "row_id")
    private Long rowId;

    @Column(name = "sls_ord_num", length = 50)
    private String orderNumber;

    @Column(name = "sls_prd_key", length = 50)
    private String productKey;

    @Column(name = "sls_cust_id")
    private Integer customerId;

    @Column(name = "sls_order_dt")
    private Integer orderDate;

    @Column(name = "sls_ship_dt")
    private Integer shipDate;

    @Column(name = "sls_due_dt")
    private Integer dueDate;

    @Column(name = "sls_sales", precision = 10, scale = 2)
    private BigDecimal sales;

    @Column(name = "sls_quantity")
    private Integer quantity;

    @Column(name = "sls_price", precision = 10, scale = 2)
    private BigDecimal price;
}
