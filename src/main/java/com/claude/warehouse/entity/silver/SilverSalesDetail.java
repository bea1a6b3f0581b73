package com.claude.warehouse.entity.silver;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 정제된 CRM 판매 상세 (sls_ord_num + sls_prd_key 당 1건)
 */
@Entity
@Table(name = "silver_crm_sales_details")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilverSalesDetail {

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
    private LocalDate orderDate;

    @Column(name = "sls_ship_dt")
    private LocalDate shipDate;

    @Column(name = "sls_due_dt")
    private LocalDate dueDate;

    @Column(name = "sls_sales", precision = 10, scale = 2)
    private BigDecimal sales;

    @Column(name = "sls_quantity")
    private Integer quantity;

    @Column(name = "sls_price", precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "dwh_date_loaded")
    private LocalDateTime dwhDateLoaded;
}
