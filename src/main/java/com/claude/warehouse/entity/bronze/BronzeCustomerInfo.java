package com.claude.warehouse.entity.bronze;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * CRM 고객 정보 원천 테이블 (source_crm/cust_info.csv)
 */
@Entity
@Table(name = "bronze_crm_cust_info")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BronzeCustomerInfo {

    // 적재 순서를 보존하는 대리키
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "row_id")
    private Long rowId;

    @Column(name = "cst_id")
    private Integer customerId;

    @Column(name = "cst_key", length = 50)
    private String customerKey;

    @Column(name = "cst_firstname", length = 50)
    private String firstName;

    @Column(name = "cst_lastname", length = 50)
    private String lastName;

    @Column(name = "cst_marital_status", length = 50)
    private String maritalStatus;

    @Column(name = "cst_gndr", length = 50)
    private String gender;

    @Column(name = "cst_create_date")
    private LocalDate createDate;
}
