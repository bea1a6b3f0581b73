package com.claude.warehouse.entity.silver;

import com.claude.warehouse.domain.Gender;
import com.claude.warehouse.domain.MaritalStatus;
import com.claude.warehouse.entity.converter.GenderConverter;
import com.claude.warehouse.entity.converter.MaritalStatusConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 정제된 CRM 고객 정보 (cst_id 당 1건)
 */
@Entity
@Table(name = "silver_crm_cust_info")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilverCustomerInfo {

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

    @Convert(converter = MaritalStatusConverter.class)
    @Column(name = "cst_marital_status", length = 50)
    private MaritalStatus maritalStatus;

    @Convert(converter = GenderConverter.class)
    @Column(name = "cst_gndr", length = 50)
    private Gender gender;

    @Column(name = "cst_create_date")
    private LocalDate createDate;

    // 데이터 계보 추적용 감사 컬럼
    @Column(name = "dwh_date_loaded")
    private LocalDateTime dwhDateLoaded;
}
