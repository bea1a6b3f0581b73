package com.claude.warehouse.entity.silver;

import com.claude.warehouse.domain.Gender;
import com.claude.warehouse.entity.converter.GenderConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Entity
@Table(name = "silver_erp_cust_demographics")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilverCustomerDemographic {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "row_id")
    private Long rowId;

    @Column(name = "cid", length = 50)
    private String customerKey;

    @Column(name = "bdate")
    private LocalDate birthDate;

    @Convert(converter = GenderConverter.class)
    @Column(name = "gen", length = 20)
    private Gender gender;

    @Column(name = "dwh_date_loaded")
    private LocalDateTime dwhDateLoaded;
}
