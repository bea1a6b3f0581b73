package com.claude.warehouse.entity.silver;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "silver_erp_cust_location")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilverCustomerLocation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "row_id")
    private Long rowId;

    @Column(name = "cid", length = 50)
    private String customerKey;

    @Column(name = "cntry", length = 100)
    private String country;

    @Column(name = "dwh_date_loaded")
    private LocalDateTime dwhDateLoaded;
}
