package com.claude.warehouse.entity.silver;

import com.claude.warehouse.domain.MaintenanceFlag;
import com.claude.warehouse.entity.converter.MaintenanceFlagConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "silver_erp_product_categories")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilverProductCategory {

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

    @Convert(converter = MaintenanceFlagConverter.class)
    @Column(name = "maintenance", length = 10)
    private MaintenanceFlag maintenance;

    @Column(name = "dwh_date_loaded")
    private LocalDateTime dwhDateLoaded;
}
