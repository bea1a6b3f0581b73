package com.claude.warehouse.repository.silver;

import com.claude.warehouse.entity.silver.SilverSalesDetail;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SilverSalesDetailRepository extends JpaRepository<SilverSalesDetail, Long> {
}
