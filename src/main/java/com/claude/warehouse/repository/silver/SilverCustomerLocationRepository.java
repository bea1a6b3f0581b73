package com.claude.warehouse.repository.silver;

import com.claude.warehouse.entity.silver.SilverCustomerLocation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SilverCustomerLocationRepository extends JpaRepository<SilverCustomerLocation, Long> {
}
