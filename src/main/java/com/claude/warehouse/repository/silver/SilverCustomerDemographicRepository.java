package com.claude.warehouse.repository.silver;

import com.claude.warehouse.entity.silver.SilverCustomerDemographic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SilverCustomerDemographicRepository extends JpaRepository<SilverCustomerDemographic, Long> {
}
