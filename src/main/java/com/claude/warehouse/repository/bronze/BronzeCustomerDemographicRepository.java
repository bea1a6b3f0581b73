package com.claude.warehouse.repository.bronze;

import com.claude.warehouse.entity.bronze.BronzeCustomerDemographic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BronzeCustomerDemographicRepository extends JpaRepository<BronzeCustomerDemographic, Long> {

    // 적재 순서(row_id) 유지 - 동률 시 먼저 들어온 레코드가 생존
    List<BronzeCustomerDemographic> findAllByOrderByRowIdAsc();
}
