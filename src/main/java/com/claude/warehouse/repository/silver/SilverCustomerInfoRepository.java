package com.claude.warehouse.repository.silver;

import com.claude.warehouse.entity.silver.SilverCustomerInfo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface SilverCustomerInfoRepository extends JpaRepository<SilverCustomerInfo, Long> {

    @Query("SELECT COUNT(DISTINCT c.customerId) FROM SilverCustomerInfo c")
    long countDistinctCustomers();

    // 저장된 라벨 문자열 기준으로 표준 어휘 준수 여부 확인
    @Query(value = "SELECT COUNT(*) FROM silver_crm_cust_info " +
                   "WHERE cst_marital_status IN ('Single', 'Married', 'Unknown')", nativeQuery = true)
    long countStandardizedMaritalStatus();

    @Query(value = "SELECT COUNT(*) FROM silver_crm_cust_info " +
                   "WHERE cst_gndr IN ('Male', 'Female', 'Unknown')", nativeQuery = true)
    long countStandardizedGender();
}
