package com.claude.warehouse.repository.silver;

import com.claude.warehouse.entity.silver.SilverProductInfo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SilverProductInfoRepository extends JpaRepository<SilverProductInfo, Long> {
}
