package com.claude.warehouse.repository.silver;

import com.claude.warehouse.entity.silver.SilverProductCategory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SilverProductCategoryRepository extends JpaRepository<SilverProductCategory, Long> {
}
