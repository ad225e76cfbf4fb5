package com.recipick.catalog.repository;

import com.recipick.catalog.entity.MaterialMappingEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MaterialMappingRepository extends JpaRepository<MaterialMappingEntity, Long> {

    List<MaterialMappingEntity> findAllByOrderByIdAsc();

    boolean existsByReceiptItem(String receiptItem);
}
