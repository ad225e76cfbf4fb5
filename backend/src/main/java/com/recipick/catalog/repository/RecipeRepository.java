package com.recipick.catalog.repository;

import com.recipick.catalog.entity.RecipeEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RecipeRepository extends JpaRepository<RecipeEntity, Long> {

    List<RecipeEntity> findAllByOrderByIdAsc();
}
