package com.riskledger.register.repository;

import com.riskledger.register.domain.Category;
import com.riskledger.register.domain.CategoryScheme;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CategoryRepository extends JpaRepository<Category, UUID> {

    Optional<Category> findBySchemeAndCode(CategoryScheme scheme, String code);

    List<Category> findBySchemeOrderBySortOrderAsc(CategoryScheme scheme);

    long countByScheme(CategoryScheme scheme);
}
