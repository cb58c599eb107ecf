package com.riskledger.register.service;

import com.riskledger.register.domain.Category;
import com.riskledger.register.domain.CategoryScheme;
import com.riskledger.register.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Resolves category codes against the managed category lists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CategoryService {

    private final CategoryRepository categoryRepository;

    /**
     * Code of the matching category, or null for a blank or unknown code.
     */
    public String resolve(CategoryScheme scheme, String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return categoryRepository.findBySchemeAndCode(scheme, code.trim())
            .map(Category::getCode)
            .orElseGet(() -> {
                log.debug("Unknown {} category '{}'", scheme.getCode(), code);
                return null;
            });
    }

    /**
     * Category after an update: blank clears it, an unknown code keeps {@code current}.
     */
    public String resolveForUpdate(CategoryScheme scheme, String requested, String current) {
        if (requested == null || requested.isBlank()) {
            return null;
        }
        String resolved = resolve(scheme, requested);
        return resolved != null ? resolved : current;
    }

    public List<Category> list(CategoryScheme scheme) {
        return categoryRepository.findBySchemeOrderBySortOrderAsc(scheme);
    }
}
