package com.riskledger.register.service;

import com.riskledger.register.config.RegisterProperties;
import com.riskledger.register.domain.Category;
import com.riskledger.register.domain.CategoryScheme;
import com.riskledger.register.repository.CategoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Seeds the configured category lists into empty schemes at startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultCategoryInitializer implements ApplicationRunner {

    private final CategoryRepository categoryRepository;
    private final RegisterProperties properties;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        if (!Boolean.TRUE.equals(properties.getCategories().getSeedDefaults())) {
            return;
        }
        seed(CategoryScheme.RISK, properties.getCategories().getRisk());
        seed(CategoryScheme.OPPORTUNITY, properties.getCategories().getOpportunity());
    }

    private void seed(CategoryScheme scheme, List<RegisterProperties.CategoryDefinition> definitions) {
        if (definitions.isEmpty() || categoryRepository.countByScheme(scheme) > 0) {
            return;
        }
        for (int i = 0; i < definitions.size(); i++) {
            RegisterProperties.CategoryDefinition definition = definitions.get(i);
            categoryRepository.save(Category.builder()
                .scheme(scheme)
                .code(definition.getCode())
                .label(definition.getLabel())
                .sortOrder(i)
                .build());
        }
        log.info("Seeded {} {} categories", definitions.size(), scheme.getCode());
    }
}
