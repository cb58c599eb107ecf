package com.riskledger.register.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "register")
public class RegisterProperties {

    private RetentionProperties retention = new RetentionProperties();
    private VersioningProperties versioning = new VersioningProperties();
    private CategoryProperties categories = new CategoryProperties();

    @Data
    public static class RetentionProperties {
        /**
         * Delete versions and audit entries together with their record.
         */
        private Boolean purgeOnDelete = false;
    }

    @Data
    public static class VersioningProperties {
        /**
         * Create version 1 on read for records that have none.
         */
        private Boolean backfillOnRead = true;
    }

    @Data
    public static class CategoryProperties {
        private Boolean seedDefaults = true;
        private List<CategoryDefinition> risk = new ArrayList<>();
        private List<CategoryDefinition> opportunity = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryDefinition {
        private String code;
        private String label;
    }
}
