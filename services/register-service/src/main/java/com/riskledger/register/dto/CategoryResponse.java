package com.riskledger.register.dto;

import com.riskledger.register.domain.Category;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CategoryResponse {

    private String code;
    private String label;

    public static CategoryResponse from(Category category) {
        return new CategoryResponse(category.getCode(), category.getLabel());
    }
}
