package com.riskledger.register.controller;

import com.riskledger.common.api.ApiResponse;
import com.riskledger.register.domain.CategoryScheme;
import com.riskledger.register.dto.CategoryResponse;
import com.riskledger.register.service.CategoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/categories")
@RequiredArgsConstructor
@Tag(name = "Categories", description = "Category lists used to resolve record categories")
public class CategoryController {

    private final CategoryService categoryService;

    @GetMapping
    @Operation(summary = "List categories of a scheme")
    public ResponseEntity<ApiResponse<List<CategoryResponse>>> list(@RequestParam(defaultValue = "risk") String scheme) {
        List<CategoryResponse> categories = categoryService.list(CategoryScheme.fromCode(scheme)).stream()
            .map(CategoryResponse::from)
            .toList();
        return ResponseEntity.ok(ApiResponse.success(categories));
    }
}
