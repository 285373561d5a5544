package com.discountrules.api.controller;

import com.discountrules.api.dto.CheckRequirementRequest;
import com.discountrules.api.dto.CheckRequirementResponse;
import com.discountrules.rules.DiscountRequirementRuleRegistry;
import com.discountrules.rules.DiscountRequirementValidationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for checking discount requirements.
 */
@RestController
@RequestMapping("/api/v1/discount-requirements")
@RequiredArgsConstructor
@Tag(name = "Discount requirements", description = "Discount requirement check API")
public class DiscountRequirementController {

    private final DiscountRequirementRuleRegistry ruleRegistry;

    @PostMapping("/{discountRequirementId}/check")
    @Operation(summary = "Check a discount requirement against a customer's cart")
    public ResponseEntity<CheckRequirementResponse> checkRequirement(
            @PathVariable int discountRequirementId,
            @Valid @RequestBody CheckRequirementRequest request) {

        DiscountRequirementValidationResult result = ruleRegistry.checkRequirement(
            discountRequirementId, request.getCustomerId(), request.getStoreId());
        return ResponseEntity.ok(new CheckRequirementResponse(discountRequirementId, result.isValid()));
    }

    @GetMapping("/configuration-url")
    @Operation(summary = "Get the admin configuration URL of a rule")
    public ResponseEntity<String> getConfigurationUrl(
            @RequestParam String systemName,
            @RequestParam int discountId,
            @RequestParam(required = false) Integer discountRequirementId) {

        String url = ruleRegistry.loadRuleBySystemName(systemName)
            .getConfigurationUrl(discountId, discountRequirementId);
        return ResponseEntity.ok(url);
    }
}
