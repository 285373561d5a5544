package com.discountrules.api.controller;

import com.discountrules.api.dto.RequirementConfigurationResponse;
import com.discountrules.api.dto.SaveRequirementConfigurationRequest;
import com.discountrules.api.dto.SaveRequirementConfigurationResponse;
import com.discountrules.rules.hasoneproduct.HasOneProductConfigurationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin API behind the "has one product" rule's configuration screen.
 *
 * Mapped to the path {@code HasOneProductDiscountRequirementRule#getConfigurationUrl} builds.
 */
@RestController
@RequestMapping("${discount-rules.admin.base-path:/Admin}/DiscountRulesHasOneProduct")
@RequiredArgsConstructor
@Tag(name = "Has one product rule", description = "Restricted product list configuration")
public class HasOneProductConfigureController {

    private final HasOneProductConfigurationService configurationService;

    @GetMapping("/Configure")
    @Operation(summary = "Get the restricted product list of a requirement")
    public ResponseEntity<RequirementConfigurationResponse> configure(
            @RequestParam int discountId,
            @RequestParam(required = false) Integer discountRequirementId) {

        String productIds = configurationService.getRestrictedProductIds(discountId, discountRequirementId);
        return ResponseEntity.ok(RequirementConfigurationResponse.builder()
            .discountId(discountId)
            .requirementId(discountRequirementId)
            .productIds(productIds)
            .build());
    }

    @PostMapping("/Configure")
    @Operation(summary = "Save the restricted product list of a requirement")
    public ResponseEntity<SaveRequirementConfigurationResponse> configure(
            @Valid @RequestBody SaveRequirementConfigurationRequest request) {

        int requirementId = configurationService.saveRestrictedProductIds(
            request.getDiscountId(), request.getDiscountRequirementId(), request.getProductIds());
        return ResponseEntity.ok(new SaveRequirementConfigurationResponse(true, requirementId));
    }
}
