package com.discountrules.api.controller;

import com.discountrules.api.dto.DiscountRuleResponse;
import com.discountrules.rules.DiscountRequirementRule;
import com.discountrules.rules.DiscountRequirementRuleRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for installing and uninstalling discount requirement rules.
 */
@RestController
@RequestMapping("/api/v1/plugins/discount-rules")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Plugins", description = "Discount rule plugin lifecycle API")
public class PluginController {

    private final DiscountRequirementRuleRegistry ruleRegistry;

    @GetMapping
    @Operation(summary = "List registered discount requirement rules")
    public ResponseEntity<List<DiscountRuleResponse>> getRules() {
        List<DiscountRuleResponse> rules = ruleRegistry.getRules().stream()
            .map(rule -> new DiscountRuleResponse(rule.getSystemName()))
            .collect(Collectors.toList());
        return ResponseEntity.ok(rules);
    }

    @PostMapping("/{systemName}/install")
    @Operation(summary = "Install a discount requirement rule")
    public ResponseEntity<Void> install(@PathVariable String systemName) {
        DiscountRequirementRule rule = ruleRegistry.loadRuleBySystemName(systemName);
        log.info("Installing plugin {}", rule.getSystemName());
        rule.install();
        return ResponseEntity.ok().build();
    }

    @PostMapping("/{systemName}/uninstall")
    @Operation(summary = "Uninstall a discount requirement rule")
    public ResponseEntity<Void> uninstall(@PathVariable String systemName) {
        DiscountRequirementRule rule = ruleRegistry.loadRuleBySystemName(systemName);
        log.info("Uninstalling plugin {}", rule.getSystemName());
        rule.uninstall();
        return ResponseEntity.ok().build();
    }
}
