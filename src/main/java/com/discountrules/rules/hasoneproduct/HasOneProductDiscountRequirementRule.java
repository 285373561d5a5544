package com.discountrules.rules.hasoneproduct;

import com.discountrules.common.exception.MalformedRestrictedProductException;
import com.discountrules.discounts.DiscountRequirement;
import com.discountrules.discounts.DiscountService;
import com.discountrules.localization.LocalizationService;
import com.discountrules.routing.RoutingHelper;
import com.discountrules.rules.DiscountRequirementRule;
import com.discountrules.rules.DiscountRequirementValidationRequest;
import com.discountrules.rules.DiscountRequirementValidationResult;
import com.discountrules.settings.SettingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Rule that requires the customer's cart to contain at least one of the
 * restricted products, optionally in an exact quantity or quantity range.
 *
 * The restricted product list is stored per requirement as a setting, e.g.
 * {@code "77, 123:2, 156:3-8"}: product 77 in any quantity, or exactly two of
 * product 123, or three to eight of product 156. An empty list places no
 * restriction at all.
 *
 * A malformed plain product id is skipped, but a malformed quantity or range
 * fails the whole check.
 */
@Component
@Slf4j
public class HasOneProductDiscountRequirementRule implements DiscountRequirementRule {

    private final SettingService settingService;
    private final DiscountService discountService;
    private final LocalizationService localizationService;
    private final RoutingHelper routingHelper;
    private final boolean cartsSharedBetweenStores;

    public HasOneProductDiscountRequirementRule(
            SettingService settingService,
            DiscountService discountService,
            LocalizationService localizationService,
            RoutingHelper routingHelper,
            @Value("${discount-rules.shopping-cart.carts-shared-between-stores:false}") boolean cartsSharedBetweenStores) {
        this.settingService = settingService;
        this.discountService = discountService;
        this.localizationService = localizationService;
        this.routingHelper = routingHelper;
        this.cartsSharedBetweenStores = cartsSharedBetweenStores;
    }

    @Override
    public DiscountRequirementValidationResult checkRequirement(DiscountRequirementValidationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Discount requirement validation request is required");
        }

        String restrictedProductIds = settingService
            .getSettingByKey(HasOneProductDefaults.settingsKey(request.getDiscountRequirementId()))
            .orElse(null);
        if (restrictedProductIds == null || restrictedProductIds.isBlank()) {
            // Nothing restricted
            return DiscountRequirementValidationResult.valid();
        }

        if (request.getCustomer() == null) {
            return DiscountRequirementValidationResult.invalid();
        }

        List<String> restrictedProducts = RestrictedProductParser.splitTokens(restrictedProductIds);
        if (restrictedProducts.isEmpty()) {
            return DiscountRequirementValidationResult.invalid();
        }

        List<CartLine> cart = CartLine.groupByProduct(
            request.getCustomer().getShoppingCartItems(), cartStoreId(request));

        try {
            for (String token : restrictedProducts) {
                Optional<RestrictedProduct> restrictedProduct = RestrictedProductParser.parse(token);
                if (restrictedProduct.isEmpty()) {
                    log.debug("Skipping restricted product '{}' of requirement {}: not a product id",
                        token, request.getDiscountRequirementId());
                    continue;
                }

                if (cart.stream().anyMatch(restrictedProduct.get()::matches)) {
                    log.debug("Requirement {} met by '{}'", request.getDiscountRequirementId(), token);
                    return DiscountRequirementValidationResult.valid();
                }
            }
        } catch (MalformedRestrictedProductException e) {
            log.debug("Requirement {} failed: {}", request.getDiscountRequirementId(), e.getMessage());
            return DiscountRequirementValidationResult.invalid();
        }

        return DiscountRequirementValidationResult.invalid();
    }

    private Integer cartStoreId(DiscountRequirementValidationRequest request) {
        if (cartsSharedBetweenStores) {
            return null;
        }
        if (request.getStore() == null) {
            throw new IllegalArgumentException("Store is required to check the cart");
        }
        return request.getStore().getId();
    }

    @Override
    public String getConfigurationUrl(int discountId, Integer discountRequirementId) {
        Map<String, Object> routeValues = new LinkedHashMap<>();
        routeValues.put("discountId", discountId);
        routeValues.put("discountRequirementId", discountRequirementId);

        String url = routingHelper.buildActionUrl(HasOneProductDefaults.CONFIGURE_ACTION,
            HasOneProductDefaults.CONFIGURE_CONTROLLER, routeValues);
        return url.startsWith("/") ? url.substring(1) : url;
    }

    @Override
    public String getSystemName() {
        return HasOneProductDefaults.SYSTEM_NAME;
    }

    @Override
    @Transactional
    public void install() {
        localizationService.addOrUpdatePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS,
            "Restricted products [and quantity range]");
        localizationService.addOrUpdatePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS_HINT,
            "The comma-separated list of product identifiers (e.g. 77, 123, 156). "
                + "You can find a product ID on its details page. "
                + "You can also specify the comma-separated list of product identifiers with quantities "
                + "({Product ID}:{Quantity}. for example, 77:1, 123:2, 156:3). "
                + "And you can also specify the comma-separated list of product identifiers with quantity range "
                + "({Product ID}:{Min quantity}-{Max quantity}. for example, 77:1-3, 123:2-5, 156:3-8).");
        localizationService.addOrUpdatePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS_ADD_NEW,
            "Add product");
        localizationService.addOrUpdatePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS_CHOOSE,
            "Choose");

        log.info("Installed discount requirement rule {}", getSystemName());
    }

    @Override
    @Transactional
    public void uninstall() {
        List<DiscountRequirement> requirements = discountService.getAllDiscountRequirements().stream()
            .filter(requirement -> getSystemName().equals(requirement.getDiscountRequirementRuleSystemName()))
            .collect(Collectors.toList());
        requirements.forEach(discountService::deleteDiscountRequirement);

        localizationService.deletePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS);
        localizationService.deletePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS_HINT);
        localizationService.deletePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS_ADD_NEW);
        localizationService.deletePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS_CHOOSE);

        log.info("Uninstalled discount requirement rule {}; removed {} requirement(s)",
            getSystemName(), requirements.size());
    }
}
