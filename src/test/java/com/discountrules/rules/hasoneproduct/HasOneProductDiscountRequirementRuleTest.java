package com.discountrules.rules.hasoneproduct;

import com.discountrules.customers.Customer;
import com.discountrules.customers.ShoppingCartItem;
import com.discountrules.customers.ShoppingCartType;
import com.discountrules.discounts.DiscountRequirement;
import com.discountrules.discounts.DiscountService;
import com.discountrules.localization.LocalizationService;
import com.discountrules.routing.RoutingHelper;
import com.discountrules.rules.DiscountRequirementValidationRequest;
import com.discountrules.rules.DiscountRequirementValidationResult;
import com.discountrules.settings.SettingService;
import com.discountrules.stores.Store;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the "has one product" rule with its collaborators mocked.
 */
@ExtendWith(MockitoExtension.class)
class HasOneProductDiscountRequirementRuleTest {

    private static final int REQUIREMENT_ID = 42;
    private static final int STORE_ID = 1;

    @Mock
    private SettingService settingService;

    @Mock
    private DiscountService discountService;

    @Mock
    private LocalizationService localizationService;

    @Mock
    private RoutingHelper routingHelper;

    @Captor
    private ArgumentCaptor<Map<String, ?>> routeValues;

    private HasOneProductDiscountRequirementRule rule;
    private Store store;

    @BeforeEach
    void setUp() {
        rule = new HasOneProductDiscountRequirementRule(
            settingService, discountService, localizationService, routingHelper, false);

        store = new Store("Main store");
        store.setId(STORE_ID);
    }

    @Test
    void testNullRequestIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> rule.checkRequirement(null));
        verifyNoInteractions(settingService);
    }

    @Test
    void testNoRestrictedProductsIsValid() {
        for (String config : new String[] {"", "   ", "\t"}) {
            givenRestrictedProducts(config);
            assertTrue(check(null).isValid(), "config '" + config + "'");
        }
    }

    @Test
    void testMissingSettingIsValid() {
        when(settingService.getSettingByKey(HasOneProductDefaults.settingsKey(REQUIREMENT_ID)))
            .thenReturn(Optional.empty());

        assertTrue(check(customerWithCart()).isValid());
    }

    @Test
    void testMissingCustomerIsInvalid() {
        givenRestrictedProducts("77");

        assertFalse(check(null).isValid());
    }

    @Test
    void testOnlySeparatorsIsInvalid() {
        givenRestrictedProducts(" , ,");

        assertFalse(check(customerWithCart(item(77, 2))).isValid());
    }

    @Test
    void testPlainProductIdMatchesAnyQuantity() {
        givenRestrictedProducts("77");

        assertTrue(check(customerWithCart(item(77, 2))).isValid());
    }

    @Test
    void testPlainProductIdNotInCart() {
        givenRestrictedProducts("77");

        assertFalse(check(customerWithCart(item(78, 2))).isValid());
    }

    @Test
    void testExactQuantity() {
        givenRestrictedProducts("123:2");
        assertTrue(check(customerWithCart(item(123, 2))).isValid());

        givenRestrictedProducts("123:3");
        assertFalse(check(customerWithCart(item(123, 2))).isValid());
    }

    @Test
    void testQuantityRange() {
        givenRestrictedProducts("156:3-8");
        assertTrue(check(customerWithCart(item(156, 5))).isValid());

        givenRestrictedProducts("156:9-10");
        assertFalse(check(customerWithCart(item(156, 5))).isValid());
    }

    @Test
    void testAnyEntryOfTheListIsEnough() {
        givenRestrictedProducts("77, 123:2, 156:3-8");

        assertTrue(check(customerWithCart(item(156, 4))).isValid());
    }

    @Test
    void testMalformedQuantityFailsWholeCheck() {
        givenRestrictedProducts("77:abc");
        assertFalse(check(customerWithCart(item(77, 1))).isValid());

        // Later entries are not looked at either
        givenRestrictedProducts("77:abc,123");
        assertFalse(check(customerWithCart(item(123, 1))).isValid());

        givenRestrictedProducts("77:1-x,123");
        assertFalse(check(customerWithCart(item(123, 1))).isValid());
    }

    @Test
    void testMalformedEntryAfterMatchIsNotReached() {
        givenRestrictedProducts("123,77:abc");

        assertTrue(check(customerWithCart(item(123, 1))).isValid());
    }

    @Test
    void testMalformedPlainProductIdIsSkipped() {
        givenRestrictedProducts("abc");
        assertFalse(check(customerWithCart(item(77, 1))).isValid());

        givenRestrictedProducts("abc, 77");
        assertTrue(check(customerWithCart(item(77, 1))).isValid());
    }

    @Test
    void testQuantitiesAreSummedBeforeComparison() {
        givenRestrictedProducts("10:3");

        assertTrue(check(customerWithCart(item(10, 1), item(10, 2))).isValid());
    }

    @Test
    void testReversedRangeNeverMatches() {
        givenRestrictedProducts("10:8-3");

        assertFalse(check(customerWithCart(item(10, 5))).isValid());
    }

    @Test
    void testWishlistAndOtherStoreItemsAreIgnored() {
        givenRestrictedProducts("77");

        Customer customer = customerWithCart(
            new ShoppingCartItem(STORE_ID, 77, 1, ShoppingCartType.WISHLIST),
            new ShoppingCartItem(STORE_ID + 1, 77, 1, ShoppingCartType.SHOPPING_CART));

        assertFalse(check(customer).isValid());
    }

    @Test
    void testCartsSharedBetweenStoresCountEveryStore() {
        rule = new HasOneProductDiscountRequirementRule(
            settingService, discountService, localizationService, routingHelper, true);
        givenRestrictedProducts("77:2");

        Customer customer = customerWithCart(
            item(77, 1),
            new ShoppingCartItem(STORE_ID + 1, 77, 1, ShoppingCartType.SHOPPING_CART));

        assertTrue(check(customer).isValid());
    }

    @Test
    void testConfigurationUrlHasNoLeadingSlash() {
        when(routingHelper.buildActionUrl(eq("Configure"), eq("DiscountRulesHasOneProduct"), any()))
            .thenReturn("/Admin/DiscountRulesHasOneProduct/Configure?discountId=5");

        assertEquals("Admin/DiscountRulesHasOneProduct/Configure?discountId=5",
            rule.getConfigurationUrl(5, null));
    }

    @Test
    void testConfigurationUrlPassesDiscountAndRequirement() {
        when(routingHelper.buildActionUrl(anyString(), anyString(), any())).thenReturn("url");

        rule.getConfigurationUrl(5, 12);

        verify(routingHelper).buildActionUrl(eq("Configure"), eq("DiscountRulesHasOneProduct"),
            routeValues.capture());
        assertEquals(5, routeValues.getValue().get("discountId"));
        assertEquals(12, routeValues.getValue().get("discountRequirementId"));
    }

    @Test
    void testInstallRegistersFourResources() {
        rule.install();

        verify(localizationService).addOrUpdatePluginLocaleResource(
            HasOneProductDefaults.RESOURCE_PRODUCTS, "Restricted products [and quantity range]");
        verify(localizationService).addOrUpdatePluginLocaleResource(
            eq(HasOneProductDefaults.RESOURCE_PRODUCTS_HINT), anyString());
        verify(localizationService).addOrUpdatePluginLocaleResource(
            HasOneProductDefaults.RESOURCE_PRODUCTS_ADD_NEW, "Add product");
        verify(localizationService).addOrUpdatePluginLocaleResource(
            HasOneProductDefaults.RESOURCE_PRODUCTS_CHOOSE, "Choose");
        verifyNoMoreInteractions(localizationService);
    }

    @Test
    void testUninstallRemovesOwnRequirementsAndResources() {
        DiscountRequirement own = new DiscountRequirement(1, HasOneProductDefaults.SYSTEM_NAME);
        DiscountRequirement other = new DiscountRequirement(1, "DiscountRequirement.Other");
        when(discountService.getAllDiscountRequirements()).thenReturn(List.of(own, other));

        rule.uninstall();

        verify(discountService).deleteDiscountRequirement(own);
        verify(discountService, never()).deleteDiscountRequirement(other);
        verify(localizationService).deletePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS);
        verify(localizationService).deletePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS_HINT);
        verify(localizationService).deletePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS_ADD_NEW);
        verify(localizationService).deletePluginLocaleResource(HasOneProductDefaults.RESOURCE_PRODUCTS_CHOOSE);
    }

    private void givenRestrictedProducts(String restrictedProductIds) {
        when(settingService.getSettingByKey(HasOneProductDefaults.settingsKey(REQUIREMENT_ID)))
            .thenReturn(Optional.of(restrictedProductIds));
    }

    private DiscountRequirementValidationResult check(Customer customer) {
        return rule.checkRequirement(DiscountRequirementValidationRequest.builder()
            .discountRequirementId(REQUIREMENT_ID)
            .customer(customer)
            .store(store)
            .build());
    }

    private static ShoppingCartItem item(int productId, int quantity) {
        return new ShoppingCartItem(STORE_ID, productId, quantity, ShoppingCartType.SHOPPING_CART);
    }

    private static Customer customerWithCart(ShoppingCartItem... items) {
        Customer customer = new Customer("customer@example.com");
        for (ShoppingCartItem item : items) {
            customer.addShoppingCartItem(item);
        }
        return customer;
    }
}
