package com.discountrules.rules.hasoneproduct;

/**
 * Constants of the "customer has one of these products in the cart" rule.
 */
public final class HasOneProductDefaults {

    /**
     * System name discount requirements use to refer to this rule.
     */
    public static final String SYSTEM_NAME = "DiscountRequirement.HasOneProduct";

    /**
     * Setting holding the restricted product list of one requirement.
     */
    public static final String SETTINGS_KEY = "DiscountRequirement.HasOneProduct-%d";

    public static final String CONFIGURE_CONTROLLER = "DiscountRulesHasOneProduct";
    public static final String CONFIGURE_ACTION = "Configure";

    public static final String RESOURCE_PREFIX = "Plugins.DiscountRules.HasOneProduct.";
    public static final String RESOURCE_PRODUCTS = RESOURCE_PREFIX + "Fields.Products";
    public static final String RESOURCE_PRODUCTS_HINT = RESOURCE_PRODUCTS + ".Hint";
    public static final String RESOURCE_PRODUCTS_ADD_NEW = RESOURCE_PRODUCTS + ".AddNew";
    public static final String RESOURCE_PRODUCTS_CHOOSE = RESOURCE_PRODUCTS + ".Choose";

    private HasOneProductDefaults() {
    }

    public static String settingsKey(int discountRequirementId) {
        return String.format(SETTINGS_KEY, discountRequirementId);
    }
}
