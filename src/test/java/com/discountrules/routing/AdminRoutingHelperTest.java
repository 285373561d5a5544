package com.discountrules.routing;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for admin URL building.
 */
class AdminRoutingHelperTest {

    private final AdminRoutingHelper routingHelper = new AdminRoutingHelper("/Admin");

    @Test
    void testBuildsControllerActionPathWithQuery() {
        Map<String, Object> routeValues = new LinkedHashMap<>();
        routeValues.put("discountId", 5);
        routeValues.put("discountRequirementId", 12);

        String url = routingHelper.buildActionUrl("Configure", "DiscountRulesHasOneProduct", routeValues);

        assertEquals("/Admin/DiscountRulesHasOneProduct/Configure?discountId=5&discountRequirementId=12", url);
    }

    @Test
    void testNullRouteValuesAreLeftOut() {
        Map<String, Object> routeValues = new LinkedHashMap<>();
        routeValues.put("discountId", 5);
        routeValues.put("discountRequirementId", null);

        String url = routingHelper.buildActionUrl("Configure", "DiscountRulesHasOneProduct", routeValues);

        assertEquals("/Admin/DiscountRulesHasOneProduct/Configure?discountId=5", url);
    }

    @Test
    void testWithoutRouteValues() {
        String url = routingHelper.buildActionUrl("Configure", "DiscountRulesHasOneProduct", null);

        assertEquals("/Admin/DiscountRulesHasOneProduct/Configure", url);
    }
}
