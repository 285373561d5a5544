package com.discountrules.routing;

import java.util.Map;

/**
 * Builds URLs for controller actions.
 */
public interface RoutingHelper {

    /**
     * Build the path of a controller action.
     *
     * @param action      the action name
     * @param controller  the controller name
     * @param routeValues query values; null values are left out
     * @return the path, starting with a slash
     */
    String buildActionUrl(String action, String controller, Map<String, ?> routeValues);
}
