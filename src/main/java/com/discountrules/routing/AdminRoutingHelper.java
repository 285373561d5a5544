package com.discountrules.routing;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Routing helper for the admin area: {base-path}/{controller}/{action}?key=value.
 */
@Component
public class AdminRoutingHelper implements RoutingHelper {

    private final String basePath;

    public AdminRoutingHelper(@Value("${discount-rules.admin.base-path:/Admin}") String basePath) {
        this.basePath = basePath;
    }

    @Override
    public String buildActionUrl(String action, String controller, Map<String, ?> routeValues) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromPath(basePath)
            .pathSegment(controller, action);

        if (routeValues != null) {
            routeValues.forEach((name, value) -> {
                if (value != null) {
                    builder.queryParam(name, value);
                }
            });
        }

        return builder.encode().build().toUriString();
    }
}
