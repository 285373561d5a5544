package com.discountrules.rules.hasoneproduct;

import com.discountrules.common.exception.MalformedRestrictedProductException;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Parser for restricted product lists.
 *
 * Three ways of specifying products are supported, comma-separated and freely mixed:
 * <ol>
 *   <li>product identifiers: {@code 77, 123, 156}</li>
 *   <li>{Product ID}:{Quantity}: {@code 77:1, 123:2, 156:3}</li>
 *   <li>{Product ID}:{Min quantity}-{Max quantity}: {@code 77:1-3, 123:2-5, 156:3-8}</li>
 * </ol>
 */
public final class RestrictedProductParser {

    private RestrictedProductParser() {
    }

    /**
     * Split a restricted product list into trimmed, non-empty tokens.
     */
    public static List<String> splitTokens(String restrictedProductIds) {
        if (restrictedProductIds == null) {
            return List.of();
        }
        return Arrays.stream(restrictedProductIds.split(","))
            .map(String::trim)
            .filter(token -> !token.isEmpty())
            .collect(Collectors.toList());
    }

    /**
     * Parse one token.
     *
     * A plain product id that is not a number yields an empty result. Tokens
     * with a quantity part must be fully numeric.
     *
     * @param token a trimmed token
     * @return the restriction, or empty if a plain product id is not a number
     * @throws MalformedRestrictedProductException if a token with a quantity part is not numeric
     */
    public static Optional<RestrictedProduct> parse(String token) {
        if (!token.contains(":")) {
            try {
                return Optional.of(RestrictedProduct.anyQuantity(parseNumber(token)));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }

        // Only the first two parts are read: "77:1:5" is 77 with quantity 1
        String[] parts = token.split(":", -1);
        String quantityPart = parts[1];

        try {
            int productId = parseNumber(parts[0]);

            if (quantityPart.contains("-")) {
                String[] range = quantityPart.split("-", -1);
                return Optional.of(RestrictedProduct.quantityRange(productId,
                    parseNumber(range[0]), parseNumber(range[1])));
            }

            return Optional.of(RestrictedProduct.exactQuantity(productId, parseNumber(quantityPart)));
        } catch (NumberFormatException e) {
            throw new MalformedRestrictedProductException(token, e);
        }
    }

    private static int parseNumber(String value) {
        return Integer.parseInt(value.trim());
    }
}
