package com.discountrules.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A registered discount requirement rule.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DiscountRuleResponse {

    private String systemName;
}
