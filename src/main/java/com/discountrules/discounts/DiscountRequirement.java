package com.discountrules.discounts;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A requirement attached to a discount.
 *
 * The rule system name selects which discount requirement rule evaluates it;
 * the rule keeps its own configuration keyed by this requirement's id.
 */
@Entity
@Table(name = "discount_requirements", indexes = {
    @Index(name = "idx_requirement_discount_id", columnList = "discount_id"),
    @Index(name = "idx_requirement_rule_system_name", columnList = "rule_system_name")
})
@Data
@NoArgsConstructor
public class DiscountRequirement {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "discount_id", nullable = false)
    private int discountId;

    @Column(name = "rule_system_name", nullable = false)
    private String discountRequirementRuleSystemName;

    public DiscountRequirement(int discountId, String discountRequirementRuleSystemName) {
        this.discountId = discountId;
        this.discountRequirementRuleSystemName = discountRequirementRuleSystemName;
    }
}
