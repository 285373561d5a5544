package com.discountrules.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of saving a requirement configuration.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SaveRequirementConfigurationResponse {

    private boolean result;
    private int newRequirementId;
}
