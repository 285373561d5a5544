package com.discountrules.localization;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A localized UI string.
 */
@Entity
@Table(name = "locale_string_resources", uniqueConstraints = {
    @UniqueConstraint(name = "uk_resource_culture_name", columnNames = {"language_culture", "resource_name"})
})
@Data
@NoArgsConstructor
public class LocaleStringResource {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "language_culture", nullable = false)
    private String languageCulture;

    @Column(name = "resource_name", nullable = false)
    private String resourceName;

    @Column(name = "resource_value", length = 4000)
    private String resourceValue;

    public LocaleStringResource(String languageCulture, String resourceName, String resourceValue) {
        this.languageCulture = languageCulture;
        this.resourceName = resourceName;
        this.resourceValue = resourceValue;
    }
}
