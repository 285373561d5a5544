package com.discountrules.settings;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A named, plain-text setting value.
 */
@Entity
@Table(name = "settings", uniqueConstraints = {
    @UniqueConstraint(name = "uk_setting_name_store", columnNames = {"name", "store_id"})
})
@Data
@NoArgsConstructor
public class Setting {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(nullable = false)
    private String name;

    @Column(name = "setting_value", length = 4000)
    private String value;

    /**
     * Store the value applies to; 0 means all stores.
     */
    @Column(name = "store_id", nullable = false)
    private int storeId;

    public Setting(String name, String value, int storeId) {
        this.name = name;
        this.value = value;
        this.storeId = storeId;
    }
}
