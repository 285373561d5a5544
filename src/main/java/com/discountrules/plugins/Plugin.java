package com.discountrules.plugins;

/**
 * Lifecycle hooks of an installable plugin.
 */
public interface Plugin {

    /**
     * Register whatever the plugin needs (resources, defaults).
     */
    void install();

    /**
     * Remove everything the plugin registered or created.
     */
    void uninstall();
}
