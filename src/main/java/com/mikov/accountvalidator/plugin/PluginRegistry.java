package com.mikov.accountvalidator.plugin;

import com.mikov.accountvalidator.events.ValidationEventPublisher;
import com.mikov.accountvalidator.model.ValidationResult;
import com.mikov.accountvalidator.model.ValidatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the registered plugins by name and runs their hooks in registration
 * order. A hook that throws is reported as a plugin error event and does not
 * stop the pipeline or the other plugins.
 *
 * @author zahari.mikov
 */
public class PluginRegistry {
    private static final Logger logger = LoggerFactory.getLogger(PluginRegistry.class);

    static final String POST_VALIDATION_HOOK = "post_validation";

    private final Map<String, ValidationPlugin> plugins = new LinkedHashMap<>();
    private final ValidatorConfig config;
    private final ValidationEventPublisher publisher;

    public PluginRegistry(final ValidatorConfig config, final ValidationEventPublisher publisher) {
        this.config = config;
        this.publisher = publisher;
    }

    /**
     * Registers a plugin, replacing any plugin registered under the same name.
     *
     * @throws IllegalArgumentException if the plugin has no name or version
     */
    public void register(final ValidationPlugin plugin) {
        if (isBlank(plugin.getName()) || isBlank(plugin.getVersion())) {
            throw new IllegalArgumentException("Plugin must have name and version");
        }

        synchronized (plugins) {
            plugins.put(plugin.getName(), plugin);
        }
        plugin.onRegister(config);

        logger.info("Registered plugin {} v{}", plugin.getName(), plugin.getVersion());
        publisher.pluginRegistered(plugin.getName(), plugin.getVersion());
    }

    public void runPostValidation(final ValidationResult result) {
        for (final var plugin : getPlugins()) {
            try {
                plugin.onPostValidation(result);
            } catch (final Exception e) {
                logger.error("Plugin {} failed at {}: {}", plugin.getName(), POST_VALIDATION_HOOK, e.getMessage());
                publisher.pluginFailed(plugin.getName(), POST_VALIDATION_HOOK, e);
            }
        }
    }

    public List<ValidationPlugin> getPlugins() {
        synchronized (plugins) {
            return new ArrayList<>(plugins.values());
        }
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }
}
