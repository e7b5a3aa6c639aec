package com.mikov.accountvalidator.plugin;

import com.mikov.accountvalidator.events.ValidationEventPublisher;
import com.mikov.accountvalidator.events.ValidationListener;
import com.mikov.accountvalidator.model.ValidationResult;
import com.mikov.accountvalidator.model.ValidatorConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PluginRegistryTest {

    private final List<String> events = new ArrayList<>();
    private final ValidatorConfig config = ValidatorConfig.getDefault();
    private PluginRegistry registry;

    @BeforeEach
    void setUp() {
        final var publisher = new ValidationEventPublisher(List.of(new ValidationListener() {
            @Override
            public void onPluginRegistered(final String name, final String version) {
                events.add("registered:" + name + "@" + version);
            }

            @Override
            public void onPluginError(final String plugin, final String hook, final Throwable error) {
                events.add("error:" + plugin + ":" + hook + ":" + error.getMessage());
            }
        }));
        registry = new PluginRegistry(config, publisher);
    }

    @Test
    @DisplayName("Should register a plugin and hand it the config")
    void shouldRegisterPlugin() {
        final var plugin = plugin("audit", "1.0.0");

        registry.register(plugin);

        verify(plugin).onRegister(config);
        assertThat(registry.getPlugins()).containsExactly(plugin);
        assertThat(events).containsExactly("registered:audit@1.0.0");
    }

    @Test
    @DisplayName("Should reject a plugin without name or version")
    void shouldRejectIncompletePlugin() {
        assertThatThrownBy(() -> registry.register(plugin(null, "1.0.0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Plugin must have name and version");
        assertThatThrownBy(() -> registry.register(plugin("audit", " ")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(registry.getPlugins()).isEmpty();
    }

    @Test
    @DisplayName("Should replace a plugin registered under the same name")
    void shouldReplaceSameName() {
        registry.register(plugin("audit", "1.0.0"));
        final var replacement = plugin("audit", "2.0.0");

        registry.register(replacement);

        assertThat(registry.getPlugins()).containsExactly(replacement);
    }

    @Test
    @DisplayName("Should run every plugin even when one fails")
    void shouldIsolateFailingPlugin() {
        final var calls = new ArrayList<String>();
        registry.register(new TestPlugin("first", () -> {
            throw new IllegalStateException("boom");
        }));
        registry.register(new TestPlugin("second", () -> calls.add("second")));

        registry.runPostValidation(ValidationResult.create("1", "1@s.whatsapp.net", 0));

        assertThat(calls).containsExactly("second");
        assertThat(events).contains("error:first:post_validation:boom");
    }

    private static ValidationPlugin plugin(final String name, final String version) {
        final var plugin = mock(ValidationPlugin.class);
        when(plugin.getName()).thenReturn(name);
        when(plugin.getVersion()).thenReturn(version);
        return plugin;
    }

    private static final class TestPlugin implements ValidationPlugin {
        private final String name;
        private final Runnable hook;

        private TestPlugin(final String name, final Runnable hook) {
            this.name = name;
            this.hook = hook;
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String getVersion() {
            return "1.0.0";
        }

        @Override
        public void onPostValidation(final ValidationResult result) {
            hook.run();
        }
    }
}
