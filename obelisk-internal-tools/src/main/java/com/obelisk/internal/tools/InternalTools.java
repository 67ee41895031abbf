package com.obelisk.internal.tools;

import com.obelisk.registry.ToolRegistry;
import com.obelisk.tool.calculator.CalculatorToolProvider;
import com.obelisk.tool.weather.WeatherToolProvider;
import com.obelisk.tools.ToolProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Registers tools with a {@link ToolRegistry}: the built-in providers, which must all register,
 * and community providers found through {@link ServiceLoader}, which are logged and skipped on
 * failure.
 */
public final class InternalTools {

    private static final Logger log = LoggerFactory.getLogger(InternalTools.class);

    private InternalTools() {
    }

    /** Built-in providers, in registration order. */
    public static List<ToolProvider> internalProviders() {
        return List.of(new CalculatorToolProvider(), new WeatherToolProvider());
    }

    /**
     * Registers every enabled built-in provider. A failure here is a startup error and propagates.
     *
     * @return number of tools registered
     */
    public static int registerInternalTools(ToolRegistry registry) {
        int n = 0;
        for (ToolProvider provider : internalProviders()) {
            if (provider.isEnabled()) {
                registry.register(provider.getTool());
                n++;
            }
        }
        log.info("Registered {} internal tool(s)", n);
        return n;
    }

    /**
     * Registers community providers listed in META-INF/services/com.obelisk.tools.ToolProvider on
     * the given class loader. A provider that fails to load, construct or register is skipped.
     *
     * @return number of tools registered
     */
    public static int registerCommunityTools(ToolRegistry registry, ClassLoader classLoader) {
        Iterator<ToolProvider> providers = ServiceLoader.load(ToolProvider.class, classLoader).iterator();
        int n = 0;
        while (true) {
            ToolProvider provider;
            try {
                if (!providers.hasNext()) {
                    break;
                }
                provider = providers.next();
            } catch (ServiceConfigurationError e) {
                log.error("Community tool provider failed to load (skipping): {}", e.getMessage(), e);
                continue;
            }
            if (!provider.isEnabled()) {
                log.info("Community tool {} is disabled", provider.getToolId());
                continue;
            }
            try {
                registry.register(provider.getTool());
                n++;
                log.info("Registered community tool {} (version={})", provider.getToolId(), provider.getVersion());
            } catch (RuntimeException e) {
                log.error("Community tool {} failed to register (skipping): {}", provider.getToolId(), e.getMessage(), e);
            }
        }
        return n;
    }

    /** Built-in tools, then community tools from the context class loader. */
    public static int registerAll(ToolRegistry registry) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) loader = InternalTools.class.getClassLoader();
        return registerInternalTools(registry) + registerCommunityTools(registry, loader);
    }
}
