package com.whereq.augur.plugin;

import com.whereq.augur.dto.PluginInfo;
import com.whereq.augur.exception.PluginNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Catalogue of the forecast plugins available in this build
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class PluginRegistry {

    private final Map<String, ForecastPlugin> plugins;

    public PluginRegistry(List<ForecastPlugin> plugins) {
        Map<String, ForecastPlugin> byName = new TreeMap<>();
        for (ForecastPlugin plugin : plugins) {
            ForecastPlugin previous = byName.putIfAbsent(plugin.name(), plugin);
            if (previous != null) {
                throw new IllegalStateException("Duplicate plugin name '" + plugin.name() + "': "
                    + previous.getClass().getName() + " and " + plugin.getClass().getName());
            }
        }
        this.plugins = Collections.unmodifiableMap(byName);
        log.info("Registered {} forecast plugin(s): {}", byName.size(), byName.keySet());
    }

    /**
     * Resolve a plugin by name
     *
     * @throws PluginNotFoundException if no plugin has that name
     */
    public ForecastPlugin resolve(String name) {
        return find(name).orElseThrow(() -> new PluginNotFoundException(name));
    }

    public Optional<ForecastPlugin> find(String name) {
        return Optional.ofNullable(name).map(plugins::get);
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /**
     * List plugins sorted by name
     */
    public List<PluginInfo> list() {
        return plugins.values().stream()
            .map(plugin -> new PluginInfo(plugin.name(), plugin.description()))
            .toList();
    }
}
