package com.whereq.augur.controller;

import com.whereq.augur.dto.PluginListResponse;
import com.whereq.augur.plugin.PluginRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Lists the registered analysis plugins.
 *
 * @author WhereQ Inc.
 */
@RestController
@RequestMapping("${augur.api.prefix:/api/intelligence}/plugins")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Plugins", description = "Registered analysis plugins")
public class PluginController {

    private final PluginRegistry pluginRegistry;

    @GetMapping
    @Operation(summary = "List plugins", description = "Names and descriptions of all registered plugins")
    public Mono<PluginListResponse> listPlugins() {
        log.debug("Listing registered plugins");
        return Mono.fromSupplier(() -> new PluginListResponse(pluginRegistry.list()));
    }
}
