package com.whereq.augur.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Discovery entry of a registered plugin
 *
 * @author WhereQ Inc.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PluginInfo {
    private String name;

    private String description;
}
