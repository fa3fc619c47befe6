package com.myscrollr.delivery.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * @param knownTables   tables the routing table must cover exactly
 * @param webhookSecret bearer secret expected on the CDC webhook; blank disables the check
 */
@ConfigurationProperties(prefix = "app.routing")
public record RoutingProperties(List<String> knownTables, String webhookSecret) {

    public RoutingProperties {
        knownTables = knownTables == null ? List.of() : List.copyOf(knownTables);
    }

    public boolean webhookAuthEnabled() {
        return webhookSecret != null && !webhookSecret.isBlank();
    }
}
