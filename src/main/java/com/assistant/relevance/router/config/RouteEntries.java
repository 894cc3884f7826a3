package com.assistant.relevance.router.config;

import com.assistant.relevance.router.Route;
import com.assistant.relevance.router.RouteName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Conversions between {@link Route} and its persisted form.
 */
final class RouteEntries {
    private static final Logger log = LoggerFactory.getLogger(RouteEntries.class);

    private RouteEntries() {
        // Utility class
    }

    static RouteEntry toEntry(Route route) {
        return new RouteEntry(
                route.name().getId(),
                route.threshold(),
                route.utterances(),
                route.negativeUtterances(),
                route.alphaOverride());
    }

    static List<RouteEntry> toEntries(List<Route> routes) {
        return routes.stream().map(RouteEntries::toEntry).toList();
    }

    /**
     * Converts persisted entries, dropping unknown names, duplicates and routes without utterances.
     *
     * @throws RouterConfigException when a known route lacks its threshold
     */
    static List<Route> toRoutes(List<RouteEntry> entries) {
        List<Route> routes = new ArrayList<>();
        Set<RouteName> seen = EnumSet.noneOf(RouteName.class);
        for (RouteEntry entry : entries) {
            if (entry == null) {
                continue;
            }
            Optional<RouteName> name = RouteName.fromId(entry.name());
            if (name.isEmpty()) {
                log.debug("router.config.route.dropped name={} reason=unknown", entry.name());
                continue;
            }
            if (!seen.add(name.get())) {
                log.debug("router.config.route.dropped name={} reason=duplicate", entry.name());
                continue;
            }
            if (entry.threshold() == null) {
                throw new RouterConfigException("Route '" + entry.name() + "' has no threshold");
            }
            Route route = new Route(name.get(), entry.utterances(), entry.negativeUtterances(),
                    entry.threshold(), entry.alpha());
            if (!route.hasUtterances()) {
                log.debug("router.config.route.dropped name={} reason=no-utterances", entry.name());
                continue;
            }
            routes.add(route);
        }
        return routes;
    }
}
