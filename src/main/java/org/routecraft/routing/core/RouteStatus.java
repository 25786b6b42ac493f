package org.routecraft.routing.core;

/**
 * Outcome category of a name-based route request.
 */
public enum RouteStatus {
    FOUND,
    NO_ROUTE,
    MISSING_INPUT,
    ORIGIN_NOT_FOUND,
    DESTINATION_NOT_FOUND
}
