package org.drinkmap.node.processes.http.api.health.dto;

/**
 * @param state   Lifecycle state of the driver
 * @param healthy Probe result, or null if the driver has no instance to probe
 */
public record DriverHealthDto(String state, Boolean healthy) {
}
