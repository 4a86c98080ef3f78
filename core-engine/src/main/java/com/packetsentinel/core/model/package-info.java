/**
 * Domain model for the packet detection engine.
 *
 * <p>
 * {@link com.packetsentinel.core.model.PacketRecord} is the unit of input,
 * {@link com.packetsentinel.core.model.FeatureVector} the numeric view every
 * ML detector consumes, {@link com.packetsentinel.core.model.Detection} the
 * output of a single detector and {@link com.packetsentinel.core.model.Alert}
 * the deduplicated, persisted form of a detection.
 * {@link com.packetsentinel.core.model.TrafficStatsSnapshot} carries the
 * periodic traffic aggregate.
 * </p>
 *
 * <p>
 * Values are immutable except for the occurrence counters of an alert and
 * the per-source login record, which are only mutated under a lock.
 * </p>
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.model;
