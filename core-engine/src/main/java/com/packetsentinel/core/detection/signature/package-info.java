/**
 * Signature detection layer.
 *
 * <p>
 * Rules are built by
 * {@link com.packetsentinel.core.detection.signature.SignatureRuleFactory}
 * from YAML definitions. Built-in rule types:
 * </p>
 * <ul>
 * <li>{@link com.packetsentinel.core.detection.signature.PatternRule} - regex
 * on payload, URI or User-Agent</li>
 * <li>{@link com.packetsentinel.core.detection.signature.PortScanRule} -
 * distinct destination ports per source</li>
 * <li>{@link com.packetsentinel.core.detection.signature.PacketBurstRule} -
 * packets per source</li>
 * <li>{@link com.packetsentinel.core.detection.signature.ExfiltrationRule} -
 * bytes per source</li>
 * <li>{@link com.packetsentinel.core.detection.signature.BruteForceRule} -
 * failed logins per source</li>
 * </ul>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new rule type, implement {@code SignatureRule} (or extend
 * {@code AggregateRule}) and register the type string in
 * {@code SignatureRuleFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.detection.signature;
