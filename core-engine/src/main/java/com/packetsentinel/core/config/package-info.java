/**
 * Engine settings and signature rule configuration.
 *
 * <p>
 * {@link com.packetsentinel.core.config.DetectionSettings} holds the tuning
 * parameters resolved from the environment.
 * {@link com.packetsentinel.core.config.SignatureRulesLoader} reads the YAML
 * rule table into a {@link com.packetsentinel.core.config.SignatureRulesConfig}
 * and validates it before anything is built from it.
 * </p>
 *
 * @since 1.0.0
 */
package com.packetsentinel.core.config;
