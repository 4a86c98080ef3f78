/**
 * Host application: Kafka in, Kafka out, a health endpoint and the
 * {@code main} entry point around the detection pipeline.
 *
 * @since 1.0.0
 */
package com.packetsentinel.app;
