package com.packetsentinel.core.alert;

import com.packetsentinel.core.model.Alert;

/**
 * Receives every newly created alert, for example to push it to
 * dashboards.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface AlertListener {

    void onAlert(Alert alert);
}
