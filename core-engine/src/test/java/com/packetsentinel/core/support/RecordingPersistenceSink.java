package com.packetsentinel.core.support;

import com.packetsentinel.core.alert.PersistenceSink;
import com.packetsentinel.core.model.Alert;
import com.packetsentinel.core.model.TrafficStatsSnapshot;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory persistence sink that can be told to fail the next writes.
 */
public class RecordingPersistenceSink implements PersistenceSink {

    private final List<Alert> alerts = new CopyOnWriteArrayList<>();
    private final List<TrafficStatsSnapshot> snapshots = new CopyOnWriteArrayList<>();
    private final AtomicInteger failuresLeft = new AtomicInteger();

    public void failNext(int count) {
        failuresLeft.set(count);
    }

    @Override
    public void persistAlert(Alert alert) {
        maybeFail();
        alerts.add(alert);
    }

    @Override
    public void persistSnapshot(TrafficStatsSnapshot snapshot) {
        maybeFail();
        snapshots.add(snapshot);
    }

    public List<Alert> alerts() {
        return alerts;
    }

    public List<TrafficStatsSnapshot> snapshots() {
        return snapshots;
    }

    private void maybeFail() {
        if (failuresLeft.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("store unavailable");
        }
    }
}
