package com.alertrouter.model;

import com.alertrouter.model.enums.DropReason;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 一次接入的结果: 入队数及每种原因的丢弃数
 */
public final class IngestReport {

    private int received;

    private int enqueued;

    private int unmatched;

    private final EnumMap<DropReason, Integer> dropped = new EnumMap<>(DropReason.class);

    public void received() { received++; }

    public void enqueued() { enqueued++; }

    public void unmatched() { unmatched++; }

    public void dropped(DropReason reason) {
        dropped.merge(reason, 1, Integer::sum);
    }

    public int getReceived() { return received; }

    public int getEnqueued() { return enqueued; }

    public int getUnmatched() { return unmatched; }

    public int getDropped(DropReason reason) {
        return dropped.getOrDefault(reason, 0);
    }

    public Map<DropReason, Integer> getDropped() {
        return Collections.unmodifiableMap(dropped);
    }

    @Override
    public String toString() {
        return "IngestReport{received=" + received + ", enqueued=" + enqueued
                + ", unmatched=" + unmatched + ", dropped=" + dropped + '}';
    }
}
