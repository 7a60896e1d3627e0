package com.finopti.support;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Clock that returns scripted readings in order, then repeats the last one.
 */
public class SteppingClock extends Clock {

    private final Deque<Long> readings = new ArrayDeque<>();
    private long last;

    public SteppingClock(long... millis) {
        for (long m : millis) {
            readings.add(m);
        }
    }

    @Override
    public synchronized long millis() {
        Long next = readings.poll();
        if (next != null) {
            last = next;
        }
        return last;
    }

    @Override
    public Instant instant() {
        return Instant.ofEpochMilli(millis());
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return this;
    }
}
