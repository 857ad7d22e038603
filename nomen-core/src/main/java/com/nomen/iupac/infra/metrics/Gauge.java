package com.nomen.iupac.infra.metrics;

/**
 * Last-written value. Thread-safe.
 */
public interface Gauge {
    void set(double value);

    double value();
}
