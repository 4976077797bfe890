package com.koni.mobility.application.port;

/**
 * Port for the derived view holding the latest measurement of every datastream.
 */
public interface LatestMeasurementsView {

    /**
     * Rebuilds the view from the measurement store without blocking readers.
     */
    void refresh();
}
