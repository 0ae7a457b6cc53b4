package org.carball.pooltune.monitor;

import org.carball.pooltune.model.query.PerformanceReport;
import org.carball.pooltune.model.query.QueryAlert;
import org.carball.pooltune.model.query.QueryRecord;
import org.carball.pooltune.model.query.QueryStats;
import org.carball.pooltune.model.query.SlowQueryRecord;

/**
 * Receives query monitor events. Callbacks run on the recording thread, or on
 * the monitor's scheduler thread for periodic reports, and should return quickly.
 */
public interface QueryMonitorListener {

    default void onQueryRecorded(QueryRecord record, QueryStats stats) {
    }

    default void onSlowQuery(SlowQueryRecord slowQuery) {
    }

    default void onAlert(QueryAlert alert) {
    }

    default void onPerformanceReport(PerformanceReport report) {
    }
}
