package org.carball.pooltune.pool;

import org.carball.pooltune.config.PoolConfiguration;

/**
 * Notified after a new pool configuration has been committed.
 */
@FunctionalInterface
public interface PoolConfigurationListener {

    void onConfigurationChanged(PoolConfiguration previous, PoolConfiguration current);
}
