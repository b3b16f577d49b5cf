package com.pnl.infrastructure.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;

@ConfigMapping(prefix = "app.pnl")
public interface EngineConfig {

    /**
     * Zone used to turn transaction instants into calendar days
     */
    @WithDefault("UTC")
    ZoneId zone();

    Fees fees();

    Daily daily();

    Cache cache();

    Reconciliation reconciliation();

    interface Fees {
        /**
         * Fee charged per option contract when a transaction reports none
         */
        @WithDefault("0.75")
        BigDecimal optionPerContract();
    }

    interface Daily {
        /**
         * Days whose absolute net P&L is within this amount are neutral
         */
        @WithDefault("0.01")
        BigDecimal neutralThreshold();
    }

    interface Cache {
        /**
         * Time a computed monthly summary stays fresh
         */
        @WithDefault("PT5M")
        Duration ttl();
    }

    interface Reconciliation {
        /**
         * What happens to a stored position whose quantity went back to zero
         */
        @WithDefault("DELETE")
        ZeroQuantityPolicy zeroQuantityPolicy();
    }

    enum ZeroQuantityPolicy {
        DELETE,
        DEACTIVATE
    }
}
