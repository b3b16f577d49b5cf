package com.pnl.domain.exception;

public interface Errors {

    interface Ledger {
        String errorCode = "01";

        Error INVALID_TRANSACTION = new Error(errorCode + "01");
        Error ASSET_MISMATCH = new Error(errorCode + "02");
    }

    interface Reconciliation {
        String errorCode = "02";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error PERSISTENCE_ERROR = new Error(errorCode + "02");
        Error CALCULATION_ERROR = new Error(errorCode + "03");
    }

    interface DailyPL {
        String errorCode = "03";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error PERSISTENCE_ERROR = new Error(errorCode + "02");
        Error NOT_FOUND = new Error(errorCode + "03");
    }

    interface OptionSymbol {
        String errorCode = "04";

        Error UNPARSEABLE = new Error(errorCode + "01");
    }

    interface AggregatedPL {
        String errorCode = "05";

        Error INVALID_INPUT = new Error(errorCode + "01");
        Error ALL_PORTFOLIOS_FAILED = new Error(errorCode + "02");
    }
}
