package com.pnl.domain.port;

import com.pnl.domain.model.OptionContract;

import java.util.Optional;

public interface AssetMetadataResolver {

    /**
     * Parses {@code SYMBOL + YYMMDD + C|P + 8-digit strike}. Empty when the symbol does not follow the format.
     */
    Optional<OptionContract> parseOptionSymbol(String symbol);
}
