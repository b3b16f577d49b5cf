package com.pnl.infrastructure.metadata;

import com.pnl.domain.model.OptionContract;
import com.pnl.domain.model.OptionType;
import com.pnl.domain.port.AssetMetadataResolver;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * OCC style option symbols: underlying, {@code YYMMDD} expiration, {@code C}/{@code P}, strike in thousandths
 * over 8 digits. Padding spaces between the underlying and the date are ignored.
 */
@Slf4j
@ApplicationScoped
public class OccOptionSymbolResolver implements AssetMetadataResolver {

    private static final Pattern OPTION_SYMBOL = Pattern.compile("^([A-Z]{1,6})(\\d{2})(\\d{2})(\\d{2})([CP])(\\d{8})$");
    private static final int CENTURY = 2000;
    private static final int STRIKE_DECIMALS = 3;

    @Override
    public Optional<OptionContract> parseOptionSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }

        Matcher matcher = OPTION_SYMBOL.matcher(symbol.replace(" ", "").toUpperCase());
        if (!matcher.matches()) {
            return Optional.empty();
        }

        try {
            LocalDate expiration = LocalDate.of(
                    CENTURY + Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)),
                    Integer.parseInt(matcher.group(4)));
            OptionType type = "C".equals(matcher.group(5)) ? OptionType.CALL : OptionType.PUT;
            BigDecimal strike = new BigDecimal(matcher.group(6)).movePointLeft(STRIKE_DECIMALS);

            return Optional.of(new OptionContract(matcher.group(1), expiration, type, strike));
        } catch (DateTimeException e) {
            log.debug("Option symbol has an invalid expiration date: symbol={}", symbol, e);
            return Optional.empty();
        }
    }
}
