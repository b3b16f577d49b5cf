package com.pnl.domain.service;

import com.pnl.domain.model.OptionContract;
import com.pnl.domain.model.OptionType;
import com.pnl.domain.model.Transaction;
import com.pnl.domain.port.AssetMetadataResolver;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Trusts an explicit strategy tag. Untagged call buybacks count as covered calls when the underlying was held,
 * in at least the option's share quantity, at the end of the buyback day.
 */
@Slf4j
public class UnderlyingOwnershipClassifier implements StrategyClassifier {

    private final Map<String, List<Transaction>> underlyingHistory;
    private final AssetMetadataResolver assetMetadataResolver;
    private final ZoneId zone;

    public UnderlyingOwnershipClassifier(List<Transaction> portfolioHistory,
                                         AssetMetadataResolver assetMetadataResolver,
                                         ZoneId zone) {
        this.underlyingHistory = portfolioHistory.stream()
                .filter(transaction -> transaction.assetClass() != null && !transaction.isOption())
                .filter(transaction -> transaction.symbol() != null)
                .collect(Collectors.groupingBy(transaction -> transaction.symbol().toUpperCase()));
        this.assetMetadataResolver = assetMetadataResolver;
        this.zone = zone;
    }

    @Override
    public boolean isCoveredCallBuyback(Transaction buy) {
        if (buy.hasStrategyTag()) {
            return TAGGED_ONLY.isCoveredCallBuyback(buy);
        }

        Optional<OptionContract> contract = assetMetadataResolver.parseOptionSymbol(buy.symbol());
        if (contract.isEmpty() || contract.get().optionType() != OptionType.CALL) {
            return false;
        }

        LocalDate day = buy.occurredAt().atZone(zone).toLocalDate();
        BigDecimal sharesOwned = sharesOwnedAtEndOf(contract.get().underlying(), day);
        boolean covered = sharesOwned.compareTo(buy.quantity()) >= 0;

        log.debug("Classified untagged option buy: symbol={}, underlying={}, date={}, sharesOwned={}, coveredCall={}",
                buy.symbol(), contract.get().underlying(), day, sharesOwned, covered);
        return covered;
    }

    private BigDecimal sharesOwnedAtEndOf(String underlying, LocalDate day) {
        return underlyingHistory.getOrDefault(underlying.toUpperCase(), List.of()).stream()
                .filter(transaction -> !transaction.occurredAt().atZone(zone).toLocalDate().isAfter(day))
                .map(transaction -> switch (transaction.kind()) {
                    case BUY -> transaction.quantity();
                    case SELL -> transaction.quantity().negate();
                    case DIVIDEND, OPTION_EXPIRED -> BigDecimal.ZERO;
                })
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
