package com.pnl.domain.service;

import com.pnl.domain.exception.Errors;
import com.pnl.domain.model.OptionContract;
import com.pnl.domain.model.Transaction;
import com.pnl.domain.model.TransactionKind;
import com.pnl.domain.port.AssetMetadataResolver;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Models the passage of an option's expiration date as a ledger event. When an option asset is still open after
 * its expiration date, an {@code OPTION_EXPIRED} transaction for the whole open quantity is appended to its stream.
 */
@Slf4j
public class OptionExpirationSynthesizer {

    private final AssetMetadataResolver assetMetadataResolver;
    private final LedgerFactory ledgerFactory;

    public OptionExpirationSynthesizer(AssetMetadataResolver assetMetadataResolver, LedgerFactory ledgerFactory) {
        this.assetMetadataResolver = assetMetadataResolver;
        this.ledgerFactory = ledgerFactory;
    }

    /**
     * @param assetStream        ordered transactions of a single asset, not empty
     * @param strategyClassifier classifier used for the dry run that measures the open quantity
     * @param today              expirations strictly before this date are applied
     */
    public Outcome synthesize(List<Transaction> assetStream,
                              StrategyClassifier strategyClassifier,
                              LocalDate today,
                              ZoneId zone) {
        Transaction reference = assetStream.get(0);
        if (!reference.isOption()) {
            return Outcome.unchanged(assetStream);
        }

        Optional<OptionContract> contract = assetMetadataResolver.parseOptionSymbol(reference.symbol());
        if (contract.isEmpty()) {
            log.warn("Unparseable option symbol, auto-expiration skipped: symbol={}, assetId={}, errorCode={}",
                    reference.symbol(), reference.assetId(), Errors.OptionSymbol.UNPARSEABLE.code());
            return new Outcome(assetStream, null, "Unparseable option symbol " + reference.symbol());
        }

        if (!contract.get().isExpiredOn(today)) {
            return Outcome.unchanged(assetStream);
        }

        CostBasisLedger dryRun = ledgerFactory.open(reference, strategyClassifier);
        dryRun.applyAll(assetStream);
        BigDecimal openQuantity = dryRun.quantity();
        if (dryRun.openLots().isEmpty()) {
            return Outcome.unchanged(assetStream);
        }

        LocalDate expirationDate = contract.get().expirationDate();
        Transaction expired = reference.toBuilder()
                .id(expirationTransactionId(reference.assetId()))
                .kind(TransactionKind.OPTION_EXPIRED)
                .quantity(openQuantity.abs())
                .price(BigDecimal.ZERO)
                .fees(BigDecimal.ZERO)
                .occurredAt(endOfDay(expirationDate, zone))
                .strategyTag(null)
                .build();

        log.info("Synthesized option expiration: symbol={}, expirationDate={}, openQuantity={}, transactionId={}",
                reference.symbol(), expirationDate, openQuantity, expired.id());

        List<Transaction> extended = new ArrayList<>(assetStream);
        extended.add(expired);
        return new Outcome(List.copyOf(extended), expired, null);
    }

    /**
     * Stable per asset so that repeated passes synthesize the same transaction
     */
    public static UUID expirationTransactionId(UUID assetId) {
        return UUID.nameUUIDFromBytes(("option-expired:" + assetId).getBytes(StandardCharsets.UTF_8));
    }

    private static Instant endOfDay(LocalDate date, ZoneId zone) {
        return date.plusDays(1).atStartOfDay(zone).toInstant().minusMillis(1);
    }

    /**
     * @param transactions the stream to compute, with the synthesized expiration appended when one applies
     * @param warning      configuration problem worth reporting, {@code null} when none
     */
    public record Outcome(List<Transaction> transactions, Transaction synthesized, String warning) {

        static Outcome unchanged(List<Transaction> transactions) {
            return new Outcome(transactions, null, null);
        }

        public Optional<Transaction> synthesizedExpiration() {
            return Optional.ofNullable(synthesized);
        }

        public Optional<String> configurationWarning() {
            return Optional.ofNullable(warning);
        }
    }
}
