package com.pnl.domain.service;

import com.pnl.domain.exception.Errors;
import com.pnl.domain.exception.ServiceException;
import com.pnl.domain.model.AssetClass;
import com.pnl.domain.model.LedgerEntry;
import com.pnl.domain.model.LedgerSnapshot;
import com.pnl.domain.model.Lot;
import com.pnl.domain.model.LotSide;
import com.pnl.domain.model.LotSide.Direction;
import com.pnl.domain.model.OrphanTransaction;
import com.pnl.domain.model.Transaction;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.UUID;

/**
 * FIFO lot matching over the transaction stream of one (portfolio, asset) pair.
 * <p>
 * Transactions are applied in the order given. Data-quality problems such as an equity oversell never throw:
 * the transaction is quarantined as an {@link OrphanTransaction} and the queue is left untouched.
 * Only malformed input raises a {@link ServiceException}.
 * <p>
 * Open lots are always on one side: an option buy closes open short lots before it opens a long lot, and an
 * option sell consumes open long lots before it opens a short lot.
 * <p>
 * Instances are not thread-safe and are meant to live for a single computation pass.
 */
@Slf4j
public class CostBasisLedger {

    private static final int COST_SCALE = 6;

    @Getter
    private final UUID portfolioId;
    @Getter
    private final UUID assetId;
    @Getter
    private final String symbol;
    @Getter
    private final AssetClass assetClass;

    private final FeeCalculator feeCalculator;
    private final StrategyClassifier strategyClassifier;

    // front of the list is the oldest lot
    private final List<LotSide> lots;
    private final List<OrphanTransaction> orphans = new ArrayList<>();
    private BigDecimal realizedPL = BigDecimal.ZERO;

    public CostBasisLedger(UUID portfolioId,
                           UUID assetId,
                           String symbol,
                           AssetClass assetClass,
                           FeeCalculator feeCalculator,
                           StrategyClassifier strategyClassifier,
                           List<LotSide> seed) {
        if (symbol == null || symbol.isBlank()) {
            throw new ServiceException(Errors.Ledger.INVALID_TRANSACTION, "Symbol is required, assetId=" + assetId);
        }
        if (assetClass == null) {
            throw new ServiceException(Errors.Ledger.INVALID_TRANSACTION, "Asset class is required, symbol=" + symbol);
        }
        this.portfolioId = portfolioId;
        this.assetId = assetId;
        this.symbol = symbol;
        this.assetClass = assetClass;
        this.feeCalculator = Objects.requireNonNull(feeCalculator, "feeCalculator");
        this.strategyClassifier = Objects.requireNonNull(strategyClassifier, "strategyClassifier");
        this.lots = seed != null ? new ArrayList<>(seed) : new ArrayList<>();
    }

    public List<LedgerEntry> applyAll(List<Transaction> transactions) {
        List<LedgerEntry> entries = new ArrayList<>(transactions.size());
        for (Transaction transaction : transactions) {
            entries.add(apply(transaction));
        }
        return entries;
    }

    public LedgerEntry apply(Transaction transaction) {
        validate(transaction);
        BigDecimal fees = effectiveFees(transaction);

        LedgerEntry entry = switch (transaction.kind()) {
            case BUY -> applyBuy(transaction, fees);
            case SELL -> applySell(transaction, fees);
            case DIVIDEND -> applyDividend(transaction, fees);
            case OPTION_EXPIRED -> applyExpiration(transaction, fees);
        };

        realizedPL = realizedPL.add(entry.realizedPL());
        if (entry.isOrphan()) {
            orphans.add(entry.orphan());
        }
        return entry;
    }

    public LedgerSnapshot snapshot() {
        BigDecimal quantity = quantity();
        BigDecimal totalCostBasis = switch (quantity.signum()) {
            case 1 -> costBasisOf(Direction.LONG);
            case -1 -> costBasisOf(Direction.SHORT);
            default -> BigDecimal.ZERO;
        };
        BigDecimal averageCost = quantity.signum() != 0
                ? totalCostBasis.divide(quantity.abs(), COST_SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        return new LedgerSnapshot(
                List.copyOf(lots),
                quantity,
                realizedPL,
                totalCostBasis,
                averageCost,
                List.copyOf(orphans)
        );
    }

    /**
     * Signed open quantity: long lots minus short lots
     */
    public BigDecimal quantity() {
        return lots.stream()
                .map(LotSide::signedQuantity)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public List<LotSide> openLots() {
        return List.copyOf(lots);
    }

    private LedgerEntry applyBuy(Transaction transaction, BigDecimal fees) {
        BigDecimal shortQuantity = openQuantity(Direction.SHORT);

        if (transaction.isOption() && shortQuantity.signum() > 0) {
            return applyBuyToClose(transaction, fees, shortQuantity);
        }

        lots.add(new LotSide.Long(new Lot(transaction.quantity(), transaction.price(), transaction.id())));
        return new LedgerEntry(transaction, BigDecimal.ZERO, BigDecimal.ZERO, fees, null);
    }

    // the premium was recognized when the option was sold, so the whole buyback payment is a loss
    private LedgerEntry applyBuyToClose(Transaction transaction, BigDecimal fees, BigDecimal shortQuantity) {
        BigDecimal covered = transaction.quantity().min(shortQuantity);
        takeFifo(Direction.SHORT, covered);

        BigDecimal remainder = transaction.quantity().subtract(covered);
        if (remainder.signum() > 0) {
            lots.add(new LotSide.Long(new Lot(remainder, transaction.price(), transaction.id())));
        }

        BigDecimal payment = covered.multiply(transaction.price()).add(fees);
        log.debug("Short option bought back: symbol={}, quantity={}, payment={}, coveredCall={}, transactionId={}",
                symbol, covered, payment, strategyClassifier.isCoveredCallBuyback(transaction), transaction.id());
        return new LedgerEntry(transaction, payment.negate(), fees, fees, null);
    }

    private LedgerEntry applySell(Transaction transaction, BigDecimal fees) {
        BigDecimal available = openQuantity(Direction.LONG);
        BigDecimal requested = transaction.quantity();

        if (available.compareTo(requested) >= 0) {
            BigDecimal profit = realizeAgainstLongLots(requested, transaction.price());
            return new LedgerEntry(transaction, profit, BigDecimal.ZERO, fees, null);
        }

        if (transaction.isOption()) {
            return applySellToOpen(transaction, fees, available);
        }

        log.warn("Oversell quarantined: symbol={}, requested={}, available={}, transactionId={}, date={}",
                symbol, requested, available, transaction.id(), transaction.occurredAt());
        return orphan(transaction, available, "Sell quantity exceeds open long quantity");
    }

    // premium received is recognized immediately, the short lot only tracks the open exposure
    private LedgerEntry applySellToOpen(Transaction transaction, BigDecimal fees, BigDecimal available) {
        BigDecimal profit = available.signum() > 0
                ? realizeAgainstLongLots(available, transaction.price())
                : BigDecimal.ZERO;

        BigDecimal openedShort = transaction.quantity().subtract(available);
        lots.add(new LotSide.Short(new Lot(openedShort, transaction.price(), transaction.id())));

        BigDecimal premium = openedShort.multiply(transaction.price()).subtract(fees);
        log.debug("Option sold to open: symbol={}, quantity={}, premium={}, transactionId={}",
                symbol, openedShort, premium, transaction.id());
        return new LedgerEntry(transaction, profit.add(premium), fees, fees, null);
    }

    private LedgerEntry applyDividend(Transaction transaction, BigDecimal fees) {
        BigDecimal income = transaction.grossAmount().subtract(fees);
        return new LedgerEntry(transaction, income, fees, fees, null);
    }

    private LedgerEntry applyExpiration(Transaction transaction, BigDecimal fees) {
        if (!transaction.isOption()) {
            log.warn("Expiration recorded for a non-option asset: symbol={}, assetClass={}, transactionId={}, date={}",
                    symbol, assetClass, transaction.id(), transaction.occurredAt());
            return orphan(transaction, quantity(), "Expiration recorded for a non-option asset");
        }

        if (lots.isEmpty()) {
            log.warn("Nothing to expire: symbol={}, requested={}, transactionId={}, date={}",
                    symbol, transaction.quantity(), transaction.id(), transaction.occurredAt());
            return orphan(transaction, BigDecimal.ZERO, "No open contracts to expire");
        }

        Direction side = lots.get(0).direction();
        return switch (side) {
            case LONG -> {
                BigDecimal expiredCost = takeFifo(Direction.LONG, transaction.quantity()).stream()
                        .map(Lot::costBasis)
                        .reduce(BigDecimal.ZERO, BigDecimal::add);
                log.info("Long option expired worthless: symbol={}, loss={}, transactionId={}, date={}",
                        symbol, expiredCost, transaction.id(), transaction.occurredAt());
                yield new LedgerEntry(transaction, expiredCost.negate(), BigDecimal.ZERO, fees, null);
            }
            case SHORT -> {
                takeFifo(Direction.SHORT, transaction.quantity());
                log.info("Short option expired, premium kept: symbol={}, transactionId={}, date={}",
                        symbol, transaction.id(), transaction.occurredAt());
                yield new LedgerEntry(transaction, BigDecimal.ZERO, BigDecimal.ZERO, fees, null);
            }
        };
    }

    private BigDecimal realizeAgainstLongLots(BigDecimal quantity, BigDecimal price) {
        return takeFifo(Direction.LONG, quantity).stream()
                .map(slice -> price.subtract(slice.unitCost()).multiply(slice.remainingQuantity()))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Removes up to {@code quantity} from the oldest lots of one side and returns the matched slices
     */
    private List<Lot> takeFifo(Direction side, BigDecimal quantity) {
        List<Lot> matched = new ArrayList<>();
        BigDecimal remaining = quantity;
        ListIterator<LotSide> iterator = lots.listIterator();

        while (remaining.signum() > 0 && iterator.hasNext()) {
            LotSide open = iterator.next();
            if (open.direction() != side) {
                continue;
            }

            Lot lot = open.lot();
            BigDecimal take = remaining.min(lot.remainingQuantity());
            matched.add(new Lot(take, lot.unitCost(), lot.originatingTransactionId()));

            if (take.compareTo(lot.remainingQuantity()) == 0) {
                iterator.remove();
            } else {
                iterator.set(open.withLot(lot.reduceBy(take)));
            }
            remaining = remaining.subtract(take);
        }
        return matched;
    }

    private BigDecimal openQuantity(Direction side) {
        return lots.stream()
                .filter(open -> open.direction() == side)
                .map(open -> open.lot().remainingQuantity())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private BigDecimal costBasisOf(Direction side) {
        return lots.stream()
                .filter(open -> open.direction() == side)
                .map(open -> open.lot().costBasis())
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private LedgerEntry orphan(Transaction transaction, BigDecimal available, String reason) {
        OrphanTransaction orphan = OrphanTransaction.of(transaction, available, reason);
        return new LedgerEntry(transaction, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, orphan);
    }

    private BigDecimal effectiveFees(Transaction transaction) {
        return transaction.fees() != null
                ? transaction.fees()
                : feeCalculator.feeFor(transaction.assetClass(), transaction.quantity());
    }

    private void validate(Transaction transaction) {
        if (transaction == null) {
            throw new ServiceException(Errors.Ledger.INVALID_TRANSACTION, "Transaction cannot be null");
        }
        if (transaction.id() == null || transaction.kind() == null || transaction.occurredAt() == null) {
            throw new ServiceException(Errors.Ledger.INVALID_TRANSACTION,
                    "Transaction id, kind and date are required, symbol=" + transaction.symbol());
        }
        if (transaction.symbol() == null || transaction.symbol().isBlank() || transaction.assetClass() == null) {
            throw new ServiceException(Errors.Ledger.INVALID_TRANSACTION,
                    "Symbol and asset class are required, transactionId=" + transaction.id());
        }
        if (transaction.quantity() == null || transaction.quantity().signum() <= 0) {
            throw new ServiceException(Errors.Ledger.INVALID_TRANSACTION,
                    "Quantity must be positive, transactionId=" + transaction.id());
        }
        if (transaction.price() == null || transaction.price().signum() < 0) {
            throw new ServiceException(Errors.Ledger.INVALID_TRANSACTION,
                    "Price cannot be negative, transactionId=" + transaction.id());
        }
        if (!Objects.equals(transaction.assetId(), assetId) || !Objects.equals(transaction.portfolioId(), portfolioId)) {
            throw new ServiceException(Errors.Ledger.ASSET_MISMATCH,
                    "Transaction " + transaction.id() + " does not belong to ledger of " + symbol);
        }
    }
}
