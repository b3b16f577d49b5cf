package com.pnl.domain.model;

import java.math.BigDecimal;

/**
 * Direction of an open lot. Long lots were bought, short lots were sold to open (options only).
 * A ledger never holds lots of both directions at once.
 */
public sealed interface LotSide {

    Lot lot();

    Direction direction();

    LotSide withLot(Lot lot);

    /**
     * Contribution to the signed position quantity
     */
    default BigDecimal signedQuantity() {
        return switch (direction()) {
            case LONG -> lot().remainingQuantity();
            case SHORT -> lot().remainingQuantity().negate();
        };
    }

    enum Direction {
        LONG,
        SHORT
    }

    record Long(Lot lot) implements LotSide {
        @Override
        public Direction direction() {
            return Direction.LONG;
        }

        @Override
        public LotSide withLot(Lot lot) {
            return new Long(lot);
        }
    }

    record Short(Lot lot) implements LotSide {
        @Override
        public Direction direction() {
            return Direction.SHORT;
        }

        @Override
        public LotSide withLot(Lot lot) {
            return new Short(lot);
        }
    }
}
