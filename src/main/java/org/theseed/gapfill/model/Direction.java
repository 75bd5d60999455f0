/**
 *
 */
package org.theseed.gapfill.model;

/**
 * This enumeration represents the direction in which a reaction carries flux.  Each
 * direction is controlled by one bound:  the upper bound for forward flux and the lower
 * bound for reverse flux.
 */
public enum Direction {
    /** flux from reactants to products */
    FORWARD(">") {
        @Override
        public double getBound(ModelReaction reaction) {
            return reaction.getUpperBound();
        }

        @Override
        public double getOpposingBound(ModelReaction reaction) {
            return reaction.getLowerBound();
        }

        @Override
        public boolean isForcing(double opposingBound) {
            return opposingBound > 0.0;
        }
    },
    /** flux from products to reactants */
    REVERSE("<") {
        @Override
        public double getBound(ModelReaction reaction) {
            return reaction.getLowerBound();
        }

        @Override
        public double getOpposingBound(ModelReaction reaction) {
            return reaction.getUpperBound();
        }

        @Override
        public boolean isForcing(double opposingBound) {
            return opposingBound < 0.0;
        }
    };

    /** symbol used in solutions and reports */
    private final String symbol;

    private Direction(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the bound that enables flux in this direction
     *
     * @param reaction	reaction of interest
     */
    public abstract double getBound(ModelReaction reaction);

    /**
     * @return the bound that limits flux in the other direction
     *
     * @param reaction	reaction of interest
     */
    public abstract double getOpposingBound(ModelReaction reaction);

    /**
     * @return TRUE if the specified opposing bound forces flux in this direction
     *
     * @param opposingBound		value of the opposing bound
     */
    public abstract boolean isForcing(double opposingBound);

    /**
     * @return the symbol for this direction (">" or "<")
     */
    public String getSymbol() {
        return this.symbol;
    }

    /**
     * @return the opposite direction
     */
    public Direction reverse() {
        return (this == FORWARD ? REVERSE : FORWARD);
    }

    /**
     * @return the direction for the specified symbol
     *
     * @param symbol	direction symbol (">" or "<")
     *
     * @throws IllegalArgumentException		if the symbol is not valid
     */
    public static Direction parse(String symbol) {
        Direction retVal;
        switch (symbol) {
        case ">" :
            retVal = FORWARD;
            break;
        case "<" :
            retVal = REVERSE;
            break;
        default :
            throw new IllegalArgumentException("Invalid direction symbol \"" + symbol + "\".");
        }
        return retVal;
    }

    @Override
    public String toString() {
        return this.symbol;
    }

}
