package domain.model;

/**
 * Thrown when a sensor value falls below the lowest boundary of its {@link BinningScheme}.
 *
 * <p>Extends {@link IllegalArgumentException} because the offending value is an
 * argument to {@link BinningScheme#bin(double)}. It is caught at the discretization
 * boundary and never escapes graph construction.
 */
public final class BinningRangeException extends IllegalArgumentException {

    private final double value;
    private final double lowerBound;

    public BinningRangeException(double value, double lowerBound) {
        super("Value " + value + " is below minimum bin boundary " + lowerBound);
        this.value = value;
        this.lowerBound = lowerBound;
    }

    public double getValue() { return value; }
    public double getLowerBound() { return lowerBound; }
}
