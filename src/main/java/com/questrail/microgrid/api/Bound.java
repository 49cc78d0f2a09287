package com.questrail.microgrid.api;

/**
 * Bound
 * -----------------------------------------------------------------------------
 * Closed inclusion interval {@code [lower, upper]} for one metric.
 *
 * <p>A point interval ({@code lower == upper}) is legal. Construction rejects
 * non-finite endpoints and inverted intervals with
 * {@link ControlErrorCode#INVALID_ARGUMENT}.</p>
 */
public record Bound(double lower, double upper)
{
    public Bound {
        if (!Double.isFinite(lower) || !Double.isFinite(upper)) {
            throw ControlException.invalidArgument(
                    "bound endpoints must be finite: [" + lower + ", " + upper + "]");
        }
        if (lower > upper) {
            throw ControlException.invalidArgument(
                    "bound lower must be <= upper: [" + lower + ", " + upper + "]");
        }
    }

    public static Bound of(double lower, double upper) {
        return new Bound(lower, upper);
    }

    public boolean contains(double value) {
        return lower <= value && value <= upper;
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + "]";
    }
}
