package io.surfworks.tirnarrow.arith;

import io.surfworks.tirnarrow.tir.TirAst.DataType;

/**
 * A closed integer range {@code [lo, hi]} whose endpoints may be infinite.
 *
 * <p>{@link Long#MIN_VALUE} stands for negative infinity and
 * {@link Long#MAX_VALUE} for positive infinity. Arithmetic saturates: an
 * endpoint that would overflow {@code long} becomes infinite, so results
 * only ever grow and never wrap.
 *
 * @param lo lower bound, or {@link #NEG_INF}
 * @param hi upper bound, or {@link #POS_INF}
 */
public record Interval(long lo, long hi) {

    public static final long NEG_INF = Long.MIN_VALUE;
    public static final long POS_INF = Long.MAX_VALUE;

    private static final Interval UNBOUNDED = new Interval(NEG_INF, POS_INF);

    public Interval {
        if (lo > hi) {
            throw new IllegalArgumentException(String.format("Empty interval [%d, %d]", lo, hi));
        }
    }

    public static Interval unbounded() {
        return UNBOUNDED;
    }

    public static Interval point(long value) {
        return new Interval(value, value);
    }

    public static Interval of(long lo, long hi) {
        return new Interval(lo, hi);
    }

    /**
     * The full range of an integral type.
     */
    public static Interval rangeOf(DataType dtype) {
        return new Interval(dtype.minValue(), dtype.maxValue());
    }

    /**
     * True when either endpoint is infinite.
     */
    public boolean isUnbounded() {
        return lo == NEG_INF || hi == POS_INF;
    }

    public boolean isBounded() {
        return !isUnbounded();
    }

    public boolean isPoint() {
        return lo == hi && isBounded();
    }

    public boolean isNonNegative() {
        return lo >= 0;
    }

    /**
     * True when both endpoints are finite and representable in {@code dtype}.
     */
    public boolean fitsIn(DataType dtype) {
        if (isUnbounded()) {
            return false;
        }
        if (dtype.isBool()) {
            return lo >= 0 && hi <= 1;
        }
        return lo >= dtype.minValue() && hi <= dtype.maxValue();
    }

    /**
     * True when both endpoints are finite and fit the signed range of
     * {@code bits} bits.
     */
    public boolean fitsSignedBits(int bits) {
        return fitsIn(DataType.intOf(bits));
    }

    public Interval union(Interval other) {
        return new Interval(Math.min(lo, other.lo), Math.max(hi, other.hi));
    }

    // ==================== Saturating Arithmetic ====================

    public Interval add(Interval other) {
        return new Interval(addLo(lo, other.lo), addHi(hi, other.hi));
    }

    public Interval sub(Interval other) {
        return add(other.negate());
    }

    public Interval negate() {
        long newLo = hi == POS_INF ? NEG_INF : -hi;
        long newHi = lo == NEG_INF ? POS_INF : -lo;
        return new Interval(newLo, newHi);
    }

    /**
     * Product of two intervals. Any infinite endpoint makes the result
     * unbounded; otherwise the four corner products are taken, and an
     * overflowing corner makes the result unbounded.
     */
    public Interval mul(Interval other) {
        if (isUnbounded() || other.isUnbounded()) {
            return UNBOUNDED;
        }
        try {
            long a = Math.multiplyExact(lo, other.lo);
            long b = Math.multiplyExact(lo, other.hi);
            long c = Math.multiplyExact(hi, other.lo);
            long d = Math.multiplyExact(hi, other.hi);
            long newLo = Math.min(Math.min(a, b), Math.min(c, d));
            long newHi = Math.max(Math.max(a, b), Math.max(c, d));
            if (newLo == NEG_INF || newHi == POS_INF) {
                return UNBOUNDED;
            }
            return new Interval(newLo, newHi);
        } catch (ArithmeticException e) {
            return UNBOUNDED;
        }
    }

    public Interval min(Interval other) {
        return new Interval(Math.min(lo, other.lo), Math.min(hi, other.hi));
    }

    public Interval max(Interval other) {
        return new Interval(Math.max(lo, other.lo), Math.max(hi, other.hi));
    }

    /**
     * Floor division by a positive constant.
     */
    public Interval floorDiv(long divisor) {
        requirePositive(divisor);
        long newLo = lo == NEG_INF ? NEG_INF : Math.floorDiv(lo, divisor);
        long newHi = hi == POS_INF ? POS_INF : Math.floorDiv(hi, divisor);
        return new Interval(newLo, newHi);
    }

    /**
     * Truncating division by a positive constant.
     */
    public Interval truncDiv(long divisor) {
        requirePositive(divisor);
        long newLo = lo == NEG_INF ? NEG_INF : lo / divisor;
        long newHi = hi == POS_INF ? POS_INF : hi / divisor;
        return new Interval(newLo, newHi);
    }

    /**
     * Floor modulo by a positive constant: always within {@code [0, m-1]},
     * and unchanged when the dividend already lies in that range.
     */
    public Interval floorMod(long modulus) {
        requirePositive(modulus);
        if (lo >= 0 && hi < modulus) {
            return this;
        }
        return new Interval(0, modulus - 1);
    }

    /**
     * Truncating modulo by a positive constant; takes the dividend's sign.
     */
    public Interval truncMod(long modulus) {
        requirePositive(modulus);
        if (lo >= 0) {
            return hi < modulus ? this : new Interval(0, modulus - 1);
        }
        if (hi <= 0) {
            return lo > -modulus ? this : new Interval(-(modulus - 1), 0);
        }
        return new Interval(-(modulus - 1), modulus - 1);
    }

    private static void requirePositive(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Divisor must be positive, got " + value);
        }
    }

    private static long addLo(long a, long b) {
        if (a == NEG_INF || b == NEG_INF) {
            return NEG_INF;
        }
        long r = a + b;
        // overflow when both operands share a sign the result does not have
        if (((a ^ r) & (b ^ r)) < 0) {
            return a < 0 ? NEG_INF : POS_INF - 1;
        }
        return r == POS_INF ? POS_INF - 1 : r;
    }

    private static long addHi(long a, long b) {
        if (a == POS_INF || b == POS_INF) {
            return POS_INF;
        }
        long r = a + b;
        if (((a ^ r) & (b ^ r)) < 0) {
            return a < 0 ? NEG_INF + 1 : POS_INF;
        }
        return r == NEG_INF ? NEG_INF + 1 : r;
    }

    @Override
    public String toString() {
        String l = lo == NEG_INF ? "-inf" : Long.toString(lo);
        String h = hi == POS_INF ? "+inf" : Long.toString(hi);
        return "[" + l + ", " + h + "]";
    }
}
