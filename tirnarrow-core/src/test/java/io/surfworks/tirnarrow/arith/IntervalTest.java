package io.surfworks.tirnarrow.arith;

import io.surfworks.tirnarrow.tir.TirAst.DataType;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IntervalTest {

    @Nested
    class Construction {

        @Test
        void rejectsEmptyInterval() {
            assertThrows(IllegalArgumentException.class, () -> Interval.of(3, 2));
        }

        @Test
        void rangeOfSignedType() {
            assertEquals(Interval.of(-128, 127), Interval.rangeOf(DataType.INT8));
        }

        @Test
        void printsInfiniteEndpoints() {
            assertEquals("[-inf, +inf]", Interval.unbounded().toString());
            assertEquals("[0, 15]", Interval.of(0, 15).toString());
        }

        @Test
        void halfOpenIntervalIsUnbounded() {
            assertTrue(Interval.of(0, Interval.POS_INF).isUnbounded());
            assertFalse(Interval.of(0, Interval.POS_INF).isPoint());
        }
    }

    @Nested
    class Fitting {

        @Test
        void int32BoundaryFits() {
            assertTrue(Interval.of(0, Integer.MAX_VALUE).fitsSignedBits(32));
            assertTrue(Interval.of(Integer.MIN_VALUE, 0).fitsSignedBits(32));
        }

        @Test
        void oneAboveInt32DoesNotFit() {
            assertFalse(Interval.of(0, Integer.MAX_VALUE + 1L).fitsSignedBits(32));
        }

        @Test
        void unboundedNeverFits() {
            assertFalse(Interval.unbounded().fitsSignedBits(64));
            assertFalse(Interval.unbounded().fitsIn(DataType.INT64));
        }

        @Test
        void sixteenBitTarget() {
            assertTrue(Interval.of(0, 32767).fitsSignedBits(16));
            assertFalse(Interval.of(0, 32768).fitsSignedBits(16));
        }
    }

    @Nested
    class Arithmetic {

        @Test
        void addition() {
            assertEquals(Interval.of(5, 25), Interval.of(0, 10).add(Interval.of(5, 15)));
        }

        @Test
        void subtraction() {
            assertEquals(Interval.of(-15, 5), Interval.of(0, 10).sub(Interval.of(5, 15)));
        }

        @Test
        void additionSaturatesInsteadOfWrapping() {
            Interval big = Interval.point(Long.MAX_VALUE - 1);
            Interval sum = big.add(Interval.point(5));
            assertTrue(sum.isUnbounded());
            assertTrue(sum.lo() > 0, "saturated sum must not wrap negative: " + sum);
        }

        @Test
        void unboundedIsAbsorbing() {
            assertTrue(Interval.of(0, 10).add(Interval.unbounded()).isUnbounded());
            assertTrue(Interval.of(0, 10).mul(Interval.unbounded()).isUnbounded());
        }

        @Test
        void multiplicationTakesAllCorners() {
            assertEquals(Interval.of(-10, 15), Interval.of(-2, 3).mul(Interval.of(4, 5)));
        }

        @Test
        void nonNegativeProductIsEndpointProduct() {
            assertEquals(Interval.of(0, 65536L * 65535), Interval.of(0, 65535).mul(Interval.point(65536)));
        }

        @Test
        void multiplicationOverflowIsUnbounded() {
            Interval big = Interval.of(0, 1L << 40);
            assertTrue(big.mul(big).isUnbounded());
        }

        @Test
        void minAndMaxAreEndpointWise() {
            Interval a = Interval.of(0, 10);
            Interval b = Interval.of(5, 7);
            assertEquals(Interval.of(0, 7), a.min(b));
            assertEquals(Interval.of(5, 10), a.max(b));
        }

        @Test
        void union() {
            assertEquals(Interval.of(-3, 9), Interval.of(-3, 0).union(Interval.of(4, 9)));
        }
    }

    @Nested
    class DivisionAndModulo {

        @Test
        void floorDivRoundsTowardNegativeInfinity() {
            assertEquals(Interval.of(-4, 4), Interval.of(-7, 9).floorDiv(2));
        }

        @Test
        void truncDivRoundsTowardZero() {
            assertEquals(Interval.of(-3, 4), Interval.of(-7, 9).truncDiv(2));
        }

        @Test
        void floorModKeepsDividendAlreadyInRange() {
            assertEquals(Interval.of(2, 5), Interval.of(2, 5).floorMod(8));
        }

        @Test
        void floorModOtherwiseCoversModulus() {
            assertEquals(Interval.of(0, 7), Interval.of(0, 100).floorMod(8));
            assertEquals(Interval.of(0, 7), Interval.of(-3, 2).floorMod(8));
        }

        @Test
        void truncModFollowsDividendSign() {
            assertEquals(Interval.of(0, 3), Interval.of(0, 100).truncMod(4));
            assertEquals(Interval.of(-3, 0), Interval.of(-10, -1).truncMod(4));
            assertEquals(Interval.of(-3, -1), Interval.of(-3, -1).truncMod(4));
            assertEquals(Interval.of(-3, 3), Interval.of(-10, 10).truncMod(4));
        }

        @Test
        void nonPositiveDivisorIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> Interval.of(0, 10).floorDiv(0));
            assertThrows(IllegalArgumentException.class, () -> Interval.of(0, 10).floorMod(-2));
        }
    }
}
