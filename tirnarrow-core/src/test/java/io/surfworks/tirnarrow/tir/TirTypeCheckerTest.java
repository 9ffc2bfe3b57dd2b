package io.surfworks.tirnarrow.tir;

import io.surfworks.tirnarrow.tir.TirAst.Add;
import io.surfworks.tirnarrow.tir.TirAst.Buffer;
import io.surfworks.tirnarrow.tir.TirAst.DataType;
import io.surfworks.tirnarrow.tir.TirAst.Evaluate;
import io.surfworks.tirnarrow.tir.TirAst.Expr;
import io.surfworks.tirnarrow.tir.TirAst.For;
import io.surfworks.tirnarrow.tir.TirAst.ForKind;
import io.surfworks.tirnarrow.tir.TirAst.IrModule;
import io.surfworks.tirnarrow.tir.TirAst.PrimFunc;
import io.surfworks.tirnarrow.tir.TirAst.Stmt;
import io.surfworks.tirnarrow.tir.TirAst.Var;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TirTypeCheckerTest {

    private final Buffer a = new Buffer("A", DataType.FLOAT32, List.of(Ops.i64(64)));
    private final Buffer b = new Buffer("B", DataType.FLOAT32, List.of(Ops.i64(64)));

    private List<String> validate(Stmt body) {
        return new TirTypeChecker().validate(new PrimFunc("f", List.of(), List.of(a, b), body));
    }

    private void assertValid(Stmt body) {
        List<String> errors = validate(body);
        assertTrue(errors.isEmpty(), "Expected no errors but got: " + errors);
    }

    private void assertInvalid(Stmt body, String... expectedErrorPatterns) {
        List<String> errors = validate(body);
        assertFalse(errors.isEmpty(), "Expected errors but got none");
        for (String pattern : expectedErrorPatterns) {
            assertTrue(errors.stream().anyMatch(e -> e.contains(pattern)),
                    "Expected error containing '" + pattern + "' but got: " + errors);
        }
    }

    @Nested
    class ValidPrograms {

        @Test
        void copyLoop() {
            Var i = Ops.var("i", DataType.INT64);
            assertValid(Ops.serial(i, 0, 64, Ops.store(b, List.of(i), Ops.load(a, List.of(i)))));
        }

        @Test
        void mixedIndexWidthsAcrossDimensions() {
            Var i = Ops.var("i", DataType.INT32);
            Var j = Ops.var("j", DataType.INT64);
            Buffer m = new Buffer("M", DataType.FLOAT32, List.of(Ops.i64(8), Ops.i64(8)));
            PrimFunc f = new PrimFunc("f", List.of(), List.of(m),
                    Ops.serial(i, 0, 8, Ops.serial(j, 0, 8,
                            Ops.store(m, List.of(i, j), Ops.f32(0.0)))));
            assertTrue(new TirTypeChecker().validate(f).isEmpty());
        }

        @Test
        void parametersAreInScope() {
            Var n = Ops.var("n", DataType.INT64);
            Var i = Ops.var("i", DataType.INT64);
            PrimFunc f = new PrimFunc("f", List.of(n), List.of(a),
                    new For(i, Ops.i64(0), n, ForKind.SERIAL, new Evaluate(Ops.add(i, n))));
            assertDoesNotThrow(() -> new TirTypeChecker().check(f));
        }
    }

    @Nested
    class InvalidPrograms {

        @Test
        void mixedWidthArithmetic() {
            Var i = Ops.var("i", DataType.INT32);
            assertInvalid(Ops.serial(i, 0, 4, new Evaluate(new Add(i, Ops.i64(1)))),
                    "operand types must match", "int32 vs int64");
        }

        @Test
        void loopBoundOfWrongWidth() {
            Var i = Ops.var("i", DataType.INT32);
            assertInvalid(new For(i, Ops.i64(0), Ops.i32(4), ForKind.SERIAL, new Evaluate(i)),
                    "loop min of 'i'");
        }

        @Test
        void storeOfWrongValueType() {
            Var i = Ops.var("i", DataType.INT64);
            assertInvalid(Ops.serial(i, 0, 4, Ops.store(b, List.of(i), i)), "store into B");
        }

        @Test
        void useOutsideScope() {
            Var i = Ops.var("i", DataType.INT64);
            Var stray = Ops.var("k", DataType.INT64);
            assertInvalid(Ops.serial(i, 0, 4, Ops.store(b, List.of(stray), Ops.f32(1.0))),
                    "'k' used outside the scope");
        }

        @Test
        void errorsNameTheFunction() {
            Var i = Ops.var("i", DataType.INT32);
            List<String> errors = validate(new For(i, Ops.i64(0), Ops.i32(4), ForKind.SERIAL, new Evaluate(i)));
            assertTrue(errors.get(0).startsWith("[f] "), errors.get(0));
        }

        @Test
        void checkThrowsWithAllErrors() {
            Var i = Ops.var("i", DataType.INT32);
            PrimFunc f = new PrimFunc("f", List.of(), List.of(),
                    new For(i, Ops.i64(0), Ops.i64(4), ForKind.SERIAL, new Evaluate(i)));
            TirValidationException e = assertThrows(TirValidationException.class,
                    () -> new TirTypeChecker().check(new IrModule("m", List.of(f))));
            assertEquals(2, e.getErrors().size());
            assertTrue(e.getMessage().startsWith("IR validation failed"));
        }
    }

    @Nested
    class SharedSubexpressions {

        @Test
        void deepSharedIndexIsCheckedOnce() {
            Var i = Ops.var("i", DataType.INT64);
            Expr e = i;
            for (int level = 0; level < 48; level++) {
                e = Ops.floorMod(Ops.add(e, e), Ops.i64(7));
            }
            Stmt body = Ops.serial(i, 0, 16, Ops.store(a, List.of(e), Ops.f32(0.0)));
            assertTimeoutPreemptively(Duration.ofSeconds(10), () -> assertValid(body));
        }

        @Test
        void sharedNodeIsRecheckedAfterItsLoopEnds() {
            Var j = Ops.var("j", DataType.INT64);
            Expr next = Ops.add(j, Ops.i64(1));
            Stmt body = Ops.seq(
                    Ops.serial(j, 0, 4, Ops.store(a, List.of(next), Ops.f32(1.0))),
                    Ops.store(b, List.of(next), Ops.f32(2.0)));
            assertInvalid(body, "'j' used outside the scope");
        }
    }
}
