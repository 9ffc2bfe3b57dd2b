package io.surfworks.tirnarrow.tir;

import io.surfworks.tirnarrow.tir.TirAst.Buffer;
import io.surfworks.tirnarrow.tir.TirAst.DataType;
import io.surfworks.tirnarrow.tir.TirAst.For;
import io.surfworks.tirnarrow.tir.TirAst.IntImm;
import io.surfworks.tirnarrow.tir.TirAst.Var;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OpsTest {

    private final Var i64 = Ops.var("i", DataType.INT64);
    private final Var i32 = Ops.var("j", DataType.INT32);

    @Test
    void mixedWidthArithmeticIsRejected() {
        TirValidationException e = assertThrows(TirValidationException.class, () -> Ops.add(i64, i32));
        assertTrue(e.getMessage().contains("int64 vs int32"), e.getMessage());
    }

    @Test
    void mixedWidthComparisonIsRejected() {
        assertThrows(TirValidationException.class, () -> Ops.lt(i64, Ops.i32(4)));
    }

    @Test
    void logicRequiresBool() {
        assertThrows(TirValidationException.class, () -> Ops.and(i64, Ops.lt(i64, Ops.i64(1))));
        assertThrows(TirValidationException.class, () -> Ops.ifThen(i64, new TirAst.Evaluate(i64)));
    }

    @Test
    void floatIndexIsRejected() {
        Buffer a = new Buffer("A", DataType.FLOAT32, List.of(Ops.i64(4)));
        assertThrows(TirValidationException.class, () -> Ops.load(a, List.of(Ops.f32(1.0))));
    }

    @Test
    void loopBoundsTakeTheLoopVariableType() {
        For loop = (For) Ops.serial(i64, 0, 16, new TirAst.Evaluate(i64));
        assertEquals(new IntImm(DataType.INT64, 0), loop.min());
        assertEquals(new IntImm(DataType.INT64, 16), loop.extent());
    }
}
