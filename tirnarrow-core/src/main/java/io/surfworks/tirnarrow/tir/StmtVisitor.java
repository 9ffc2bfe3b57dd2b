package io.surfworks.tirnarrow.tir;

import io.surfworks.tirnarrow.tir.TirAst.Block;
import io.surfworks.tirnarrow.tir.TirAst.BufferStore;
import io.surfworks.tirnarrow.tir.TirAst.Evaluate;
import io.surfworks.tirnarrow.tir.TirAst.For;
import io.surfworks.tirnarrow.tir.TirAst.IfThenElse;
import io.surfworks.tirnarrow.tir.TirAst.SeqStmt;
import io.surfworks.tirnarrow.tir.TirAst.ThreadBinding;

/**
 * Visitor over every statement kind.
 *
 * @param <R> the result type
 */
public interface StmtVisitor<R> {

    R visitFor(For op);

    R visitThreadBinding(ThreadBinding op);

    R visitBlock(Block op);

    R visitIfThenElse(IfThenElse op);

    R visitBufferStore(BufferStore op);

    R visitSeqStmt(SeqStmt op);

    R visitEvaluate(Evaluate op);
}
