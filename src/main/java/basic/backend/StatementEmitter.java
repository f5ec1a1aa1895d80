package basic.backend;

import basic.ast.Statement;
import basic.backend.instructions.Instruction;
import basic.backend.operands.TempSupply;
import java.util.List;

/**
 * Translates a straight-line statement (LET, PRINT, DIM, CALL, RESTORE) into IL. Control
 * statements are lowered by the {@link Linearizer} itself and are never passed here.
 */
public interface StatementEmitter {
  List<Instruction> emit(Statement statement, TempSupply temps);
}
