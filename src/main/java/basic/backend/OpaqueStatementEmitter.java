package basic.backend;

import basic.ast.Statement;
import basic.backend.instructions.Execute;
import basic.backend.instructions.Instruction;
import basic.backend.operands.TempSupply;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** Leaves every statement to the code generator as a single {@link Execute}. */
public class OpaqueStatementEmitter implements StatementEmitter {
  @Override
  public List<Instruction> emit(Statement statement, TempSupply temps) {
    return ImmutableList.of(new Execute(statement));
  }
}
