package basic.backend.instructions;

/**
 * An instruction of the linear IL the CFG is lowered to. The IL is a three-address form in the
 * style of QBE: values live in temps that are assigned once, control flow happens through labels,
 * jumps and two-way branches only.
 */
public abstract class Instruction {

  public abstract void accept(Visitor visitor);

  public interface Visitor {

    void visit(Label label);

    void visit(Comment comment);

    void visit(Allocate allocate);

    void visit(ZeroInit zeroInit);

    void visit(Evaluate evaluate);

    void visit(Execute execute);

    void visit(Load load);

    void visit(Store store);

    void visit(LoadIndexed load);

    void visit(StoreIndexed store);

    void visit(Compare compare);

    void visit(Arith arith);

    void visit(Select select);

    void visit(Jump jump);

    void visit(Branch branch);

    void visit(RuntimeCall call);

    void visit(RuntimeError error);

    void visit(Ret ret);
  }
}
