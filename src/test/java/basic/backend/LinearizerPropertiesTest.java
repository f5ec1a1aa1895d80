package basic.backend;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.jooq.lambda.Seq.seq;

import basic.ast.Program;
import basic.ast.ProgramGenerator;
import basic.backend.instructions.Branch;
import basic.backend.instructions.Instruction;
import basic.backend.instructions.Jump;
import basic.backend.instructions.Label;
import basic.backend.instructions.Ret;
import basic.backend.instructions.RuntimeError;
import basic.cfg.ControlFlowGraph;
import basic.cfg.ProgramCfg;
import basic.cfg.build.CfgOptions;
import basic.cfg.build.ProgramCfgBuilder;
import basic.semantic.SymbolTable;
import com.google.common.collect.ImmutableList;
import com.pholser.junit.quickcheck.From;
import com.pholser.junit.quickcheck.Property;
import com.pholser.junit.quickcheck.generator.Size;
import com.pholser.junit.quickcheck.runner.JUnitQuickcheck;
import java.util.List;
import org.junit.runner.RunWith;

@RunWith(JUnitQuickcheck.class)
public class LinearizerPropertiesTest {

  private static List<Linearization> linearize(Program program) {
    ProgramCfg cfg = ProgramCfgBuilder.build(program, CfgOptions.DEFAULT);
    return new Linearizer(SymbolTable.of(), CfgOptions.DEFAULT).linearizeAll(cfg);
  }

  private static boolean isTerminator(Instruction instruction) {
    return instruction instanceof Jump
        || instruction instanceof Branch
        || instruction instanceof Ret
        || instruction instanceof RuntimeError;
  }

  @Property(trials = 300)
  public void everyBlockIsLabelledAndTerminated(
      @From(ProgramGenerator.class) @Size(max = 150) Program program) {
    for (Linearization linearization : linearize(program)) {
      for (int block : linearization.emissionOrder) {
        ImmutableList<Instruction> instructions = linearization.instructionsOf(block);
        assertThat(instructions.get(0), instanceOf(Label.class));
        assertThat(
            linearization.graph.name + " bb" + block,
            isTerminator(instructions.get(instructions.size() - 1)),
            is(true));
      }
    }
  }

  @Property(trials = 300)
  public void builtGraphsNeedNoFallback(
      @From(ProgramGenerator.class) @Size(max = 150) Program program) {
    for (Linearization linearization : linearize(program)) {
      assertThat(
          linearization.warnings.toString(),
          seq(linearization.warnings).ofType(UnknownEdgeShapeWarning.class).isEmpty(),
          is(true));
    }
  }

  @Property(trials = 200)
  public void everyBlockIsEmittedOnceInIdOrder(
      @From(ProgramGenerator.class) @Size(max = 150) Program program) {
    for (Linearization linearization : linearize(program)) {
      ControlFlowGraph graph = linearization.graph;
      List<Integer> ids = seq(graph.blocks).map(b -> b.id).sorted().toList();
      assertThat(linearization.emissionOrder, is(ids));
      List<String> labels =
          seq(linearization.function.instructions)
              .ofType(Label.class)
              .map(l -> l.label)
              .filter(l -> !l.contains("."))
              .toList();
      assertThat(labels, is(seq(ids).map(Linearizer::blockLabel).toList()));
    }
  }

  @Property(trials = 200)
  public void branchTargetsAreDefinedLabels(
      @From(ProgramGenerator.class) @Size(max = 150) Program program) {
    for (Linearization linearization : linearize(program)) {
      List<String> defined =
          seq(linearization.function.instructions).ofType(Label.class).map(l -> l.label).toList();
      for (Instruction instruction : linearization.function.instructions) {
        if (instruction instanceof Jump) {
          assertThat(defined.contains(((Jump) instruction).label), is(true));
        } else if (instruction instanceof Branch) {
          Branch branch = (Branch) instruction;
          assertThat(defined.contains(branch.ifNonZero), is(true));
          assertThat(defined.contains(branch.ifZero), is(true));
        }
      }
    }
  }

  @Property(trials = 200)
  public void gosubReturnSitesAreEmitted(
      @From(ProgramGenerator.class) @Size(max = 150) Program program) {
    for (Linearization linearization : linearize(program)) {
      for (int site : linearization.graph.gosubReturnBlocks) {
        assertThat(linearization.emissionOrder.contains(site), is(true));
      }
    }
  }
}
