package basic;

import basic.ast.Program;
import basic.backend.IlModule;
import basic.backend.Linearization;
import basic.backend.Linearizer;
import basic.backend.OpaqueStatementEmitter;
import basic.backend.StatementEmitter;
import basic.backend.syntax.IlSyntax;
import basic.cfg.CfgReport;
import basic.cfg.ProgramCfg;
import basic.cfg.build.CfgOptions;
import basic.cfg.build.ProgramCfgBuilder;
import basic.semantic.SymbolTable;
import java.util.List;

/** The middle end in one place: control flow graphs, then linear IL. */
public class Compiler {

  private Compiler() {}

  public static ProgramCfg buildCfgs(Program program, CfgOptions options) {
    return ProgramCfgBuilder.build(program, options);
  }

  public static List<Linearization> linearize(
      ProgramCfg cfgs, SymbolTable symbols, StatementEmitter emitter, CfgOptions options) {
    return new Linearizer(symbols, emitter, options).linearizeAll(cfgs);
  }

  /**
   * Builds and linearizes every routine of {@code program}. If any routine fails to build, the
   * first error is thrown after all routines have been tried.
   */
  public static IlModule compile(
      Program program, SymbolTable symbols, StatementEmitter emitter, CfgOptions options) {
    ProgramCfg cfgs = buildCfgs(program, options);
    if (cfgs.hasErrors()) {
      throw cfgs.errors.get(0);
    }
    Linearizer linearizer = new Linearizer(symbols, emitter, options);
    return linearizer.module(linearizer.linearizeAll(cfgs));
  }

  public static String compileToIl(Program program, SymbolTable symbols, CfgOptions options) {
    IlModule module = compile(program, symbols, new OpaqueStatementEmitter(), options);
    return IlSyntax.formatModule(module);
  }

  /** With the options set through the environment, see {@link EnvVar}. */
  public static String compileToIl(Program program, SymbolTable symbols) {
    return compileToIl(program, symbols, CfgOptions.fromEnvironment());
  }

  public static String report(Program program, CfgOptions options) {
    return CfgReport.render(buildCfgs(program, options));
  }

  public static String report(Program program) {
    return report(program, CfgOptions.fromEnvironment());
  }
}
