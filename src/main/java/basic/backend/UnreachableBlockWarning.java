package basic.backend;

public class UnreachableBlockWarning extends LinearizerWarning {

  public UnreachableBlockWarning(String routine, int block) {
    super(routine, block);
  }

  @Override
  public String getMessage() {
    return String.format("%s: bb%d is never executed", routine, block);
  }
}
