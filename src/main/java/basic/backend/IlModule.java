package basic.backend;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * All functions of a program plus the data they share: the GOSUB return stack and its stack
 * pointer. The stack holds {@link #returnStackCapacity} words.
 */
public class IlModule {
  public final int returnStackCapacity;
  public final ImmutableList<IlFunction> functions;

  public IlModule(int returnStackCapacity, List<IlFunction> functions) {
    this.returnStackCapacity = returnStackCapacity;
    this.functions = ImmutableList.copyOf(functions);
  }
}
