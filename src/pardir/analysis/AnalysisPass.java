package pardir.analysis;

import pardir.hir.Container;
import pardir.hir.IRTools;
import pardir.hir.PrintTools;
import pardir.hir.Tools;

/**
 * Base class of the passes that run over a whole container. After a pass
 * ends the tree is checked for consistency.
 */
public abstract class AnalysisPass
{
  protected Container container;

  protected AnalysisPass(Container container)
  {
    this.container = container;
  }

  public abstract String getPassName();

  public static void run(AnalysisPass pass)
  {
    double timer = Tools.getTime();
    PrintTools.println(pass.getPassName() + " begin", 0);
    pass.start();
    PrintTools.println(pass.getPassName() + " end in " +
      String.format("%.2f seconds", Tools.getTime(timer)), 0);
    if (!IRTools.checkConsistency(pass.container))
      throw new InternalError("Inconsistent IR after " + pass.getPassName());
  }

  public abstract void start();
}
