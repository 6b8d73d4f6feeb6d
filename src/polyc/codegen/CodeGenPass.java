package polyc.codegen;

import polyc.hir.PrintTools;
import polyc.hir.Statement;
import polyc.scop.Scop;

/**
 * A pass producing the generated tree of a scop.
 */
public abstract class CodeGenPass
{
  protected Scop scop;

  protected Statement tree;

  protected CodeGenPass(Scop scop)
  {
    if (scop == null)
      throw new IllegalArgumentException("no scop to generate code for");
    this.scop = scop;
    this.tree = null;
  }

  public abstract String getPassName();

  public static void run(CodeGenPass pass)
  {
    PrintTools.printlnStatus(0, pass.getPassName(), "begin");
    pass.start();
    PrintTools.printlnStatus(0, pass.getPassName(), "end");
  }

  public abstract void start();

  /** Returns the tree built by the last run, or null. */
  public Statement getTree()
  {
    return tree;
  }
}
