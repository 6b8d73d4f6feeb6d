package polyc.codegen;

import polyc.hir.ExpressionStatement;
import polyc.hir.ForLoop;

/**
* Callbacks invoked by {@link AstBuild} while it constructs a tree. For a
* loop, {@link #beforeFor} runs before any statement inside the loop is
* built and {@link #afterFor} after the whole loop has been built; the body
* of the loop passed to {@code beforeFor} is still empty. The schedule
* returned by {@link AstBuild#getSchedule} during a callback describes the
* node the callback is invoked for.
*/
public interface AstBuildListener {

    /** Called when a loop is created, before its body is built. */
    void beforeFor(ForLoop loop, AstBuild build);

    /** Called once the loop and its whole body have been built. */
    void afterFor(ForLoop loop, AstBuild build);

    /**
    * Called for each leaf, whose expression is the call
    * {@code S(i0, i1, ..)} naming the executed statement.
    */
    void atEachDomain(ExpressionStatement leaf, AstBuild build);

}
