package gpusync.hir;

/**
* Visitor pattern visitor interface for the {@link Traversable} class
* hierarchy.
*
* <p>
* There is one {@code visit} method for every concrete descendant class of
* {@link Traversable}, and each of those classes directly implements an
* {@code accept} method that simply calls {@code v.visit(this)}. A visitor
* implementing this interface therefore handles every node kind, and adding a
* node kind breaks every visitor at compile time until it is handled.
* </p>
*
* <p>
* Visitors are responsible for descending into children themselves.
* </p>
*/
public interface TraversableVisitor {
  // Root
    public void visit(Program node);
  // Statement
    public void visit(AttributeStatement node);
    public void visit(BufferStore node);
    public void visit(CompoundStatement node);
    public void visit(ExpressionStatement node);
    public void visit(ForLoop node);
    public void visit(IfStatement node);
    public void visit(ThreadExtentStatement node);
  // Expression
    public void visit(BinaryExpression node);
    public void visit(BufferLoad node);
    public void visit(FunctionCall node);
    public void visit(Identifier node);
    public void visit(IntegerLiteral node);
    public void visit(StringLiteral node);
}
