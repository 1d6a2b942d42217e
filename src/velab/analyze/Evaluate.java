package velab.analyze;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import velab.ast.BinaryExpression;
import velab.ast.ConditionalExpression;
import velab.ast.Declaration;
import velab.ast.Expression;
import velab.ast.GenvarDeclaration;
import velab.ast.IdentifierRef;
import velab.ast.LocalparamDeclaration;
import velab.ast.Number;
import velab.ast.ParameterDeclaration;
import velab.ast.StringLiteral;
import velab.ast.UnaryExpression;

/**
 * Constant expression evaluation.
 * Parameters and localparams are constants; genvars only while bound by {@link #bind(Declaration, long)}.
 * Values of parameters and localparams are cached on the declaration.
 */
public class Evaluate {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static final class Value {
    final long value;
    Value(long value) { this.value = value; }
  }

  private final Resolve resolve;
  private final Map<Declaration, Long> bindings = new IdentityHashMap<>();
  private final Set<Declaration> inProgress = Collections.newSetFromMap(new IdentityHashMap<>());

  public Evaluate() { this(new Resolve()); }
  public Evaluate(Resolve resolve) { this.resolve = resolve; }

  /** Binds a declaration (typically a genvar) to a value for subsequent evaluations. */
  public Evaluate bind(Declaration decl, long value) {
    bindings.put(decl, value);
    return this;
  }

  private static boolean isConstantDecl(Declaration decl) {
    return decl instanceof ParameterDeclaration || decl instanceof LocalparamDeclaration || decl instanceof GenvarDeclaration;
  }

  /** Whether all names in expr refer to parameters, localparams or genvars. Does not evaluate. */
  public boolean isConstant(Expression expr) {
    boolean[] constant = {true};
    expr.walk(n -> {
      if (n instanceof StringLiteral)
        constant[0] = false;
      else if (n instanceof IdentifierRef) {
        Optional<Declaration> decl = resolve.getResolution((IdentifierRef)n);
        if (decl.isEmpty() || !isConstantDecl(decl.get()))
          constant[0] = false;
      }
    });
    return constant[0];
  }

  /**
   * Computes and caches the initial value of a declaration, if it has a constant initializer.
   * Declarations whose initializer is not (yet) constant simply have no value.
   */
  public OptionalLong initValue(Declaration decl) {
    if (decl.getValue().isEmpty())
      return OptionalLong.empty();
    Optional<Value> cached = decl.getCache(Value.class);
    if (cached.isPresent())
      return OptionalLong.of(cached.get().value);
    if (!isConstant(decl.getValue().get()))
      return OptionalLong.empty();
    try {
      long value = getValue(decl.getValue().get());
      decl.setCache(Value.class, new Value(value));
      return OptionalLong.of(value);
    } catch (EvaluationException e) {
      logger.trace("No initial value for {}: {}", decl.getId(), e.getMessage());
      return OptionalLong.empty();
    }
  }

  /** Drops the cached value of a declaration. */
  public static void invalidate(Declaration decl) { decl.dropCache(Value.class); }

  /**
   * Evaluates a constant expression.
   * @throws EvaluationException if the expression is not constant or cannot be computed
   */
  public long getValue(Expression expr) {
    if (expr instanceof Number)
      return ((Number)expr).getValue();
    if (expr instanceof IdentifierRef)
      return getValue((IdentifierRef)expr);
    if (expr instanceof UnaryExpression) {
      UnaryExpression ue = (UnaryExpression)expr;
      long v = getValue(ue.getOperand());
      switch (ue.getOp()) {
      case NEGATE:
        return -v;
      case LOGICAL_NOT:
        return v == 0 ? 1 : 0;
      case BITWISE_NOT:
        return ~v;
      }
      throw new IllegalStateException("unhandled operator " + ue.getOp());
    }
    if (expr instanceof BinaryExpression)
      return getValue((BinaryExpression)expr);
    if (expr instanceof ConditionalExpression) {
      ConditionalExpression ce = (ConditionalExpression)expr;
      return getValue(ce.getCond()) != 0 ? getValue(ce.getLhs()) : getValue(ce.getRhs());
    }
    throw new EvaluationException("Not an integer constant expression: " + expr);
  }

  private long getValue(IdentifierRef ref) {
    Declaration decl = resolve.getResolution(ref).orElseThrow(
        () -> new EvaluationException("Unable to resolve " + ref.getId().readable() + " in constant expression"));
    Long bound = bindings.get(decl);
    if (bound != null)
      return bound;
    if (decl instanceof GenvarDeclaration)
      throw new EvaluationException("Genvar " + decl.getId().readable() + " is used outside of its loop");
    if (!isConstantDecl(decl))
      throw new EvaluationException(decl.getId().readable() + " is not a constant");
    Optional<Value> cached = decl.getCache(Value.class);
    if (cached.isPresent())
      return cached.get().value;
    Expression init = decl.getValue().orElseThrow(
        () -> new EvaluationException("Constant " + decl.getId().readable() + " has no value"));
    if (!inProgress.add(decl))
      throw new EvaluationException("Circular definition of " + decl.getId().readable());
    try {
      long value = getValue(init);
      decl.setCache(Value.class, new Value(value));
      return value;
    } finally {
      inProgress.remove(decl);
    }
  }

  private long getValue(BinaryExpression be) {
    long l = getValue(be.getLhs());
    // The right operand is not evaluated if the left one decides the result.
    if (be.getOp() == BinaryExpression.Op.LOGICAL_AND && l == 0)
      return 0;
    if (be.getOp() == BinaryExpression.Op.LOGICAL_OR && l != 0)
      return 1;
    long r = getValue(be.getRhs());
    switch (be.getOp()) {
    case LOGICAL_OR:
    case LOGICAL_AND:
      return r != 0 ? 1 : 0;
    case BITWISE_OR:
      return l | r;
    case BITWISE_XOR:
      return l ^ r;
    case BITWISE_AND:
      return l & r;
    case EQ:
      return l == r ? 1 : 0;
    case NE:
      return l != r ? 1 : 0;
    case LT:
      return l < r ? 1 : 0;
    case LE:
      return l <= r ? 1 : 0;
    case GT:
      return l > r ? 1 : 0;
    case GE:
      return l >= r ? 1 : 0;
    case SHL:
      return l << r;
    case SHR:
      return l >> r;
    case PLUS:
      return l + r;
    case MINUS:
      return l - r;
    case TIMES:
      return l * r;
    case DIV:
      if (r == 0)
        throw new EvaluationException("Division by zero in " + be);
      return l / r;
    case MOD:
      if (r == 0)
        throw new EvaluationException("Division by zero in " + be);
      return l % r;
    }
    throw new IllegalStateException("unhandled operator " + be.getOp());
  }
}
