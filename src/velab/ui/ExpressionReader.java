package velab.ui;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import velab.ast.BinaryExpression;
import velab.ast.ConditionalExpression;
import velab.ast.Expression;
import velab.ast.Identifier;
import velab.ast.IdentifierRef;
import velab.ast.Number;
import velab.ast.StringLiteral;
import velab.ast.UnaryExpression;

/**
 * Reads the constant-expression subset used in design files:
 * decimal numbers, string literals, (hierarchical, indexed) names, unary - ! ~, the binary operators of
 * {@link BinaryExpression.Op} with their usual precedence, parentheses and the conditional operator.
 */
public class ExpressionReader {
  private final String text;
  private int pos = 0;

  private ExpressionReader(String text) { this.text = text; }

  public static Expression parse(String text) throws DesignFormatException {
    ExpressionReader reader = new ExpressionReader(text);
    Expression ret = reader.conditional();
    reader.skipSpace();
    if (reader.pos != text.length())
      throw reader.fail("unexpected '" + text.charAt(reader.pos) + "'");
    return ret;
  }

  private DesignFormatException fail(String what) {
    return new DesignFormatException("Cannot parse expression \"" + text + "\" at column " + (pos + 1) + ": " + what);
  }

  private void skipSpace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
      ++pos;
  }

  private boolean accept(String token) {
    skipSpace();
    if (!text.startsWith(token, pos))
      return false;
    pos += token.length();
    return true;
  }

  private void expect(String token) throws DesignFormatException {
    if (!accept(token))
      throw fail("expected '" + token + "'");
  }

  private Expression conditional() throws DesignFormatException {
    Expression cond = binary(1);
    if (!accept("?"))
      return cond;
    Expression lhs = conditional();
    expect(":");
    Expression rhs = conditional();
    return new ConditionalExpression(cond, lhs, rhs);
  }

  // Precedence climbing; all binary operators are left associative.
  private Expression binary(int minPrecedence) throws DesignFormatException {
    Expression lhs = unary();
    while (true) {
      Optional<BinaryExpression.Op> op = peekBinaryOp();
      if (op.isEmpty() || op.get().getPrecedence() < minPrecedence)
        return lhs;
      pos += op.get().getSymbol().length();
      Expression rhs = binary(op.get().getPrecedence() + 1);
      lhs = new BinaryExpression(lhs, op.get(), rhs);
    }
  }

  private Optional<BinaryExpression.Op> peekBinaryOp() {
    skipSpace();
    if (pos + 1 < text.length()) {
      Optional<BinaryExpression.Op> twoChar = BinaryExpression.Op.fromSymbol(text.substring(pos, pos + 2));
      if (twoChar.isPresent())
        return twoChar;
    }
    if (pos < text.length())
      return BinaryExpression.Op.fromSymbol(text.substring(pos, pos + 1));
    return Optional.empty();
  }

  private Expression unary() throws DesignFormatException {
    skipSpace();
    if (pos >= text.length())
      throw fail("unexpected end of expression");
    for (UnaryExpression.Op op : UnaryExpression.Op.values()) {
      // '!' must not swallow the first character of '!='
      if (text.startsWith(op.getSymbol(), pos) && !text.startsWith("!=", pos)) {
        pos += op.getSymbol().length();
        return new UnaryExpression(op, unary());
      }
    }
    return primary();
  }

  private Expression primary() throws DesignFormatException {
    char c = text.charAt(pos);
    if (c == '(') {
      ++pos;
      Expression ret = conditional();
      expect(")");
      return ret;
    }
    if (c == '"') {
      int end = text.indexOf('"', pos + 1);
      if (end < 0)
        throw fail("unterminated string");
      String value = text.substring(pos + 1, end);
      pos = end + 1;
      return new StringLiteral(value);
    }
    if (Character.isDigit(c))
      return new Number(number());
    if (isNameStart(c))
      return new IdentifierRef(identifier());
    throw fail("unexpected '" + c + "'");
  }

  private long number() throws DesignFormatException {
    int start = pos;
    while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '_'))
      ++pos;
    try {
      return Long.parseLong(text.substring(start, pos).replace("_", ""));
    } catch (NumberFormatException e) {
      throw fail("number out of range");
    }
  }

  private static boolean isNameStart(char c) { return Character.isLetter(c) || c == '_'; }
  private static boolean isNamePart(char c) { return Character.isLetterOrDigit(c) || c == '_' || c == '$'; }

  private Identifier identifier() throws DesignFormatException {
    List<Identifier.Id> ids = new ArrayList<>();
    do {
      skipSpace();
      if (pos >= text.length() || !isNameStart(text.charAt(pos)))
        throw fail("expected a name");
      int start = pos;
      while (pos < text.length() && isNamePart(text.charAt(pos)))
        ++pos;
      String name = text.substring(start, pos);
      if (accept("[")) {
        skipSpace();
        long index = number();
        expect("]");
        if (index > Integer.MAX_VALUE)
          throw fail("index out of range");
        ids.add(new Identifier.Id(name, (int)index));
      } else {
        ids.add(new Identifier.Id(name));
      }
    } while (accept("."));
    return new Identifier(ids);
  }
}
