package de.example.py2cs;

import de.example.py2cs.ast.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionTranslatorTest {

  private final ExpressionTranslator expr = new ExpressionTranslator(MappingTables.defaults());
  private TranslationContext ctx;

  @BeforeEach
  void setUp() {
    ctx = new TranslationContext(new CSharpEmitter());
  }

  private String cs(Expr e) {
    return expr.toCSharp(e, ctx);
  }

  private static NameRef n(String id) {
    return new NameRef(id);
  }

  private static Constant c(Object v) {
    return new Constant(v);
  }

  @Test
  void constants() {
    assertEquals("\"say \\\"hi\\\"\\n\"", cs(c("say \"hi\"\n")));
    assertEquals("true", cs(c(true)));
    assertEquals("null", cs(Constant.none()));
    assertEquals("42", cs(c(42)));
    assertEquals("double.PositiveInfinity", cs(c(Double.POSITIVE_INFINITY)));
  }

  @Test
  void namesGoThroughTheTypeTable() {
    assertEquals("x", cs(n("x")));
    assertEquals("true", cs(n("True")));
    assertEquals("null", cs(n("None")));
  }

  @Test
  void selfBecomesThisInsideAClass() {
    Expr attr = new Attribute(n("self"), "count");
    assertEquals("self.count", cs(attr));
    ctx.inClass("Counter", () -> assertEquals("this.count", cs(attr)));
  }

  @Test
  void compoundExpressionsAreParenthesized() {
    assertEquals("(a + (b * 2))", cs(new BinaryOp(n("a"), BinaryOperator.ADD, new BinaryOp(n("b"), BinaryOperator.MULT, c(2)))));
    assertEquals("(!done)", cs(new UnaryOp(UnaryOperator.NOT, n("done"))));
    assertEquals("(a && b)", cs(new BoolOp(BoolOperator.AND, List.of(n("a"), n("b")))));
    assertEquals("(x != null)", cs(new Compare(n("x"), CompareOperator.IS_NOT, Constant.none())));
  }

  @Test
  void powerBecomesMathPow() {
    assertEquals("Math.Pow(x, 2)", cs(new BinaryOp(n("x"), BinaryOperator.POW, c(2))));
  }

  @Test
  void chainedComparisonIsAConjunction() {
    Compare chain = new Compare(c(0), List.of(CompareOperator.LT, CompareOperator.LT_E), List.of(n("i"), n("n")));
    assertEquals("((0 < i) && (i <= n))", cs(chain));
  }

  @Test
  void membershipTestsUseContains() {
    assertEquals("xs.Contains(x)", cs(new Compare(n("x"), CompareOperator.IN, n("xs"))));
    assertEquals("(!xs.Contains(x))", cs(new Compare(n("x"), CompareOperator.NOT_IN, n("xs"))));
  }

  @Test
  void builtinCalls() {
    assertEquals("Console.WriteLine(\"hi\")", cs(new Call(n("print"), List.of(c("hi")))));
    assertEquals("xs.Count()", cs(new Call(n("len"), List.of(n("xs")))));
    assertEquals("xs.Max()", cs(new Call(n("max"), List.of(n("xs")))));
    assertEquals("int.Parse(s)", cs(new Call(n("int"), List.of(n("s")))));
  }

  @Test
  void rangeForms() {
    assertEquals("Enumerable.Range(0, 5)", cs(new Call(n("range"), List.of(c(5)))));
    assertEquals("Enumerable.Range(2, (5 - 2))", cs(new Call(n("range"), List.of(c(2), c(5)))));
    assertEquals("Enumerable.Range(0, (10 - 0)).Where((x, i) => i % 2 == 0)",
        cs(new Call(n("range"), List.of(c(0), c(10), c(2)))));
  }

  @Test
  void rangeWithNegativeStepCountsDown() {
    assertEquals("Enumerable.Range(0, Math.Max(0, (10 - 0 + 2 - 1) / 2)).Select(k => 10 - k * 2)",
        cs(new Call(n("range"), List.of(c(10), c(0), c(-2)))));
    assertEquals("Enumerable.Range(0, Math.Max(0, (n - 0 + 1 - 1) / 1)).Select(k => n - k * 1)",
        cs(new Call(n("range"), List.of(n("n"), c(0), new UnaryOp(UnaryOperator.USUB, c(1))))));
    assertTrue(ctx.unsupported().isEmpty());
  }

  @Test
  void methodCallsGoThroughTheMethodTable() {
    Call append = new Call(new Attribute(n("items"), "append"), List.of(n("x")));
    assertEquals("items.Add(x)", cs(append));

    Call custom = new Call(new Attribute(n("obj"), "run"), List.of(), List.of(new Keyword("fast", c(true))));
    assertEquals("obj.run(fast: true)", cs(custom));
  }

  @Test
  void slicesUseSkipAndTake() {
    assertEquals("xs.Skip(1).Take(3 - 1)", cs(new Subscript(n("xs"), new Slice(c(1), c(3)))));
    assertEquals("xs.Skip(0).Take(2)", cs(new Subscript(n("xs"), new Slice(null, c(2)))));
    assertEquals("xs.Skip(2).Take(xs.Count - 2)", cs(new Subscript(n("xs"), new Slice(c(2), null))));
    assertEquals("xs[0]", cs(new Subscript(n("xs"), c(0))));
  }

  @Test
  void negativeSliceBoundsAreMarked() {
    String out = cs(new Subscript(n("xs"), new Slice(c(-1), null)));
    assertEquals("/* Unsupported expression: Slice (negative bound) */", out);
    assertEquals(List.of("Slice (negative bound)"), ctx.unsupported());
  }

  @Test
  void sliceWithoutBoundsIsMarked() {
    assertEquals("/* Unsupported expression: Slice (no bounds) */", cs(new Subscript(n("xs"), new Slice(null, null))));
    assertEquals("/* Unsupported expression: Slice (no bounds) */",
        cs(new Subscript(n("xs"), new Slice(null, null, c(2)))));
    assertEquals(List.of("Slice (no bounds)", "Slice (no bounds)"), ctx.unsupported());
  }

  @Test
  void slicesWithAStep() {
    assertEquals("xs.Skip(1).Take(9 - 1).Where((x, i) => i % 3 == 0)",
        cs(new Subscript(n("xs"), new Slice(c(1), c(9), c(3)))));
  }

  @Test
  void collectionLiterals() {
    assertEquals("new List<object> { 1, 2 }", cs(new ListLiteral(List.of(c(1), c(2)))));
    assertEquals("new List<object>()", cs(new ListLiteral(List.of())));
    assertEquals("new HashSet<object> { \"a\" }", cs(new SetLiteral(List.of(c("a")))));
    assertEquals("new Dictionary<object, object> { [\"a\"] = 1 }",
        cs(new DictLiteral(List.of(c("a")), List.of(c(1)))));
    assertEquals("(1, \"b\")", cs(new TupleLiteral(List.of(c(1), c("b")))));
  }

  @Test
  void tupleArityFallbacks() {
    assertEquals("ValueTuple.Create()", cs(new TupleLiteral(List.of())));
    assertEquals("ValueTuple.Create(1)", cs(new TupleLiteral(List.of(c(1)))));
    assertEquals("(1, 2, 3, 4, 5, 6, 7, 8)",
        cs(new TupleLiteral(List.of(c(1), c(2), c(3), c(4), c(5), c(6), c(7), c(8)))));
    assertEquals("new object[] { 1, 2, 3, 4, 5, 6, 7, 8, 9 }",
        cs(new TupleLiteral(List.of(c(1), c(2), c(3), c(4), c(5), c(6), c(7), c(8), c(9)))));
  }

  @Test
  void integersBeyondLongUseBigInteger() {
    BigInteger big = new BigInteger("123456789012345678901234567890");
    assertEquals("System.Numerics.BigInteger.Parse(\"123456789012345678901234567890\")", cs(c(big)));
    assertEquals("42", cs(c(BigInteger.valueOf(42))));
  }

  @Test
  void lineSeparatorsInStringsAreEscaped() {
    assertEquals("\"a\\u2028b\\u0085c\\u0001\"", cs(c("a\u2028b\u0085c\u0001")));
  }

  @Test
  void listComprehensionBecomesLinqChain() {
    ListComprehension lc = new ListComprehension(
        new BinaryOp(n("x"), BinaryOperator.MULT, c(2)),
        List.of(new Comprehension(n("x"), n("nums"), List.of(new Compare(n("x"), CompareOperator.GT, c(0))))));

    assertEquals("nums.Where(x => (x > 0)).Select(x => (x * 2)).ToList()", cs(lc));
  }

  @Test
  void dictAndSetComprehensions() {
    Comprehension gen = new Comprehension(n("w"), n("words"), List.of());
    DictComprehension dc = new DictComprehension(n("w"), new Call(n("len"), List.of(n("w"))), List.of(gen));
    SetComprehension sc = new SetComprehension(new Call(new Attribute(n("w"), "lower"), List.of()), List.of(gen));

    assertEquals("words.ToDictionary(w => w, w => w.Count())", cs(dc));
    assertEquals("new HashSet<object>(words.Select(w => w.ToLower()))", cs(sc));
  }

  @Test
  void nestedForClausesAreReported() {
    ListComprehension lc = new ListComprehension(n("x"), List.of(
        new Comprehension(n("row"), n("grid"), List.of()),
        new Comprehension(n("x"), n("row"), List.of())));

    assertEquals("grid.Select(row => x).ToList()", cs(lc));
    assertEquals(List.of("ListComprehension (nested for-clause)"), ctx.unsupported());
  }

  @Test
  void fStringsBecomeInterpolatedStrings() {
    InterpolatedString s = new InterpolatedString(List.of(
        c("Hi {"), new InterpolationSlot(n("name")), c("} "),
        new InterpolationSlot(n("score"), -1, new InterpolatedString(List.of(c(".2f"))))));

    assertEquals("$\"Hi {{{name}}} {score:.2f}\"", cs(s));
  }

  @Test
  void unsupportedKindsBecomeInlineMarkers() {
    assertEquals("/* Unsupported expression: Lambda */", cs(new UnsupportedExpr("Lambda")));
    assertEquals("/* Unsupported expression: BinaryOp (MatMult) */",
        cs(new BinaryOp(n("a"), BinaryOperator.MAT_MULT, n("b"))));
    assertEquals(List.of("Lambda", "BinaryOp (MatMult)"), ctx.unsupported());
  }

  @Test
  void negativeNumberDetection() {
    assertTrue(ExpressionTranslator.isNegativeNumber(c(-1)));
    assertTrue(ExpressionTranslator.isNegativeNumber(new UnaryOp(UnaryOperator.USUB, c(2))));
    assertFalse(ExpressionTranslator.isNegativeNumber(c(3)));
    assertFalse(ExpressionTranslator.isNegativeNumber(n("k")));
  }
}
