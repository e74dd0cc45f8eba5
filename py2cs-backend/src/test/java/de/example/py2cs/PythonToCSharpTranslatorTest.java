package de.example.py2cs;

import de.example.py2cs.ast.*;
import de.example.py2cs.ast.Module;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PythonToCSharpTranslatorTest {

  private final PythonToCSharpTranslator translator = new PythonToCSharpTranslator();

  private static NameRef n(String id) {
    return new NameRef(id);
  }

  private static Constant c(Object v) {
    return new Constant(v);
  }

  private static Stmt print(Expr... args) {
    return new ExpressionStatement(new Call(n("print"), List.of(args)));
  }

  private static Module module(Stmt... body) {
    return new Module(List.of(body));
  }

  private List<String> lines(Module m) {
    return Arrays.asList(translator.translate(m).split("\n"));
  }

  @Test
  void printBecomesConsoleWriteLine() {
    String out = translator.translate(module(print(c("hi"))));

    assertTrue(out.startsWith("using System;\nusing System.Collections.Generic;\nusing System.Linq;\nusing System.IO;\n\n"));
    assertTrue(out.contains("namespace PythonTranslated\n{\n"));
    assertTrue(out.contains("    Console.WriteLine(\"hi\");"));
    assertTrue(out.endsWith("}"));
  }

  @Test
  void eachSimpleStatementIsOneLine() {
    List<String> out = lines(module(print(c(1)), print(c(2)), print(c(3))));
    assertEquals(3, out.stream().filter(l -> l.contains("Console.WriteLine")).count());
    assertEquals(11, out.size());
  }

  @Test
  void rangeLoopsBecomeCountedForLoops() {
    Module m = module(
        new For(n("i"), new Call(n("range"), List.of(c(3))), List.of(print(n("i")))),
        new For(n("j"), new Call(n("range"), List.of(c(2), n("n"))), List.of(new Pass())),
        new For(n("k"), new Call(n("range"), List.of(c(10), c(0), c(-2))), List.of(new Break())),
        new For(n("m"), new Call(n("range"), List.of(c(1), c(10), c(3))), List.of(new Continue())));

    List<String> out = lines(m);
    assertTrue(out.contains("    for (int i = 0; i < 3; i++)"));
    assertTrue(out.contains("        Console.WriteLine(i);"));
    assertTrue(out.contains("    for (int j = 2; j < n; j++)"));
    assertTrue(out.contains("        // pass"));
    assertTrue(out.contains("    for (int k = 10; k > 0; k += -2)"));
    assertTrue(out.contains("        break;"));
    assertTrue(out.contains("    for (int m = 1; m < 10; m += 3)"));
    assertTrue(out.contains("        continue;"));
  }

  @Test
  void otherIterablesBecomeForeach() {
    Expr items = new Call(new Attribute(n("d"), "items"), List.of());
    Module m = module(
        new For(n("name"), n("names"), List.of(new Continue())),
        new For(new TupleLiteral(List.of(n("k"), n("v"))), items, List.of(print(n("k")))));

    List<String> out = lines(m);
    assertTrue(out.contains("    foreach (var name in names)"));
    assertTrue(out.contains("    foreach (var (k, v) in d.ToList())"));
  }

  @Test
  void assignmentsInferLocalTypes() {
    Module m = module(
        new Assign(n("x"), c(5)),
        new Assign(n("items"), new ListLiteral(List.of())),
        new Assign(n("total"), new BinaryOp(n("x"), BinaryOperator.ADD, c(1))),
        new AnnotatedAssign(n("count"), n("int"), c(0)),
        new AugmentedAssign(n("x"), BinaryOperator.ADD, c(2)),
        new AugmentedAssign(n("x"), BinaryOperator.POW, c(2)),
        new Assign(new Subscript(n("d"), c("k")), c(1)));

    List<String> out = lines(m);
    assertTrue(out.contains("    int x = 5;"));
    assertTrue(out.contains("    List<object> items = new List<object>();"));
    assertTrue(out.contains("    var total = (x + 1);"));
    assertTrue(out.contains("    int count = 0;"));
    assertTrue(out.contains("    x += 2;"));
    assertTrue(out.contains("    x = Math.Pow(x, 2);"));
    assertTrue(out.contains("    d[\"k\"] = 1;"));
  }

  @Test
  void ifElifElseChainStaysFlat() {
    If chain = new If(
        new Compare(n("x"), CompareOperator.GT, c(0)),
        List.of(print(c("pos"))),
        List.of(new If(
            new Compare(n("x"), CompareOperator.LT, c(0)),
            List.of(print(c("neg"))),
            List.of(print(c("zero"))))));

    List<String> out = lines(module(chain));
    assertTrue(out.contains("    if (x > 0)"));
    assertTrue(out.contains("    else if (x < 0)"));
    assertTrue(out.contains("    else"));
    assertEquals(1, out.stream().filter(l -> l.trim().equals("else")).count());
  }

  @Test
  void whileLoop() {
    While w = new While(
        new BoolOp(BoolOperator.AND, List.of(n("running"), new Compare(n("i"), CompareOperator.LT, c(10)))),
        List.of(new AugmentedAssign(n("i"), BinaryOperator.ADD, c(1))));

    List<String> out = lines(module(w));
    assertTrue(out.contains("    while (running && (i < 10))"));
    assertTrue(out.contains("        i += 1;"));
  }

  @Test
  void moduleFunctionsLiveInTheContainerClass() {
    FunctionDef add = new FunctionDef("add",
        List.of(new Parameter("a", n("int")), new Parameter("b", n("int"), c(1))),
        n("int"),
        List.of(new Return(new BinaryOp(n("a"), BinaryOperator.ADD, n("b")))));
    FunctionDef greet = new FunctionDef("greet", List.of(Parameter.of("name")), null, List.of(print(n("name"))));
    FunctionDef guess = new FunctionDef("guess", List.of(), null,
        List.of(new If(n("ok"), List.of(new Return(c(1))))));

    List<String> out = lines(module(add, greet, guess));
    assertTrue(out.contains("    public class Program"));
    assertTrue(out.contains("        public static int add(int a, int b = 1)"));
    assertTrue(out.contains("            return (a + b);"));
    assertTrue(out.contains("        public static void greet(object name)"));
    assertTrue(out.contains("        public static object guess()"));
  }

  @Test
  void classesGetConstructorsAndInstanceMethods() {
    FunctionDef init = new FunctionDef("__init__",
        List.of(Parameter.of("self"), new Parameter("start", n("int"))), null,
        List.of(new Assign(new Attribute(n("self"), "count"), n("start"))));
    FunctionDef inc = new FunctionDef("inc", List.of(Parameter.of("self")), Constant.none(),
        List.of(new AugmentedAssign(new Attribute(n("self"), "count"), BinaryOperator.ADD, c(1))));
    FunctionDef zero = new FunctionDef("zero", List.of(), n("int"), List.of(new Return(c(0))),
        List.of(n("staticmethod")));
    ClassDef counter = new ClassDef("Counter", List.of(n("object")), List.of(init, inc, zero));

    List<String> out = lines(module(counter));
    assertTrue(out.contains("    public class Counter"));
    assertFalse(out.contains("    public class Program"));
    assertTrue(out.contains("        public Counter(int start)"));
    assertTrue(out.contains("            this.count = start;"));
    assertTrue(out.contains("        public void inc()"));
    assertTrue(out.contains("            this.count += 1;"));
    assertTrue(out.contains("        public static int zero()"));
  }

  @Test
  void classBasesAreKept() {
    ClassDef err = new ClassDef("AppError", List.of(n("Exception")), List.of(new Pass()));
    assertTrue(lines(module(err)).contains("    public class AppError : Exception"));
  }

  @Test
  void tryExceptFinally() {
    Try t = new Try(
        List.of(new Assign(n("x"), new Call(n("int"), List.of(n("s"))))),
        List.of(
            new ExceptHandler(n("ValueError"), "e", List.of(print(n("e")))),
            new ExceptHandler(new TupleLiteral(List.of(n("KeyError"), n("IndexError"))), null, List.of(new Pass())),
            new ExceptHandler(null, null, List.of(new Raise(null)))),
        List.of(new ExpressionStatement(new Call(n("cleanup"), List.of()))));

    List<String> out = lines(module(t));
    assertTrue(out.contains("    try"));
    assertTrue(out.contains("        int x = int.Parse(s);"));
    assertTrue(out.contains("    catch (ArgumentException e)"));
    assertTrue(out.contains("    catch (Exception ex) when (ex is KeyNotFoundException || ex is IndexOutOfRangeException)"));
    assertTrue(out.contains("    catch (Exception)"));
    assertTrue(out.contains("        throw;"));
    assertTrue(out.contains("    finally"));
    assertTrue(out.contains("        cleanup();"));
  }

  @Test
  void raiseForms() {
    Module m = module(
        new Raise(new Call(n("ValueError"), List.of(c("bad")))),
        new Raise(n("KeyError")),
        new Raise(n("err")));

    List<String> out = lines(m);
    assertTrue(out.contains("    throw new ArgumentException(\"bad\");"));
    assertTrue(out.contains("    throw new KeyNotFoundException();"));
    assertTrue(out.contains("    throw err;"));
  }

  @Test
  void importsAndDocstringsBecomeComments() {
    Module m = module(
        new ExpressionStatement(c("Utility module.\n\n  Second line.\n")),
        new Import(List.of(Alias.of("os"))),
        new ImportFrom("collections", List.of(new Alias("defaultdict", "dd"))));

    List<String> out = lines(m);
    assertTrue(out.contains("    // Utility module."));
    assertTrue(out.contains("    // Second line."));
    assertTrue(out.contains("    // import os"));
    assertTrue(out.contains("    // from collections import defaultdict as dd"));
  }

  @Test
  void unsupportedStatementsDegradeAndTheWalkContinues() {
    Module m = module(
        new UnsupportedStmt("With"),
        new Assign(List.of(n("a"), n("b")), c(1)),
        new While(n("x"), List.of(new Pass()), List.of(print(c("done")))),
        print(c("after")));

    Translation t = translator.translateWithReport(m);
    List<String> out = Arrays.asList(t.code().split("\n"));

    assertTrue(out.contains("    // Unsupported statement: With"));
    assertTrue(out.contains("    // Unsupported statement: Assign (multiple targets)"));
    assertTrue(out.contains("    // Unsupported statement: While (else clause)"));
    assertTrue(out.contains("    Console.WriteLine(\"after\");"));
    assertEquals(List.of("With", "Assign (multiple targets)", "While (else clause)"), t.unsupported());
    assertFalse(t.isComplete());
  }

  @Test
  void unsupportedExpressionsAreReportedToo() {
    Translation t = translator.translateWithReport(module(
        new Assign(n("f"), new UnsupportedExpr("Lambda"))));

    assertTrue(t.code().contains("var f = /* Unsupported expression: Lambda */;"));
    assertEquals(List.of("Lambda"), t.unsupported());
  }

  @Test
  void fullyTranslatedModuleIsComplete() {
    Translation t = translator.translateWithReport(module(print(c("ok"))));
    assertTrue(t.isComplete());
  }

  @Test
  void nullRootIsAnInvalidTree() {
    assertThrows(InvalidTreeException.class, () -> translator.translate(null));
  }

  @Test
  void configuredNamespaceAndIndentAreUsed() {
    TranslatorProperties props = new TranslatorProperties();
    props.setNamespace("Demo");
    props.setContainerClass("Functions");
    props.setIndent(2);
    PythonToCSharpTranslator custom = new PythonToCSharpTranslator(props, source -> module());

    String out = custom.translate(module(new FunctionDef("f", List.of(), null, List.of(new Pass()))));
    assertTrue(out.contains("namespace Demo\n{\n  public class Functions\n  {\n"));
    assertTrue(out.contains("    public static void f()"));
    assertTrue(out.contains("      // pass"));
  }

  @Test
  void translatesFromJsonSource() {
    String json = "{\"_type\": \"Module\", \"body\": [{\"_type\": \"Expr\", \"value\": "
        + "{\"_type\": \"Call\", \"func\": {\"_type\": \"Name\", \"id\": \"print\"}, "
        + "\"args\": [{\"_type\": \"Constant\", \"value\": \"hi\"}], \"keywords\": []}}]}";

    Translation t = translator.translateSource(json);
    assertTrue(t.code().contains("    Console.WriteLine(\"hi\");"));
  }
}
