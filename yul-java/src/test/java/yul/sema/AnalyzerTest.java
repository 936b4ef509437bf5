package yul.sema;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import yul.ast.Ast;
import yul.ast.CharStream;
import yul.ast.DebugData;
import yul.ast.TypedName;
import yul.ast.expr.FunctionCall;
import yul.ast.expr.Identifier;
import yul.ast.expr.Literal;
import yul.ast.expr.LiteralKind;
import yul.ast.stmt.*;
import yul.diagnostics.Diagnostic;
import yul.diagnostics.ErrorReporter;
import yul.dialect.Dialect;
import yul.dialect.EvmDialect;
import yul.dialect.EvmDialectTyped;
import yul.dialect.EvmVersion;
import yul.parser.Parser;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class AnalyzerTest {

    private static final Dialect EVM = EvmDialect.strictAssemblyForEvmObjects(EvmVersion.current());
    private static final Dialect TYPED = EvmDialectTyped.instance(EvmVersion.current());

    private record Outcome(boolean ok, List<Diagnostic> diagnostics, Block block, AnalysisInfo info) {
        Diagnostic single() {
            assertEquals(1, diagnostics.size(), () -> "diagnostics: " + diagnostics);
            return diagnostics.get(0);
        }
    }

    private static Outcome analyze(String src, Dialect dialect) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        ErrorReporter reporter = new ErrorReporter(diagnostics);
        Block block = new Parser(reporter, dialect).parse(src)
                .orElseThrow(() -> new AssertionError("parse failed: " + diagnostics));
        AnalysisInfo info = new AnalysisInfo();
        boolean ok = new Analyzer(info, reporter, dialect).analyze(block);
        return new Outcome(ok, diagnostics, block, info);
    }

    private static void assertOk(String src, Dialect dialect) {
        Outcome o = analyze(src, dialect);
        assertTrue(o.ok(), () -> "diagnostics: " + o.diagnostics());
        assertTrue(Diagnostic.containsOnlyWarnings(o.diagnostics()));
    }

    // ---------- scoping ----------

    @Test
    void functions_are_visible_before_their_definition() {
        assertOk("{ let x := f() function f() -> r { r := 1 } }", EVM);
    }

    @Test
    void functions_are_visible_in_nested_blocks_and_other_functions() {
        assertOk("""
                {
                    function a() -> r { r := b() }
                    function b() -> r { r := 2 }
                    { pop(a()) }
                }
                """, EVM);
    }

    @Test
    void variable_is_not_visible_before_declaration() {
        Diagnostic d = analyze("{ let y := x let x := 1 }", EVM).single();
        assertEquals(Diagnostic.Kind.DECLARATION_ERROR, d.kind());
        assertEquals("Identifier \"x\" not found.", d.message());
    }

    @Test
    void variable_is_not_visible_in_own_initializer() {
        Diagnostic d = analyze("{ let x := x }", EVM).single();
        assertEquals("Identifier \"x\" not found.", d.message());
    }

    @Test
    void block_local_variable_is_gone_after_block() {
        Diagnostic d = analyze("{ { let x := 1 } pop(x) }", EVM).single();
        assertEquals("Identifier \"x\" not found.", d.message());
    }

    @Test
    void outer_variables_are_invisible_inside_functions() {
        Diagnostic d = analyze("{ let x := 1 function f() -> r { r := x } }", EVM).single();
        assertEquals("Identifier \"x\" not found.", d.message());
    }

    @Test
    void assigning_outer_variable_from_function_is_rejected() {
        Diagnostic d = analyze("{ let x := 1 function f() { x := 2 } }", EVM).single();
        assertEquals(Diagnostic.Kind.DECLARATION_ERROR, d.kind());
        assertEquals("Variable not found or variable not lvalue.", d.message());
    }

    @Test
    void for_loop_pre_variables_are_visible_in_all_parts() {
        assertOk("{ for { let i := 0 } lt(i, 10) { i := add(i, 1) } { pop(i) } }", EVM);
    }

    @Test
    void for_loop_pre_variables_are_gone_after_the_loop() {
        Diagnostic d = analyze("{ for { let i := 0 } lt(i, 10) { } { } pop(i) }", EVM).single();
        assertEquals("Identifier \"i\" not found.", d.message());
    }

    // ---------- no shadowing ----------

    @Test
    void redeclaration_in_same_scope() {
        Diagnostic d = analyze("{ let x := 1 let x := 2 }", EVM).single();
        assertEquals(Diagnostic.Kind.DECLARATION_ERROR, d.kind());
        assertEquals("Variable name x already taken in this scope.", d.message());
    }

    @Test
    void shadowing_in_nested_block_is_rejected() {
        Diagnostic d = analyze("{ let x := 1 { let x := 2 } }", EVM).single();
        assertEquals("Variable name x already taken in this scope.", d.message());
    }

    @Test
    void parameter_may_not_shadow_visible_outer_variable() {
        Diagnostic d = analyze("{ let x := 1 function f(x) { } }", EVM).single();
        assertEquals("Variable name x already taken in this scope.", d.message());
    }

    @Test
    void function_may_reuse_name_of_later_outer_variable() {
        assertOk("{ function f(x) -> y { y := x } let x := f(1) let y := 2 }", EVM);
    }

    @Test
    void variable_may_not_reuse_function_name() {
        Diagnostic d = analyze("{ function f() { } let f := 1 }", EVM).single();
        assertEquals("Variable name f already taken in this scope.", d.message());
    }

    @Test
    void duplicate_function_names() {
        Diagnostic d = analyze("{ function f() { } function f() { } }", EVM).single();
        assertEquals(Diagnostic.Kind.DECLARATION_ERROR, d.kind());
        assertEquals("Function name f already taken in this scope.", d.message());
    }

    @Test
    void nested_function_may_not_shadow_outer_function() {
        Diagnostic d = analyze("{ function f() { function f() { } } }", EVM).single();
        assertEquals("Function name f already taken in this scope.", d.message());
    }

    @Test
    void sibling_blocks_may_reuse_names() {
        assertOk("{ { let x := 1 } { let x := 2 } function g() { let x := 3 } }", EVM);
    }

    // ---------- calls and identifiers ----------

    static Stream<Object[]> callErrors() {
        return Stream.of(
                new Object[]{"{ pop(add(1)) }", Diagnostic.Kind.TYPE_ERROR, "Function \"add\" expects 2 arguments but got 1."},
                new Object[]{"{ function f(a) { } f() }", Diagnostic.Kind.TYPE_ERROR, "Function \"f\" expects 1 arguments but got 0."},
                new Object[]{"{ g() }", Diagnostic.Kind.DECLARATION_ERROR, "Function \"g\" not found."},
                new Object[]{"{ let x := 1 x() }", Diagnostic.Kind.TYPE_ERROR, "Attempt to call variable instead of function."},
                new Object[]{"{ function f() { } let x := f }", Diagnostic.Kind.TYPE_ERROR, "Function f used without being called."},
                new Object[]{"{ add(1, 2) }", Diagnostic.Kind.TYPE_ERROR,
                        "Top-level expressions are not supposed to return values (this expression returns 1 value). Use ``pop()`` or assign them."},
                new Object[]{"{ function f() -> a, b { } f() }", Diagnostic.Kind.TYPE_ERROR,
                        "Top-level expressions are not supposed to return values (this expression returns 2 values). Use ``pop()`` or assign them."},
                new Object[]{"{ function f() -> a, b { } pop(f()) }", Diagnostic.Kind.TYPE_ERROR,
                        "Expected expression to evaluate to one value, but got 2 values instead."},
                new Object[]{"{ if mstore(0, 0) { } }", Diagnostic.Kind.TYPE_ERROR,
                        "Expected expression to evaluate to one value, but got 0 values instead."},
                new Object[]{"{ let x, y := 1 }", Diagnostic.Kind.DECLARATION_ERROR,
                        "Variable count mismatch for declaration of \"x, y\": 2 variables and 1 values."},
                new Object[]{"{ let x, y function f() -> a { } x, y := f() }", Diagnostic.Kind.DECLARATION_ERROR,
                        "Variable count mismatch for assignment to \"x, y\": 2 variables and 1 values."},
                new Object[]{"{ let x x, x := mul(1, 2) }", Diagnostic.Kind.DECLARATION_ERROR,
                        "Variable x occurs multiple times on the left-hand side of the assignment."},
                new Object[]{"{ y := 1 }", Diagnostic.Kind.DECLARATION_ERROR, "Variable not found or variable not lvalue."},
                new Object[]{"{ function f() { } f := 1 }", Diagnostic.Kind.DECLARATION_ERROR, "Variable not found or variable not lvalue."}
        );
    }

    @ParameterizedTest
    @MethodSource("callErrors")
    void reports_call_and_assignment_errors(String src, Diagnostic.Kind kind, String message) {
        Outcome o = analyze(src, EVM);
        assertFalse(o.ok());
        Diagnostic d = o.diagnostics().get(0);
        assertEquals(kind, d.kind());
        assertEquals(message, d.message());
    }

    @Test
    void duplicate_assignment_target_is_reported_once() {
        Outcome o = analyze("{ let x x, x := mul(1, 2) }", EVM);
        // the mismatch between 2 targets and 1 value is reported too
        assertEquals(2, o.diagnostics().size());
    }

    @Test
    void literal_arguments() {
        assertOk("{ let s := datasize(\"a string longer than thirty-two bytes in total\") }", EVM);
        assertOk("{ let p := memoryguard(0x80) }", EVM);

        assertEquals("Function expects direct literals as arguments.",
                analyze("{ let x := 1 let s := datasize(x) }", EVM).single().message());
        assertEquals("Function expects a string literal as argument.",
                analyze("{ let s := datasize(1) }", EVM).single().message());
        assertEquals("Function expects a number literal as argument.",
                analyze("{ let p := memoryguard(\"x\") }", EVM).single().message());
    }

    @Test
    void plain_dialect_has_no_object_access() {
        Dialect plain = EvmDialect.strictAssemblyForEvm(EvmVersion.current());
        Diagnostic d = analyze("{ let s := datasize(\"x\") }", plain).single();
        assertEquals("Function \"datasize\" not found.", d.message());
    }

    // ---------- EVM versions ----------

    @Test
    void instruction_not_yet_available() {
        Dialect petersburg = EvmDialect.strictAssemblyForEvmObjects(EvmVersion.PETERSBURG);
        Diagnostic d = analyze("{ let c := chainid() }", petersburg).single();
        assertEquals(Diagnostic.Kind.TYPE_ERROR, d.kind());
        assertEquals("The \"chainid\" instruction is only available for Istanbul-compatible VMs "
                + "(you are currently compiling for \"petersburg\").", d.message());
        assertOk("{ let c := chainid() }", EvmDialect.strictAssemblyForEvmObjects(EvmVersion.ISTANBUL));
    }

    @Test
    void instruction_no_longer_available() {
        Diagnostic d = analyze("{ let d := difficulty() }", EVM).single();
        assertEquals("The \"difficulty\" instruction is not available for Paris-compatible VMs or later "
                + "(you are currently compiling for \"cancun\").", d.message());
        assertOk("{ let d := prevrandao() }", EVM);
    }

    // ---------- switch ----------

    @Test
    void duplicate_case_is_a_declaration_error() {
        Diagnostic d = analyze("{ switch calldatasize() case 0 { } case 0 { } }", EVM).single();
        assertEquals(Diagnostic.Kind.DECLARATION_ERROR, d.kind());
        assertEquals("Duplicate case \"0\" defined.", d.message());
    }

    @Test
    void duplicate_case_compares_values() {
        assertEquals("Duplicate case \"0x10\" defined.",
                analyze("{ switch calldatasize() case 16 { } case 0x10 { } }", EVM).single().message());
        // "a" is 0x61 left-aligned in 32 bytes
        assertOk("{ switch calldatasize() case \"a\" { } case 0x61 { } }", EVM);
        assertEquals("Duplicate case \"ab\" defined.",
                analyze("{ switch calldatasize() case \"ab\" { } case \"ab\" { } }", EVM).single().message());
        assertEquals(1, analyze("{ switch calldatasize() case \"a\" { } "
                + "case 0x6100000000000000000000000000000000000000000000000000000000000000 { } }", EVM)
                .diagnostics().size());
    }

    @Test
    void switch_with_only_default_warns() {
        Outcome o = analyze("{ switch calldatasize() default { } }", EVM);
        assertTrue(o.ok());
        Diagnostic d = o.single();
        assertEquals(Diagnostic.Kind.WARNING, d.kind());
        assertEquals("\"switch\" statement with only a default case.", d.message());
    }

    @Test
    void switch_shape_is_checked_for_built_trees() {
        Literal zero = new Literal(null, LiteralKind.NUMBER, "0", null);
        Block empty = new Block(null, List.of());
        Switch sw = new Switch(null, zero, List.of(
                new Case(null, null, empty),
                new Case(null, zero, empty),
                new Case(null, null, empty)));
        Switch none = new Switch(null, zero, List.of());

        List<Diagnostic> diagnostics = new ArrayList<>();
        boolean ok = new Analyzer(new AnalysisInfo(), new ErrorReporter(diagnostics), EVM)
                .analyze(new Block(null, List.of(sw, none)));
        assertFalse(ok);
        assertEquals(List.of(
                "Default case must be the last case.",
                "Only one default case allowed.",
                "Switch statement without any cases."
        ), diagnostics.stream().map(Diagnostic::message).toList());
    }

    // ---------- literals and types ----------

    @Test
    void literal_limits() {
        String max = "0x" + "f".repeat(64);
        assertOk("{ let x := " + max + " }", EVM);
        assertEquals("Number literal too large (> 256 bits)",
                analyze("{ let x := 0x1" + "0".repeat(64) + " }", EVM).single().message());
        assertEquals("String literal too long (33 > 32)",
                analyze("{ let x := \"" + "a".repeat(33) + "\" }", EVM).single().message());
        assertOk("{ let x := \"" + "a".repeat(32) + "\" }", EVM);
    }

    @Test
    void typed_dialect_checks() {
        assertOk("{ let b:bool := lt(1, 2) if b { } let c:bool := not(b) }", TYPED);

        assertEquals("Expected a value of boolean type \"bool\" but got \"u256\"",
                analyze("{ if 1 { } }", TYPED).single().message());
        assertEquals("Assigning value of type \"bool\" to variable of type \"u256\".",
                analyze("{ let x := true }", TYPED).single().message());
        assertEquals("Assigning a value of type \"u256\" to a variable of type \"bool\".",
                analyze("{ let b:bool := true b := 1 }", TYPED).single().message());
        assertEquals("Expected a value of type \"u256\" but got \"bool\"",
                analyze("{ pop(add(true, 1)) }", TYPED).single().message());
        assertEquals("Expected a value of type \"u256\" but got \"bool\"",
                analyze("{ switch 1 case true { } }", TYPED).single().message());
        assertEquals("\"u8\" is not a valid type (user defined types are not yet supported).",
                analyze("{ let x:u8 := 1 }", TYPED).single().message());
        assertEquals("Invalid type \"u256\" for literal \"true\".",
                analyze("{ let x := true:u256 }", TYPED).single().message());
    }

    @Test
    void typed_dialect_replaces_iszero_with_not() {
        Diagnostic d = analyze("{ let b := iszero(1) }", TYPED).diagnostics().get(0);
        assertEquals("Function \"iszero\" not found.", d.message());
        assertOk("{ let x := bitnot(1) let b:bool := u256_to_bool(x) popbool(b) }", TYPED);
    }

    @Test
    void types_in_untyped_dialect_are_rejected() {
        Diagnostic d = analyze("{ let x:u256 := 1 }", EVM).single();
        assertEquals(Diagnostic.Kind.TYPE_ERROR, d.kind());
        assertEquals("\"u256\" is not a valid type (user defined types are not yet supported).", d.message());
    }

    // ---------- analysis info ----------

    @Test
    void analysis_info_records_scopes_and_types() {
        Outcome o = analyze("{ function f(a) -> r { r := a } let x := f(1) }", TYPED);
        assertTrue(o.ok());

        Scope root = o.info().scopeOf(o.block());
        assertInstanceOf(FuncSymbol.class, root.getLocal("f"));
        assertEquals(new VarSymbol("x", "u256"), root.getLocal("x"));

        FunctionDefinition f = (FunctionDefinition) o.block().statements().get(0);
        Scope fnScope = o.info().scopeOf(f);
        assertTrue(fnScope.isFunctionScope());
        assertEquals(List.of("a", "r"), List.copyOf(fnScope.symbols().keySet()));
        assertEquals(List.of("u256"), o.info().functionOf(f).parameterTypes());

        VariableDeclaration decl = (VariableDeclaration) o.block().statements().get(1);
        assertEquals(List.of("u256"), o.info().typesOf(decl.value()));
    }

    @Test
    void analysis_info_keys_on_identity() {
        // two structurally equal literals in different places
        Outcome o = analyze("{ let x := 1 let y := 1:u256 }", TYPED);
        Literal first = (Literal) ((VariableDeclaration) o.block().statements().get(0)).value();
        Literal second = (Literal) ((VariableDeclaration) o.block().statements().get(1)).value();
        assertEquals(first, second);
        assertNotSame(first, second);
        assertNotNull(o.info().typesOf(first));
        assertNotNull(o.info().typesOf(second));
    }

    // ---------- locations ----------

    @Test
    void errors_point_at_nearest_located_node() {
        CharStream src = new CharStream("a.sol", "");
        Identifier x = new Identifier(null, "x");
        ExpressionStatement stmt = new ExpressionStatement(DebugData.of(src, 5, 9),
                new FunctionCall(null, new Identifier(null, "pop"), List.of(x)));
        List<Diagnostic> diagnostics = new ArrayList<>();
        new Analyzer(new AnalysisInfo(), new ErrorReporter(diagnostics), EVM)
                .analyze(new Block(DebugData.of(src, 0, 20), List.of(stmt)));
        assertEquals(1, diagnostics.size());
        assertEquals(Ast.locationOf(stmt), diagnostics.get(0).location());
    }

    @Test
    void errors_use_own_location_when_present() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        ErrorReporter reporter = new ErrorReporter(diagnostics);
        Block block = new Parser(reporter, EVM, Parser::virtualSource, Parser.UseSourceLocationFrom.SCANNER)
                .parse("{ let a := 1 let a := 2 }").orElseThrow();
        new Analyzer(new AnalysisInfo(), reporter, EVM).analyze(block);
        assertEquals(1, diagnostics.size());
        assertEquals(17, diagnostics.get(0).location().start());
        assertEquals(18, diagnostics.get(0).location().end());
    }

    @Test
    void analyze_reports_success_of_this_call_only() {
        List<Diagnostic> diagnostics = new ArrayList<>();
        ErrorReporter reporter = new ErrorReporter(diagnostics);
        reporter.typeError(null, "earlier failure");
        Block block = new Block(null, List.of(new VariableDeclaration(null,
                List.of(new TypedName(null, "x", null)), null)));
        assertTrue(new Analyzer(new AnalysisInfo(), reporter, EVM).analyze(block));
        assertEquals(1, diagnostics.size());
    }
}
