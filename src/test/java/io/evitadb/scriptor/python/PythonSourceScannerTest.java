package io.evitadb.scriptor.python;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PythonSourceScanner structure analysis")
class PythonSourceScannerTest {

	@Nested
	@DisplayName("Logical lines")
	class LogicalLines {

		@Test
		@DisplayName("joins bracket continuations into one logical line")
		void shouldJoinBracketContinuation() {
			final List<LogicalLine> lines = PythonSourceScanner.scan("values = [\n    1,\n    2,\n]\nprint(values)");

			assertEquals(2, lines.size());
			assertEquals(0, lines.get(0).firstLine());
			assertEquals(3, lines.get(0).lastLine());
			assertEquals(4, lines.get(1).firstLine());
		}

		@Test
		@DisplayName("separates comment and blank lines")
		void shouldSeparateCommentsAndBlanks() {
			final List<LogicalLine> lines = PythonSourceScanner.scan("# note\n\nx = 1");

			assertEquals(LogicalLine.Kind.COMMENT, lines.get(0).kind());
			assertEquals(LogicalLine.Kind.BLANK, lines.get(1).kind());
			assertEquals(LogicalLine.Kind.CODE, lines.get(2).kind());
		}

		@Test
		@DisplayName("ignores brackets and colons inside strings")
		void shouldIgnoreStringContent() {
			final LogicalLine line = PythonSourceScanner.scan("label = \"if (x: \" + 'y]'").get(0);

			assertEquals(-1, line.skeleton().indexOf(':'));
			assertFalse(line.isBlockHeader());
			assertTrue(line.assignmentIndex() > 0);
		}

		@Test
		@DisplayName("reports lines that start inside a triple-quoted string")
		void shouldReportStringContinuationLines() {
			assertEquals(
				Set.of(1, 2),
				PythonSourceScanner.stringContinuationLines("doc = \"\"\"first\nsecond\n\"\"\"\nx = 1")
			);
		}

		@Test
		@DisplayName("expands tabs to multiples of eight")
		void shouldComputeIndentWithTabs() {
			assertEquals(8, PythonSourceScanner.indentOf("\tx"));
			assertEquals(8, PythonSourceScanner.indentOf("  \tx"));
			assertEquals(3, PythonSourceScanner.indentOf("   x"));
		}

		@Test
		@DisplayName("does not treat comparison operators as assignment")
		void shouldNotTreatComparisonAsAssignment() {
			assertEquals(-1, PythonSourceScanner.scan("a == b").get(0).assignmentIndex());
			assertEquals(-1, PythonSourceScanner.scan("a <= b").get(0).assignmentIndex());
			assertEquals(-1, PythonSourceScanner.scan("a != b").get(0).assignmentIndex());
			assertTrue(PythonSourceScanner.scan("a <<= b").get(0).assignmentIndex() > 0);
		}
	}

	@Nested
	@DisplayName("Module statements")
	class ModuleStatements {

		@Test
		@DisplayName("classifies top-level statements")
		void shouldClassifyStatements() throws PythonSyntaxException {
			final List<TopLevelStatement> statements = PythonSourceScanner.parseModule(
				"\"\"\"Doc.\"\"\"\n" +
					"import os\n" +
					"from sys import argv\n" +
					"LIMIT: int = 3\n" +
					"def f():\n" +
					"    return 1\n" +
					"class C:\n" +
					"    pass\n" +
					"for i in range(3):\n" +
					"    f()\n" +
					"f()\n" +
					"raise SystemExit"
			);

			assertEquals(
				List.of(
					StatementKind.DOCSTRING, StatementKind.IMPORT, StatementKind.FROM_IMPORT, StatementKind.ASSIGNMENT,
					StatementKind.FUNCTION, StatementKind.CLASS, StatementKind.COMPOUND, StatementKind.EXPRESSION,
					StatementKind.OTHER
				),
				statements.stream().map(TopLevelStatement::kind).toList()
			);
			assertEquals("LIMIT", statements.get(3).name());
			assertEquals("f", statements.get(4).name());
			assertEquals("C", statements.get(5).name());
		}

		@Test
		@DisplayName("attaches decorators and leading comments to definitions")
		void shouldAttachDecoratorsAndComments() throws PythonSyntaxException {
			final List<TopLevelStatement> statements = PythonSourceScanner.parseModule(
				"x = 1\n\n# cached helper\n@cache\nasync def load():\n    return x"
			);

			assertEquals(2, statements.size());
			final TopLevelStatement function = statements.get(1);
			assertEquals(StatementKind.FUNCTION, function.kind());
			assertEquals("load", function.name());
			assertEquals("# cached helper\n@cache\nasync def load():\n    return x", function.text());
			assertEquals(2, function.firstLine());
			assertTrue(function.isNamedDefinition());
		}

		@Test
		@DisplayName("keeps clauses with their compound statement")
		void shouldKeepClausesTogether() throws PythonSyntaxException {
			final List<TopLevelStatement> statements = PythonSourceScanner.parseModule(
				"try:\n    run()\nexcept ValueError:\n    pass\nfinally:\n    stop()"
			);

			assertEquals(1, statements.size());
			assertEquals(StatementKind.COMPOUND, statements.get(0).kind());
			assertEquals(5, statements.get(0).lastLine());
		}

		@Test
		@DisplayName("names augmented assignment by its target")
		void shouldNameAugmentedAssignment() throws PythonSyntaxException {
			final TopLevelStatement statement = PythonSourceScanner.parseModule("total += 1").get(0);

			assertEquals(StatementKind.ASSIGNMENT, statement.kind());
			assertEquals("total", statement.name());
		}

		@Test
		@DisplayName("returns no statements for comments only")
		void shouldReturnNothingForCommentsOnly() throws PythonSyntaxException {
			assertTrue(PythonSourceScanner.parseModule("# nothing here\n\n").isEmpty());
		}
	}

	@Nested
	@DisplayName("Validation")
	class Validation {

		@Test
		@DisplayName("accepts well-formed code")
		void shouldAcceptValidCode() {
			assertDoesNotThrow(() -> PythonSourceScanner.validate(
				"def f(a, b):\n    if a:\n        return b\n    elif b:\n        return a\n    else:\n        return None\n"
			));
		}

		@Test
		@DisplayName("rejects missing indented block")
		void shouldRejectMissingBody() {
			final PythonSyntaxException exception = assertThrows(
				PythonSyntaxException.class,
				() -> PythonSourceScanner.validate("def f():\nreturn 1")
			);

			assertTrue(exception.getMessage().contains("expected an indented block after 'def'"));
			assertEquals(2, exception.getLineNumber());
		}

		@Test
		@DisplayName("rejects header at end of input")
		void shouldRejectTrailingHeader() {
			assertThrows(PythonSyntaxException.class, () -> PythonSourceScanner.validate("while True:"));
		}

		@Test
		@DisplayName("rejects clause without opening statement")
		void shouldRejectOrphanClause() {
			final PythonSyntaxException exception = assertThrows(
				PythonSyntaxException.class,
				() -> PythonSourceScanner.validate("else:\n    pass")
			);

			assertTrue(exception.getMessage().contains("'else' without a matching statement"));
		}

		@Test
		@DisplayName("rejects unterminated string literal")
		void shouldRejectUnterminatedString() {
			final PythonSyntaxException exception = assertThrows(
				PythonSyntaxException.class,
				() -> PythonSourceScanner.validate("x = 1\nname = 'abc")
			);

			assertTrue(exception.getMessage().contains("unterminated string literal"));
			assertEquals(2, exception.getLineNumber());
		}

		@Test
		@DisplayName("rejects unclosed bracket")
		void shouldRejectUnclosedBracket() {
			final PythonSyntaxException exception = assertThrows(
				PythonSyntaxException.class,
				() -> PythonSourceScanner.validate("x = 1\ny = (1,\n  2")
			);

			assertTrue(exception.getMessage().contains("'(' was never closed"));
			assertEquals(2, exception.getLineNumber());
		}

		@Test
		@DisplayName("rejects mismatched brackets")
		void shouldRejectMismatchedBrackets() {
			assertThrows(PythonSyntaxException.class, () -> PythonSourceScanner.validate("x = [1, 2)"));
		}

		@Test
		@DisplayName("rejects unexpected indent")
		void shouldRejectUnexpectedIndent() {
			final PythonSyntaxException exception = assertThrows(
				PythonSyntaxException.class,
				() -> PythonSourceScanner.validate("x = 1\n    y = 2")
			);

			assertTrue(exception.getMessage().contains("unexpected indent"));
		}

		@Test
		@DisplayName("rejects inconsistent dedent")
		void shouldRejectInconsistentDedent() {
			final PythonSyntaxException exception = assertThrows(
				PythonSyntaxException.class,
				() -> PythonSourceScanner.validate("if x:\n        a()\n    b()")
			);

			assertTrue(exception.getMessage().contains("unindent does not match"));
		}

		@Test
		@DisplayName("rejects header without colon")
		void shouldRejectHeaderWithoutColon() {
			final PythonSyntaxException exception = assertThrows(
				PythonSyntaxException.class,
				() -> PythonSourceScanner.validate("if x\n    a()")
			);

			assertTrue(exception.getMessage().contains("expected ':' after 'if'"));
		}

		@Test
		@DisplayName("rejects decorator without definition")
		void shouldRejectDanglingDecorator() {
			assertThrows(PythonSyntaxException.class, () -> PythonSourceScanner.validate("@cache\nx = 1"));
		}
	}
}
