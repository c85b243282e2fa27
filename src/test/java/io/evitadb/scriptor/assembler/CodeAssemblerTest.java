package io.evitadb.scriptor.assembler;

import io.evitadb.scriptor.TestLog;
import io.evitadb.scriptor.model.AssemblerConfig;
import io.evitadb.scriptor.model.BlockType;
import io.evitadb.scriptor.model.CodeBlock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

@DisplayName("CodeAssembler merges translated blocks into one program")
class CodeAssemblerTest {

	private TestLog log;
	private CodeAssembler assembler;

	@BeforeEach
	void setUp() {
		this.log = new TestLog();
		this.assembler = new CodeAssembler(AssemblerConfig.defaults(), this.log);
	}

	@Test
	@DisplayName("returns empty string for no blocks")
	void shouldReturnEmptyStringForNoBlocks() throws AssemblyException {
		assertEquals("", this.assembler.assemble(List.of()));
	}

	@Test
	@DisplayName("returns empty string and warns when no block carries code")
	void shouldReturnEmptyStringWhenNoCodeBlocks() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.naturalLanguage("compute the sum of all numbers")
		));

		assertEquals("", result);
		assertTrue(this.log.hasWarn("No code blocks found"));
	}

	@Test
	@DisplayName("last definition of a function wins")
	void shouldKeepLastDefinitionOfFunction() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("def f():\n    return 1"),
			CodeBlock.code("def f():\n    return 2")
		));

		assertEquals("def f():\n    return 2\n", result);
	}

	@Test
	@DisplayName("merged definition keeps the position of its first occurrence")
	void shouldKeepPositionOfFirstOccurrence() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("def a():\n    return 1\n\ndef b():\n    return 2"),
			CodeBlock.code("def a():\n    return 3")
		));

		assertEquals("def a():\n    return 3\n\ndef b():\n    return 2\n", result);
	}

	@Test
	@DisplayName("groups imports into standard, third party and local")
	void shouldGroupImports() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("import os\nfrom math import sqrt\nimport numpy\nfrom .mymodule import x\n\nprint(sqrt(4))")
		));

		assertEquals(
			"import os\n" +
				"from math import sqrt\n" +
				"\n" +
				"import numpy\n" +
				"\n" +
				"from .mymodule import x\n" +
				"\n" +
				"\n" +
				"if __name__ == \"__main__\":\n" +
				"    print(sqrt(4))\n",
			result
		);
	}

	@Test
	@DisplayName("deduplicates imports across blocks")
	void shouldDeduplicateImports() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("import os"),
			CodeBlock.code("import os\nfrom os import sep"),
			CodeBlock.code("from os import getcwd")
		));

		assertEquals("import os\nfrom os import getcwd, sep\n", result);
	}

	@Test
	@DisplayName("places __future__ imports first")
	void shouldPlaceFutureImportsFirst() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("import sys\nfrom __future__ import annotations")
		));

		assertEquals("from __future__ import annotations\nimport sys\n", result);
	}

	@Test
	@DisplayName("wraps top-level calls in a main guard")
	void shouldWrapTopLevelCallsInMainGuard() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("print(\"hi\")")
		));

		assertEquals("if __name__ == \"__main__\":\n    print(\"hi\")\n", result);
	}

	@Test
	@DisplayName("does not wrap code that already has a main guard")
	void shouldNotWrapExistingMainGuard() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("def main():\n    print(\"hi\")"),
			CodeBlock.code("if __name__ == '__main__':\n    main()")
		));

		assertEquals(
			"def main():\n    print(\"hi\")\n\n\nif __name__ == '__main__':\n    main()\n",
			result
		);
	}

	@Test
	@DisplayName("splits globals into constants and variables")
	void shouldSplitGlobalsIntoConstantsAndVariables() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("MAX_SIZE = 10\ncounter = 0\nDEBUG: bool = False")
		));

		assertEquals(
			"# Constants\nMAX_SIZE = 10\nDEBUG: bool = False\n\n# Global variables\ncounter = 0\n",
			result
		);
	}

	@Test
	@DisplayName("orders sections as docstring, imports, globals, functions, classes and main")
	void shouldOrderSections() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("\"\"\"Inventory tool.\"\"\""),
			CodeBlock.code("class Item:\n    pass"),
			CodeBlock.code("def load():\n    return []"),
			CodeBlock.code("LIMIT = 5"),
			CodeBlock.code("import json")
		));

		assertEquals(
			"\"\"\"Inventory tool.\"\"\"\n\n\n" +
				"import json\n\n\n" +
				"# Constants\nLIMIT = 5\n\n\n" +
				"def load():\n    return []\n\n\n" +
				"class Item:\n    pass\n",
			result
		);
	}

	@Test
	@DisplayName("drops module docstring when docstrings are not preserved")
	void shouldDropModuleDocstringWhenNotPreserved() throws AssemblyException {
		final CodeAssembler noDocstrings = new CodeAssembler(
			new AssemblerConfig(4, 88, true, false, true), this.log
		);

		final String result = noDocstrings.assemble(List.of(
			CodeBlock.code("\"\"\"Module doc.\"\"\"\n\nimport os")
		));

		assertEquals("import os\n", result);
	}

	@Test
	@DisplayName("adds imports for well-known names that are called")
	void shouldAddCommonImports() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("x = sqrt(16)")
		));

		assertEquals("from math import sqrt\n\n\n# Global variables\nx = sqrt(16)\n", result);
	}

	@Test
	@DisplayName("does not add common imports when switched off")
	void shouldNotAddCommonImportsWhenDisabled() throws AssemblyException {
		final CodeAssembler plain = new CodeAssembler(AssemblerConfig.defaults().withAutoImportCommon(false), this.log);

		final String result = plain.assemble(List.of(CodeBlock.code("x = sqrt(16)")));

		assertEquals("# Global variables\nx = sqrt(16)\n", result);
	}

	@Test
	@DisplayName("does not add common import for a name reached through its module")
	void shouldNotAddCommonImportForImportedModule() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("import json\ndata = json.dumps({})")
		));

		assertEquals("import json\n\n\n# Global variables\ndata = json.dumps({})\n", result);
	}

	@Test
	@DisplayName("removes comments when comments are not preserved")
	void shouldRemoveCommentsWhenNotPreserved() throws AssemblyException {
		final CodeAssembler noComments = new CodeAssembler(
			new AssemblerConfig(4, 88, false, true, false), this.log
		);

		final String result = noComments.assemble(List.of(
			CodeBlock.code("# helper\ndef f():\n    # body\n    return 1  # one")
		));

		assertEquals("def f():\n    return 1  # one\n", result);
	}

	@Test
	@DisplayName("re-indents blocks to the configured indentation")
	void shouldReindentToConfiguredIndentation() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("def f(x):\n  if x:\n    return 1\n  return 0")
		));

		assertEquals("def f(x):\n    if x:\n        return 1\n    return 0\n", result);
	}

	@Test
	@DisplayName("ignores natural-language blocks")
	void shouldIgnoreNaturalLanguageBlocks() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.naturalLanguage("first compute the value"),
			CodeBlock.code("value = 42")
		));

		assertEquals("# Global variables\nvalue = 42\n", result);
	}

	@Test
	@DisplayName("keeps unparsable block verbatim and warns")
	void shouldKeepUnparsableBlockVerbatim() throws AssemblyException {
		final String result = this.assembler.assemble(List.of(
			CodeBlock.code("value = 1"),
			CodeBlock.of(BlockType.TARGET_CODE, "total = (1 +", 4, 4)
		));

		assertTrue(result.contains("value = 1"));
		assertTrue(result.contains("total = (1 +"));
		assertTrue(this.log.hasWarn("TARGET_CODE[4-4]"));
		assertTrue(this.log.hasWarn("kept verbatim"));
	}

	@Test
	@DisplayName("produces identical output for identical input")
	void shouldBeDeterministic() throws AssemblyException {
		final List<CodeBlock> blocks = List.of(
			CodeBlock.code("import sys\nimport os\nfrom typing import List"),
			CodeBlock.code("def g():\n    return sys.argv"),
			CodeBlock.code("class A:\n    def run(self):\n        return g()"),
			CodeBlock.code("A().run()")
		);

		final String first = this.assembler.assemble(blocks);
		final String second = new CodeAssembler(AssemblerConfig.defaults(), new TestLog()).assemble(blocks);

		assertEquals(first, second);
		assertTrue(first.endsWith("\n"));
		assertFalse(first.endsWith("\n\n"));
	}

	@Test
	@DisplayName("collects blocks from an iterator")
	void shouldAssembleFromIterator() throws AssemblyException {
		final List<CodeBlock> blocks = List.of(CodeBlock.code("x = 1"), CodeBlock.code("y = 2"));

		assertEquals(this.assembler.assemble(blocks), this.assembler.assembleStreaming(blocks.iterator()));
	}

	@Test
	@DisplayName("reports the failing stage and its blocks")
	void shouldThrowWithStageAndBlocks() {
		final Log failingLog = mock(Log.class);
		doThrow(new IllegalStateException("log sink closed")).when(failingLog).debug(contains("code blocks out of"));
		final CodeAssembler failingAssembler = new CodeAssembler(AssemblerConfig.defaults(), failingLog);

		final AssemblyException exception = assertThrows(
			AssemblyException.class,
			() -> failingAssembler.assemble(List.of(
				CodeBlock.of(BlockType.TARGET_CODE, "x = 1", 1, 1),
				CodeBlock.of(BlockType.NATURAL_LANGUAGE, "add one", 2, 2)
			))
		);

		assertEquals(AssemblyException.Stage.FILTER, exception.getStage());
		assertEquals(List.of("TARGET_CODE[1-1]", "NATURAL_LANGUAGE[2-2]"), exception.getBlocks());
		assertEquals("Failed to assemble code blocks (stage: filter): log sink closed", exception.getMessage());
		assertInstanceOf(IllegalStateException.class, exception.getCause());
		verify(failingLog).error("[ASSEMBLE] Stage filter failed: log sink closed");
	}

	@Nested
	@DisplayName("AssemblyException")
	class AssemblyExceptionTests {

		@Test
		@DisplayName("formats stage, cause, blocks and suggestions")
		void shouldFormatReport() {
			final AssemblyException exception = new AssemblyException(
				"Failed to assemble code blocks",
				AssemblyException.Stage.MERGE,
				List.of(CodeBlock.of(BlockType.TARGET_CODE, "x = 1", 3, 7)),
				List.of("Check for naming conflicts"),
				new IllegalStateException("boom")
			);

			assertEquals("Failed to assemble code blocks (stage: merge): boom", exception.getMessage());
			assertEquals(AssemblyException.Stage.MERGE, exception.getStage());
			assertEquals(List.of("TARGET_CODE[3-7]"), exception.getBlocks());
			assertEquals(
				"Failed to assemble code blocks (stage: merge): boom\nBlocks: TARGET_CODE[3-7]\n - Check for naming conflicts",
				exception.toReport()
			);
		}

		@Test
		@DisplayName("omits cause when there is none")
		void shouldOmitMissingCause() {
			final AssemblyException exception = new AssemblyException(
				"Assembled program is not valid Python",
				AssemblyException.Stage.VALIDATION,
				List.of(),
				List.of(),
				null
			);

			assertEquals("Assembled program is not valid Python (stage: validation)", exception.getMessage());
			assertEquals(exception.getMessage(), exception.toReport());
		}
	}
}
