package io.evitadb.scriptor.assembler;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MainGuardWrapper detection and wrapping")
class MainGuardWrapperTest {

	private final MainGuardWrapper wrapper = new MainGuardWrapper(4);

	@Test
	@DisplayName("detects guards in both quoting styles")
	void shouldDetectExistingGuard() {
		assertTrue(MainGuardWrapper.hasMainGuard("if __name__ == \"__main__\":\n    run()"));
		assertTrue(MainGuardWrapper.hasMainGuard("if __name__ == '__main__':\n    run()"));
		assertFalse(MainGuardWrapper.hasMainGuard("run()"));
	}

	@Test
	@DisplayName("requires a guard for top-level calls")
	void shouldRequireGuardForCalls() {
		assertTrue(MainGuardWrapper.needsMainGuard("print('hi')"));
		assertTrue(MainGuardWrapper.needsMainGuard("name = input('name? ')"));
		assertTrue(MainGuardWrapper.needsMainGuard("result = main()"));
		assertTrue(MainGuardWrapper.needsMainGuard("for item in items:\n    sys.exit(1)"));
		assertTrue(MainGuardWrapper.needsMainGuard("process(data)"));
	}

	@Test
	@DisplayName("does not require a guard for plain statements")
	void shouldNotRequireGuardWithoutCalls() {
		assertFalse(MainGuardWrapper.needsMainGuard("assert total > 0"));
		assertFalse(MainGuardWrapper.needsMainGuard("for item in items:\n    pass"));
	}

	@Test
	@DisplayName("wraps and indents every non-blank line")
	void shouldWrapMainSection() {
		assertEquals(
			"if __name__ == \"__main__\":\n    main()\n\n    cleanup()",
			this.wrapper.wrap("main()\n\ncleanup()", "main()\n\ncleanup()")
		);
	}

	@Test
	@DisplayName("leaves string continuation lines unindented")
	void shouldNotIndentStringContinuation() {
		final String main = "print(\"\"\"\nhello\n\"\"\")";

		assertEquals(
			"if __name__ == \"__main__\":\n    print(\"\"\"\nhello\n\"\"\")",
			this.wrapper.wrap(main, main)
		);
	}

	@Test
	@DisplayName("does not wrap when a guard exists anywhere in the program")
	void shouldNotWrapWhenGuardPresent() {
		assertEquals("main()", this.wrapper.wrap("main()", "if __name__ == '__main__':\n    pass\nmain()"));
	}

	@Test
	@DisplayName("returns empty main section unchanged")
	void shouldKeepEmptyMain() {
		assertEquals("", this.wrapper.wrap("", ""));
	}
}
