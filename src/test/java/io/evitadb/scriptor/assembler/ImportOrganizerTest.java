package io.evitadb.scriptor.assembler;

import io.evitadb.scriptor.TestLog;
import io.evitadb.scriptor.assembler.ImportOrganizer.ImportGroup;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImportOrganizer grouping and rendering")
class ImportOrganizerTest {

	private TestLog log;
	private ImportOrganizer organizer;

	@BeforeEach
	void setUp() {
		this.log = new TestLog();
		this.organizer = new ImportOrganizer(this.log);
	}

	@Test
	@DisplayName("categorizes modules by their top-level package")
	void shouldCategorizeModules() {
		assertEquals(ImportGroup.STANDARD, ImportOrganizer.categorize("os"));
		assertEquals(ImportGroup.STANDARD, ImportOrganizer.categorize("os.path"));
		assertEquals(ImportGroup.STANDARD, ImportOrganizer.categorize("__future__"));
		assertEquals(ImportGroup.THIRD_PARTY, ImportOrganizer.categorize("numpy"));
		assertEquals(ImportGroup.THIRD_PARTY, ImportOrganizer.categorize("requests.adapters"));
		assertEquals(ImportGroup.LOCAL, ImportOrganizer.categorize(".mymodule"));
		assertEquals(ImportGroup.LOCAL, ImportOrganizer.categorize(".."));
	}

	@Test
	@DisplayName("renders nothing when nothing was imported")
	void shouldRenderEmptySection() {
		assertTrue(this.organizer.isEmpty());
		assertEquals("", this.organizer.render());
	}

	@Test
	@DisplayName("splits a multi-module import into separate lines")
	void shouldSplitMultiModuleImport() {
		this.organizer.addImport("import sys, os as operating_system");

		assertEquals("import os as operating_system\nimport sys", this.organizer.render());
	}

	@Test
	@DisplayName("merges from-imports of the same module")
	void shouldMergeFromImports() {
		this.organizer.addFromImport("from typing import List, Dict");
		this.organizer.addFromImport("from typing import (\n    Optional,\n    List,\n)");

		assertEquals("from typing import Dict, List, Optional", this.organizer.render());
	}

	@Test
	@DisplayName("renders groups separated by a blank line")
	void shouldSeparateGroups() {
		this.organizer.addFromImport("from .helpers import util");
		this.organizer.addImport("import requests");
		this.organizer.addImport("import json");

		assertEquals("import json\n\nimport requests\n\nfrom .helpers import util", this.organizer.render());
	}

	@Test
	@DisplayName("warns about malformed imports and skips them")
	void shouldSkipMalformedImport() {
		this.organizer.addImport("import");

		assertTrue(this.organizer.isEmpty());
		assertTrue(this.log.hasWarn("Ignoring malformed import"));
	}

	@Test
	@DisplayName("auto-imports a called name that nothing binds")
	void shouldAutoImportCalledName() {
		this.organizer.addCommonImports("matches = findall(pattern, text)");

		assertEquals("from re import findall", this.organizer.render());
		assertTrue(this.log.hasDebug("Auto-adding import: from re import findall"));
	}

	@Test
	@DisplayName("does not auto-import a name bound by an alias")
	void shouldNotAutoImportBoundName() {
		this.organizer.addFromImport("from numpy import sqrt");
		this.organizer.addCommonImports("root = sqrt(2)");

		assertEquals("from numpy import sqrt", this.organizer.render());
	}
}
