package io.evitadb.scriptor;

import org.apache.maven.plugin.MojoExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScriptorMojo actions")
public class ScriptorMojoTest {

	@TempDir
	Path tempDir;

	private ScriptorMojo mojo;
	private TestLog log;

	@BeforeEach
	void setUp() {
		this.mojo = new ScriptorMojo();
		this.log = new TestLog();
		this.mojo.setLog(this.log);
	}

	@Test
	@DisplayName("show-config displays defaults and warns about missing settings")
	void shouldShowConfigWithWarnings() throws MojoExecutionException {
		this.mojo.setAction(null);

		this.mojo.execute();

		assertTrue(this.log.hasInfo("Scriptor Plugin Configuration:"));
		assertTrue(this.log.hasInfo(" - llmProvider: openai"));
		assertTrue(this.log.hasInfo(" - maxConcurrentChunks: 3"));
		assertTrue(this.log.hasInfo(" - llmModel: <provider default>"));
		assertTrue(this.log.hasWarn("LLM url is not set"));
		assertTrue(this.log.hasWarn("LLM token is not set"));
		assertTrue(this.log.hasWarn("Input file is not set"));
		assertTrue(this.log.hasWarn("Output file is not set"));
	}

	@Test
	@DisplayName("show-config masks the token")
	void shouldMaskToken() throws MojoExecutionException {
		this.mojo.setAction("show-config");
		this.mojo.setLlmToken("sk-secret-abcd");

		this.mojo.execute();

		assertTrue(this.log.hasInfo(" - llmToken: ****abcd"));
		assertFalse(this.log.hasInfo("secret"));
		assertEquals("****", ScriptorMojo.mask("abc"));
		assertEquals("****", ScriptorMojo.mask(null));
	}

	@Test
	@DisplayName("rejects unknown actions")
	void shouldRejectUnknownAction() {
		this.mojo.setAction("compile");

		final MojoExecutionException exception = assertThrows(MojoExecutionException.class, this.mojo::execute);
		assertEquals("Unknown action: compile. Supported actions: show-config, translate", exception.getMessage());
	}

	@Test
	@DisplayName("translate requires input, output and URL")
	void shouldValidateTranslateParameters() throws Exception {
		this.mojo.setAction("translate");
		assertEquals(
			"Input file must be specified for translate action",
			assertThrows(MojoExecutionException.class, this.mojo::execute).getMessage()
		);

		this.mojo.setInputFile(writeInput("x = 1\n").toString());
		assertEquals(
			"Output file must be specified for translate action",
			assertThrows(MojoExecutionException.class, this.mojo::execute).getMessage()
		);

		this.mojo.setOutputFile(this.tempDir.resolve("out.py").toString());
		assertEquals(
			"LLM URL must be specified for non-dry-run translate action",
			assertThrows(MojoExecutionException.class, this.mojo::execute).getMessage()
		);
	}

	@Test
	@DisplayName("translate fails for a missing input file")
	void shouldFailForMissingInputFile() {
		this.mojo.setAction("translate");
		this.mojo.setDryRun(true);
		this.mojo.setInputFile(this.tempDir.resolve("missing.md").toString());

		final MojoExecutionException exception = assertThrows(MojoExecutionException.class, this.mojo::execute);
		assertTrue(exception.getMessage().startsWith("Input file does not exist or is not a file"));
	}

	@Test
	@DisplayName("translate reports invalid configuration")
	void shouldReportInvalidConfiguration() throws Exception {
		this.mojo.setAction("translate");
		this.mojo.setDryRun(true);
		this.mojo.setInputFile(writeInput("x = 1\n").toString());
		this.mojo.setMaxConcurrentChunks(0);

		final MojoExecutionException exception = assertThrows(MojoExecutionException.class, this.mojo::execute);
		assertEquals("Invalid configuration: maxConcurrentChunks must be at least 1", exception.getMessage());
	}

	@Test
	@DisplayName("translate reports an unknown provider")
	void shouldReportUnknownProvider() throws Exception {
		this.mojo.setAction("translate");
		this.mojo.setInputFile(writeInput("x = 1\n").toString());
		this.mojo.setOutputFile(this.tempDir.resolve("out.py").toString());
		this.mojo.setLlmUrl("http://localhost:11434/v1");
		this.mojo.setLlmProvider("gemini");

		final MojoExecutionException exception = assertThrows(MojoExecutionException.class, this.mojo::execute);
		assertTrue(exception.getMessage().startsWith("Invalid LLM configuration: Unknown LLM provider: gemini"));
	}

	@Test
	@DisplayName("dry run only reports parsed blocks")
	void shouldReportBlocksInDryRun() throws Exception {
		final Path output = this.tempDir.resolve("out.py");
		this.mojo.setAction("translate");
		this.mojo.setDryRun(true);
		this.mojo.setInputFile(writeInput("x = 1\n\nsum all numbers\n```js\nlet y = 2\n```\n").toString());
		this.mojo.setOutputFile(output.toString());

		this.mojo.execute();

		assertTrue(this.log.hasInfo("--- Dry-run Summary for"));
		assertTrue(this.log.hasInfo("TARGET_CODE: 1"));
		assertTrue(this.log.hasInfo("NATURAL_LANGUAGE: 2"));
		assertTrue(this.log.hasWarn("Code fence in 'js' at line 4 treated as pseudocode"));
		assertFalse(Files.exists(output));
	}

	@Test
	@DisplayName("translate assembles and writes a program without pseudocode")
	void shouldWriteProgramOfCodeOnlyInput() throws Exception {
		final Path output = this.tempDir.resolve("nested/dir/out.py");
		this.mojo.setAction("translate");
		this.mojo.setInputFile(writeInput("import os\nx = 1\nprint(os.getcwd(), x)\n").toString());
		this.mojo.setOutputFile(output.toString());
		// never contacted, the input contains no pseudocode
		this.mojo.setLlmUrl("http://localhost:11434/v1");
		this.mojo.setIndentSize(2);

		this.mojo.execute();

		assertTrue(Files.isRegularFile(output));
		final String program = Files.readString(output, StandardCharsets.UTF_8);
		assertTrue(program.startsWith("import os\n"));
		assertTrue(program.contains("x = 1"));
		assertTrue(program.contains("print(os.getcwd(), x)"));
		assertTrue(this.log.hasInfo("Chunks: 1"));
		assertTrue(this.log.hasInfo("Failed: 0 (timed out: 0)"));
	}

	private Path writeInput(String content) throws Exception {
		final Path input = this.tempDir.resolve("input.md");
		Files.writeString(input, content, StandardCharsets.UTF_8);
		return input;
	}
}
