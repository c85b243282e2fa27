package io.evitadb.scriptor;

import dev.langchain4j.model.chat.ChatModel;
import io.evitadb.scriptor.assembler.AssemblyException;
import io.evitadb.scriptor.assembler.CodeAssembler;
import io.evitadb.scriptor.llm.ChatModelFactory;
import io.evitadb.scriptor.llm.LlmCodeTranslator;
import io.evitadb.scriptor.model.AssemblerConfig;
import io.evitadb.scriptor.model.BlockType;
import io.evitadb.scriptor.model.CodeBlock;
import io.evitadb.scriptor.model.ParseResult;
import io.evitadb.scriptor.model.StreamConfig;
import io.evitadb.scriptor.parser.BlockParser;
import io.evitadb.scriptor.parser.PseudocodeParser;
import io.evitadb.scriptor.stream.LoggingStreamEventListener;
import io.evitadb.scriptor.stream.StreamSummary;
import io.evitadb.scriptor.stream.StreamingPipeline;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Main Mojo of the Scriptor plugin providing actions:
 * - show-config: prints the effective configuration
 * - translate: streams a pseudocode file through the translator and writes the assembled program
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class ScriptorMojo extends AbstractMojo {

	/** Which action to perform: "show-config" or "translate". */
	@Parameter(property = "scriptor.action", defaultValue = "show-config")
	private String action;

	/** LLM provider: "openai" or "anthropic". */
	@Parameter(property = "scriptor.llmProvider", defaultValue = "openai")
	private String llmProvider = "openai";

	/** LLM URL (no default). */
	@Parameter(property = "scriptor.llmUrl")
	private String llmUrl;

	/** LLM token (no default). */
	@Parameter(property = "scriptor.llmToken")
	private String llmToken;

	/** LLM model name, the provider default when not set. */
	@Parameter(property = "scriptor.llmModel")
	private String llmModel;

	/** Pseudocode file to translate (no default). */
	@Parameter(property = "scriptor.inputFile")
	private String inputFile;

	/** File the assembled program is written to (no default). */
	@Parameter(property = "scriptor.outputFile")
	private String outputFile;

	/** When true, only parse the input and report its blocks without calling the LLM. */
	@Parameter(property = "scriptor.dryRun", defaultValue = "false")
	private boolean dryRun;

	/** When true, the build fails if any chunk failed. */
	@Parameter(property = "scriptor.failOnChunkError", defaultValue = "false")
	private boolean failOnChunkError;

	@Parameter(property = "scriptor.targetLanguage", defaultValue = StreamConfig.DEFAULT_TARGET_LANGUAGE)
	private String targetLanguage = StreamConfig.DEFAULT_TARGET_LANGUAGE;

	@Parameter(property = "scriptor.enableStreaming", defaultValue = "true")
	private boolean enableStreaming = true;

	@Parameter(property = "scriptor.minFileSizeForStreaming", defaultValue = "102400")
	private int minFileSizeForStreaming = StreamConfig.DEFAULT_MIN_FILE_SIZE_FOR_STREAMING;

	@Parameter(property = "scriptor.maxConcurrentChunks", defaultValue = "3")
	private int maxConcurrentChunks = StreamConfig.DEFAULT_MAX_CONCURRENT_CHUNKS;

	/** Time budget of a single chunk in seconds. */
	@Parameter(property = "scriptor.chunkTimeoutSeconds", defaultValue = "30")
	private long chunkTimeoutSeconds = StreamConfig.DEFAULT_CHUNK_TIMEOUT.toSeconds();

	@Parameter(property = "scriptor.progressIntervalMillis", defaultValue = "500")
	private long progressIntervalMillis = StreamConfig.DEFAULT_PROGRESS_CALLBACK_INTERVAL.toMillis();

	@Parameter(property = "scriptor.maintainContextWindow", defaultValue = "true")
	private boolean maintainContextWindow = true;

	@Parameter(property = "scriptor.contextWindowSize", defaultValue = "1024")
	private int contextWindowSize = StreamConfig.DEFAULT_CONTEXT_WINDOW_SIZE;

	@Parameter(property = "scriptor.enableBackpressure", defaultValue = "true")
	private boolean enableBackpressure = true;

	@Parameter(property = "scriptor.maxQueueSize", defaultValue = "10")
	private int maxQueueSize = StreamConfig.DEFAULT_MAX_QUEUE_SIZE;

	@Parameter(property = "scriptor.threadPoolSize", defaultValue = "4")
	private int threadPoolSize = StreamConfig.DEFAULT_THREAD_POOL_SIZE;

	@Parameter(property = "scriptor.chunkSize", defaultValue = "4096")
	private int chunkSize = StreamConfig.DEFAULT_CHUNK_SIZE;

	@Parameter(property = "scriptor.maxContextLength", defaultValue = "4096")
	private int maxContextLength = StreamConfig.DEFAULT_MAX_CONTEXT_LENGTH;

	@Parameter(property = "scriptor.adaptiveChunking", defaultValue = "false")
	private boolean adaptiveChunking;

	@Parameter(property = "scriptor.indentSize", defaultValue = "4")
	private int indentSize = 4;

	@Parameter(property = "scriptor.maxLineLength", defaultValue = "88")
	private int maxLineLength = 88;

	@Parameter(property = "scriptor.preserveComments", defaultValue = "true")
	private boolean preserveComments = true;

	@Parameter(property = "scriptor.preserveDocstrings", defaultValue = "true")
	private boolean preserveDocstrings = true;

	@Parameter(property = "scriptor.autoImportCommon", defaultValue = "true")
	private boolean autoImportCommon = true;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config" -> showConfig(getLog());
			case "translate" -> translate(getLog());
			default -> throw new MojoExecutionException(
				"Unknown action: " + this.action + ". Supported actions: show-config, translate"
			);
		}
	}

	private void showConfig(@Nonnull Log log) {
		log.info("Scriptor Plugin Configuration:");
		log.info(" - llmProvider: " + this.llmProvider);
		log.info(" - llmUrl: " + orNotSet(this.llmUrl));
		if (isBlank(this.llmUrl)) {
			log.warn("LLM url is not set");
		}
		log.info(" - llmToken: " + (isBlank(this.llmToken) ? "<not set>" : mask(this.llmToken)));
		if (isBlank(this.llmToken)) {
			log.warn("LLM token is not set");
		}
		log.info(" - llmModel: " + (isBlank(this.llmModel) ? "<provider default>" : this.llmModel));
		log.info(" - inputFile: " + orNotSet(this.inputFile));
		if (isBlank(this.inputFile)) {
			log.warn("Input file is not set");
		}
		log.info(" - outputFile: " + orNotSet(this.outputFile));
		if (isBlank(this.outputFile)) {
			log.warn("Output file is not set");
		}
		log.info(" - dryRun: " + this.dryRun);
		log.info(" - failOnChunkError: " + this.failOnChunkError);
		log.info(" - targetLanguage: " + this.targetLanguage);
		log.info(" - enableStreaming: " + this.enableStreaming);
		log.info(" - minFileSizeForStreaming: " + this.minFileSizeForStreaming);
		log.info(" - maxConcurrentChunks: " + this.maxConcurrentChunks);
		log.info(" - chunkTimeoutSeconds: " + this.chunkTimeoutSeconds);
		log.info(" - progressIntervalMillis: " + this.progressIntervalMillis);
		log.info(" - maintainContextWindow: " + this.maintainContextWindow);
		log.info(" - contextWindowSize: " + this.contextWindowSize);
		log.info(" - enableBackpressure: " + this.enableBackpressure);
		log.info(" - maxQueueSize: " + this.maxQueueSize);
		log.info(" - threadPoolSize: " + this.threadPoolSize);
		log.info(" - chunkSize: " + this.chunkSize);
		log.info(" - maxContextLength: " + this.maxContextLength);
		log.info(" - adaptiveChunking: " + this.adaptiveChunking);
		log.info(" - indentSize: " + this.indentSize);
		log.info(" - maxLineLength: " + this.maxLineLength);
		log.info(" - preserveComments: " + this.preserveComments);
		log.info(" - preserveDocstrings: " + this.preserveDocstrings);
		log.info(" - autoImportCommon: " + this.autoImportCommon);
	}

	private void translate(@Nonnull Log log) throws MojoExecutionException {
		if (isBlank(this.inputFile)) {
			throw new MojoExecutionException("Input file must be specified for translate action");
		}
		if (!this.dryRun && isBlank(this.outputFile)) {
			throw new MojoExecutionException("Output file must be specified for translate action");
		}
		if (!this.dryRun && isBlank(this.llmUrl)) {
			throw new MojoExecutionException("LLM URL must be specified for non-dry-run translate action");
		}

		final Path input = Path.of(this.inputFile).toAbsolutePath().normalize();
		if (!Files.isRegularFile(input)) {
			throw new MojoExecutionException("Input file does not exist or is not a file: " + input);
		}
		final String source;
		try {
			source = Files.readString(input, StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new MojoExecutionException("Failed to read " + input + ": " + e.getMessage(), e);
		}

		final StreamConfig streamConfig;
		final AssemblerConfig assemblerConfig;
		try {
			streamConfig = buildStreamConfig();
			assemblerConfig = new AssemblerConfig(
				this.indentSize, this.maxLineLength, this.preserveComments, this.preserveDocstrings, this.autoImportCommon
			);
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException("Invalid configuration: " + e.getMessage(), e);
		}

		final BlockParser parser = new PseudocodeParser(log);
		if (this.dryRun) {
			reportBlocks(log, input, parser.parse(source));
			return;
		}

		final ChatModel chatModel;
		try {
			chatModel = ChatModelFactory.create(this.llmProvider, this.llmUrl, this.llmToken, this.llmModel);
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException("Invalid LLM configuration: " + e.getMessage(), e);
		}
		try (StreamingPipeline pipeline = new StreamingPipeline(
			streamConfig,
			parser,
			new LlmCodeTranslator(chatModel, log),
			new CodeAssembler(assemblerConfig, log),
			new LoggingStreamEventListener(log),
			log
		)) {
			pipeline.addProgressCallback(progress -> log.info("[PROGRESS] " + progress));
			log.info("=== Translating " + input + " to " + this.targetLanguage + " ===");
			final StreamSummary summary = pipeline.stream(source, result -> {
				for (String warning : result.warnings()) {
					log.warn("[CHUNK " + result.index() + "] " + warning);
				}
			});
			final String program = pipeline.assembleStreamedCode();
			final Path written = new Writer().write(program, Path.of(this.outputFile));

			log.info("--- Translation Summary ---");
			log.info("Chunks: " + summary.totalChunks());
			log.info("Successful: " + summary.successfulChunks());
			log.info("Failed: " + summary.failedChunks() + " (timed out: " + summary.timedOutChunks() + ")");
			log.info("Warnings: " + summary.warnings().size());
			log.info("Output: " + written);
			if (summary.hasFailures() && this.failOnChunkError) {
				throw new MojoExecutionException(summary.failedChunks() + " chunk(s) failed: " + summary.errors());
			}
		} catch (AssemblyException e) {
			log.error(e.toReport());
			throw new MojoExecutionException("Assembly failed: " + e.getMessage(), e);
		} catch (IOException e) {
			throw new MojoExecutionException("Failed to write " + this.outputFile + ": " + e.getMessage(), e);
		}
	}

	@Nonnull
	private StreamConfig buildStreamConfig() {
		return StreamConfig.builder()
			.enableStreaming(this.enableStreaming)
			.minFileSizeForStreaming(this.minFileSizeForStreaming)
			.maxConcurrentChunks(this.maxConcurrentChunks)
			.chunkTimeout(Duration.ofSeconds(this.chunkTimeoutSeconds))
			.progressCallbackInterval(Duration.ofMillis(this.progressIntervalMillis))
			.maintainContextWindow(this.maintainContextWindow)
			.contextWindowSize(this.contextWindowSize)
			.enableBackpressure(this.enableBackpressure)
			.maxQueueSize(this.maxQueueSize)
			.threadPoolSize(this.threadPoolSize)
			.chunkSize(this.chunkSize)
			.maxContextLength(this.maxContextLength)
			.adaptiveChunking(this.adaptiveChunking)
			.targetLanguage(this.targetLanguage)
			.build();
	}

	private static void reportBlocks(@Nonnull Log log, @Nonnull Path input, @Nonnull ParseResult parsed) {
		log.info("--- Dry-run Summary for " + input + " ---");
		if (!parsed.success()) {
			parsed.errors().forEach(error -> log.error("Parse error: " + error));
			return;
		}
		final Map<BlockType, Integer> counts = new EnumMap<>(BlockType.class);
		for (CodeBlock block : parsed.blocks()) {
			counts.merge(block.type(), 1, Integer::sum);
		}
		for (BlockType type : BlockType.values()) {
			log.info(type + ": " + counts.getOrDefault(type, 0));
		}
		parsed.warnings().forEach(warning -> log.warn(warning));
	}

	@Nonnull
	static String mask(@Nullable String value) {
		if (value == null || value.length() <= 4) {
			return "****";
		}
		return "****" + value.substring(value.length() - 4);
	}

	@Nonnull
	private static String orNotSet(@Nullable String value) {
		return isBlank(value) ? "<not set>" : value;
	}

	private static boolean isBlank(@Nullable String value) {
		return value == null || value.isBlank();
	}

	// Setters for tests (package-private)
	void setAction(@Nullable String action) { this.action = action; }
	void setLlmProvider(@Nullable String llmProvider) { this.llmProvider = llmProvider; }
	void setLlmUrl(@Nullable String llmUrl) { this.llmUrl = llmUrl; }
	void setLlmToken(@Nullable String llmToken) { this.llmToken = llmToken; }
	void setLlmModel(@Nullable String llmModel) { this.llmModel = llmModel; }
	void setInputFile(@Nullable String inputFile) { this.inputFile = inputFile; }
	void setOutputFile(@Nullable String outputFile) { this.outputFile = outputFile; }
	void setDryRun(boolean dryRun) { this.dryRun = dryRun; }
	void setMaxConcurrentChunks(int maxConcurrentChunks) { this.maxConcurrentChunks = maxConcurrentChunks; }
	void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }
	void setIndentSize(int indentSize) { this.indentSize = indentSize; }
}
