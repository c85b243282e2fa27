package io.evitadb.scriptor.llm;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads prompt templates from {@code META-INF/prompts/} on the classpath and fills in their placeholders.
 * Placeholders have the form {@code {{name}}}; placeholders without a value are left untouched.
 * Loaded templates are cached per instance.
 */
public final class PromptLoader {

	private static final String PROMPTS_PATH = "META-INF/prompts/";
	private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{(\\w+)}}");

	private final Map<String, String> templates = new ConcurrentHashMap<>();

	/**
	 * Returns the template with the given file name.
	 *
	 * @param templateName file name under {@code META-INF/prompts/}
	 * @return template text with line endings normalized to {@code \n}
	 * @throws IllegalArgumentException if the template does not exist or cannot be read
	 */
	@Nonnull
	public String loadTemplate(@Nonnull String templateName) {
		Objects.requireNonNull(templateName, "templateName must not be null");
		return this.templates.computeIfAbsent(templateName, PromptLoader::readTemplate);
	}

	/**
	 * Returns the template with its placeholders replaced.
	 *
	 * @param templateName file name under {@code META-INF/prompts/}
	 * @param values       placeholder values keyed by placeholder name
	 * @return rendered prompt
	 */
	@Nonnull
	public String render(@Nonnull String templateName, @Nonnull Map<String, String> values) {
		return interpolate(loadTemplate(templateName), values);
	}

	/**
	 * Replaces {@code {{name}}} placeholders in the template.
	 *
	 * @param template template text
	 * @param values   placeholder values keyed by placeholder name
	 * @return interpolated text
	 */
	@Nonnull
	public static String interpolate(@Nonnull String template, @Nonnull Map<String, String> values) {
		Objects.requireNonNull(template, "template must not be null");
		Objects.requireNonNull(values, "values must not be null");

		final Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
		final StringBuilder result = new StringBuilder();
		while (matcher.find()) {
			final String value = values.get(matcher.group(1));
			matcher.appendReplacement(result, Matcher.quoteReplacement(value == null ? matcher.group() : value));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	@Nonnull
	private static String readTemplate(@Nonnull String templateName) {
		final String resourcePath = PROMPTS_PATH + templateName;
		try (InputStream inputStream = PromptLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
			if (inputStream == null) {
				throw new IllegalArgumentException("Prompt template not found: " + resourcePath);
			}
			return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8)
				.replace("\r\n", "\n")
				.stripTrailing();
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read prompt template: " + resourcePath, e);
		}
	}
}
