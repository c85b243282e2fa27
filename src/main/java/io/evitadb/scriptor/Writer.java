package io.evitadb.scriptor;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Writes the assembled program to the target file in UTF-8, creating missing parent directories.
 */
public final class Writer {

	/**
	 * Writes the program text, replacing any existing file.
	 *
	 * @param program    assembled program text
	 * @param targetFile file to write
	 * @return absolute normalized path of the written file
	 * @throws IOException if the directories cannot be created or the file cannot be written
	 */
	@Nonnull
	public Path write(@Nonnull String program, @Nonnull Path targetFile) throws IOException {
		Objects.requireNonNull(program, "program must not be null");
		Objects.requireNonNull(targetFile, "targetFile must not be null");

		final Path absolute = targetFile.toAbsolutePath().normalize();
		final Path parent = absolute.getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		Files.write(absolute, program.getBytes(StandardCharsets.UTF_8));
		return absolute;
	}
}
