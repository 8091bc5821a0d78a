package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * File system implementation of {@link PollSessionStateRepository}.
 *
 * <p>
 * Each session is stored as {@code <directory>/<sessionId>.json}. Writes go to a
 * temporary file first and are moved into place, so a crash mid-write leaves the previous
 * checkpoint intact.
 */
public class FileSystemPollSessionStateRepository implements PollSessionStateRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemPollSessionStateRepository.class);

	private static final Pattern SAFE_SESSION_ID = Pattern.compile("[A-Za-z0-9._-]+");

	private final Path directory;

	private final ObjectMapper objectMapper;

	public FileSystemPollSessionStateRepository(Path directory, ObjectMapper objectMapper) {
		this.directory = directory;
		this.objectMapper = objectMapper;
	}

	public Path getDirectory() {
		return directory;
	}

	@Override
	public void save(PollSessionState state) {
		Path target = fileFor(state.sessionId());
		try {
			Files.createDirectories(directory);
			Path temp = Files.createTempFile(directory, state.sessionId(), ".tmp");
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), state);
			Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			logger.debug("Saved session {} after cycle {}/{} to {}", state.sessionId(), state.cyclesAttempted(),
					state.maxCycles(), target);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to save session state: " + target, e);
		}
	}

	@Override
	public Optional<PollSessionState> load(String sessionId) {
		Path source = fileFor(sessionId);
		if (!Files.exists(source)) {
			return Optional.empty();
		}
		try {
			PollSessionState state = objectMapper.readValue(source.toFile(), PollSessionState.class);
			logger.info("Loaded session {} at cycle {}/{} from {}", sessionId, state.cyclesAttempted(),
					state.maxCycles(), source);
			return Optional.of(state);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to read session state: " + source, e);
		}
	}

	@Override
	public void delete(String sessionId) {
		Path file = fileFor(sessionId);
		try {
			if (Files.deleteIfExists(file)) {
				logger.debug("Deleted session state {}", file);
			}
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to delete session state: " + file, e);
		}
	}

	private Path fileFor(String sessionId) {
		if (!SAFE_SESSION_ID.matcher(sessionId).matches()) {
			throw new IllegalArgumentException(
					"Session id may only contain letters, digits, '.', '_' and '-': " + sessionId);
		}
		return directory.resolve(sessionId + ".json");
	}

}
