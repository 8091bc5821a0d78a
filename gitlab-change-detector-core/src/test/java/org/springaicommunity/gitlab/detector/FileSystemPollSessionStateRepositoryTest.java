package org.springaicommunity.gitlab.detector;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FileSystemPollSessionStateRepository}.
 */
@DisplayName("FileSystemPollSessionStateRepository Tests")
class FileSystemPollSessionStateRepositoryTest {

	@TempDir
	Path tempDir;

	private Path stateDir;

	private FileSystemPollSessionStateRepository repository;

	private PollSessionState state;

	@BeforeEach
	void setUp() {
		stateDir = tempDir.resolve("sessions");
		repository = new FileSystemPollSessionStateRepository(stateDir, ObjectMapperFactory.create());
		state = PollSessionState
			.start("nightly", List.of(RepositoryTarget.of(2949, "master"), new RepositoryTarget("group/app", "main")),
					"2024-01-01T00:00:00Z", 10, Duration.ofMinutes(1))
			.afterCycle(List.of());
	}

	@Nested
	@DisplayName("Save and Load Tests")
	class SaveAndLoadTest {

		@Test
		@DisplayName("Should create the directory and write one file per session")
		void shouldWriteSessionFile() {
			repository.save(state);

			assertThat(stateDir.resolve("nightly.json")).exists();
			assertThat(stateDir).isDirectoryNotContaining("glob:**.tmp");
		}

		@Test
		@DisplayName("Should load what was saved")
		void shouldLoadSavedState() {
			repository.save(state);

			assertThat(repository.load("nightly")).contains(state);
		}

		@Test
		@DisplayName("Should replace an older checkpoint")
		void shouldReplaceOlderCheckpoint() {
			repository.save(state);
			PollSessionState later = state.afterCycle(List.of());

			repository.save(later);

			assertThat(repository.load("nightly")).hasValueSatisfying(
					loaded -> assertThat(loaded.cyclesAttempted()).isEqualTo(2));
		}

		@Test
		@DisplayName("Should return empty for an unknown session")
		void shouldReturnEmptyForUnknownSession() {
			assertThat(repository.load("unknown")).isEmpty();
		}

		@Test
		@DisplayName("Should report a corrupt checkpoint")
		void shouldReportCorruptCheckpoint() throws Exception {
			Files.createDirectories(stateDir);
			Files.writeString(stateDir.resolve("broken.json"), "{not json");

			assertThatThrownBy(() -> repository.load("broken")).isInstanceOf(UncheckedIOException.class)
				.hasMessageContaining("broken.json");
		}

	}

	@Nested
	@DisplayName("Delete Tests")
	class DeleteTest {

		@Test
		@DisplayName("Should delete a saved session")
		void shouldDeleteSavedSession() {
			repository.save(state);

			repository.delete("nightly");

			assertThat(stateDir.resolve("nightly.json")).doesNotExist();
			assertThat(repository.load("nightly")).isEmpty();
		}

		@Test
		@DisplayName("Should ignore deleting an unknown session")
		void shouldIgnoreUnknownSession() {
			assertThatCode(() -> repository.delete("unknown")).doesNotThrowAnyException();
		}

	}

	@Test
	@DisplayName("Should refuse session ids that escape the directory")
	void shouldRefuseUnsafeSessionIds() {
		assertThatThrownBy(() -> repository.load("../outside")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> repository.delete("a/b")).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("In-memory repository should behave the same")
	void inMemoryRepositoryShouldBehaveTheSame() {
		InMemoryPollSessionStateRepository memory = new InMemoryPollSessionStateRepository();

		memory.save(state);
		assertThat(memory.load("nightly")).contains(state);

		memory.delete("nightly");
		assertThat(memory.load("nightly")).isEmpty();
	}

}
