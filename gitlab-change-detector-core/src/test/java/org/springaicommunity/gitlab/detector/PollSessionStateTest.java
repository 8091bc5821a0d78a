package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PollSessionState Tests")
class PollSessionStateTest {

	private static final List<RepositoryTarget> TARGETS = List.of(RepositoryTarget.of(101, "main"),
			RepositoryTarget.of(202, "main"));

	@Nested
	@DisplayName("Validation Tests")
	class ValidationTest {

		@ParameterizedTest
		@ValueSource(ints = { 0, -1 })
		@DisplayName("Should reject a cycle budget below one")
		void shouldRejectBudgetBelowOne(int budget) {
			assertThatThrownBy(() -> PollSessionState.start("s1", TARGETS, null, budget, Duration.ZERO))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("at least 1");
		}

		@Test
		@DisplayName("Should reject a negative interval")
		void shouldRejectNegativeInterval() {
			assertThatThrownBy(() -> PollSessionState.start("s1", TARGETS, null, 3, Duration.ofSeconds(-1)))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should reject attempts beyond the budget")
		void shouldRejectAttemptsBeyondBudget() {
			assertThatThrownBy(() -> new PollSessionState("s1", TARGETS, null, 4, 3, Duration.ZERO, List.of()))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should generate a session id when none is given")
		void shouldGenerateSessionId() {
			PollSessionState state = PollSessionState.start(TARGETS, null, 3, Duration.ZERO);

			assertThat(state.sessionId()).isNotBlank();
			assertThat(state.cyclesAttempted()).isZero();
			assertThat(state.changedRepositories()).isEmpty();
			assertThat(state.isFinished()).isFalse();
			assertThat(state.remainingCycles()).isEqualTo(3);
		}

		@Test
		@DisplayName("Should keep map iteration order for targets")
		void shouldKeepMapOrder() {
			Map<String, String> branches = new LinkedHashMap<>();
			branches.put("group/project", "main");
			branches.put("2949", "master");

			PollSessionState state = PollSessionState.start("s1", branches, null, 3, Duration.ZERO);

			assertThat(state.targets()).containsExactly(new RepositoryTarget("group/project", "main"),
					new RepositoryTarget("2949", "master"));
		}

	}

	@Nested
	@DisplayName("Transition Tests")
	class TransitionTest {

		@Test
		@DisplayName("Should count attempts and finish when the budget is spent")
		void shouldFinishWhenBudgetSpent() {
			PollSessionState state = PollSessionState.start("s1", TARGETS, null, 2, Duration.ZERO);

			PollSessionState first = state.afterCycle(List.of());
			PollSessionState second = first.afterCycle(List.of());

			assertThat(first.cyclesAttempted()).isEqualTo(1);
			assertThat(first.isFinished()).isFalse();
			assertThat(second.cyclesAttempted()).isEqualTo(2);
			assertThat(second.isFinished()).isTrue();
			assertThat(second.changedRepositories()).isEmpty();
			assertThatThrownBy(() -> second.afterCycle(List.of())).isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should finish as soon as a change is recorded")
		void shouldFinishOnChange() {
			PollSessionState state = PollSessionState.start("s1", TARGETS, null, 5, Duration.ZERO);

			PollSessionState next = state.afterCycle(List.of("202"));

			assertThat(next.isFinished()).isTrue();
			assertThat(next.changedRepositories()).containsExactly("202");
			assertThat(state.changedRepositories()).isEmpty();
		}

		@Test
		@DisplayName("Should keep earlier changes and never duplicate them")
		void shouldBeMonotonicWithoutDuplicates() {
			PollSessionState resumed = new PollSessionState("s1", TARGETS, null, 1, 5, Duration.ZERO,
					List.of("101", "101"));
			assertThat(resumed.changedRepositories()).containsExactly("101");

			PollSessionState next = new PollSessionState("s1", TARGETS, null, 1, 5, Duration.ZERO, List.of())
				.afterCycle(List.of("202", "101", "202"));

			assertThat(next.changedRepositories()).containsExactly("202", "101");
		}

	}

	@Nested
	@DisplayName("Serialization Tests")
	class SerializationTest {

		private final ObjectMapper objectMapper = ObjectMapperFactory.create();

		@Test
		@DisplayName("Should round-trip through JSON with snake_case keys")
		void shouldRoundTripThroughJson() throws Exception {
			PollSessionState state = PollSessionState
				.start("nightly", TARGETS, "2024-01-01T00:00:00+02:00", 10, Duration.ofMinutes(1))
				.afterCycle(List.of());

			String json = objectMapper.writeValueAsString(state);
			JsonNode tree = objectMapper.readTree(json);

			assertThat(tree.fieldNames()).toIterable()
				.containsExactlyInAnyOrder("session_id", "targets", "since", "cycles_attempted", "max_cycles",
						"check_interval", "changed_repositories");
			assertThat(tree.get("check_interval").asText()).isEqualTo("PT1M");
			assertThat(tree.get("targets").get(0).get("project_id").asText()).isEqualTo("101");
			assertThat(objectMapper.readValue(json, PollSessionState.class)).isEqualTo(state);
		}

		@Test
		@DisplayName("Should round-trip a state without since")
		void shouldRoundTripWithoutSince() throws Exception {
			PollSessionState state = PollSessionState.start("nightly", TARGETS, null, 3, Duration.ZERO);

			PollSessionState restored = objectMapper.readValue(objectMapper.writeValueAsString(state),
					PollSessionState.class);

			assertThat(restored).isEqualTo(state);
			assertThat(restored.since()).isNull();
		}

	}

}
