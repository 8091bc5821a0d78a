package org.springaicommunity.gitlab.detector;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChangeDetectionSensor Tests")
class ChangeDetectionSensorTest {

	private static final String SINCE = "2024-01-01T00:00:00Z";

	private static final RepositoryTarget REPO_101 = RepositoryTarget.of(101, "main");

	private static final RepositoryTarget REPO_202 = RepositoryTarget.of(202, "main");

	@Mock
	private GitLabClient client;

	private static CommitResult changed() {
		return CommitResult.success(List.of(new Commit("abc", "abc", "Fix build", "Example User",
				"2024-01-02T10:00:00Z", "https://gitlab.example.com/commit/abc")));
	}

	@Test
	@DisplayName("Should query each target once with the blocking client")
	void shouldQueryEachTargetOnce() {
		when(client.getCommits(REPO_101, SINCE)).thenReturn(CommitResult.success(List.of()));
		when(client.getCommits(REPO_202, SINCE)).thenReturn(changed());

		List<String> changed = new ChangeDetectionSensor(client).poke(List.of(REPO_101, REPO_202), SINCE);

		assertThat(changed).containsExactly("202");
		InOrder inOrder = inOrder(client);
		inOrder.verify(client).getCommits(REPO_101, SINCE);
		inOrder.verify(client).getCommits(REPO_202, SINCE);
		verifyNoMoreInteractions(client);
	}

	@Test
	@DisplayName("Should report no changes when every query fails")
	void shouldReportNoChangesOnFailures() {
		when(client.getCommits(REPO_101, SINCE)).thenReturn(CommitResult.notSucceeded());
		when(client.getCommits(REPO_202, SINCE))
			.thenReturn(CommitResult.transportError(new IOException("Connection refused")));

		assertThat(new ChangeDetectionSensor(client).poke(List.of(REPO_101, REPO_202), SINCE)).isEmpty();
	}

	@Test
	@DisplayName("Should return nothing for no targets")
	void shouldReturnNothingForNoTargets() {
		assertThat(new ChangeDetectionSensor(client).poke(List.of(), SINCE)).isEmpty();
		verifyNoInteractions(client);
	}

}
