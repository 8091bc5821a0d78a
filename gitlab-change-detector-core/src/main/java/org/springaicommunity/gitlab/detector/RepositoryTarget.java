package org.springaicommunity.gitlab.detector;

/**
 * A GitLab project and the branch watched on it.
 *
 * @param projectId numeric project id ({@code "2949"}) or namespaced path
 * ({@code "group/project"})
 * @param branch branch name passed as {@code ref_name}
 */
public record RepositoryTarget(String projectId, String branch) {

	public RepositoryTarget {
		if (projectId == null || projectId.isBlank()) {
			throw new IllegalArgumentException("Project id cannot be blank");
		}
		if (branch == null || branch.isBlank()) {
			throw new IllegalArgumentException("Branch cannot be blank for project " + projectId);
		}
	}

	public static RepositoryTarget of(long projectId, String branch) {
		return new RepositoryTarget(Long.toString(projectId), branch);
	}

	@Override
	public String toString() {
		return projectId + "@" + branch;
	}

}
