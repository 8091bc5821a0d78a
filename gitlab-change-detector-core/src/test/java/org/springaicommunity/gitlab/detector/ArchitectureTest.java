package org.springaicommunity.gitlab.detector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import java.nio.file.Path;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link GitLabClient} - commit queries against GitLab</li>
 * <li>{@link PollSessionStateRepository} - session checkpoints</li>
 * <li>{@link ChangeNotificationPublisher} - downstream delivery of changes</li>
 * </ul>
 *
 * <h3>Implementations</h3>
 * <ul>
 * <li>{@link GitLabHttpClient} - JDK HttpClient implementation</li>
 * <li>{@link FileSystemPollSessionStateRepository},
 * {@link InMemoryPollSessionStateRepository} - checkpoint stores</li>
 * <li>{@link PrintStreamChangeNotificationPublisher} - JSON lines publisher</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Poller / Sensor → Interfaces (NOT concrete implementations)
 *   Models → nothing but other models
 *   Only the builder and the Spring configuration pick implementations
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.gitlab.detector", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule detection_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameStartingWith("ChangeDetection")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("GitLabHttpClient")
		.because("The poller and the sensor should depend on the GitLabClient interface");

	@ArchTest
	static final ArchRule poller_should_not_depend_on_file_system_repository = noClasses().that()
		.haveSimpleNameStartingWith("ChangeDetection")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("FileSystemPollSessionStateRepository")
		.because("The poller should depend on the PollSessionStateRepository interface");

	@ArchTest
	static final ArchRule poller_should_not_do_direct_file_io = noClasses().that()
		.haveSimpleNameStartingWith("ChangeDetection")
		.should()
		.accessClassesThat()
		.resideInAPackage("java.nio.file")
		.because("Checkpoints go through PollSessionStateRepository");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule gitlab_clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("Client")
		.and()
		.haveSimpleNameStartingWith("GitLab")
		.and()
		.doNotHaveSimpleName("GitLabClient")
		.should()
		.implement(GitLabClient.class)
		.because("All GitLab*Client classes should implement the GitLabClient interface");

	@ArchTest
	static final ArchRule state_repositories_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("StateRepository")
		.and()
		.doNotHaveSimpleName("PollSessionStateRepository")
		.should()
		.implement(PollSessionStateRepository.class)
		.because("All *StateRepository classes should implement PollSessionStateRepository");

	@ArchTest
	static final ArchRule publishers_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("Publisher")
		.and()
		.doNotHaveSimpleName("ChangeNotificationPublisher")
		.should()
		.implement(ChangeNotificationPublisher.class)
		.because("All *Publisher classes should implement ChangeNotificationPublisher");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Result")
		.or()
		.haveSimpleNameEndingWith("State")
		.or()
		.haveSimpleNameEndingWith("Event")
		.or()
		.haveSimpleName("Commit")
		.or()
		.haveSimpleName("RepositoryTarget")
		.or()
		.haveSimpleName("ChangeNotification")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Client")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Poller")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Repository")
		.because("Model classes should be pure data without service dependencies");

	// ========== Framework Rules ==========

	@ArchTest
	static final ArchRule only_configuration_should_use_spring = noClasses().that()
		.doNotHaveSimpleName("ChangeDetectorConfig")
		.should()
		.dependOnClassesThat()
		.resideInAPackage("org.springframework..")
		.because("Spring is optional; everything but ChangeDetectorConfig must work without it");

	@ArchTest
	static final ArchRule support_classes_should_not_depend_on_detection = noClasses().that()
		.haveSimpleNameEndingWith("Utils")
		.or()
		.haveSimpleNameEndingWith("Parser")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameStartingWith("ChangeDetection")
		.because("Support/utility classes should not depend on higher-level services");

	@ArchTest
	static final ArchRule only_builder_and_config_should_instantiate_implementations = noClasses().that()
		.doNotHaveSimpleName("ChangeDetectorBuilder")
		.and()
		.doNotHaveSimpleName("ChangeDetectorConfig")
		.and()
		.doNotHaveSimpleName("GitLabHttpClient")
		.should()
		.callConstructor(GitLabHttpClient.class, GitLabConfig.class, ObjectMapper.class)
		.orShould()
		.callConstructor(FileSystemPollSessionStateRepository.class, Path.class,
				ObjectMapper.class)
		.because("Only ChangeDetectorBuilder and ChangeDetectorConfig should create concrete implementations");

}
