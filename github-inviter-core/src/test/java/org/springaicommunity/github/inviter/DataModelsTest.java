package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for data model records and enums.
 */
@DisplayName("Data Models Tests")
class DataModelsTest {

	private ObjectMapper objectMapper;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
	}

	@Nested
	@DisplayName("RepositoryTarget Tests")
	class RepositoryTargetTest {

		@Test
		@DisplayName("Should split owner and repository")
		void shouldParse() {
			RepositoryTarget target = RepositoryTarget.parse(" spring-projects/spring-ai ");

			assertThat(target.owner()).isEqualTo("spring-projects");
			assertThat(target.repo()).isEqualTo("spring-ai");
			assertThat(target).hasToString("spring-projects/spring-ai");
		}

		@ParameterizedTest
		@ValueSource(strings = { "", "acme", "acme/", "/widgets", "a/b/c", " / " })
		@DisplayName("Should reject malformed targets")
		void shouldRejectMalformed(String value) {
			assertThatThrownBy(() -> RepositoryTarget.parse(value)).isInstanceOf(InvalidTargetException.class)
				.hasMessageContaining("owner/repo")
				.satisfies(e -> assertThat(((InvalidTargetException) e).getTarget()).isEqualTo(value));
		}

	}

	@Nested
	@DisplayName("Permission and Role Tests")
	class PermissionTest {

		@ParameterizedTest
		@CsvSource({ "read, READ", "WRITE, WRITE", "Admin, ADMIN" })
		@DisplayName("Should parse repository permissions ignoring case")
		void shouldParsePermission(String value, RepositoryPermission expected) {
			assertThat(RepositoryPermission.fromValue(value)).isEqualTo(expected);
		}

		@Test
		@DisplayName("Should reject unknown repository permissions")
		void shouldRejectPermission() {
			assertThatThrownBy(() -> RepositoryPermission.fromValue("maintain"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Invalid permission 'maintain': must be 'read', 'write', or 'admin'");
		}

		@Test
		@DisplayName("Should parse organization roles and reject others")
		void shouldParseRole() {
			assertThat(OrganizationRole.fromValue("member")).isEqualTo(OrganizationRole.MEMBER);
			assertThat(OrganizationRole.fromValue("ADMIN")).isEqualTo(OrganizationRole.ADMIN);
			assertThatThrownBy(() -> OrganizationRole.fromValue("owner")).isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Invalid role 'owner': must be 'member' or 'admin'");
		}

	}

	@Nested
	@DisplayName("InvitationRequest Tests")
	class InvitationRequestTest {

		@Test
		@DisplayName("Should trim values and copy usernames")
		void shouldNormalize() {
			List<String> usernames = new ArrayList<>(List.of(" alice ", "bob"));
			InvitationRequest request = new InvitationRequest(usernames, " acme/widgets ", " write ");
			usernames.add("mallory");

			assertThat(request.usernames()).containsExactly("alice", "bob");
			assertThat(request.target()).isEqualTo("acme/widgets");
			assertThat(request.permission()).isEqualTo("write");
		}

		@Test
		@DisplayName("Should require at least one non-blank username")
		void shouldRequireUsernames() {
			assertThatThrownBy(() -> new InvitationRequest(List.of(), "acme/widgets", "write"))
				.isInstanceOf(IllegalArgumentException.class);
			assertThatThrownBy(() -> new InvitationRequest(List.of("alice", " "), "acme/widgets", "write"))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should reject an empty target")
		void shouldRejectEmptyTarget() {
			assertThatThrownBy(() -> new InvitationRequest(List.of("alice"), "", "write"))
				.isInstanceOf(InvalidTargetException.class)
				.hasMessage("target_name must not be empty");
		}

	}

	@Nested
	@DisplayName("BatchResult Tests")
	class BatchResultTest {

		@Test
		@DisplayName("Should count info as successful")
		void shouldCountOutcomes() {
			BatchResult result = BatchResult.fromOutcomes(List.of(InvitationOutcome.success("a", "ok"),
					InvitationOutcome.info("b", "already"), InvitationOutcome.error("c", "boom")));

			assertThat(result.successful()).isEqualTo(2);
			assertThat(result.failed()).isEqualTo(1);
			assertThat(result.results()).hasSize(3);
		}

		@Test
		@DisplayName("Should reject inconsistent counts")
		void shouldRejectInconsistentCounts() {
			assertThatThrownBy(() -> new BatchResult(List.of(InvitationOutcome.success("a", "ok")), 1, 1))
				.isInstanceOf(IllegalArgumentException.class);
		}

		@Test
		@DisplayName("Should serialize with lowercase statuses")
		void shouldSerialize() throws Exception {
			BatchResult result = BatchResult.fromOutcomes(List.of(InvitationOutcome.error("ghost", "missing")));

			JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(result));

			assertThat(json.path("results").get(0).path("username").asText()).isEqualTo("ghost");
			assertThat(json.path("results").get(0).path("status").asText()).isEqualTo("error");
			assertThat(json.path("results").get(0).path("message").asText()).isEqualTo("missing");
			assertThat(json.path("successful").asInt()).isZero();
			assertThat(json.path("failed").asInt()).isEqualTo(1);
		}

		@Test
		@DisplayName("Should expose an immutable results list")
		void shouldBeImmutable() {
			BatchResult result = BatchResult.fromOutcomes(new ArrayList<>(List.of(InvitationOutcome.success("a", "ok"))));

			assertThatThrownBy(() -> result.results().add(InvitationOutcome.success("b", "ok")))
				.isInstanceOf(UnsupportedOperationException.class);
		}

	}

	@Nested
	@DisplayName("RateLimitInfo Tests")
	class RateLimitInfoTest {

		@Test
		@DisplayName("Should start with full default quota")
		void shouldStartWithDefaults() {
			RateLimitInfo info = RateLimitInfo.initial();

			assertThat(info.remaining()).isEqualTo(5000);
			assertThat(info.isExceeded()).isFalse();
		}

		@Test
		@DisplayName("Should report exhaustion and reset time")
		void shouldReportExhaustion() {
			RateLimitInfo info = new RateLimitInfo(5000, 0, 1_700_000_000L, 5000);

			assertThat(info.isExceeded()).isTrue();
			assertThat(info.getResetTime().getEpochSecond()).isEqualTo(1_700_000_000L);
		}

	}

}
