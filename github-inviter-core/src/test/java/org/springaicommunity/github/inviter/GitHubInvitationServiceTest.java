package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for GitHubInvitationService with a mocked GitHubClient.
 */
@DisplayName("GitHubInvitationService Tests")
@ExtendWith(MockitoExtension.class)
class GitHubInvitationServiceTest {

	@Mock
	private GitHubClient mockClient;

	private ObjectMapper objectMapper;

	private GitHubInvitationService service;

	@BeforeEach
	void setUp() {
		objectMapper = ObjectMapperFactory.create();
		service = new GitHubInvitationService(mockClient, objectMapper);
	}

	private JsonNode json(String content) throws Exception {
		return objectMapper.readTree(content);
	}

	private static ResourceNotFoundException notFound(String path) {
		return new ResourceNotFoundException("Not found: GET " + path, StubGitHubServer.NOT_FOUND_BODY, 4999, 0);
	}

	@Nested
	@DisplayName("User Lookup Tests")
	class UserLookupTest {

		@Test
		@DisplayName("Should return the user document")
		void shouldReturnUser() throws Exception {
			when(mockClient.get("/users/alice")).thenReturn(json("{\"login\":\"alice\",\"id\":1}"));

			JsonNode user = service.getUserInfo("alice");

			assertThat(user.path("login").asText()).isEqualTo("alice");
		}

		@Test
		@DisplayName("Should name the user when not found")
		void shouldNameMissingUser() {
			when(mockClient.get("/users/ghost")).thenThrow(notFound("/users/ghost"));

			assertThatThrownBy(() -> service.getUserInfo("ghost")).isInstanceOf(ResourceNotFoundException.class)
				.hasMessage("User 'ghost' not found or doesn't exist")
				.satisfies(e -> assertThat(((GitHubApiException) e).getStatusCode()).isEqualTo(404));
		}

		@Test
		@DisplayName("Should encode path segments")
		void shouldEncodeSegments() throws Exception {
			when(mockClient.get("/users/a%20b")).thenReturn(json("{}"));

			service.getUserInfo("a b");

			verify(mockClient).get("/users/a%20b");
		}

		@Test
		@DisplayName("Should propagate other failures unchanged")
		void shouldPropagateOtherFailures() {
			GitHubApiException failure = new GitHubApiException("GitHub API error: boom", 500, "boom");
			when(mockClient.get("/users/alice")).thenThrow(failure);

			assertThatThrownBy(() -> service.getUserInfo("alice")).isSameAs(failure);
		}

	}

	@Nested
	@DisplayName("Repository Invitation Tests")
	class RepositoryInvitationTest {

		@Test
		@DisplayName("Should look up the user before adding the collaborator")
		void shouldLookUpThenInvite() throws Exception {
			when(mockClient.get("/users/alice")).thenReturn(json("{\"login\":\"alice\"}"));
			when(mockClient.put(eq("/repos/acme/widgets/collaborators/alice"), any()))
				.thenReturn(json("{\"id\":7,\"state\":\"pending\"}"));

			JsonNode response = service.inviteToRepository("acme", "widgets", "alice", RepositoryPermission.WRITE);

			assertThat(response.path("state").asText()).isEqualTo("pending");
			InOrder inOrder = inOrder(mockClient);
			inOrder.verify(mockClient).get("/users/alice");
			inOrder.verify(mockClient)
				.put("/repos/acme/widgets/collaborators/alice", Map.of("permission", "write"));
		}

		@Test
		@DisplayName("Should not write when the user does not exist")
		void shouldNotWriteForUnknownUser() {
			when(mockClient.get("/users/ghost")).thenThrow(notFound("/users/ghost"));

			assertThatThrownBy(() -> service.inviteToRepository("acme", "widgets", "ghost", RepositoryPermission.READ))
				.isInstanceOf(ResourceNotFoundException.class);

			verify(mockClient, never()).put(anyString(), any());
		}

	}

	@Nested
	@DisplayName("Organization Invitation Tests")
	class OrganizationInvitationTest {

		@Test
		@DisplayName("Should invite when no membership exists")
		void shouldInviteWithoutMembership() throws Exception {
			when(mockClient.get("/users/alice")).thenReturn(json("{\"login\":\"alice\"}"));
			when(mockClient.get("/orgs/acme/memberships/alice")).thenThrow(notFound("/orgs/acme/memberships/alice"));
			when(mockClient.put(eq("/orgs/acme/memberships/alice"), any()))
				.thenReturn(json("{\"state\":\"pending\",\"role\":\"member\"}"));

			JsonNode response = service.inviteToOrganization("acme", "alice", OrganizationRole.MEMBER);

			assertThat(response.path("state").asText()).isEqualTo("pending");
			verify(mockClient).put("/orgs/acme/memberships/alice", Map.of("role", "member"));
		}

		@Test
		@DisplayName("Should not write when the user is already an active member")
		void shouldSkipActiveMember() throws Exception {
			when(mockClient.get("/users/alice")).thenReturn(json("{\"login\":\"alice\"}"));
			when(mockClient.get("/orgs/acme/memberships/alice")).thenReturn(json("{\"state\":\"active\"}"));

			JsonNode response = service.inviteToOrganization("acme", "alice", OrganizationRole.ADMIN);

			assertThat(response.path("state").asText()).isEqualTo("active");
			assertThat(response.path("message").asText()).isEqualTo("User is already active in the organization");
			verify(mockClient, never()).put(anyString(), any());
		}

		@Test
		@DisplayName("Should not write when an invitation is already pending")
		void shouldSkipPendingMember() throws Exception {
			when(mockClient.get("/users/bob")).thenReturn(json("{\"login\":\"bob\"}"));
			when(mockClient.get("/orgs/acme/memberships/bob")).thenReturn(json("{\"state\":\"pending\"}"));

			JsonNode response = service.inviteToOrganization("acme", "bob", OrganizationRole.MEMBER);

			assertThat(response.path("state").asText()).isEqualTo("pending");
			verify(mockClient, never()).put(anyString(), any());
		}

		@Test
		@DisplayName("Should propagate membership lookup failures other than not found")
		void shouldPropagateLookupFailure() throws Exception {
			when(mockClient.get("/users/alice")).thenReturn(json("{\"login\":\"alice\"}"));
			when(mockClient.get("/orgs/acme/memberships/alice"))
				.thenThrow(new GitHubApiException("GitHub API error: forbidden", 403, "forbidden"));

			assertThatThrownBy(() -> service.inviteToOrganization("acme", "alice", OrganizationRole.MEMBER))
				.isInstanceOf(GitHubApiException.class)
				.hasMessageContaining("forbidden");

			verify(mockClient, never()).put(anyString(), any());
		}

	}

}
