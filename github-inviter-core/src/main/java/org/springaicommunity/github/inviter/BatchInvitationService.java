package org.springaicommunity.github.inviter;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Invites a list of users to a repository or organization, one user at a time.
 *
 * <p>
 * Each user's attempt is classified as success, info or error; a failure for one user
 * never stops the batch. The target and permission are validated before the first
 * network call, and a malformed target aborts the whole batch with
 * {@link InvalidTargetException}.
 *
 * <p>
 * Between two users the service pauses for the configured inter-request delay to stay
 * under GitHub's abuse limits. This pacing is independent of the reactive rate limit
 * handling in {@link GitHubHttpClient}. If the calling thread is interrupted, whether
 * between users or inside an upstream call, the batch stops and throws
 * {@link BatchCancelledException}; the interrupted user is not recorded.
 */
public class BatchInvitationService {

	private static final Logger logger = LoggerFactory.getLogger(BatchInvitationService.class);

	static final String INVITATION_SENT = "Invitation sent successfully";

	static final String ALREADY_COLLABORATOR = "User is already a collaborator";

	private final InvitationService invitationService;

	private final Duration interRequestDelay;

	private final Sleeper sleeper;

	public BatchInvitationService(InvitationService invitationService, Duration interRequestDelay, Sleeper sleeper) {
		if (interRequestDelay.isNegative()) {
			throw new IllegalArgumentException("interRequestDelay must not be negative");
		}
		this.invitationService = invitationService;
		this.interRequestDelay = interRequestDelay;
		this.sleeper = sleeper;
	}

	/**
	 * Invite users to a repository or organization.
	 * @param usernames users to invite, in order
	 * @param target repository ({@code owner/repo}) or organization name
	 * @param permission repository permission or organization role
	 * @param mode what to invite to
	 * @return one outcome per username, in input order
	 * @throws InvalidTargetException if the target is malformed
	 * @throws IllegalArgumentException if the permission is not valid for the mode
	 * @throws BatchCancelledException if the calling thread is interrupted
	 */
	public BatchResult batchInvite(List<String> usernames, String target, String permission, InvitationMode mode) {
		return batchInvite(new InvitationRequest(usernames, target, permission), mode);
	}

	/**
	 * Invite the users of a request to a repository or organization.
	 * @param request the invitation request
	 * @param mode what to invite to
	 * @return one outcome per username, in input order
	 */
	public BatchResult batchInvite(InvitationRequest request, InvitationMode mode) {
		return switch (mode) {
			case REPOSITORY -> inviteToRepository(request);
			case ORGANIZATION -> inviteToOrganization(request);
		};
	}

	/**
	 * Invite users to the repository named by {@code request.target()}.
	 * @param request request whose target is {@code owner/repo} and whose permission is
	 * read, write or admin
	 * @return one outcome per username, in input order
	 */
	public BatchResult inviteToRepository(InvitationRequest request) {
		RepositoryTarget target = RepositoryTarget.parse(request.target());
		RepositoryPermission permission = RepositoryPermission.fromValue(request.permission());

		logger.info("Inviting {} users to repository {} with {} permission", request.usernames().size(), target,
				permission.value());
		return runBatch(request.usernames(), username -> inviteUserToRepository(target, username, permission));
	}

	/**
	 * Invite users to the organization named by {@code request.target()}.
	 * @param request request whose target is an organization name and whose permission is
	 * member or admin
	 * @return one outcome per username, in input order
	 */
	public BatchResult inviteToOrganization(InvitationRequest request) {
		String org = request.target();
		if (org.contains("/")) {
			throw new InvalidTargetException(org, "Organization name must not contain '/': '" + org + "'");
		}
		OrganizationRole role = OrganizationRole.fromValue(request.permission());

		logger.info("Inviting {} users to organization {} as {}", request.usernames().size(), org, role.value());
		return runBatch(request.usernames(), username -> inviteUserToOrganization(org, username, role));
	}

	private BatchResult runBatch(List<String> usernames, Function<String, InvitationOutcome> invite) {
		List<InvitationOutcome> outcomes = new ArrayList<>(usernames.size());

		for (int i = 0; i < usernames.size(); i++) {
			if (Thread.currentThread().isInterrupted()) {
				throw cancelled(outcomes, usernames.size());
			}

			InvitationOutcome outcome = invite.apply(usernames.get(i));
			// interrupted inside the upstream call: the user was not processed
			if (Thread.currentThread().isInterrupted()) {
				throw cancelled(outcomes, usernames.size());
			}
			outcomes.add(outcome);
			logger.info("[{}/{}] {}: {} - {}", i + 1, usernames.size(), outcome.username(), outcome.status().value(),
					outcome.message());

			if (i < usernames.size() - 1) {
				pause(outcomes, usernames.size());
			}
		}

		BatchResult result = BatchResult.fromOutcomes(outcomes);
		logger.info("Batch completed: {} successful, {} failed", result.successful(), result.failed());
		return result;
	}

	private InvitationOutcome inviteUserToRepository(RepositoryTarget target, String username,
			RepositoryPermission permission) {
		try {
			JsonNode response = invitationService.inviteToRepository(target.owner(), target.repo(), username,
					permission);
			if ("pending".equals(response.path("state").asText())) {
				return InvitationOutcome.success(username, INVITATION_SENT);
			}
			return InvitationOutcome.success(username,
					response.path("message").asText("User has been added to the repository"));
		}
		catch (GitHubApiException e) {
			if (isAlreadyCollaborator(e)) {
				return InvitationOutcome.info(username, ALREADY_COLLABORATOR);
			}
			return failed(username, e);
		}
		catch (RuntimeException e) {
			return failed(username, e);
		}
	}

	private InvitationOutcome inviteUserToOrganization(String org, String username, OrganizationRole role) {
		try {
			JsonNode response = invitationService.inviteToOrganization(org, username, role);
			String state = response.path("state").asText("");
			return switch (state) {
				case "active" -> InvitationOutcome.success(username, "User is already an active member");
				case "pending" -> InvitationOutcome.success(username, INVITATION_SENT);
				default -> InvitationOutcome.success(username,
						response.path("message").asText("User has been invited to the organization"));
			};
		}
		catch (RuntimeException e) {
			return failed(username, e);
		}
	}

	/**
	 * The structured reason is preferred; the message check covers clients that do not
	 * classify errors.
	 */
	private static boolean isAlreadyCollaborator(GitHubApiException e) {
		return e.getReason() == ErrorReason.ALREADY_COLLABORATOR
				|| ErrorReason.containsIgnoreCase(e.getMessage(), ErrorReason.ALREADY_COLLABORATOR_TEXT);
	}

	private static InvitationOutcome failed(String username, RuntimeException e) {
		if (e instanceof GitHubApiException apiException && apiException.isRateLimitError()) {
			logger.warn("Invitation failed for {} while rate limited ({} requests remaining): {}", username,
					apiException.getRateLimitRemaining(), e.getMessage());
		}
		else {
			logger.warn("Invitation failed for {}: {}", username, e.getMessage());
		}
		String message = e.getMessage();
		return InvitationOutcome.error(username, message != null ? message : e.getClass().getSimpleName());
	}

	private void pause(List<InvitationOutcome> outcomes, int requested) {
		if (interRequestDelay.isZero()) {
			return;
		}
		try {
			sleeper.sleep(interRequestDelay);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw cancelled(outcomes, requested);
		}
	}

	private static BatchCancelledException cancelled(List<InvitationOutcome> outcomes, int requested) {
		logger.warn("Batch interrupted after {} of {} users", outcomes.size(), requested);
		return new BatchCancelledException(outcomes, requested);
	}

}
