package org.springaicommunity.github.inviter;

import java.util.List;

/**
 * Thrown when the thread running a batch is interrupted. The batch stops before the next
 * username; outcomes recorded so far are kept for diagnostics only.
 */
public class BatchCancelledException extends RuntimeException {

	private final List<InvitationOutcome> completedOutcomes;

	private final int requestedCount;

	public BatchCancelledException(List<InvitationOutcome> completedOutcomes, int requestedCount) {
		super("Batch cancelled after " + completedOutcomes.size() + " of " + requestedCount + " users");
		this.completedOutcomes = List.copyOf(completedOutcomes);
		this.requestedCount = requestedCount;
	}

	public List<InvitationOutcome> getCompletedOutcomes() {
		return completedOutcomes;
	}

	public int getRequestedCount() {
		return requestedCount;
	}

}
