package org.springaicommunity.github.inviter;

import java.util.List;

/**
 * Aggregated results of a batch invitation.
 *
 * <p>
 * Serializes as {@code {"results": [...], "successful": n, "failed": m}}.
 *
 * @param results one outcome per requested username, in request order
 * @param successful number of outcomes with status success or info
 * @param failed number of outcomes with status error
 */
public record BatchResult(List<InvitationOutcome> results, int successful, int failed) {

	public BatchResult {
		results = List.copyOf(results);
		if (successful + failed != results.size()) {
			throw new IllegalArgumentException("successful (" + successful + ") + failed (" + failed
					+ ") must equal the number of results (" + results.size() + ")");
		}
	}

	/**
	 * Create a result from a list of outcomes, counting both success and info as
	 * successful.
	 * @param outcomes outcomes in request order
	 * @return aggregated result
	 */
	public static BatchResult fromOutcomes(List<InvitationOutcome> outcomes) {
		int successful = (int) outcomes.stream().filter(outcome -> outcome.status().isSuccessful()).count();
		return new BatchResult(outcomes, successful, outcomes.size() - successful);
	}

}
