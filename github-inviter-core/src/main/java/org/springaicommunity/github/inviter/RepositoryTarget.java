package org.springaicommunity.github.inviter;

/**
 * A repository addressed as {@code owner/name}.
 *
 * @param owner the user or organization owning the repository
 * @param repo the repository name
 */
public record RepositoryTarget(String owner, String repo) {

	/**
	 * Parse an {@code owner/name} identifier.
	 * @param target identifier to parse
	 * @return the parsed target
	 * @throws InvalidTargetException unless the identifier splits into exactly two
	 * non-empty segments on {@code /}
	 */
	public static RepositoryTarget parse(String target) {
		String[] parts = target.trim().split("/", -1);
		if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
			throw new InvalidTargetException(target, "target_name must be in format 'owner/repo': '" + target + "'");
		}
		return new RepositoryTarget(parts[0], parts[1]);
	}

	@Override
	public String toString() {
		return owner + "/" + repo;
	}

}
