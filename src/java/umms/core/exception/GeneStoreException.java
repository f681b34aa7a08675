package umms.core.exception;

import umms.core.annotation.Location;

/**
 * Thrown when a query against the gene store fails. Carries the name of the query and
 * the location it was issued for so the caller can log or retry.
 */
public class GeneStoreException extends Exception {

	private static final long serialVersionUID = 4417091582046281311L;

	private final String query;
	private final Location location;

	public GeneStoreException(String message) {
		this(message, null, null, null);
	}

	public GeneStoreException(String message, Throwable cause) {
		this(message, null, null, cause);
	}

	/**
	 * @param query name of the failing query
	 * @param location location the query was issued for, may be null
	 * @param cause underlying store error
	 */
	public GeneStoreException(String query, Location location, Throwable cause) {
		this("Query " + query + (location == null ? "" : " for " + location) + " failed: "
				+ (cause == null ? "unknown error" : cause.getMessage()), query, location, cause);
	}

	private GeneStoreException(String message, String query, Location location, Throwable cause) {
		super(message, cause);
		this.query = query;
		this.location = location;
	}

	public String getQuery() {
		return query;
	}

	public Location getLocation() {
		return location;
	}
}
