package relay.model;

/**
 * External identity returned by the protocol client for a channel handle.
 *
 * @param externalId numeric channel id on the messaging network
 * @param handle     canonical username, may be {@code null}
 */
public record ResolvedIdentity(long externalId, String handle) {
}
