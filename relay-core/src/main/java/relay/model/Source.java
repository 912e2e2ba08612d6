package relay.model;

import java.util.Objects;

/**
 * A monitored upstream channel as known to the source registry.
 *
 * <p>{@code id} is assigned by the registry and never changes. {@code externalId} is the
 * channel's numeric id on the messaging network; it stays {@code null} until the channel is
 * resolved through the protocol client and is unique across sources once set.
 *
 * @param id         internal registry id
 * @param externalId external channel id, or {@code null} while unresolved
 * @param handle     public channel username, or {@code null} if unknown
 * @param url        canonical channel URL (never null)
 */
public record Source(long id, Long externalId, String handle, String url) {

    public Source {
        Objects.requireNonNull(url, "url");
    }

    /**
     * Returns {@code true} once the external id is known.
     */
    public boolean isResolved() {
        return externalId != null;
    }

    /**
     * Returns a copy carrying the resolved external identity.
     *
     * @param externalId resolved external id
     * @param handle     resolved username; the current handle is kept when {@code null}
     * @return the resolved source
     */
    public Source withIdentity(long externalId, String handle) {
        return new Source(id, externalId, handle != null ? handle : this.handle, url);
    }
}
