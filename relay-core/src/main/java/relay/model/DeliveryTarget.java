package relay.model;

import relay.resolve.ChannelUrls;

import java.util.Objects;

/**
 * Delivery metadata attached to every batch sent to the sink.
 *
 * @param sourceId        internal source id, used for watermark updates
 * @param channelId       external channel id
 * @param channelUsername channel username, falls back to the numeric id
 * @param channelUrl      canonical channel URL
 */
public record DeliveryTarget(long sourceId, long channelId, String channelUsername, String channelUrl) {

    public DeliveryTarget {
        Objects.requireNonNull(channelUsername, "channelUsername");
        Objects.requireNonNull(channelUrl, "channelUrl");
    }

    /**
     * Builds the target for a resolved source. A blank registry URL is replaced by the
     * canonical URL of the username.
     *
     * @param source     resolved source
     * @param handleHint username observed on the wire, used when the registry has none
     * @return the delivery target
     * @throws IllegalArgumentException if the source is not resolved
     */
    public static DeliveryTarget of(Source source, String handleHint) {
        if (!source.isResolved()) {
            throw new IllegalArgumentException("source " + source.id() + " is not resolved");
        }
        String username = source.handle();
        if (username == null || username.isEmpty()) {
            username = handleHint != null && !handleHint.isEmpty()
                    ? handleHint
                    : String.valueOf(source.externalId());
        }
        String url = source.url().isBlank() ? ChannelUrls.canonicalUrl(username) : source.url();
        return new DeliveryTarget(source.id(), source.externalId(), username, url);
    }
}
