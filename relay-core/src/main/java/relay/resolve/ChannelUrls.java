package relay.resolve;

import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts public channel usernames from {@code t.me} URLs.
 *
 * <p>Private invite links ({@code t.me/joinchat/...}, {@code t.me/+...}) and the reserved
 * path segments in {@link #RESERVED_SEGMENTS} never name a channel and yield empty.
 */
public final class ChannelUrls {
    private static final Pattern HANDLE = Pattern.compile("t\\.me/([a-zA-Z0-9_]+)");

    /**
     * Path segments that are {@code t.me} features rather than usernames. Matched exactly.
     */
    public static final Set<String> RESERVED_SEGMENTS = Set.of("joinchat", "addlist", "s", "c");

    private ChannelUrls() {
    }

    /**
     * Returns the channel username embedded in {@code url}.
     *
     * @param url channel URL, may be {@code null}
     * @return the username, or empty for private, reserved or unparseable URLs
     */
    public static Optional<String> extractHandle(String url) {
        if (url == null || url.contains("/joinchat/") || url.contains("/+")) {
            return Optional.empty();
        }
        Matcher matcher = HANDLE.matcher(url);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String handle = matcher.group(1);
        if (RESERVED_SEGMENTS.contains(handle)) {
            return Optional.empty();
        }
        return Optional.of(handle);
    }

    /**
     * Builds the canonical URL for a username.
     */
    public static String canonicalUrl(String handle) {
        return "https://t.me/" + handle;
    }
}
