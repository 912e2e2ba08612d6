package relay.model;

import java.util.Objects;

/**
 * A formatting span inside a message body (bold, link, mention, ...).
 *
 * @param type   entity type name as reported by the protocol client
 * @param offset start offset in UTF-16 code units
 * @param length span length in UTF-16 code units
 */
public record FormattingEntity(String type, int offset, int length) {

    public FormattingEntity {
        Objects.requireNonNull(type, "type");
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("offset and length must be >= 0");
        }
    }
}
