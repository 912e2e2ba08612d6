package relay.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Normalized channel message, immutable once built.
 *
 * <p>Identity is {@code (source, sequenceId)}. Sequence ids grow monotonically within a
 * channel, so they double as the ordering key for watermarks and catch-up dedup.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * ChannelEvent event = ChannelEvent.builder(101, Instant.now())
 *     .message("hello")
 *     .views(42)
 *     .build();
 * }</pre>
 */
public final class ChannelEvent {
    private final long sequenceId;
    private final Instant date;
    private final String message;
    private final Integer views;
    private final Integer forwards;
    private final Instant editDate;
    private final String postAuthor;
    private final String media;
    private final List<FormattingEntity> entities;
    private final Long replyTo;

    private ChannelEvent(Builder builder) {
        if (builder.sequenceId <= 0) {
            throw new IllegalArgumentException("sequenceId must be > 0");
        }
        this.sequenceId = builder.sequenceId;
        this.date = Objects.requireNonNull(builder.date, "date");
        this.message = builder.message == null ? "" : builder.message;
        this.views = builder.views;
        this.forwards = builder.forwards;
        this.editDate = builder.editDate;
        this.postAuthor = builder.postAuthor;
        this.media = builder.media;
        this.entities = builder.entities == null ? null : List.copyOf(builder.entities);
        this.replyTo = builder.replyTo;
    }

    public static Builder builder(long sequenceId, Instant date) {
        return new Builder(sequenceId, date);
    }

    public long sequenceId() {
        return sequenceId;
    }

    public Instant date() {
        return date;
    }

    public String message() {
        return message;
    }

    public Integer views() {
        return views;
    }

    public Integer forwards() {
        return forwards;
    }

    public Instant editDate() {
        return editDate;
    }

    public String postAuthor() {
        return postAuthor;
    }

    /**
     * Media type name (e.g. {@code MessageMediaPhoto}), or {@code null} for text-only messages.
     */
    public String media() {
        return media;
    }

    /**
     * Formatting entities, or {@code null} when the message carries none.
     */
    public List<FormattingEntity> entities() {
        return entities;
    }

    /**
     * Sequence id of the message this one replies to, or {@code null}.
     */
    public Long replyTo() {
        return replyTo;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelEvent that)) return false;
        return sequenceId == that.sequenceId
                && date.equals(that.date)
                && message.equals(that.message)
                && Objects.equals(views, that.views)
                && Objects.equals(forwards, that.forwards)
                && Objects.equals(editDate, that.editDate)
                && Objects.equals(postAuthor, that.postAuthor)
                && Objects.equals(media, that.media)
                && Objects.equals(entities, that.entities)
                && Objects.equals(replyTo, that.replyTo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sequenceId, date, message, views, forwards, editDate,
                postAuthor, media, entities, replyTo);
    }

    @Override
    public String toString() {
        return "ChannelEvent{sequenceId=" + sequenceId + ", date=" + date + '}';
    }

    /**
     * Builder for {@link ChannelEvent}. Only the sequence id and date are required.
     */
    public static final class Builder {
        private final long sequenceId;
        private final Instant date;
        private String message;
        private Integer views;
        private Integer forwards;
        private Instant editDate;
        private String postAuthor;
        private String media;
        private List<FormattingEntity> entities;
        private Long replyTo;

        private Builder(long sequenceId, Instant date) {
            this.sequenceId = sequenceId;
            this.date = date;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder views(Integer views) {
            this.views = views;
            return this;
        }

        public Builder forwards(Integer forwards) {
            this.forwards = forwards;
            return this;
        }

        public Builder editDate(Instant editDate) {
            this.editDate = editDate;
            return this;
        }

        public Builder postAuthor(String postAuthor) {
            this.postAuthor = postAuthor;
            return this;
        }

        public Builder media(String media) {
            this.media = media;
            return this;
        }

        public Builder entities(List<FormattingEntity> entities) {
            this.entities = entities;
            return this;
        }

        public Builder replyTo(Long replyTo) {
            this.replyTo = replyTo;
            return this;
        }

        /**
         * @throws NullPointerException     if {@code date} is null
         * @throws IllegalArgumentException if {@code sequenceId <= 0}
         */
        public ChannelEvent build() {
            return new ChannelEvent(this);
        }
    }
}
