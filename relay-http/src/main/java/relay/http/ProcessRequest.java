package relay.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import relay.model.ChannelEvent;
import relay.model.DeliveryTarget;
import relay.model.FormattingEntity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Request body of the processing endpoint.
 */
record ProcessRequest(
    long channelId,
    String channelUsername,
    String channelUrl,
    List<Message> messages) {

  static ProcessRequest of(DeliveryTarget target, List<ChannelEvent> events) {
    List<Message> messages = new ArrayList<>(events.size());
    for (ChannelEvent event : events) {
      messages.add(Message.of(event));
    }
    return new ProcessRequest(target.channelId(), target.channelUsername(), target.channelUrl(), messages);
  }

  /**
   * One serialized message. Absent optional fields are written as {@code null}.
   */
  @JsonInclude(JsonInclude.Include.ALWAYS)
  record Message(
      long id,
      Instant date,
      String message,
      Integer views,
      Integer forwards,
      @JsonProperty("edit_date") Instant editDate,
      @JsonProperty("post_author") String postAuthor,
      String media,
      List<FormattingEntity> entities,
      @JsonProperty("reply_to") Long replyTo) {

    static Message of(ChannelEvent event) {
      return new Message(
          event.sequenceId(),
          event.date(),
          event.message(),
          event.views(),
          event.forwards(),
          event.editDate(),
          event.postAuthor(),
          event.media(),
          event.entities(),
          event.replyTo());
    }
  }
}
