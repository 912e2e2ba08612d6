/**
 * HTTP delivery sink.
 *
 * <p>{@link relay.http.HttpDeliverySink} implements {@link relay.spi.DeliverySink} by posting
 * each batch as JSON to a processing endpoint with bearer authentication.
 *
 * @see relay.http.HttpDeliverySink
 */
package relay.http;
