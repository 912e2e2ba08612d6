/**
 * Immutable value types shared by the cache, dispatcher and reconciler.
 *
 * @see relay.model.Source
 * @see relay.model.ChannelEvent
 * @see relay.model.Watermark
 */
package relay.model;
