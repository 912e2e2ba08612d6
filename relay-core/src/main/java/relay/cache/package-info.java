/**
 * TTL-bounded, single-flight cache of the sources currently subscribed for delivery.
 *
 * @see relay.cache.AuthorizationCache
 */
package relay.cache;
