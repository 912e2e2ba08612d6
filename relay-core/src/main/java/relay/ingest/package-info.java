/**
 * Inbound boundary between the protocol client and the dispatcher.
 */
package relay.ingest;
