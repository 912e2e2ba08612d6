/**
 * Periodic trigger for the catch-up path.
 */
package relay.schedule;
