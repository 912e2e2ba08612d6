/**
 * Source identity resolution: URL parsing and registry write-back.
 */
package relay.resolve;
