/**
 * Spring Boot auto-configuration for the relay.
 *
 * <p>Add this module and a {@link javax.sql.DataSource} to the classpath, set
 * {@code relay.sink.token}, and declare a {@link relay.spi.SourceClient} bean; a started
 * {@link relay.Relay} and its {@link relay.spi.IngestListener} become available for injection.
 *
 * @see relay.spring.boot.RelayAutoConfiguration
 * @see relay.spring.boot.RelayProperties
 */
package relay.spring.boot;
