/**
 * Spring Boot auto-configuration for the journal router.
 *
 * <p>{@link journal.spring.boot.JournalAutoConfiguration} wires a
 * {@link journal.dispatch.Router}, a JDBC listener store detected from the
 * {@code DataSource}, and {@link journal.admin.JournalOutputs} from {@code journal.*}
 * application properties. Annotate {@link journal.Destination} beans with
 * {@link journal.spring.boot.JournalOutput @JournalOutput} to mount them declaratively.
 *
 * @see journal.spring.boot.JournalProperties
 * @see journal.spring.boot.JournalOutputRegistrar
 */
package journal.spring.boot;
