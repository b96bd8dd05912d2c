/**
 * Administration of persisted journal outputs.
 *
 * @see journal.admin.JournalOutputs
 */
package journal.admin;
