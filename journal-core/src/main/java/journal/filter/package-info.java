/**
 * Structured event predicates for history search.
 *
 * <p>Filters are composed from a fixed set of path, scope, content and attribute terms.
 * There is no expression evaluation.
 *
 * @see journal.filter.EventFilters
 */
package journal.filter;
