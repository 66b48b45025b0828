/**
 * Header recognition for instrument export files.
 *
 * <p>Two export variants exist: one whose header starts with a fixed literal prefix, and one identified by a
 * row-marker label in its second column. {@link ca.gc.cra.harvest.domain.schema.SchemaDetector} tries both and
 * returns the channel bindings of the first match.</p>
 */
package ca.gc.cra.harvest.domain.schema;
