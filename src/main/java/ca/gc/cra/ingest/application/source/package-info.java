/**
 * File-based dataset sources (local directory and object store) sharing one CSV parsing path.
 *
 * @since 0.1.0
 */
package ca.gc.cra.ingest.application.source;
