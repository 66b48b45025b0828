package ca.gc.cra.harvest.domain.tail;

/**
 * Lifecycle phase of a tracked export file.
 *
 * @since 0.1.0
 */
public enum TrackingPhase {
  /** Header not yet seen; every complete line is offered to the schema detector. */
  DISCOVERING,
  /** Header bound; complete lines are treated as candidate data rows. */
  TAILING
}
