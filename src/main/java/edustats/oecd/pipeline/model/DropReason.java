package edustats.oecd.pipeline.model;

/**
 * Why a record cleaner excluded a row. Drops are counted, never raised.
 */
public enum DropReason {
    MISSING_DIMENSION, // location, time or value absent
    KIND_MISMATCH, // indicator present but not for this dataset kind
    INVALID_YEAR, // time not an integer
    YEAR_OUT_OF_WINDOW, // year outside the configured window
    INVALID_VALUE, // measure not a finite number
    OUT_OF_RANGE // measure outside the kind's bound
}
