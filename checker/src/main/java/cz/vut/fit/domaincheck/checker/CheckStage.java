package cz.vut.fit.domaincheck.checker;

/**
 * The states of a single domain check. The first three stages run strictly one after another,
 * then the registration, traffic and index lookups run concurrently before the results are merged.
 */
public enum CheckStage {
    RESOLVING,
    PROBING,
    FETCHING_AUTHORITY,
    FETCHING_PARALLEL_GROUP,
    MERGING,
    DONE,
    FAILED
}
