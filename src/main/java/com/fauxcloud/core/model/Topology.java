package com.fauxcloud.core.model;

/**
 * Container role layout of an instance, from a single node up to a fully clustered deployment.
 */
public enum Topology {
    /** One container holding every role. */
    STANDALONE,
    /** One search head and one indexer. */
    DISTRIBUTED_MINIMAL,
    /** Search head cluster plus indexer cluster behind a cluster manager and deployer. */
    DISTRIBUTED_CLUSTERED,
    /** Clustered layout with every optional feature switched on. */
    FULL
}
