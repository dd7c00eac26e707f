package com.chainmirror.ingestion.apply;

/**
 * Watched contract kinds. Declaration order is the order appliers run within a block.
 */
public enum ContractKind {
    USER_FACTORY,
    TRACK_FACTORY,
    SOCIAL_FEATURE_FACTORY,
    USER_REPLICA_SET_MANAGER,
    PLAYLIST_FACTORY,
    USER_LIBRARY_FACTORY
}
