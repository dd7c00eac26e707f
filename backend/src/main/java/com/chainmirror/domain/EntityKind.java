package com.chainmirror.domain;

/**
 * Versioned entity kinds and the collection holding their versions.
 */
public enum EntityKind {
    USER(UserVersion.class),
    TRACK(TrackVersion.class),
    PLAYLIST(PlaylistVersion.class),
    FOLLOW(FollowVersion.class),
    REPOST(RepostVersion.class),
    SAVE(SaveVersion.class);

    private final Class<? extends EntityVersion> versionType;

    EntityKind(Class<? extends EntityVersion> versionType) {
        this.versionType = versionType;
    }

    public Class<? extends EntityVersion> versionType() {
        return versionType;
    }
}
