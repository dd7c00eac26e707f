package com.chainmirror.domain;

/**
 * Target type of a save or repost.
 */
public enum SocialItemType {
    TRACK,
    PLAYLIST,
    ALBUM
}
