package com.chainmirror.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "tracks")
@CompoundIndexes({
    @CompoundIndex(name = "business_block_tx", def = "{'businessId': 1, 'blocknumber': -1, 'txIndex': -1}"),
    @CompoundIndex(name = "blockhash", def = "{'blockhash': 1}"),
    @CompoundIndex(name = "current_block", def = "{'current': 1, 'blocknumber': 1}"),
    @CompoundIndex(name = "owner_current", def = "{'ownerId': 1, 'current': 1}")
})
@NoArgsConstructor
@Getter
@Setter
public class TrackVersion extends EntityVersion {

    private Long trackId;
    private Long ownerId;
    private String title;
    private String routeId;
    private boolean isUnlisted;
    /** Parent track id when this track is a stem; stems are excluded from track counts. */
    private Long stemOf;
    private String metadataMultihash;

    @Override
    public EntityKind kind() {
        return EntityKind.TRACK;
    }

    @Override
    public String naturalKey() {
        return String.valueOf(trackId);
    }
}
