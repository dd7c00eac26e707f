package com.chainmirror.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

@Document(collection = "playlists")
@CompoundIndexes({
    @CompoundIndex(name = "business_block_tx", def = "{'businessId': 1, 'blocknumber': -1, 'txIndex': -1}"),
    @CompoundIndex(name = "blockhash", def = "{'blockhash': 1}"),
    @CompoundIndex(name = "current_block", def = "{'current': 1, 'blocknumber': 1}"),
    @CompoundIndex(name = "owner_current", def = "{'playlistOwnerId': 1, 'current': 1}")
})
@NoArgsConstructor
@Getter
@Setter
public class PlaylistVersion extends EntityVersion {

    private Long playlistId;
    private Long playlistOwnerId;
    private String playlistName;
    private boolean isAlbum;
    private boolean isPrivate;
    private List<Long> trackIds;

    @Override
    public EntityKind kind() {
        return EntityKind.PLAYLIST;
    }

    @Override
    public String naturalKey() {
        return String.valueOf(playlistId);
    }
}
