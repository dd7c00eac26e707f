package com.chainmirror.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "reposts")
@CompoundIndexes({
    @CompoundIndex(name = "business_block_tx", def = "{'businessId': 1, 'blocknumber': -1, 'txIndex': -1}"),
    @CompoundIndex(name = "blockhash", def = "{'blockhash': 1}"),
    @CompoundIndex(name = "current_block", def = "{'current': 1, 'blocknumber': 1}"),
    @CompoundIndex(name = "user_current", def = "{'userId': 1, 'current': 1}")
})
@NoArgsConstructor
@Getter
@Setter
public class RepostVersion extends EntityVersion {

    private Long userId;
    private Long repostItemId;
    private SocialItemType repostType;

    @Override
    public EntityKind kind() {
        return EntityKind.REPOST;
    }

    @Override
    public String naturalKey() {
        return userId + ":" + repostType + ":" + repostItemId;
    }
}
