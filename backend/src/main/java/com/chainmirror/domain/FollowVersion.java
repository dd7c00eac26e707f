package com.chainmirror.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

@Document(collection = "follows")
@CompoundIndexes({
    @CompoundIndex(name = "business_block_tx", def = "{'businessId': 1, 'blocknumber': -1, 'txIndex': -1}"),
    @CompoundIndex(name = "blockhash", def = "{'blockhash': 1}"),
    @CompoundIndex(name = "current_block", def = "{'current': 1, 'blocknumber': 1}"),
    @CompoundIndex(name = "followee_current", def = "{'followeeUserId': 1, 'current': 1}"),
    @CompoundIndex(name = "follower_current", def = "{'followerUserId': 1, 'current': 1}")
})
@NoArgsConstructor
@Getter
@Setter
public class FollowVersion extends EntityVersion {

    private Long followerUserId;
    private Long followeeUserId;

    @Override
    public EntityKind kind() {
        return EntityKind.FOLLOW;
    }

    @Override
    public String naturalKey() {
        return followerUserId + ":" + followeeUserId;
    }
}
