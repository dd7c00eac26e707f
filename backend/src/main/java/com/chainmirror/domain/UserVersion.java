package com.chainmirror.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

@Document(collection = "users")
@CompoundIndexes({
    @CompoundIndex(name = "business_block_tx", def = "{'businessId': 1, 'blocknumber': -1, 'txIndex': -1}"),
    @CompoundIndex(name = "blockhash", def = "{'blockhash': 1}"),
    @CompoundIndex(name = "current_block", def = "{'current': 1, 'blocknumber': 1}"),
    @CompoundIndex(name = "user_current", def = "{'userId': 1, 'current': 1}")
})
@NoArgsConstructor
@Getter
@Setter
public class UserVersion extends EntityVersion {

    private Long userId;
    private String handle;
    private String wallet;
    private String name;
    private boolean isCreator;
    private boolean isVerified;
    private boolean isDeactivated;
    private String metadataMultihash;
    private String creatorNodeEndpoint;
    private Long primaryId;
    private List<Long> secondaryIds;
    private String replicaSetUpdateSigner;

    @Override
    public EntityKind kind() {
        return EntityKind.USER;
    }

    @Override
    public String naturalKey() {
        return String.valueOf(userId);
    }
}
