package com.chainmirror.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Current-version pointer per (kind, businessId). The _id makes "at most one current version" a storage
 * constraint; VersionLog moves it with compare-and-set on {@code versionId}.
 */
@Document(collection = "current_versions")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CurrentVersion {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private EntityKind kind;
    private String businessId;
    private String versionId;
    private String blockhash;
    private Long blocknumber;
    private Instant updatedAt;

    public static String idOf(EntityKind kind, String businessId) {
        return kind.name() + ":" + businessId;
    }
}
