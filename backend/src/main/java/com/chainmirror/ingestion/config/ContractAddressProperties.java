package com.chainmirror.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Addresses of the six watched contracts. Transactions sent to any other address are ignored.
 * An unset address matches nothing.
 */
@ConfigurationProperties(prefix = "chainmirror.contracts")
@NoArgsConstructor
@Getter
@Setter
public class ContractAddressProperties {

    private String userFactory;
    private String trackFactory;
    private String socialFeatureFactory;
    private String playlistFactory;
    private String userLibraryFactory;
    private String userReplicaSetManager;
}
