package com.chainmirror.ingestion.apply;

import com.chainmirror.ingestion.adapter.ChainTransaction;
import com.chainmirror.ingestion.config.ContractAddressProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Static recipient address → {@link ContractKind} map. Built once per cycle from configuration; lookups ignore case.
 */
public final class ContractClassifier {

    private final Map<String, ContractKind> kindByAddress;

    private ContractClassifier(Map<String, ContractKind> kindByAddress) {
        this.kindByAddress = Collections.unmodifiableMap(kindByAddress);
    }

    public static ContractClassifier from(ContractAddressProperties properties) {
        Map<String, ContractKind> map = new HashMap<>();
        register(map, properties.getUserFactory(), ContractKind.USER_FACTORY);
        register(map, properties.getTrackFactory(), ContractKind.TRACK_FACTORY);
        register(map, properties.getSocialFeatureFactory(), ContractKind.SOCIAL_FEATURE_FACTORY);
        register(map, properties.getUserReplicaSetManager(), ContractKind.USER_REPLICA_SET_MANAGER);
        register(map, properties.getPlaylistFactory(), ContractKind.PLAYLIST_FACTORY);
        register(map, properties.getUserLibraryFactory(), ContractKind.USER_LIBRARY_FACTORY);
        return new ContractClassifier(map);
    }

    private static void register(Map<String, ContractKind> map, String address, ContractKind kind) {
        if (address == null || address.isBlank()) {
            return;
        }
        ContractKind previous = map.put(normalize(address), kind);
        if (previous != null && previous != kind) {
            throw new IllegalStateException("Address " + address + " configured for both " + previous + " and " + kind);
        }
    }

    public Optional<ContractKind> classify(String toAddress) {
        if (toAddress == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(kindByAddress.get(normalize(toAddress)));
    }

    /**
     * Buckets transactions by kind, keeping their input order. Every kind has a (possibly empty) bucket;
     * transactions to unwatched addresses are dropped.
     */
    public Map<ContractKind, List<ChainTransaction>> bucket(List<ChainTransaction> transactions) {
        Map<ContractKind, List<ChainTransaction>> buckets = new EnumMap<>(ContractKind.class);
        for (ContractKind kind : ContractKind.values()) {
            buckets.put(kind, new ArrayList<>());
        }
        for (ChainTransaction tx : transactions) {
            classify(tx.to()).ifPresent(kind -> buckets.get(kind).add(tx));
        }
        return buckets;
    }

    private static String normalize(String address) {
        return address.trim().toLowerCase(Locale.ROOT);
    }
}
