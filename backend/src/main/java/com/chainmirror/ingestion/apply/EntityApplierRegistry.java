package com.chainmirror.ingestion.apply;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * One applier per {@link ContractKind}. Applier beans are picked up from the context; kinds without a bean
 * get a {@link PassThroughEntityApplier}. Two beans for the same kind fail startup.
 */
@Component
@Slf4j
public class EntityApplierRegistry {

    private final Map<ContractKind, EntityApplier> appliers;

    public EntityApplierRegistry(List<EntityApplier> provided) {
        EnumMap<ContractKind, EntityApplier> byKind = new EnumMap<>(ContractKind.class);
        for (EntityApplier applier : provided) {
            EntityApplier previous = byKind.put(applier.kind(), applier);
            if (previous != null) {
                throw new IllegalStateException("Duplicate applier for " + applier.kind() + ": "
                        + previous.getClass().getName() + " and " + applier.getClass().getName());
            }
        }
        for (ContractKind kind : ContractKind.values()) {
            if (!byKind.containsKey(kind)) {
                log.info("No applier registered for {}; using pass-through", kind);
                byKind.put(kind, new PassThroughEntityApplier(kind));
            }
        }
        this.appliers = Collections.unmodifiableMap(byKind);
    }

    public EntityApplier get(ContractKind kind) {
        return appliers.get(kind);
    }

    /** Appliers in execution order. */
    public List<EntityApplier> inOrder() {
        return List.copyOf(appliers.values());
    }
}
