package com.chainmirror.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Persisted chain as seen by this indexer: a linked list through {@code parenthash}.
 * Exactly one block is current (the locally known canonical tip); the partial unique index rejects a second one.
 * The origin row seeded from the configured start block has no number when it is the 0x0 sentinel or genesis.
 */
@Document(collection = "blocks")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Block {

    /** Hash used for a start block configured as "0x0" and for the zero-hash parent of genesis. */
    public static final String ORIGIN_HASH = "0x0";
    /** Parent hash reported by the chain for its genesis block. */
    public static final String ZERO_HASH = "0x" + "0".repeat(64);

    @Id
    @EqualsAndHashCode.Include
    private String blockhash;
    @Indexed(unique = true, sparse = true)
    private Long number;
    private String parenthash;
    @Indexed(name = "single_current", unique = true, partialFilter = "{ 'current': true }")
    private boolean current;

    public Block(String blockhash, Long number, String parenthash, boolean current) {
        this.blockhash = blockhash;
        this.number = number;
        this.parenthash = parenthash;
        this.current = current;
    }

    /** Parent hash with the genesis zero-hash mapped onto the origin row's hash. */
    public String effectiveParentHash() {
        return ZERO_HASH.equals(parenthash) ? ORIGIN_HASH : parenthash;
    }

    @Override
    public String toString() {
        return "Block(" + blockhash + ", number=" + number + ", parent=" + parenthash + ", current=" + current + ")";
    }
}
