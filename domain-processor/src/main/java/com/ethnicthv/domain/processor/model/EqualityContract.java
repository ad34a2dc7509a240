package com.ethnicthv.domain.processor.model;

import java.util.List;

/**
 * A validated host with its entries sorted by (order, declaration position).
 */
public record EqualityContract(HostDeclaration host, List<ContractEntry> entries) {
    public EqualityContract {
        entries = List.copyOf(entries);
    }
}
