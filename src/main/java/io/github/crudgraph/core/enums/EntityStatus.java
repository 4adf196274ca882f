package io.github.crudgraph.core.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum EntityStatus {
    REGULAR(1),
    ARCHIVED(2),
    DELETED(3);

    private final int id;
}
