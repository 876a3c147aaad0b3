package com.simtask.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * A simulation task: an identifier paired with the query text it stands for.
 *
 * <p>Both values are taken as given. The identifier is an opaque token (number, string or
 * {@code null}) and the query is never parsed. Instances are read-only after construction and
 * compare by identity.
 */
@Getter
@RequiredArgsConstructor
public class SimulationTask {
    private final Object id;
    private final String query;
}
