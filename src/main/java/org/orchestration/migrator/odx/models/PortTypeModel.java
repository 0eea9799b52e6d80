package org.orchestration.migrator.odx.models;

import java.util.List;
import java.util.Optional;

public record PortTypeModel(String name, String typeModifier, List<OperationModel> operations) {
    public PortTypeModel {
        operations = operations == null ? List.of() : List.copyOf(operations);
    }

    public Optional<OperationModel> findOperation(String operationName) {
        return operations.stream()
                .filter(op -> op.name().equals(operationName))
                .findFirst();
    }
}
