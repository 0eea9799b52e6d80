package org.orchestration.migrator.odx.models;

import lombok.Builder;

/**
 * A port declared by the orchestration.
 * Transport fields start empty; the binding merge step fills them through {@code toBuilder()}.
 */
@Builder(toBuilder = true)
public record PortModel(
        String name,
        String portTypeName,
        PortDirection direction,
        BindingKind bindingKind,
        String adapterName,
        String address,
        String bindingName
) {
    public PortModel {
        direction = direction == null ? PortDirection.NONE : direction;
        bindingKind = bindingKind == null ? BindingKind.UNKNOWN : bindingKind;
        adapterName = adapterName == null ? "" : adapterName;
        address = address == null ? "" : address;
        bindingName = bindingName == null ? "" : bindingName;
    }
}
