package com.purchasingpower.pipelinehealth.ci;

/**
 * Owner/name pair identifying a project at the CI provider.
 */
public record ProjectRef(String owner, String name) {

    public ProjectRef {
        if (owner == null || owner.isBlank() || name == null || name.isBlank()) {
            throw new IllegalArgumentException("Project owner and name are required");
        }
    }

    public String fullName() {
        return owner + "/" + name;
    }

    @Override
    public String toString() {
        return fullName();
    }
}
