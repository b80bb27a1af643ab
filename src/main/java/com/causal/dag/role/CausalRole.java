package com.causal.dag.role;

/** The single role label a node receives relative to an exposure/outcome pair. */
public enum CausalRole {
    CONFOUNDER("Confounder"),
    MEDIATOR("Mediator"),
    COLLIDER("Collider"),
    INSTRUMENTAL_VARIABLE("InstrumentalVariable"),
    PRECISION_VARIABLE("PrecisionVariable"),
    CONFOUNDER_MEDIATOR("ConfounderMediator"),
    CONFOUNDER_COLLIDER("ConfounderCollider"),
    MEDIATOR_COLLIDER("MediatorCollider"),
    CONFOUNDER_MEDIATOR_COLLIDER("ConfounderMediatorCollider"),
    UNCLASSIFIED("Unclassified");

    private final String label;

    CausalRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
