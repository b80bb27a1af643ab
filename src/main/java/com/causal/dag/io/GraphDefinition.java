package com.causal.dag.io;

import com.causal.dag.graph.CausalGraph;
import com.causal.dag.graph.Edge;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.AllArgsConstructor;

/**
 * POJO handoff of a causal graph from an ingestion layer: node ids, directed
 * edges and the exposure/outcome designation.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class GraphDefinition {
    private String name;
    private String exposure, outcome;
    private List<String> nodes;
    private List<EdgeDef> edges;

    /** A directed edge {@code from -> to}. */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class EdgeDef {
        private String from, to;
    }

    /**
     * Builds the graph. Nodes named only by edges are added; a missing node
     * list is derived from the edges.
     */
    public CausalGraph toGraph() {
        Set<String> ids = new LinkedHashSet<>();
        if (nodes != null)
            ids.addAll(nodes);
        List<Edge> list = new ArrayList<>();
        if (edges != null) {
            for (EdgeDef e : edges) {
                Edge edge = new Edge(e.getFrom(), e.getTo());
                ids.add(edge.from());
                ids.add(edge.to());
                list.add(edge);
            }
        }
        return CausalGraph.build(ids, list, exposure, outcome);
    }

    public static GraphDefinition from(CausalGraph graph) {
        GraphDefinition def = new GraphDefinition();
        def.setExposure(graph.exposure());
        def.setOutcome(graph.outcome());
        def.setNodes(new ArrayList<>(graph.nodes()));
        List<EdgeDef> edges = new ArrayList<>();
        for (Edge e : graph.edges())
            edges.add(new EdgeDef(e.from(), e.to()));
        def.setEdges(edges);
        return def;
    }
}
