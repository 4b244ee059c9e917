package com.architecture.flowlayout.model.graph;

import com.architecture.flowlayout.dto.flow.GatewayType;
import com.architecture.flowlayout.dto.layout.NodeKind;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable, index-addressed process graph.
 *
 * Nodes and edges live in parallel arrays; a node is identified by its arena index and
 * an edge by its transition index. Adjacency is stored CSR-style:
 * - outOffset[i]..outOffset[i+1] delimits node i's outgoing edge indices in outList
 * - inOffset[i]..inOffset[i+1] delimits node i's incoming edge indices in inList
 * Both lists preserve transition input order, which keeps every traversal deterministic.
 */
public final class FlowGraph {

    private final String flowId;
    private final String title;

    // Roles
    private final String[] roleIds;
    private final String[] roleNames;

    // Nodes
    private final String[] nodeIds;
    private final String[] labels;
    private final NodeKind[] kinds;
    private final GatewayType[] gatewayTypes;
    private final String[] roleRefs;
    private final int[] roleIndexes;       // -1 for gateways and unresolved role references

    // Edges
    private final String[] edgeIds;
    private final String[] edgeLabels;
    private final int[] sources;
    private final int[] targets;

    // CSR adjacency
    private final int[] outOffset;
    private final int[] outList;
    private final int[] inOffset;
    private final int[] inList;

    private final Map<String, Integer> indexById;

    private FlowGraph(Builder b) {
        this.flowId = b.flowId;
        this.title = b.title;
        this.roleIds = b.roleIds.toArray(new String[0]);
        this.roleNames = b.roleNames.toArray(new String[0]);
        this.nodeIds = b.nodeIds.toArray(new String[0]);
        this.labels = b.labels.toArray(new String[0]);
        this.kinds = b.kinds.toArray(new NodeKind[0]);
        this.gatewayTypes = b.gatewayTypes.toArray(new GatewayType[0]);
        this.roleRefs = b.roleRefs.toArray(new String[0]);
        this.roleIndexes = b.roleIndexes.stream().mapToInt(Integer::intValue).toArray();
        this.edgeIds = b.edgeIds.toArray(new String[0]);
        this.edgeLabels = b.edgeLabels.toArray(new String[0]);
        this.sources = b.sources.stream().mapToInt(Integer::intValue).toArray();
        this.targets = b.targets.stream().mapToInt(Integer::intValue).toArray();
        this.indexById = Map.copyOf(b.indexById);

        int n = nodeIds.length;
        int m = edgeIds.length;
        this.outOffset = new int[n + 1];
        this.inOffset = new int[n + 1];
        for (int e = 0; e < m; e++) {
            outOffset[sources[e] + 1]++;
            inOffset[targets[e] + 1]++;
        }
        for (int i = 0; i < n; i++) {
            outOffset[i + 1] += outOffset[i];
            inOffset[i + 1] += inOffset[i];
        }
        this.outList = new int[m];
        this.inList = new int[m];
        int[] outFill = new int[n];
        int[] inFill = new int[n];
        for (int e = 0; e < m; e++) {
            int s = sources[e];
            int t = targets[e];
            outList[outOffset[s] + outFill[s]++] = e;
            inList[inOffset[t] + inFill[t]++] = e;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getFlowId() {
        return flowId;
    }

    public String getTitle() {
        return title;
    }

    public int nodeCount() {
        return nodeIds.length;
    }

    public int edgeCount() {
        return edgeIds.length;
    }

    public int roleCount() {
        return roleIds.length;
    }

    public boolean isEmpty() {
        return nodeIds.length == 0;
    }

    public String roleId(int role) {
        return roleIds[role];
    }

    public String roleName(int role) {
        return roleNames[role];
    }

    public String nodeId(int node) {
        return nodeIds[node];
    }

    public String label(int node) {
        return labels[node];
    }

    public NodeKind kind(int node) {
        return kinds[node];
    }

    public boolean isGateway(int node) {
        return kinds[node] == NodeKind.GATEWAY;
    }

    public GatewayType gatewayType(int node) {
        return gatewayTypes[node];
    }

    /** Role id exactly as the document gave it; may be unresolved. */
    public String roleRef(int node) {
        return roleRefs[node];
    }

    /** Position of the node's role in the roles list, or -1. */
    public int roleIndex(int node) {
        return roleIndexes[node];
    }

    /** Resolves a node id to its arena index, or -1 if unknown. */
    public int indexOf(String nodeId) {
        Integer idx = nodeId == null ? null : indexById.get(nodeId);
        return idx == null ? -1 : idx;
    }

    public String edgeId(int edge) {
        return edgeIds[edge];
    }

    public String edgeLabel(int edge) {
        return edgeLabels[edge];
    }

    public int source(int edge) {
        return sources[edge];
    }

    public int target(int edge) {
        return targets[edge];
    }

    public int outDegree(int node) {
        return outOffset[node + 1] - outOffset[node];
    }

    /** The k-th outgoing edge index of node, in transition input order. */
    public int outEdge(int node, int k) {
        return outList[outOffset[node] + k];
    }

    public int inDegree(int node) {
        return inOffset[node + 1] - inOffset[node];
    }

    /** The k-th incoming edge index of node, in transition input order. */
    public int inEdge(int node, int k) {
        return inList[inOffset[node] + k];
    }

    /**
     * Builder for the FlowGraph arena.
     * Rejects duplicate node ids and edges whose endpoints were never added.
     */
    public static final class Builder {
        private String flowId;
        private String title;
        private final List<String> roleIds = new ArrayList<>();
        private final List<String> roleNames = new ArrayList<>();
        private final Map<String, Integer> roleIndexById = new HashMap<>();
        private final List<String> nodeIds = new ArrayList<>();
        private final List<String> labels = new ArrayList<>();
        private final List<NodeKind> kinds = new ArrayList<>();
        private final List<GatewayType> gatewayTypes = new ArrayList<>();
        private final List<String> roleRefs = new ArrayList<>();
        private final List<Integer> roleIndexes = new ArrayList<>();
        private final List<String> edgeIds = new ArrayList<>();
        private final List<String> edgeLabels = new ArrayList<>();
        private final List<Integer> sources = new ArrayList<>();
        private final List<Integer> targets = new ArrayList<>();
        private final Map<String, Integer> indexById = new HashMap<>();

        private Builder() {
        }

        public Builder flow(String flowId, String title) {
            this.flowId = flowId;
            this.title = title;
            return this;
        }

        public Builder addRole(String roleId, String roleName) {
            int idx = roleIds.size();
            roleIds.add(roleId);
            roleNames.add(roleName);
            if (roleId != null) {
                roleIndexById.putIfAbsent(roleId, idx);
            }
            return this;
        }

        public Builder addActivity(String id, String label, String roleRef) {
            Integer roleIdx = roleRef == null ? null : roleIndexById.get(roleRef);
            return addNode(id, label, NodeKind.ACTIVITY, null, roleRef, roleIdx == null ? -1 : roleIdx);
        }

        public Builder addGateway(String id, String label, GatewayType type) {
            return addNode(id, label, NodeKind.GATEWAY, type == null ? GatewayType.EXCLUSIVE : type, null, -1);
        }

        private Builder addNode(String id, String label, NodeKind kind, GatewayType type, String roleRef, int roleIdx) {
            if (id == null) {
                throw new IllegalArgumentException("Node id must not be null");
            }
            if (indexById.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate node id: " + id);
            }
            indexById.put(id, nodeIds.size());
            nodeIds.add(id);
            labels.add(label == null ? "" : label);
            kinds.add(kind);
            gatewayTypes.add(type);
            roleRefs.add(roleRef);
            roleIndexes.add(roleIdx);
            return this;
        }

        public boolean hasNode(String id) {
            return id != null && indexById.containsKey(id);
        }

        public Builder addEdge(String edgeId, String sourceId, String targetId, String label) {
            Integer s = sourceId == null ? null : indexById.get(sourceId);
            Integer t = targetId == null ? null : indexById.get(targetId);
            if (s == null || t == null) {
                throw new IllegalArgumentException("Edge " + edgeId + " has an unknown endpoint");
            }
            edgeIds.add(edgeId);
            edgeLabels.add(label);
            sources.add(s);
            targets.add(t);
            return this;
        }

        public FlowGraph build() {
            return new FlowGraph(this);
        }
    }
}
