package net.katagaitai.tsurugi.evm.cfg;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

// 書き込みはロックで直列化し、読み出しはコピーを返す
@Slf4j(topic = "tsurugi")
public class StateSpace {
    private final NodeIdManager nodeIdManager;
    private final Map<Integer, Node> nodes = Maps.newLinkedHashMap();
    private final List<Edge> edges = Lists.newArrayList();
    private final Object lock = new Object();

    public StateSpace(NodeIdManager nodeIdManager) {
        this.nodeIdManager = nodeIdManager;
    }

    public Node newNode(String contractName, String functionName) {
        return newNode(contractName, functionName, 0);
    }

    public Node newNode(String contractName, String functionName, int startAddress) {
        return new Node(nodeIdManager.getNextNodeId(), contractName, functionName, startAddress);
    }

    public void addNode(Node node) {
        synchronized (lock) {
            nodes.put(node.getUid(), node);
        }
        log.trace("ノード追加: {}", node);
    }

    public void addEdge(Edge edge) {
        synchronized (lock) {
            edges.add(edge);
        }
        log.trace("エッジ追加: {}", edge);
    }

    public Node getNode(int uid) {
        synchronized (lock) {
            return nodes.get(uid);
        }
    }

    public Map<Integer, Node> getNodes() {
        synchronized (lock) {
            return ImmutableMap.copyOf(nodes);
        }
    }

    public List<Edge> getEdges() {
        synchronized (lock) {
            return ImmutableList.copyOf(edges);
        }
    }

    public int nodeCount() {
        synchronized (lock) {
            return nodes.size();
        }
    }

    public int edgeCount() {
        synchronized (lock) {
            return edges.size();
        }
    }
}
