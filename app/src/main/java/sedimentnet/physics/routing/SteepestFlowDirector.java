package sedimentnet.physics.routing;

import lombok.extern.slf4j.Slf4j;
import sedimentnet.domain.network.FlowDirectionService;
import sedimentnet.domain.network.NetworkGraph;

import java.util.Arrays;

/**
 * Direcciones de flujo por máxima pendiente (D4 sobre el grafo).
 * <p>
 * Cada nodo drena hacia el vecino con mayor pendiente estrictamente descendente; los nodos sin
 * vecino más bajo son salidas de la red. Las direcciones se calculan con la cota topográfica
 * vigente al llamar a {@link #runOneStep()} y no se recalculan solas.
 */
@Slf4j
public class SteepestFlowDirector implements FlowDirectionService {

    private final NetworkGraph graph;

    private int[] receivingLink;
    private int[] upstreamNode;
    private int[] downstreamNode;
    private int[][] incomingAtNode;

    public SteepestFlowDirector(NetworkGraph graph) {
        this.graph = graph;
    }

    /**
     * Calcula el tramo receptor de cada nodo y orienta todos los tramos.
     */
    public void runOneStep() {
        int nodes = graph.getNumberOfNodes();
        int links = graph.getNumberOfLinks();

        receivingLink = new int[nodes];
        Arrays.fill(receivingLink, NetworkGraph.NO_LINK);
        for (int n = 0; n < nodes; n++) {
            double steepest = 0.0;
            for (int link : graph.getLinksAtNode(n)) {
                if (link == NetworkGraph.NO_LINK) {
                    continue;
                }
                int other = otherEnd(link, n);
                double slope = (graph.getTopographicElevation(n) - graph.getTopographicElevation(other))
                        / graph.getLinkLength(link);
                if (slope > steepest) {
                    steepest = slope;
                    receivingLink[n] = link;
                }
            }
        }

        upstreamNode = new int[links];
        downstreamNode = new int[links];
        for (int l = 0; l < links; l++) {
            int[] ends = graph.getNodesAtLink(l);
            int tail = ends[0];
            int head = ends[1];
            if (receivingLink[tail] == l) {
                orient(l, tail, head);
            } else if (receivingLink[head] == l) {
                orient(l, head, tail);
            } else if (graph.getTopographicElevation(head) > graph.getTopographicElevation(tail)) {
                orient(l, head, tail);
            } else {
                orient(l, tail, head);
            }
        }

        incomingAtNode = new int[nodes][];
        for (int n = 0; n < nodes; n++) {
            int[] linksAtNode = graph.getLinksAtNode(n);
            int[] incoming = new int[linksAtNode.length];
            for (int slot = 0; slot < linksAtNode.length; slot++) {
                int link = linksAtNode[slot];
                if (link != NetworkGraph.NO_LINK) {
                    incoming[slot] = downstreamNode[link] == n ? 1 : -1;
                }
            }
            incomingAtNode[n] = incoming;
        }

        log.debug("Direcciones de flujo calculadas: {} salidas en {} nodos",
                Arrays.stream(receivingLink).filter(l -> l == NetworkGraph.NO_LINK).count(), nodes);
    }

    private void orient(int link, int from, int to) {
        upstreamNode[link] = from;
        downstreamNode[link] = to;
    }

    private int otherEnd(int link, int node) {
        int[] ends = graph.getNodesAtLink(link);
        return ends[0] == node ? ends[1] : ends[0];
    }

    private void requireDirections() {
        if (receivingLink == null) {
            throw new IllegalStateException("Las direcciones de flujo no se han calculado. Llama a runOneStep() primero.");
        }
    }

    @Override
    public NetworkGraph getGraph() {
        return graph;
    }

    @Override
    public int upstreamNodeAtLink(int link) {
        requireDirections();
        return upstreamNode[link];
    }

    @Override
    public int downstreamNodeAtLink(int link) {
        requireDirections();
        return downstreamNode[link];
    }

    @Override
    public int[][] flowLinkIncomingAtNode() {
        requireDirections();
        int[][] copy = new int[incomingAtNode.length][];
        for (int n = 0; n < incomingAtNode.length; n++) {
            copy[n] = incomingAtNode[n].clone();
        }
        return copy;
    }

    @Override
    public int linkToFlowReceivingNode(int node) {
        requireDirections();
        return receivingLink[node];
    }
}
