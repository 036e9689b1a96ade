package sedimentnet.physics.impl;

import lombok.extern.slf4j.Slf4j;
import sedimentnet.domain.network.FlowDirectionService;
import sedimentnet.domain.network.NetworkGraph;
import sedimentnet.physics.solver.SedimentTransportEquations;

import java.util.ArrayList;
import java.util.List;

/**
 * Traslada el sedimento almacenado a la cota de los nodos y recalcula la pendiente de
 * los tramos a partir de las cotas resultantes.
 * <p>
 * Los tramos que aportan a cada nodo se resuelven una sola vez al construir: la topología
 * y el sentido del flujo no cambian durante la simulación.
 */
@Slf4j
public class BedElevationAdjuster {

    private final NetworkGraph graph;
    private final FlowDirectionService flowDirector;
    private final double porosity;

    /** Tramos que entran en cada nodo. Vacío en los nodos de cabecera. */
    private final int[][] contributingLinks;

    public BedElevationAdjuster(NetworkGraph graph, FlowDirectionService flowDirector, double porosity) {
        this.graph = graph;
        this.flowDirector = flowDirector;
        this.porosity = porosity;
        this.contributingLinks = resolveContributingLinks();
    }

    private int[][] resolveContributingLinks() {
        int[][] incoming = flowDirector.flowLinkIncomingAtNode();
        int nodes = graph.getNumberOfNodes();
        int[][] result = new int[nodes][];
        for (int n = 0; n < nodes; n++) {
            int[] linksAtNode = graph.getLinksAtNode(n);
            List<Integer> upstream = new ArrayList<>();
            for (int slot = 0; slot < linksAtNode.length; slot++) {
                if (linksAtNode[slot] != NetworkGraph.NO_LINK && incoming[n][slot] == 1) {
                    upstream.add(linksAtNode[slot]);
                }
            }
            result[n] = upstream.stream().mapToInt(Integer::intValue).toArray();
        }
        return result;
    }

    /**
     * Sobrescribe la cota topográfica de cada nodo con aportes como roca madre + aluvión.
     * Los nodos de cabecera no se modifican.
     *
     * @param storedVolume Volumen almacenado por tramo [m³].
     */
    public void adjustNodeElevations(double[] storedVolume) {
        for (int n = 0; n < graph.getNumberOfNodes(); n++) {
            int[] upstream = contributingLinks[n];
            if (upstream.length == 0) {
                continue;
            }

            double[] upstreamWidths = new double[upstream.length];
            double[] upstreamLengths = new double[upstream.length];
            for (int i = 0; i < upstream.length; i++) {
                upstreamWidths[i] = graph.getChannelWidth(upstream[i]);
                upstreamLengths[i] = graph.getLinkLength(upstream[i]);
            }

            int downstreamLink = flowDirector.linkToFlowReceivingNode(n);
            double downstreamWidth = 0.0;
            double downstreamLength = 0.0;
            double stored = 0.0;
            if (downstreamLink != NetworkGraph.NO_LINK) {
                downstreamWidth = graph.getChannelWidth(downstreamLink);
                downstreamLength = graph.getLinkLength(downstreamLink);
                stored = storedVolume[downstreamLink];
            }

            double alluviumDepth = SedimentTransportEquations.calculateAlluviumDepth(
                    stored, upstreamWidths, upstreamLengths, downstreamWidth, downstreamLength, porosity);

            graph.setTopographicElevation(n, graph.getBedrockElevation(n) + alluviumDepth);
        }
    }

    /**
     * Recalcula la pendiente de todos los tramos con las cotas actuales.
     */
    public void updateChannelSlopes() {
        for (int l = 0; l < graph.getNumberOfLinks(); l++) {
            int upstreamNode = flowDirector.upstreamNodeAtLink(l);
            int downstreamNode = flowDirector.downstreamNodeAtLink(l);
            double slope = SedimentTransportEquations.recalculateChannelSlope(
                    graph.getTopographicElevation(upstreamNode),
                    graph.getTopographicElevation(downstreamNode),
                    graph.getLinkLength(l));
            graph.setChannelSlope(l, slope);
        }
        log.trace("Pendientes recalculadas para {} tramos", graph.getNumberOfLinks());
    }
}
