package sedimentnet.domain.network;

/**
 * Sentido del flujo sobre una {@link NetworkGraph}: qué extremo de cada tramo está aguas
 * arriba, qué tramos entran en cada nodo y por qué tramo sale el agua de cada nodo.
 */
public interface FlowDirectionService {

    /**
     * Red sobre la que se han calculado las direcciones.
     */
    NetworkGraph getGraph();

    int upstreamNodeAtLink(int link);

    int downstreamNodeAtLink(int link);

    /**
     * Matriz de incidencia del flujo, alineada con {@link NetworkGraph#getLinksAtNode(int)}:
     * {@code 1} si el tramo entra en el nodo, {@code -1} si sale de él y {@code 0} para el relleno.
     */
    int[][] flowLinkIncomingAtNode();

    /**
     * @return Tramo por el que el nodo evacúa su flujo, o {@link NetworkGraph#NO_LINK} si es una salida de la red.
     */
    int linkToFlowReceivingNode(int node);

    /**
     * Tramo que recibe lo que sale por el extremo aguas abajo de {@code link}.
     *
     * @return El tramo receptor o {@link NetworkGraph#NO_LINK} si {@code link} es terminal.
     */
    default int downstreamLinkOf(int link) {
        return linkToFlowReceivingNode(downstreamNodeAtLink(link));
    }
}
