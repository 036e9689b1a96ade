package sedimentnet.domain.network;

/**
 * Grafo dirigido de nodos y tramos (links) que representa la red fluvial.
 * <p>
 * La topología y la geometría de los tramos son estáticas. La cota topográfica de
 * los nodos y la pendiente de los tramos son campos mutables: los escribe el motor
 * de transporte de sedimentos una vez por paso de tiempo.
 */
public interface NetworkGraph {

    /**
     * Índice reservado que indica "sin tramo" (relleno en {@link #getLinksAtNode(int)},
     * nodo sin tramo receptor, etc.).
     */
    int NO_LINK = -1;

    int getNumberOfNodes();

    int getNumberOfLinks();

    /**
     * @return Longitud del tramo en metros (> 0).
     */
    double getLinkLength(int link);

    /**
     * @return Ancho del cauce en metros (>= 0).
     */
    double getChannelWidth(int link);

    /**
     * @return Pendiente del cauce (m/m). NaN si todavía no se ha calculado.
     */
    double getChannelSlope(int link);

    void setChannelSlope(int link, double slope);

    /**
     * Indica si la red trae pendientes iniciales o si hay que derivarlas de la topografía.
     */
    boolean hasChannelSlope();

    /**
     * @return Par {cola, cabeza} de nodos del tramo. No implica sentido del flujo.
     */
    int[] getNodesAtLink(int link);

    /**
     * @return Tramos conectados al nodo, rellenos con {@link #NO_LINK} hasta el grado máximo de la red.
     */
    int[] getLinksAtNode(int node);

    double getBedrockElevation(int node);

    double getTopographicElevation(int node);

    void setTopographicElevation(int node, double elevation);
}
