package sedimentnet.domain.network;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import sedimentnet.domain.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Red fluvial de nodos y tramos con la geometría que necesita el transporte de sedimentos.
 * <p>
 * La topología (nodos de cada tramo), la longitud y el ancho de los tramos y la cota de la
 * roca madre son inmutables. La cota topográfica de los nodos y la pendiente de los tramos
 * son campos mutables que sólo escribe el motor de transporte.
 * <p>
 * Si no se proporcionan longitudes, se derivan de las coordenadas de los nodos. Si no se
 * proporciona cota topográfica, se parte de la roca madre desnuda.
 */
public final class RiverNetwork implements NetworkGraph {

    @Getter
    @JsonIgnore
    private final int numberOfNodes;
    @Getter
    @JsonIgnore
    private final int numberOfLinks;

    @JsonProperty("nodesAtLink")
    private final int[][] nodesAtLink;
    @JsonProperty("linkLength")
    private final double[] linkLength;
    @JsonProperty("channelWidth")
    private final double[] channelWidth;
    @JsonProperty("bedrockElevation")
    private final double[] bedrockElevation;
    @JsonProperty("topographicElevation")
    private final double[] topographicElevation;
    @JsonProperty("channelSlope")
    private final double[] channelSlope;

    @JsonIgnore
    private final boolean slopeProvided;
    @JsonIgnore
    private final int[][] linksAtNode;

    /**
     * @param nodesAtLink          Par {cola, cabeza} de cada tramo.
     * @param xOfNode              Coordenada x de cada nodo (opcional si se da linkLength).
     * @param yOfNode              Coordenada y de cada nodo (opcional si se da linkLength).
     * @param linkLength           Longitud de cada tramo en metros (opcional si se dan coordenadas).
     * @param channelWidth         Ancho del cauce de cada tramo en metros.
     * @param bedrockElevation     Cota de la roca madre de cada nodo en metros.
     * @param topographicElevation Cota topográfica de cada nodo (opcional, por defecto la roca madre).
     * @param channelSlope         Pendiente inicial de cada tramo (opcional, la calcula el motor).
     * @throws ConfigurationException si faltan campos obligatorios o las dimensiones no cuadran.
     */
    @JsonCreator
    public RiverNetwork(@JsonProperty("nodesAtLink") int[][] nodesAtLink,
                        @JsonProperty("xOfNode") double[] xOfNode,
                        @JsonProperty("yOfNode") double[] yOfNode,
                        @JsonProperty("linkLength") double[] linkLength,
                        @JsonProperty("channelWidth") double[] channelWidth,
                        @JsonProperty("bedrockElevation") double[] bedrockElevation,
                        @JsonProperty("topographicElevation") double[] topographicElevation,
                        @JsonProperty("channelSlope") double[] channelSlope) {
        requirePresent(nodesAtLink, "nodesAtLink");
        requirePresent(channelWidth, "channelWidth");
        requirePresent(bedrockElevation, "bedrockElevation");

        int links = nodesAtLink.length;
        int nodes = bedrockElevation.length;
        if (links == 0) {
            throw new ConfigurationException("La red debe tener al menos un tramo.");
        }
        if (nodes < 2) {
            throw new ConfigurationException("La red debe tener al menos dos nodos.");
        }

        int[][] topology = new int[links][];
        for (int l = 0; l < links; l++) {
            int[] pair = nodesAtLink[l];
            if (pair == null || pair.length != 2) {
                throw new ConfigurationException("El tramo " + l + " debe definir exactamente dos nodos.");
            }
            for (int node : pair) {
                if (node < 0 || node >= nodes) {
                    throw new ConfigurationException(String.format("El tramo %d referencia el nodo %d, fuera del rango [0, %d].", l, node, nodes - 1));
                }
            }
            if (pair[0] == pair[1]) {
                throw new ConfigurationException("El tramo " + l + " une un nodo consigo mismo.");
            }
            topology[l] = pair.clone();
        }

        requireLength(channelWidth, links, "channelWidth");
        for (int l = 0; l < links; l++) {
            if (!(channelWidth[l] >= 0)) {
                throw new ConfigurationException(String.format("Ancho de cauce inválido en el tramo %d: %.4f", l, channelWidth[l]));
            }
        }

        double[] lengths;
        if (linkLength != null) {
            requireLength(linkLength, links, "linkLength");
            lengths = linkLength.clone();
        } else {
            if (xOfNode == null || yOfNode == null) {
                throw new ConfigurationException("Hace falta linkLength o las coordenadas de los nodos (xOfNode, yOfNode).");
            }
            requireLength(xOfNode, nodes, "xOfNode");
            requireLength(yOfNode, nodes, "yOfNode");
            lengths = new double[links];
            for (int l = 0; l < links; l++) {
                int tail = topology[l][0];
                int head = topology[l][1];
                lengths[l] = Math.hypot(xOfNode[head] - xOfNode[tail], yOfNode[head] - yOfNode[tail]);
            }
        }
        for (int l = 0; l < links; l++) {
            if (!(lengths[l] > 0)) {
                throw new ConfigurationException(String.format("Longitud no positiva en el tramo %d: %.4f", l, lengths[l]));
            }
        }

        if (topographicElevation != null) {
            requireLength(topographicElevation, nodes, "topographicElevation");
        }
        if (channelSlope != null) {
            requireLength(channelSlope, links, "channelSlope");
        }

        this.numberOfNodes = nodes;
        this.numberOfLinks = links;
        this.nodesAtLink = topology;
        this.linkLength = lengths;
        this.channelWidth = channelWidth.clone();
        this.bedrockElevation = bedrockElevation.clone();
        this.topographicElevation = topographicElevation != null ? topographicElevation.clone() : bedrockElevation.clone();
        this.slopeProvided = channelSlope != null;
        this.channelSlope = new double[links];
        if (slopeProvided) {
            System.arraycopy(channelSlope, 0, this.channelSlope, 0, links);
        } else {
            Arrays.fill(this.channelSlope, Double.NaN);
        }
        this.linksAtNode = buildLinksAtNode(topology, nodes);
    }

    /**
     * Construye la tabla nodo -> tramos, rellenando con {@link #NO_LINK} hasta el grado máximo.
     */
    private static int[][] buildLinksAtNode(int[][] topology, int nodes) {
        List<List<Integer>> adjacency = new ArrayList<>(nodes);
        for (int n = 0; n < nodes; n++) {
            adjacency.add(new ArrayList<>());
        }
        for (int l = 0; l < topology.length; l++) {
            adjacency.get(topology[l][0]).add(l);
            adjacency.get(topology[l][1]).add(l);
        }
        int maxDegree = adjacency.stream().mapToInt(List::size).max().orElse(0);

        int[][] table = new int[nodes][maxDegree];
        for (int n = 0; n < nodes; n++) {
            Arrays.fill(table[n], NO_LINK);
            List<Integer> links = adjacency.get(n);
            for (int i = 0; i < links.size(); i++) {
                table[n][i] = links.get(i);
            }
        }
        return table;
    }

    private static void requirePresent(Object array, String field) {
        if (array == null) {
            throw new ConfigurationException("Campo obligatorio ausente en la red: " + field);
        }
    }

    private static void requireLength(double[] array, int expected, String field) {
        if (array.length != expected) {
            throw new ConfigurationException(String.format("El campo %s tiene %d valores, se esperaban %d.", field, array.length, expected));
        }
    }

    @Override
    public double getLinkLength(int link) {
        validateLinkIndex(link);
        return linkLength[link];
    }

    @Override
    public double getChannelWidth(int link) {
        validateLinkIndex(link);
        return channelWidth[link];
    }

    @Override
    public double getChannelSlope(int link) {
        validateLinkIndex(link);
        return channelSlope[link];
    }

    @Override
    public void setChannelSlope(int link, double slope) {
        validateLinkIndex(link);
        channelSlope[link] = slope;
    }

    @Override
    public boolean hasChannelSlope() {
        return slopeProvided;
    }

    @Override
    public int[] getNodesAtLink(int link) {
        validateLinkIndex(link);
        return nodesAtLink[link].clone();
    }

    @Override
    public int[] getLinksAtNode(int node) {
        validateNodeIndex(node);
        return linksAtNode[node].clone();
    }

    @Override
    public double getBedrockElevation(int node) {
        validateNodeIndex(node);
        return bedrockElevation[node];
    }

    @Override
    public double getTopographicElevation(int node) {
        validateNodeIndex(node);
        return topographicElevation[node];
    }

    @Override
    public void setTopographicElevation(int node, double elevation) {
        validateNodeIndex(node);
        topographicElevation[node] = elevation;
    }

    private void validateLinkIndex(int link) {
        if (link < 0 || link >= numberOfLinks) {
            throw new IndexOutOfBoundsException(String.format("Índice de tramo fuera de rango: %d. El rango válido es de 0 a %d.", link, numberOfLinks - 1));
        }
    }

    private void validateNodeIndex(int node) {
        if (node < 0 || node >= numberOfNodes) {
            throw new IndexOutOfBoundsException(String.format("Índice de nodo fuera de rango: %d. El rango válido es de 0 a %d.", node, numberOfNodes - 1));
        }
    }

    @Override
    public String toString() {
        double totalLengthKm = Arrays.stream(linkLength).sum() / 1000.0;
        return String.format("RiverNetwork {nodes=%d, links=%d, totalLength=%.3f km, width=[%.2f m ... %.2f m]}",
                numberOfNodes, numberOfLinks, totalLengthKm,
                Arrays.stream(channelWidth).min().orElse(0), Arrays.stream(channelWidth).max().orElse(0));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RiverNetwork that = (RiverNetwork) o;
        return numberOfNodes == that.numberOfNodes && numberOfLinks == that.numberOfLinks
                && Arrays.deepEquals(nodesAtLink, that.nodesAtLink)
                && Arrays.equals(linkLength, that.linkLength)
                && Arrays.equals(channelWidth, that.channelWidth)
                && Arrays.equals(bedrockElevation, that.bedrockElevation);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(numberOfNodes, numberOfLinks);
        result = 31 * result + Arrays.deepHashCode(nodesAtLink);
        result = 31 * result + Arrays.hashCode(linkLength);
        result = 31 * result + Arrays.hashCode(channelWidth);
        result = 31 * result + Arrays.hashCode(bedrockElevation);
        return result;
    }
}
