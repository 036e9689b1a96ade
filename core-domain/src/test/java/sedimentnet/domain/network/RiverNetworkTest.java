package sedimentnet.domain.network;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sedimentnet.domain.exception.ConfigurationException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test unitario para {@link RiverNetwork}.
 * <p>
 * Red de referencia: confluencia en Y con nodos 0 y 1 como cabeceras, 2 como unión y 3 como salida.
 */
class RiverNetworkTest {

    private static final int[][] Y_TOPOLOGY = {{0, 2}, {1, 2}, {2, 3}};

    private RiverNetwork confluence() {
        return new RiverNetwork(Y_TOPOLOGY,
                new double[]{0, 0, 30, 70},
                new double[]{40, -40, 0, 0},
                null,
                new double[]{5, 5, 10},
                new double[]{3, 3, 2, 1},
                null,
                null);
    }

    @Test
    @DisplayName("Las longitudes se derivan de las coordenadas si no se proporcionan")
    void constructor_shouldDeriveLinkLengthsFromCoordinates() {
        RiverNetwork network = confluence();

        assertEquals(50.0, network.getLinkLength(0), 1e-12);
        assertEquals(50.0, network.getLinkLength(1), 1e-12);
        assertEquals(40.0, network.getLinkLength(2), 1e-12);
    }

    @Test
    @DisplayName("La tabla nodo -> tramos se rellena con NO_LINK hasta el grado máximo")
    void getLinksAtNode_shouldBePaddedToMaxDegree() {
        RiverNetwork network = confluence();

        assertArrayEquals(new int[]{0, 1, 2}, network.getLinksAtNode(2));
        assertArrayEquals(new int[]{0, NetworkGraph.NO_LINK, NetworkGraph.NO_LINK}, network.getLinksAtNode(0));
        assertArrayEquals(new int[]{2, NetworkGraph.NO_LINK, NetworkGraph.NO_LINK}, network.getLinksAtNode(3));
    }

    @Test
    @DisplayName("Sin cota topográfica ni pendientes: se parte de la roca madre y pendientes NaN")
    void constructor_withoutOptionalFields_shouldUseDefaults() {
        RiverNetwork network = confluence();

        assertFalse(network.hasChannelSlope());
        assertTrue(Double.isNaN(network.getChannelSlope(0)));
        assertEquals(network.getBedrockElevation(2), network.getTopographicElevation(2));
    }

    @Test
    @DisplayName("Los campos mutables se actualizan sin tocar la roca madre")
    void setters_shouldUpdateMutableFieldsOnly() {
        RiverNetwork network = confluence();

        network.setTopographicElevation(2, 2.5);
        network.setChannelSlope(2, 0.0375);

        assertEquals(2.5, network.getTopographicElevation(2));
        assertEquals(2.0, network.getBedrockElevation(2));
        assertEquals(0.0375, network.getChannelSlope(2));
    }

    @Test
    @DisplayName("Las consultas devuelven copias defensivas")
    void getNodesAtLink_shouldReturnCopy() {
        RiverNetwork network = confluence();

        network.getNodesAtLink(0)[0] = 99;

        assertArrayEquals(new int[]{0, 2}, network.getNodesAtLink(0));
    }

    @Test
    @DisplayName("Dimensiones incoherentes o referencias fuera de rango se rechazan")
    void constructor_invalidInput_shouldThrowConfigurationException() {
        double[] width = {5, 5, 10};
        double[] bedrock = {3, 3, 2, 1};
        double[] lengths = {50, 50, 40};

        assertThrows(ConfigurationException.class, () ->
                new RiverNetwork(new int[][]{{0, 2}, {1, 9}, {2, 3}}, null, null, lengths, width, bedrock, null, null));
        assertThrows(ConfigurationException.class, () ->
                new RiverNetwork(Y_TOPOLOGY, null, null, lengths, new double[]{5, 5}, bedrock, null, null));
        assertThrows(ConfigurationException.class, () ->
                new RiverNetwork(Y_TOPOLOGY, null, null, null, width, bedrock, null, null));
        assertThrows(ConfigurationException.class, () ->
                new RiverNetwork(Y_TOPOLOGY, null, null, new double[]{50, 0, 40}, width, bedrock, null, null));
        assertThrows(ConfigurationException.class, () ->
                new RiverNetwork(new int[][]{{0, 0}}, null, null, new double[]{1}, new double[]{1}, new double[]{1}, null, null));
    }

    @Test
    @DisplayName("Índices fuera de rango en las consultas")
    void accessors_outOfRange_shouldThrow() {
        RiverNetwork network = confluence();

        assertThrows(IndexOutOfBoundsException.class, () -> network.getLinkLength(3));
        assertThrows(IndexOutOfBoundsException.class, () -> network.getTopographicElevation(-1));
    }
}
