package sedimentnet.factory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sedimentnet.domain.exception.ConfigurationException;
import sedimentnet.domain.network.RiverNetwork;

import static org.junit.jupiter.api.Assertions.*;

class RiverNetworkFactoryTest {

    private RiverNetworkFactory factory;

    @BeforeEach
    void setUp() {
        factory = new RiverNetworkFactory();
    }

    @Test
    @DisplayName("Cadena recta: cotas de roca madre con pendiente uniforme hasta la salida")
    void createStraightChain_shouldBuildUniformSlope() {
        RiverNetwork network = factory.createStraightChain(3, 100.0, 15.0, 0.0, 0.0078);

        assertEquals(4, network.getNumberOfNodes());
        assertEquals(3, network.getNumberOfLinks());
        assertEquals(2.34, network.getBedrockElevation(0), 1e-12);
        assertEquals(1.56, network.getBedrockElevation(1), 1e-12);
        assertEquals(0.0, network.getBedrockElevation(3), 1e-12);
        assertEquals(network.getBedrockElevation(2), network.getTopographicElevation(2));
        assertArrayEquals(new int[]{1, 2}, network.getNodesAtLink(1));
        assertEquals(15.0, network.getChannelWidth(2));
    }

    @Test
    @DisplayName("Confluencia: tres tramos de la misma longitud y dos cabeceras a la misma cota")
    void createConfluence_shouldBuildYShape() {
        RiverNetwork network = factory.createConfluence(50.0, 8.0, 10.0, 0.02);

        assertEquals(4, network.getNumberOfNodes());
        assertEquals(3, network.getNumberOfLinks());
        assertEquals(12.0, network.getBedrockElevation(0), 1e-12);
        assertEquals(12.0, network.getBedrockElevation(1), 1e-12);
        assertEquals(11.0, network.getBedrockElevation(2), 1e-12);
        for (int l = 0; l < 3; l++) {
            assertEquals(50.0, network.getLinkLength(l), 1e-12);
        }
    }

    @Test
    @DisplayName("Matriz de calados constante con una fila por instante")
    void createUniformFlowDepth_shouldHaveTimestepsPlusOneRows() {
        double[][] depth = factory.createUniformFlowDepth(4, 2, 1.2);

        assertEquals(5, depth.length);
        assertArrayEquals(new double[]{1.2, 1.2}, depth[4]);
    }

    @Test
    @DisplayName("Geometrías sin sentido físico se rechazan")
    void create_invalidGeometry_shouldThrow() {
        assertThrows(ConfigurationException.class, () -> factory.createStraightChain(0, 100.0, 15.0, 0.0, 0.01));
        assertThrows(ConfigurationException.class, () -> factory.createStraightChain(2, -1.0, 15.0, 0.0, 0.01));
        assertThrows(ConfigurationException.class, () -> factory.createConfluence(100.0, 10.0, 0.0, -0.01));
    }
}
